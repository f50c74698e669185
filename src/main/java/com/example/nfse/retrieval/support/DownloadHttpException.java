package com.example.nfse.retrieval.support;

public class DownloadHttpException extends RetrievalException {

    private final int status;
    private final String url;

    public DownloadHttpException(int status, String url) {
        super("Download failed with HTTP %d for %s".formatted(status, url));
        this.status = status;
        this.url = url;
    }

    public int getStatus() {
        return status;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public String errorType() {
        return "DownloadHttpError";
    }
}
