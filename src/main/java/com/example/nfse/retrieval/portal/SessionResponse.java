package com.example.nfse.retrieval.portal;

import java.util.Map;

public record SessionResponse(int status, Map<String, String> headers, byte[] body) {

    public SessionResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
