package com.example.nfse.retrieval.support;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.springframework.stereotype.Component;

/**
 * Unwraps gzip payloads the portal occasionally serves without the client
 * having decoded them. Only the magic bytes decide; a Content-Encoding
 * header over a plain body is ignored.
 */
@Slf4j
@Component
public class CompressionSupport {

    private static final int SIGNATURE_LENGTH = 6;

    public byte[] decodeIfNecessary(byte[] body, Map<String, String> headers, String url) {
        if (body == null || body.length == 0) {
            return body == null ? new byte[0] : body;
        }
        if (!isGzipSignature(body)) {
            if (isGzipEncoded(headers)) {
                log.debug("Content-Encoding says gzip but payload is already plain url={}", url);
            }
            return body;
        }

        log.debug("Detected gzip payload url={} compressedBytes={}", url, body.length);
        try (InputStream in = new GzipCompressorInputStream(new ByteArrayInputStream(body), true)) {
            return in.readAllBytes();
        } catch (IOException ex) {
            throw new RetrievalException("Failed to decompress gzip payload from %s".formatted(url), ex);
        }
    }

    static boolean isGzipSignature(byte[] body) {
        int length = Math.min(SIGNATURE_LENGTH, body.length);
        return GzipCompressorInputStream.matches(body, length);
    }

    private static boolean isGzipEncoded(Map<String, String> headers) {
        if (headers == null) {
            return false;
        }
        return headers.entrySet().stream()
                .filter(entry -> "content-encoding".equalsIgnoreCase(entry.getKey()))
                .anyMatch(entry -> entry.getValue() != null
                        && entry.getValue().toLowerCase(Locale.ROOT).contains("gzip"));
    }
}
