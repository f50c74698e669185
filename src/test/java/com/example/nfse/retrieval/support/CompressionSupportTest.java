package com.example.nfse.retrieval.support;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CompressionSupport")
class CompressionSupportTest {

    private final CompressionSupport compressionSupport = new CompressionSupport();

    private static byte[] gzip(byte[] plain) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(out)) {
            gzip.write(plain);
        }
        return out.toByteArray();
    }

    @Test
    @DisplayName("Should inflate a gzip body detected by its magic bytes")
    void inflatesGzip() throws IOException {
        byte[] plain = "<?xml version=\"1.0\"?><NFSe/>".getBytes(StandardCharsets.UTF_8);

        byte[] decoded = compressionSupport.decodeIfNecessary(gzip(plain), Map.of(), "https://portal/x");

        assertArrayEquals(plain, decoded);
    }

    @Test
    @DisplayName("Should return a plain body untouched even when Content-Encoding claims gzip")
    void keepsPlainBody() {
        byte[] plain = "%PDF-1.4".getBytes(StandardCharsets.US_ASCII);

        byte[] decoded = compressionSupport.decodeIfNecessary(plain, Map.of("Content-Encoding", "gzip"),
                "https://portal/y");

        assertSame(plain, decoded);
    }
}
