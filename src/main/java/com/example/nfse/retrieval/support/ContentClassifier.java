package com.example.nfse.retrieval.support;

import com.example.nfse.retrieval.model.DetectedExtension;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Decides the file extension of a downloaded payload: the declared
 * Content-Type wins when it is specific, otherwise the leading bytes are
 * sniffed. Anything inconclusive is {@code bin}.
 */
@Component
public class ContentClassifier {

    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] UTF8_BOM = { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF };

    public DetectedExtension classify(Map<String, String> headers, byte[] body) {
        String contentType = header(headers, "content-type").toLowerCase(Locale.ROOT);
        if (contentType.contains("xml")) {
            return DetectedExtension.XML;
        }
        if (contentType.contains("pdf")) {
            return DetectedExtension.PDF;
        }
        return sniff(body);
    }

    public DetectedExtension sniff(byte[] body) {
        if (body == null || body.length == 0) {
            return DetectedExtension.BIN;
        }
        if (startsWith(body, 0, PDF_MAGIC)) {
            return DetectedExtension.PDF;
        }
        int offset = startsWith(body, 0, UTF8_BOM) ? UTF8_BOM.length : 0;
        while (offset < body.length && Character.isWhitespace(body[offset])) {
            offset++;
        }
        if (offset < body.length && body[offset] == '<') {
            return DetectedExtension.XML;
        }
        return DetectedExtension.BIN;
    }

    private static boolean startsWith(byte[] body, int offset, byte[] prefix) {
        if (body.length - offset < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (body[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static String header(Map<String, String> headers, String name) {
        if (headers == null) {
            return "";
        }
        return headers.entrySet().stream()
                .filter(entry -> name.equalsIgnoreCase(entry.getKey()))
                .map(Map.Entry::getValue)
                .filter(value -> value != null)
                .findFirst()
                .orElse("");
    }
}
