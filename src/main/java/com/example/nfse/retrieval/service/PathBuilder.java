package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.config.AutomationProperties;
import com.example.nfse.retrieval.model.BillingPeriod;
import com.example.nfse.retrieval.model.DetectedExtension;
import com.example.nfse.retrieval.model.Direction;
import com.example.nfse.retrieval.model.DocumentCategory;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps (period, company, direction) to the artifact directory and
 * (documentKey, category, extension) to the file name. Pure: the same inputs
 * always give the same path and nothing touches the file system.
 *
 * <pre>
 * {base}/{MM-YYYY}/{company}/{Emitidas|Recebidas}/{documentKey}.{xml|pdf|bin}
 * </pre>
 */
@Component
public class PathBuilder {

    static final String EMPTY_COMPANY_NAME = "sem-nome";
    static final String EMPTY_DOCUMENT_KEY = "documento";

    private static final Pattern COMPANY_ILLEGAL = Pattern.compile("[/\\\\:*?\"<>|\\p{Cntrl}]");
    private static final Pattern KEY_ILLEGAL = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_DOTS = Pattern.compile("\\.+$");
    private static final Pattern ONLY_DOTS = Pattern.compile("\\.+");

    private final Path base;

    @Autowired
    public PathBuilder(AutomationProperties properties) {
        this(properties.downloadsBase());
    }

    public PathBuilder(Path base) {
        this.base = base.toAbsolutePath().normalize();
    }

    public Path base() {
        return base;
    }

    /** Relative, {@code /}-separated form used in logs, manifests and API responses. */
    public String buildPath(BillingPeriod period, String companyName, Direction direction) {
        return String.join("/", period.folderName(), sanitizeCompanyName(companyName), direction.folderName());
    }

    public Path resolve(BillingPeriod period, String companyName, Direction direction) {
        return companyDirectory(period, companyName).resolve(direction.folderName());
    }

    public Path companyDirectory(BillingPeriod period, String companyName) {
        return base.resolve(period.folderName()).resolve(sanitizeCompanyName(companyName));
    }

    /**
     * {@code <key>.xml} or {@code <key>.pdf}. Inconclusive content keeps the
     * category in the name so a row's two files never overwrite each other.
     */
    public String buildFileName(String documentKey, DocumentCategory category, DetectedExtension extension) {
        String key = sanitizeDocumentKey(documentKey);
        if (extension == DetectedExtension.BIN) {
            return "%s.%s.%s".formatted(key, category.label(), extension.suffix());
        }
        return "%s.%s".formatted(key, extension.suffix());
    }

    public String relativize(Path file) {
        return base.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    public static String sanitizeCompanyName(String name) {
        if (name == null) {
            return EMPTY_COMPANY_NAME;
        }
        String cleaned = COMPANY_ILLEGAL.matcher(name).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        cleaned = TRAILING_DOTS.matcher(cleaned).replaceAll("").trim();
        return cleaned.isEmpty() ? EMPTY_COMPANY_NAME : cleaned;
    }

    public static String sanitizeDocumentKey(String documentKey) {
        if (documentKey == null || documentKey.isBlank()) {
            return EMPTY_DOCUMENT_KEY;
        }
        String cleaned = KEY_ILLEGAL.matcher(documentKey.trim()).replaceAll("_");
        return ONLY_DOTS.matcher(cleaned).matches() ? "_" : cleaned;
    }
}
