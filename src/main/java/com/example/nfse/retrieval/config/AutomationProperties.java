package com.example.nfse.retrieval.config;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Read-only automation settings. Changing them requires a restart.
 *
 * <pre>
 * app:
 *   automation:
 *     headless: false
 *     company-timeout: 300s
 *     max-retries-per-step: 3
 *     min-action-delay: 500ms
 *     max-concurrent-browsers: 5
 *     default-concurrent-browsers: 3
 *     browser-launch-delay: 1000ms
 *     viewport: FULLHD
 *     downloads-path: ./downloads
 *     log-retention-days: 30
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.automation")
public class AutomationProperties {

    private boolean headless = false;

    /** Deadline for one job, from leaving the queue to reaching a terminal state. */
    private Duration companyTimeout = Duration.ofSeconds(300);

    private int maxRetriesPerStep = 3;

    /** Pause between UI actions (menu clicks, page turns). */
    private Duration minActionDelay = Duration.ofMillis(500);

    private int maxConcurrentBrowsers = 5;

    private int defaultConcurrentBrowsers = 3;

    /** Minimum gap between two browser launches. */
    private Duration browserLaunchDelay = Duration.ofMillis(1000);

    private ViewportPreset viewport = ViewportPreset.FULLHD;

    private int customViewportWidth = 1920;

    private int customViewportHeight = 1080;

    private String downloadsPath = "./downloads";

    private int logRetentionDays = 30;

    /** Log lines kept per job snapshot. */
    private int maxLogEntries = 100;

    private int queueCapacity = 50;

    private long minArtifactBytes = 16;

    /** Terminal snapshots older than this are evicted by the retention sweep. */
    private Duration statusRetention = Duration.ofHours(24);

    private String timeZone = "America/Sao_Paulo";

    private String credentialsPath = "./certificados";

    public int workerCount() {
        return Math.max(1, Math.min(defaultConcurrentBrowsers, maxConcurrentBrowsers));
    }

    public int viewportWidth() {
        return viewport == ViewportPreset.CUSTOM ? customViewportWidth : viewport.width();
    }

    public int viewportHeight() {
        return viewport == ViewportPreset.CUSTOM ? customViewportHeight : viewport.height();
    }

    public Path downloadsBase() {
        return Path.of(downloadsPath).toAbsolutePath().normalize();
    }

    public ZoneId zone() {
        return ZoneId.of(timeZone);
    }
}
