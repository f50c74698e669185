package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.config.AutomationProperties;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class StatusRetentionSweeper {

    private final StatusStore store;
    private final AutomationProperties properties;

    @Scheduled(fixedDelayString = "${app.automation.status-sweep-interval:PT10M}")
    public void sweep() {
        int evicted = store.evictTerminalOlderThan(Instant.now().minus(properties.getStatusRetention()));
        if (evicted > 0) {
            log.info("Evicted {} finished job snapshots older than {}", evicted, properties.getStatusRetention());
        }
    }
}
