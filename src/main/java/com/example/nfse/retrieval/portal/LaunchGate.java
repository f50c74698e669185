package com.example.nfse.retrieval.portal;

import com.example.nfse.retrieval.support.RetrievalException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/** Spaces browser launches at least {@code spacing} apart across all workers. */
@Slf4j
class LaunchGate {

    private final long spacingNanos;
    private long lastLaunch;
    private boolean launched;

    LaunchGate(Duration spacing) {
        this.spacingNanos = Math.max(0, spacing.toNanos());
    }

    synchronized void awaitTurn() {
        long now = System.nanoTime();
        if (launched) {
            long waitNanos = lastLaunch + spacingNanos - now;
            if (waitNanos > 0) {
                log.debug("Staggering browser launch by {} ms", Duration.ofNanos(waitNanos).toMillis());
                try {
                    Thread.sleep(Duration.ofNanos(waitNanos).toMillis(), (int) (waitNanos % 1_000_000));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new RetrievalException("Interrupted while waiting to launch a browser", ex);
                }
                now = System.nanoTime();
            }
        }
        lastLaunch = now;
        launched = true;
    }
}
