package com.fleetwarden.core.sync;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link ReconciliationEngine#reconcileOnce()} on a fixed delay when {@code fleetwarden.sync.enabled} is set.
 */
@Service
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final ReconciliationEngine engine;
    private final SyncProperties properties;

    private ScheduledExecutorService scheduler;

    public SyncScheduler(ReconciliationEngine engine, SyncProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @PostConstruct
    public synchronized void start() {
        if (!properties.isEnabled() || scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "board-sync");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::tick,
                properties.getInitialDelayMs(), properties.getIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Board sync scheduled every {}ms (first run in {}ms)",
                properties.getIntervalMs(), properties.getInitialDelayMs());
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Board sync stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void tick() {
        try {
            engine.reconcileOnce();
        } catch (RuntimeException e) {
            // keep the schedule alive; the next tick retries
            log.error("Board sync tick failed: {}", e.getMessage(), e);
        }
    }
}
