package com.fleetwarden.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for fleet supervision and board sync.
 */
@Service
public class FleetMetrics {

    private final MeterRegistry registry;

    public FleetMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEventEmitted(String type) {
        Counter.builder("fleetwarden.events.emitted")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordEventDeduplicated() {
        Counter.builder("fleetwarden.events.deduplicated")
                .description("Events dropped by the duplicate-signal window")
                .register(registry)
                .increment();
    }

    public void recordVerdict(String action, String pattern) {
        Counter.builder("fleetwarden.recovery.verdicts")
                .tag("action", action)
                .tag("pattern", pattern)
                .register(registry)
                .increment();
    }

    public void recordAgentStale() {
        Counter.builder("fleetwarden.agents.stale")
                .description("Staleness episodes detected by the sweep")
                .register(registry)
                .increment();
    }

    /**
     * Records a finished reconciliation pass.
     *
     * @param status "ok", "skipped" or "error"
     * @param ms     wall-clock duration of the pass
     */
    public void recordSyncCycle(String status, long ms) {
        Counter.builder("fleetwarden.sync.cycles")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("fleetwarden.sync.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRateLimited(String scope) {
        Counter.builder("fleetwarden.sync.rate_limited")
                .description("Board calls that hit a rate limit")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }
}
