package com.fleetwarden.core.events;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Capacity, timing and auto-action limits for the {@link AgentEventBus}.
 */
@Component
@ConfigurationProperties(prefix = "fleetwarden.bus")
public class BusProperties {

    /** Events kept in the in-memory ring buffer. */
    private int maxEventLogSize = 500;

    /** Heartbeat silence after which an agent is considered stale. */
    private long staleThresholdMs = 90_000;

    private long staleCheckIntervalMs = 30_000;

    /** Repeats of the same (type, taskId) inside this window are dropped. */
    private long dedupeWindowMs = 500;

    private int maxErrorPatternsPerTask = 50;

    /** Bus-level auto-retries per task before a retry verdict is escalated to block. */
    private int maxAutoRetries = 5;

    public int getMaxEventLogSize() { return maxEventLogSize; }
    public void setMaxEventLogSize(int maxEventLogSize) { this.maxEventLogSize = maxEventLogSize; }

    public long getStaleThresholdMs() { return staleThresholdMs; }
    public void setStaleThresholdMs(long staleThresholdMs) { this.staleThresholdMs = staleThresholdMs; }

    public long getStaleCheckIntervalMs() { return staleCheckIntervalMs; }
    public void setStaleCheckIntervalMs(long staleCheckIntervalMs) { this.staleCheckIntervalMs = staleCheckIntervalMs; }

    public long getDedupeWindowMs() { return dedupeWindowMs; }
    public void setDedupeWindowMs(long dedupeWindowMs) { this.dedupeWindowMs = dedupeWindowMs; }

    public int getMaxErrorPatternsPerTask() { return maxErrorPatternsPerTask; }
    public void setMaxErrorPatternsPerTask(int maxErrorPatternsPerTask) { this.maxErrorPatternsPerTask = maxErrorPatternsPerTask; }

    public int getMaxAutoRetries() { return maxAutoRetries; }
    public void setMaxAutoRetries(int maxAutoRetries) { this.maxAutoRetries = maxAutoRetries; }
}
