package com.fleetwarden.core.executor;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Which executor failures are stream or network blips worth retrying, and how long to wait.
 * Client errors (400/401/403/404) are never retried.
 */
public class StreamRetryPolicy {

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "stream disconnected", "response.failed", "stream closed before", "stream ended before",
            "turn.failed", "connection reset", "econnreset", "socket hang up", "network socket disconnected",
            "etimedout", "epipe", "socket timeout", "bad gateway", "service temporarily unavailable",
            "service_unavailable", "529", "rate_limit_exceeded", "overloaded_error");

    private static final List<String> TRANSIENT_STATUS = List.of("502", "503", "504");

    private final int maxRetries;
    private final long baseMs;
    private final long maxMs;
    private final long jitterMs;
    private final DoubleSupplier random;

    public StreamRetryPolicy(ExecutorProperties properties) {
        this(properties.getMaxStreamRetries(), properties.getRetryBaseMs(), properties.getRetryMaxMs(),
                properties.getRetryJitterMs(), () -> ThreadLocalRandom.current().nextDouble());
    }

    StreamRetryPolicy(int maxRetries, long baseMs, long maxMs, long jitterMs, DoubleSupplier random) {
        this.maxRetries = maxRetries;
        this.baseMs = baseMs;
        this.maxMs = maxMs;
        this.jitterMs = jitterMs;
        this.random = random;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase();
            if (TRANSIENT_MARKERS.stream().anyMatch(message::contains)) {
                return true;
            }
            if (!message.contains("invalid_request") && TRANSIENT_STATUS.stream().anyMatch(message::contains)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Delay before retry {@code attempt} (zero-based): {@code min(base * 2^attempt, max)} plus up to {@code jitter}.
     */
    public long delayMs(int attempt) {
        long backoff = Math.min(baseMs << Math.min(attempt, 30), maxMs);
        return backoff + (long) (random.getAsDouble() * jitterMs);
    }
}
