package com.fleetwarden.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Disables self-update for a window after repeated install failures, persisted in
 * {@code auto-update-state.json}.
 */
@Service
public class AutoUpdateStateStore {

    private static final Logger log = LoggerFactory.getLogger(AutoUpdateStateStore.class);

    static final String FILE_NAME = "auto-update-state.json";
    static final int DEFAULT_FAILURE_LIMIT = 3;
    static final long DEFAULT_DISABLE_WINDOW_MS = Duration.ofHours(24).toMillis();

    private final JsonStateFile<AutoUpdateState> file;
    private final Clock clock;
    private final int failureLimit;
    private final long disableWindowMs;

    @Autowired
    public AutoUpdateStateStore(StateProperties properties, Clock clock) {
        this(properties.resolve(FILE_NAME), clock, DEFAULT_FAILURE_LIMIT, DEFAULT_DISABLE_WINDOW_MS);
    }

    AutoUpdateStateStore(Path path, Clock clock, int failureLimit, long disableWindowMs) {
        this.file = new JsonStateFile<>(path, AutoUpdateState.class);
        this.clock = clock;
        this.failureLimit = failureLimit;
        this.disableWindowMs = disableWindowMs;
    }

    public AutoUpdateState current() {
        return file.read().orElseGet(AutoUpdateState::initial);
    }

    /**
     * Counts one failed install. Reaching the failure limit opens the disable window.
     */
    public synchronized AutoUpdateState recordFailure(String reason) {
        AutoUpdateState state = current();
        int failures = state.failureCount() + 1;
        long disabledUntil = state.disabledUntil();
        long lastNotifiedAt = state.lastNotifiedAt();
        if (disabledUntil == 0 && failures >= failureLimit) {
            disabledUntil = clock.millis() + disableWindowMs;
            lastNotifiedAt = 0;
            log.warn("Auto-update disabled for {}ms after {} failures (last: {})", disableWindowMs, failures, reason);
        }
        AutoUpdateState next = new AutoUpdateState(failures, reason, disabledUntil, lastNotifiedAt);
        file.write(next);
        return next;
    }

    /**
     * True while the disable window is open. An expired window resets the breaker.
     */
    public synchronized boolean isDisabled() {
        AutoUpdateState state = current();
        long now = clock.millis();
        if (state.isDisabled(now)) {
            return true;
        }
        if (state.disabledUntil() != 0) {
            reset();
        }
        return false;
    }

    /**
     * Marks the current disable window as announced.
     *
     * @return true when this call is the first to announce it
     */
    public synchronized boolean markNotified() {
        AutoUpdateState state = current();
        if (!state.isDisabled(clock.millis()) || state.lastNotifiedAt() != 0) {
            return false;
        }
        file.write(new AutoUpdateState(state.failureCount(), state.lastFailureReason(),
                state.disabledUntil(), clock.millis()));
        return true;
    }

    public String disableNotice(AutoUpdateState state) {
        long hours = Math.round(disableWindowMs / 3_600_000.0);
        return "Auto-update disabled for " + hours + "h after " + state.failureCount() + " failures (last: "
                + (state.lastFailureReason() == null ? "unknown" : state.lastFailureReason())
                + "). Run 'fleetwarden backoff --reset' to re-enable.";
    }

    public synchronized void reset() {
        file.write(AutoUpdateState.initial());
        log.info("Auto-update circuit breaker reset");
    }
}
