package com.fleetwarden.core.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Limits invalid-payload warnings to one per {@code role:name:reason} per throttle window,
 * across processes, using the persisted backoff state.
 */
public class PayloadWarningThrottle {

    private static final Logger log = LoggerFactory.getLogger(PayloadWarningThrottle.class);

    private final BackoffStateStore store;
    private final long throttleMs;
    private final Clock clock;

    public PayloadWarningThrottle(BackoffStateStore store, long throttleMs, Clock clock) {
        this.store = store;
        this.throttleMs = throttleMs;
        this.clock = clock;
    }

    /**
     * Logs the warning unless the same key was warned about within the window.
     *
     * @return true when the warning was logged
     */
    public boolean warn(String role, String name, String reason, String shape) {
        String key = role + ":" + name + ":" + reason;
        long now = clock.millis();
        Long last = store.current().payloadWarnings().get(key);
        if (last != null && now - last < throttleMs) {
            log.debug("Suppressed repeated payload warning {}", key);
            return false;
        }
        store.update(state -> state.withPayloadWarning(key, now));
        log.warn("Unexpected {} payload for {} ({}): {}", role, name, reason, shape);
        return true;
    }
}
