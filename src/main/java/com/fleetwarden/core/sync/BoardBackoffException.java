package com.fleetwarden.core.sync;

import java.time.Instant;

/**
 * Raised instead of calling the board while a backoff window is open.
 */
public class BoardBackoffException extends RuntimeException {

    private final long untilEpochMs;

    public BoardBackoffException(String reason, long untilEpochMs) {
        super(reason + " (backing off until " + Instant.ofEpochMilli(untilEpochMs) + ")");
        this.untilEpochMs = untilEpochMs;
    }

    public long getUntilEpochMs() {
        return untilEpochMs;
    }
}
