package com.fleetwarden.core.events;

/**
 * Result details of a lifecycle hook run (pre-push checks and similar).
 */
public record HookDetails(String hookId, String output, Long durationMs) {

    public static HookDetails none() {
        return new HookDetails(null, null, null);
    }
}
