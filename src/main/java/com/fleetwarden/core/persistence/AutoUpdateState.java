package com.fleetwarden.core.persistence;

/**
 * Circuit-breaker record for self-update attempts.
 *
 * @param failureCount      consecutive failed installs
 * @param lastFailureReason short failure code of the latest failure
 * @param disabledUntil     epoch ms until which updates are skipped, 0 when enabled
 * @param lastNotifiedAt    epoch ms the operator was told about the current disable window, 0 when not yet
 */
public record AutoUpdateState(int failureCount, String lastFailureReason, long disabledUntil, long lastNotifiedAt) {

    public static AutoUpdateState initial() {
        return new AutoUpdateState(0, null, 0, 0);
    }

    public boolean isDisabled(long now) {
        return disabledUntil != 0 && now < disabledUntil;
    }
}
