package com.fleetwarden.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Claim record written to a task's shared-state comment so that concurrent orchestrators
 * can see who owns the current attempt.
 *
 * @param ownerId        {@code workstation/agent} identity of the owner
 * @param attemptToken   unique token for the current attempt
 * @param attemptStarted ISO timestamp of the attempt start
 * @param heartbeat      ISO timestamp of the last owner heartbeat
 * @param status         {@code claimed}, {@code working} or {@code stale}
 * @param retryCount     attempts made so far
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SharedState(
    String ownerId,
    String attemptToken,
    String attemptStarted,
    String heartbeat,
    String status,
    Integer retryCount
) {

    /** Has every field a reader needs to trust the claim. */
    public boolean isComplete() {
        return notBlank(ownerId) && notBlank(attemptToken) && notBlank(attemptStarted)
                && notBlank(heartbeat) && notBlank(status);
    }

    public boolean isStale() {
        return "stale".equals(status);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
