package com.fleetwarden.core.persistence;

/**
 * What is needed to resume a task's executor session after a restart.
 *
 * @param taskId       the task
 * @param sessionId    executor thread or session identifier, {@code null} before the first turn
 * @param sdk          executor name
 * @param status       {@code active}, {@code idle}, {@code completed} or {@code failed}
 * @param turnCount    turns completed so far
 * @param lastActiveAt epoch ms of the last turn
 * @param lastResponse final response of the last turn, truncated
 */
public record SessionSnapshot(
    String taskId,
    String sessionId,
    String sdk,
    String status,
    int turnCount,
    long lastActiveAt,
    String lastResponse
) {

    static final int MAX_RESPONSE_CHARS = 2000;

    public SessionSnapshot {
        if (lastResponse != null && lastResponse.length() > MAX_RESPONSE_CHARS) {
            lastResponse = lastResponse.substring(0, MAX_RESPONSE_CHARS);
        }
    }

    public SessionSnapshot afterTurn(String newSessionId, String newStatus, long at, String response) {
        return new SessionSnapshot(taskId, newSessionId != null ? newSessionId : sessionId, sdk, newStatus,
                turnCount + 1, at, response);
    }
}
