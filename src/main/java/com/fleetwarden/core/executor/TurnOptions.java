package com.fleetwarden.core.executor;

import java.time.Duration;

/**
 * Per-turn settings.
 *
 * @param taskId       task the turn works on
 * @param sessionId    session to resume, {@code null} for a fresh one
 * @param timeout      caller budget for the whole turn including retries, {@code null} for the default
 * @param cancellation fired to abort the turn
 */
public record TurnOptions(String taskId, String sessionId, Duration timeout, CancellationSignal cancellation) {

    public TurnOptions {
        cancellation = cancellation == null ? new CancellationSignal() : cancellation;
    }

    public static TurnOptions forTask(String taskId) {
        return new TurnOptions(taskId, null, null, null);
    }

    public TurnOptions withTimeout(Duration newTimeout) {
        return new TurnOptions(taskId, sessionId, newTimeout, cancellation);
    }

    public TurnOptions withSession(String newSessionId) {
        return new TurnOptions(taskId, newSessionId, timeout, cancellation);
    }
}
