package com.fleetwarden.core.executor;

/**
 * One coding-agent executor. Implementations wrap a vendor SDK or subprocess.
 */
public interface ExecutorClient {

    /** Short executor name used in logs and events, e.g. {@code codex}. */
    String name();

    /**
     * Runs one agent turn to completion.
     * <p>
     * Implementations should stop promptly when {@link TurnOptions#cancellation()} fires or the
     * calling thread is interrupted.
     *
     * @throws RuntimeException on any failure; stream and network faults are retried by {@link AgentTurnRunner}
     */
    TurnResult execPrompt(String message, TurnOptions options);
}
