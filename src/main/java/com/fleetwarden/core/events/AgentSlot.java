package com.fleetwarden.core.events;

/**
 * Executor slot a task was dispatched to.
 *
 * @param sdk             executor kind, e.g. {@code codex} or {@code copilot}
 * @param agentInstanceId executor instance, may be {@code null}
 * @param branch          working branch, may be {@code null}
 * @param worktreePath    local worktree, may be {@code null}
 */
public record AgentSlot(String sdk, String agentInstanceId, String branch, String worktreePath) {

    public static AgentSlot of(String sdk) {
        return new AgentSlot(sdk, null, null, null);
    }
}
