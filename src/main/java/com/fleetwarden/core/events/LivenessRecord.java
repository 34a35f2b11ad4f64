package com.fleetwarden.core.events;

/**
 * Snapshot of one agent's heartbeat state.
 *
 * @param taskId        the task the agent works on
 * @param lastHeartbeat epoch millis of the last heartbeat
 * @param alive         heartbeat seen within the stale threshold
 * @param staleSinceMs  elapsed time since the last heartbeat when stale, else {@code null}
 */
public record LivenessRecord(
    String taskId,
    long lastHeartbeat,
    boolean alive,
    Long staleSinceMs
) {}
