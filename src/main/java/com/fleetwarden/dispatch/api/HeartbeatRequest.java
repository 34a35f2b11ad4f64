package com.fleetwarden.dispatch.api;

/**
 * Body of {@code POST /api/v1/fleet/agents/{taskId}/heartbeat}; the body itself is optional.
 */
public record HeartbeatRequest(String message) {}
