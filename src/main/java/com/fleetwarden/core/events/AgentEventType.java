package com.fleetwarden.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of agent lifecycle signals carried by the {@link AgentEventBus}.
 */
public enum AgentEventType {
    // Task lifecycle
    TASK_QUEUED("task:queued"),
    TASK_STARTED("task:started"),
    TASK_COMPLETED("task:completed"),
    TASK_FAILED("task:failed"),
    TASK_BLOCKED("task:blocked"),
    TASK_STATUS_CHANGE("task:status-change"),
    TASK_OWNERSHIP_CONFLICT("task:ownership-conflict"),

    // Agent self-reports
    AGENT_HEARTBEAT("agent:heartbeat"),
    AGENT_COMPLETE("agent:complete"),
    AGENT_ERROR("agent:error"),
    AGENT_ALIVE("agent:alive"),
    AGENT_STALE("agent:stale"),

    // Auto-actions
    AUTO_RETRY("auto:retry"),
    AUTO_REVIEW("auto:review"),
    AUTO_COOLDOWN("auto:cooldown"),
    AUTO_BLOCK("auto:block"),
    AUTO_NEW_SESSION("auto:new-session"),

    EXECUTOR_PAUSED("executor:paused"),
    EXECUTOR_RESUMED("executor:resumed"),

    ERROR_CLASSIFIED("error:classified"),
    ERROR_PATTERN_DETECTED("error:pattern-detected"),
    ERROR_THRESHOLD_REACHED("error:threshold-reached"),

    HOOK_PASSED("hook:passed"),
    HOOK_FAILED("hook:failed");

    private static final Map<String, AgentEventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(AgentEventType::wireName, Function.identity()));

    private final String wireName;

    AgentEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a type by wire name or enum constant name, {@code null} when unknown.
     */
    public static AgentEventType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        AgentEventType byWire = BY_WIRE_NAME.get(value.trim().toLowerCase());
        if (byWire != null) {
            return byWire;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
