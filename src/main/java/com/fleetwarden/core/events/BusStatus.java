package com.fleetwarden.core.events;

import com.fleetwarden.core.classifier.ErrorPattern;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the event bus for status endpoints.
 */
public record BusStatus(
    boolean started,
    int eventLogSize,
    int trackedAgents,
    int errorTrackedTasks,
    int autoActionTasks,
    int listenerCount,
    List<LivenessRecord> liveness,
    Map<ErrorPattern, PatternSummary> errorPatterns
) {}
