package com.fleetwarden.core.classifier;

import java.util.Map;

/**
 * Snapshot of the recovery state machine's counters.
 *
 * @param totalErrors           failures recorded since start
 * @param totalRecoveries       counted failures cleared by a successful completion or restart
 * @param activeTaskErrors      tasks currently holding recovery state
 * @param rateLimitHitsInWindow rate-limit hits inside the kill-switch window
 * @param taskBreakdown         counted failures per task
 */
public record ClassifierStats(
    long totalErrors,
    long totalRecoveries,
    int activeTaskErrors,
    int rateLimitHitsInWindow,
    Map<String, Integer> taskBreakdown
) {}
