package com.fleetwarden.core.events;

import java.util.List;

/**
 * Aggregate of one error pattern across every tracked task.
 *
 * @param count    occurrences in retained history
 * @param lastSeen epoch millis of the latest occurrence
 * @param tasks    tasks that hit the pattern, in first-seen order
 */
public record PatternSummary(int count, long lastSeen, List<String> tasks) {}
