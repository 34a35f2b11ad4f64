package com.fleetwarden.core.classifier;

import java.util.List;
import java.util.Map;

/**
 * Behavioural stall patterns found in a window of agent messages.
 *
 * @param patterns every pattern detected, in detection order
 * @param primary  the most actionable pattern, or {@code null} when none was detected
 * @param details  per-pattern explanation
 */
public record SequenceAnalysis(
    List<ErrorPattern> patterns,
    ErrorPattern primary,
    Map<ErrorPattern, String> details
) {

    public SequenceAnalysis {
        patterns = List.copyOf(patterns);
        details = Map.copyOf(details);
    }

    public static SequenceAnalysis empty() {
        return new SequenceAnalysis(List.of(), null, Map.of());
    }

    public boolean has(ErrorPattern pattern) {
        return patterns.contains(pattern);
    }
}
