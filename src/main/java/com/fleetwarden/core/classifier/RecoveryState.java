package com.fleetwarden.core.classifier;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-task recovery bookkeeping. Only {@link ErrorClassifier} mutates it, always while
 * holding the instance monitor.
 */
final class RecoveryState {

    private final Map<ErrorPattern, Integer> counts = new EnumMap<>(ErrorPattern.class);
    private int errorCount;
    private ErrorPattern lastPattern;
    private long cooldownUntil;
    private long lastErrorAt;

    int increment(ErrorPattern pattern, long now) {
        errorCount++;
        lastPattern = pattern;
        lastErrorAt = now;
        return counts.merge(pattern, 1, Integer::sum);
    }

    void noteThrottle(ErrorPattern pattern, long now, long cooldownMs) {
        lastPattern = pattern;
        lastErrorAt = now;
        cooldownUntil = Math.max(cooldownUntil, now + cooldownMs);
    }

    int count(ErrorPattern pattern) {
        return counts.getOrDefault(pattern, 0);
    }

    int errorCount() {
        return errorCount;
    }

    ErrorPattern lastPattern() {
        return lastPattern;
    }

    long cooldownUntil() {
        return cooldownUntil;
    }

    long lastErrorAt() {
        return lastErrorAt;
    }
}
