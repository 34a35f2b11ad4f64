package com.fleetwarden.core.classifier;

/**
 * Result of matching raw agent output against the {@link PatternLibrary}.
 *
 * @param pattern    the matched pattern, {@link ErrorPattern#UNKNOWN} when nothing matched
 * @param confidence fixed per-pattern constant
 * @param details    human readable description of the pattern
 * @param rawMatch   the input line that triggered the rule, or {@code null}
 */
public record ErrorClassification(
    ErrorPattern pattern,
    double confidence,
    String details,
    String rawMatch
) {

    public static ErrorClassification of(ErrorPattern pattern, String rawMatch) {
        return new ErrorClassification(pattern, pattern.confidence(), pattern.description(), rawMatch);
    }

    public static ErrorClassification unknown() {
        return of(ErrorPattern.UNKNOWN, null);
    }
}
