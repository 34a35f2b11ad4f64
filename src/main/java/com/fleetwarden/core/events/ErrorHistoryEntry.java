package com.fleetwarden.core.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fleetwarden.core.classifier.ErrorPattern;
import com.fleetwarden.core.classifier.RecoveryAction;

/**
 * One classified failure kept in a task's error history.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorHistoryEntry(
    ErrorPattern pattern,
    long ts,
    RecoveryAction action,
    double confidence,
    String details,
    String rawMatch
) {}
