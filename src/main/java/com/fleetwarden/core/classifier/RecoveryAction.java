package com.fleetwarden.core.classifier;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Decision returned by {@link ErrorClassifier#recordError}.
 */
public enum RecoveryAction {
    RETRY_WITH_PROMPT("retry_with_prompt"),
    COOLDOWN("cooldown"),
    MANUAL("manual"),
    BLOCK("block");

    private final String wireName;

    RecoveryAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Verdicts that require a human. */
    public boolean isEscalation() {
        return this == MANUAL || this == BLOCK;
    }
}
