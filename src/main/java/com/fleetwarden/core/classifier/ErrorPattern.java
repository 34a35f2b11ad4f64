package com.fleetwarden.core.classifier;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of failure and stall patterns recognised by the classifier.
 * <p>
 * Single-text patterns carry a fixed confidence used when {@link PatternLibrary} matches them.
 * Sequence patterns are only produced by {@link MessageSequenceAnalyzer}.
 */
public enum ErrorPattern {

    /** API key invalid, expired or missing. Never retryable. */
    AUTH_ERROR("auth_error", 0.97, "API key invalid, expired, or missing"),
    /** Safety filter rejected the request. Never retryable. */
    CONTENT_POLICY("content_policy", 0.96, "Content policy or safety filter violation"),
    /** Model name unknown, deprecated or unavailable. */
    MODEL_ERROR("model_error", 0.92, "Model not found, deprecated, or unavailable"),
    RATE_LIMITED("rate_limited", 0.95, "API rate limit or quota exceeded"),
    TOKEN_OVERFLOW("token_overflow", 0.90, "Context or token limit exceeded"),
    /** Network or upstream server error. Transient. */
    API_ERROR("api_error", 0.90, "API connection or server error"),
    SESSION_EXPIRED("session_expired", 0.90, "Agent session or thread expired"),
    REQUEST_ERROR("request_error", 0.91, "Bad request (400/404/422), invalid payload or endpoint"),
    OOM_KILL("oom_kill", 0.97, "Process killed by the OS due to out-of-memory"),
    OOM("oom", 0.95, "Heap out-of-memory error"),
    CODEX_SANDBOX("codex_sandbox", 0.88, "Executor sandbox or permission error"),
    PUSH_FAILURE("push_failure", 0.85, "Git push or pre-push hook failure"),
    TEST_FAILURE("test_failure", 0.83, "Unit or integration test failure"),
    LINT_FAILURE("lint_failure", 0.82, "Lint or code formatting failure"),
    BUILD_FAILURE("build_failure", 0.80, "Build or compilation failure"),
    GIT_CONFLICT("git_conflict", 0.85, "Git merge or rebase conflict detected"),
    PLAN_STUCK("plan_stuck", 0.85, "Agent created a plan but did not implement it"),
    PERMISSION_WAIT("permission_wait", 0.75, "Agent waiting for human input or permission"),

    TOOL_LOOP("tool_loop", 0.80, "Same tool invoked repeatedly without new arguments"),
    ANALYSIS_PARALYSIS("analysis_paralysis", 0.80, "Only read operations, no edits"),
    NEEDS_CLARIFICATION("needs_clarification", 0.75, "Agent asked for clarification"),
    FALSE_COMPLETION("false_completion", 0.80, "Completion claimed without a commit or push"),
    COMMITS_NO_PUSH("commits_no_push", 0.80, "Changes committed but never pushed"),
    ERROR_LOOP("error_loop", 0.85, "Identical error repeated consecutively"),
    NO_PROGRESS("no_progress", 0.70, "Messages without tool activity"),

    UNKNOWN("unknown", 0.30, "Unclassified error");

    private final String wireName;
    private final double confidence;
    private final String description;

    ErrorPattern(String wireName, double confidence, String description) {
        this.wireName = wireName;
        this.confidence = confidence;
        this.description = description;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public double confidence() {
        return confidence;
    }

    public String description() {
        return description;
    }

    /** Failures that retrying cannot fix. */
    public boolean isUnrecoverable() {
        return this == AUTH_ERROR || this == MODEL_ERROR || this == CONTENT_POLICY;
    }

    /** Throughput problems handled by cooldown only. */
    public boolean isThrottle() {
        return this == RATE_LIMITED || this == API_ERROR;
    }

    /** Workflow failures retried with a remediation prompt up to the workflow ceiling. */
    public boolean isWorkflowFailure() {
        return this == PUSH_FAILURE || this == TEST_FAILURE || this == LINT_FAILURE
                || this == BUILD_FAILURE || this == GIT_CONFLICT;
    }

    public static ErrorPattern fromWireName(String name) {
        for (ErrorPattern p : values()) {
            if (p.wireName.equals(name)) {
                return p;
            }
        }
        return UNKNOWN;
    }
}
