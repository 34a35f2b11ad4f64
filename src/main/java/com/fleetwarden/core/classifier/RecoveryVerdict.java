package com.fleetwarden.core.classifier;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Recovery decision for one failed attempt.
 *
 * @param action     what the orchestrator should do next
 * @param pattern    the pattern the decision was made for
 * @param reason     human readable explanation, always present
 * @param prompt     remediation prompt to re-inject into the agent, may be {@code null}
 * @param errorCount occurrences of {@code pattern} for the task so far
 * @param cooldownMs wait before the next attempt, only for {@link RecoveryAction#COOLDOWN}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecoveryVerdict(
    RecoveryAction action,
    ErrorPattern pattern,
    String reason,
    String prompt,
    int errorCount,
    Long cooldownMs
) {

    static RecoveryVerdict retry(ErrorPattern pattern, String reason, String prompt, int errorCount) {
        return new RecoveryVerdict(RecoveryAction.RETRY_WITH_PROMPT, pattern, reason, prompt, errorCount, null);
    }

    static RecoveryVerdict cooldown(ErrorPattern pattern, String reason, long cooldownMs, int errorCount) {
        return new RecoveryVerdict(RecoveryAction.COOLDOWN, pattern, reason, null, errorCount, cooldownMs);
    }

    static RecoveryVerdict manual(ErrorPattern pattern, String reason, String prompt, int errorCount) {
        return new RecoveryVerdict(RecoveryAction.MANUAL, pattern, reason, prompt, errorCount, null);
    }

    static RecoveryVerdict block(ErrorPattern pattern, String reason, int errorCount) {
        return new RecoveryVerdict(RecoveryAction.BLOCK, pattern, reason, null, errorCount, null);
    }
}
