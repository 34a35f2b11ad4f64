package com.fleetwarden.core.events;

/**
 * Outcome of a finished task attempt, reported by the executor or by the agent itself.
 *
 * @param attempts   attempts used, at least 1
 * @param success    the attempt finished without error
 * @param hasCommits the agent produced at least one commit
 * @param branch     branch carrying the commits
 * @param prUrl      pull request URL when one was opened
 * @param prNumber   pull request number when one was opened
 */
public record CompletionReport(
    int attempts,
    boolean success,
    boolean hasCommits,
    String branch,
    String prUrl,
    Integer prNumber
) {

    public CompletionReport {
        attempts = Math.max(1, attempts);
    }

    public static CompletionReport succeeded(boolean hasCommits, String branch) {
        return new CompletionReport(1, true, hasCommits, branch, null, null);
    }

    public static CompletionReport failed(int attempts) {
        return new CompletionReport(attempts, false, false, null, null, null);
    }
}
