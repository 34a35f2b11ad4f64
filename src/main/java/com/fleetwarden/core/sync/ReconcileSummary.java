package com.fleetwarden.core.sync;

/**
 * Outcome of one reconciliation pass.
 *
 * @param status            {@code ok}, {@code skipped}, {@code backoff} or {@code error}
 * @param checked           open remote issues compared with the local store
 * @param projectMismatches issues whose board column disagreed with the issue and was applied
 * @param conflicts         tasks whose local and remote owners disagree
 * @param closed            tasks closed because a merged PR resolved them or they were closed remotely
 * @param missing           local tasks dropped because the remote issue no longer exists
 * @param imported          remote issues added to the local store
 * @param pushed            local statuses written to the board
 * @param pulled            remote statuses applied locally
 * @param errors            per-item failures
 */
public record ReconcileSummary(
    String status,
    int checked,
    int projectMismatches,
    int conflicts,
    int closed,
    int missing,
    int imported,
    int pushed,
    int pulled,
    int errors,
    long durationMs
) {

    public static final String OK = "ok";
    public static final String SKIPPED = "skipped";
    public static final String BACKOFF = "backoff";
    public static final String ERROR = "error";

    public boolean isOk() {
        return OK.equals(status);
    }
}
