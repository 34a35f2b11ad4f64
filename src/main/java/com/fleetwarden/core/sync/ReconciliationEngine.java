package com.fleetwarden.core.sync;

import com.fleetwarden.core.events.AgentEventBus;
import com.fleetwarden.core.events.AgentEventType;
import com.fleetwarden.core.logging.MdcContext;
import com.fleetwarden.core.metrics.FleetMetrics;
import com.fleetwarden.core.model.FleetTask;
import com.fleetwarden.core.model.SharedState;
import com.fleetwarden.core.model.TaskStatus;
import com.fleetwarden.core.store.InMemoryTaskStore;
import com.fleetwarden.core.sync.BoardAdapter.IssueState;
import com.fleetwarden.core.sync.BoardAdapter.PullRequestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Brings the local task store and the board into agreement.
 * <p>
 * One pass, in order:
 * <ol>
 *   <li>in kanban mode, board columns win over issue labels;</li>
 *   <li>open issues referenced by a merged pull request are closed;</li>
 *   <li>issues referenced by an open pull request move to review;</li>
 *   <li>local and remote statuses are merged: local work in flight is pushed over a remote
 *       todo, otherwise the remote wins;</li>
 *   <li>local owners are checked against the issue's shared-state claim;</li>
 *   <li>local tasks absent from the open list are closed or dropped.</li>
 * </ol>
 * Per-item failures are counted and skipped. A rate-limit or owner backoff ends the pass early.
 */
@Service
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    static final String CONFLICT_META = "ownershipConflict";

    private static final Set<TaskStatus> LOCAL_WORK = Set.of(TaskStatus.INPROGRESS, TaskStatus.INREVIEW, TaskStatus.BLOCKED);
    private static final Set<TaskStatus> REMOTE_IDLE = Set.of(TaskStatus.TODO, TaskStatus.DRAFT);

    private final BoardAdapter board;
    private final InMemoryTaskStore store;
    private final ProjectSettings settings;
    private final FleetMetrics metrics;
    private final Clock clock;
    private final AgentEventBus eventBus;

    private final AtomicLong cycles = new AtomicLong();
    private volatile ReconcileSummary lastSummary;

    public ReconciliationEngine(BoardAdapter board, InMemoryTaskStore store, ProjectSettings settings,
                                FleetMetrics metrics, Clock clock,
                                @Autowired(required = false) AgentEventBus eventBus) {
        this.board = board;
        this.store = store;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    /** Mutable tallies for one pass. */
    private static final class Tally {
        int checked;
        int projectMismatches;
        int conflicts;
        int closed;
        int missing;
        int imported;
        int pushed;
        int pulled;
        int errors;

        ReconcileSummary toSummary(String status, long durationMs) {
            return new ReconcileSummary(status, checked, projectMismatches, conflicts, closed, missing,
                    imported, pushed, pulled, errors, durationMs);
        }
    }

    public synchronized ReconcileSummary reconcileOnce() {
        long cycle = cycles.incrementAndGet();
        MdcContext.setSyncCycle(cycle);
        long startedAt = clock.millis();
        Tally tally = new Tally();
        String status;
        try {
            if (!settings.hasRepository()) {
                log.warn("Board sync skipped: no repository configured (set GITHUB_REPOSITORY)");
                status = ReconcileSummary.SKIPPED;
            } else {
                runPass(tally);
                status = ReconcileSummary.OK;
            }
        } catch (BoardBackoffException e) {
            log.warn("Board sync cycle {} stopped: {}", cycle, e.getMessage());
            status = ReconcileSummary.BACKOFF;
        } catch (RuntimeException e) {
            log.error("Board sync cycle {} failed: {}", cycle, e.getMessage(), e);
            tally.errors++;
            status = ReconcileSummary.ERROR;
        } finally {
            MdcContext.clear();
        }

        long durationMs = clock.millis() - startedAt;
        ReconcileSummary summary = tally.toSummary(status, durationMs);
        metrics.recordSyncCycle(status, durationMs);
        lastSummary = summary;
        log.info("Board sync cycle {} {}: checked={} mismatches={} conflicts={} closed={} missing={} "
                        + "imported={} pushed={} pulled={} errors={} ({}ms)",
                cycle, status, summary.checked(), summary.projectMismatches(), summary.conflicts(), summary.closed(),
                summary.missing(), summary.imported(), summary.pushed(), summary.pulled(), summary.errors(), durationMs);
        return summary;
    }

    public Optional<ReconcileSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    private void runPass(Tally tally) {
        List<BoardIssue> openIssues = board.listIssues(IssueState.OPEN);
        List<PullRequestRef> openPrs = board.listPullRequests(PullRequestState.OPEN);
        List<PullRequestRef> mergedPrs = board.listPullRequests(PullRequestState.MERGED);
        Set<String> closedRemote = new HashSet<>();
        for (BoardIssue issue : board.listIssues(IssueState.CLOSED)) {
            closedRemote.add(issue.number());
        }

        Map<String, BoardIssue> open = new LinkedHashMap<>();
        Map<String, TaskStatus> remoteStatus = new LinkedHashMap<>();
        for (BoardIssue issue : openIssues) {
            open.put(issue.number(), issue);
            remoteStatus.put(issue.number(), issue.status());
        }

        if (settings.usesProjectBoard()) {
            applyBoardColumns(remoteStatus, tally);
        }
        closeMergedIssues(mergedPrs, remoteStatus, tally);
        moveToReview(openPrs, remoteStatus, tally);

        for (BoardIssue issue : open.values()) {
            mergeIssue(issue, remoteStatus.get(issue.number()), tally);
        }
        sweepAbsent(open.keySet(), closedRemote, tally);
    }

    private void applyBoardColumns(Map<String, TaskStatus> remoteStatus, Tally tally) {
        List<BoardItem> items;
        try {
            items = board.listProjectItems(settings.boardId());
        } catch (GhCommandException | BoardBackoffException e) {
            log.warn("Project board {} unavailable, using issue labels only: {}", settings.boardId(), e.getMessage());
            return;
        }
        for (BoardItem item : items) {
            TaskStatus current = remoteStatus.get(item.issueNumber());
            if (current == null || current == item.status()) {
                continue;
            }
            try {
                board.updateTaskStatus(item.issueNumber(), item.status());
                remoteStatus.put(item.issueNumber(), item.status());
                tally.projectMismatches++;
                log.info("Issue #{} follows board column '{}' ({} -> {})",
                        item.issueNumber(), item.rawStatus(), current.wireName(), item.status().wireName());
            } catch (GhCommandException e) {
                tally.errors++;
                log.warn("Failed to apply board column for #{}: {}", item.issueNumber(), e.getMessage());
            }
        }
    }

    private void closeMergedIssues(List<PullRequestRef> mergedPrs, Map<String, TaskStatus> remoteStatus, Tally tally) {
        for (PullRequestRef pr : mergedPrs) {
            for (String number : pr.referencedIssues()) {
                TaskStatus current = remoteStatus.get(number);
                if (current == null || current.isTerminal()) {
                    continue;
                }
                try {
                    board.updateTaskStatus(number, TaskStatus.DONE);
                    remoteStatus.put(number, TaskStatus.DONE);
                    tally.closed++;
                    log.info("Closed issue #{}: resolved by merged PR #{}", number, pr.number());
                } catch (GhCommandException e) {
                    tally.errors++;
                    log.warn("Failed to close issue #{} for merged PR #{}: {}", number, pr.number(), e.getMessage());
                }
            }
        }
    }

    private void moveToReview(List<PullRequestRef> openPrs, Map<String, TaskStatus> remoteStatus, Tally tally) {
        for (PullRequestRef pr : openPrs) {
            for (String number : pr.referencedIssues()) {
                TaskStatus current = remoteStatus.get(number);
                if (current != TaskStatus.TODO && current != TaskStatus.INPROGRESS) {
                    continue;
                }
                try {
                    board.updateTaskStatus(number, TaskStatus.INREVIEW);
                    remoteStatus.put(number, TaskStatus.INREVIEW);
                    log.info("Issue #{} in review: open PR #{}", number, pr.number());
                } catch (GhCommandException e) {
                    tally.errors++;
                    log.warn("Failed to move issue #{} to review: {}", number, e.getMessage());
                }
            }
        }
    }

    private void mergeIssue(BoardIssue issue, TaskStatus remote, Tally tally) {
        tally.checked++;
        Optional<FleetTask> existing = store.findTask(issue.number());
        if (existing.isEmpty()) {
            if (!remote.isTerminal()) {
                store.upsert(FleetTask.of(issue.number(), issue.title(), remote));
                tally.imported++;
            }
            return;
        }

        FleetTask task = existing.get();
        if (task.status() != remote) {
            if (LOCAL_WORK.contains(task.status()) && REMOTE_IDLE.contains(remote)) {
                try {
                    board.updateTaskStatus(issue.number(), task.status());
                    tally.pushed++;
                } catch (GhCommandException e) {
                    tally.errors++;
                    log.warn("Failed to push status of #{}: {}", issue.number(), e.getMessage());
                }
            } else {
                task = store.update(task.id(), t -> t.withStatus(remote)).orElse(task);
                tally.pulled++;
            }
        }
        checkOwnership(task, tally);
    }

    private void checkOwnership(FleetTask task, Tally tally) {
        String localOwner = OwnershipResolver.localOwner(task);
        if (localOwner == null || task.status().isTerminal()) {
            return;
        }
        String remoteOwner;
        try {
            remoteOwner = board.readSharedState(task.id()).map(SharedState::ownerId).orElse(null);
        } catch (GhCommandException e) {
            tally.errors++;
            log.warn("Failed to read shared state of #{}: {}", task.id(), e.getMessage());
            return;
        }

        if (!OwnershipResolver.isConflict(localOwner, remoteOwner, task.isStale())) {
            if (task.meta().containsKey(CONFLICT_META)) {
                store.update(task.id(), t -> t.withMeta(CONFLICT_META, null));
            }
            return;
        }

        tally.conflicts++;
        String detectedAt = Instant.ofEpochMilli(clock.millis()).toString();
        Map<String, Object> conflict = Map.of(
                "localOwner", localOwner,
                "remoteOwner", remoteOwner,
                "detectedAt", detectedAt);
        store.update(task.id(), t -> t.withMeta(CONFLICT_META, conflict));
        log.warn("Ownership conflict on #{}: local owner {} but board claim is {}", task.id(), localOwner, remoteOwner);
        if (eventBus != null) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("title", task.title());
            payload.put("localOwner", localOwner);
            payload.put("remoteOwner", remoteOwner);
            eventBus.emit(AgentEventType.TASK_OWNERSHIP_CONFLICT, task.id(), payload);
        }
    }

    private void sweepAbsent(Set<String> openNumbers, Set<String> closedRemote, Tally tally) {
        for (FleetTask task : store.listTasks()) {
            if (task.status().isTerminal() || openNumbers.contains(task.id()) || !isIssueNumber(task.id())) {
                continue;
            }
            try {
                if (closedRemote.contains(task.id())) {
                    store.update(task.id(), t -> t.withStatus(TaskStatus.DONE));
                    tally.closed++;
                    continue;
                }
                Optional<BoardIssue> remote = board.getIssue(task.id());
                if (remote.isEmpty()) {
                    store.remove(task.id());
                    tally.missing++;
                    log.info("Dropped local task #{}: issue no longer exists", task.id());
                } else if (!remote.get().isOpen()) {
                    store.update(task.id(), t -> t.withStatus(TaskStatus.DONE));
                    tally.closed++;
                } else {
                    log.debug("Task #{} is open remotely but out of scope, left unchanged", task.id());
                }
            } catch (GhCommandException e) {
                tally.errors++;
                log.warn("Failed to check remote state of #{}: {}", task.id(), e.getMessage());
            }
        }
    }

    private static boolean isIssueNumber(String id) {
        return id != null && !id.isEmpty() && id.chars().allMatch(Character::isDigit);
    }
}
