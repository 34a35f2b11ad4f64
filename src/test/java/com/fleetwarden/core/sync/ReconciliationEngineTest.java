package com.fleetwarden.core.sync;

import com.fleetwarden.MutableClock;
import com.fleetwarden.core.events.AgentEventBus;
import com.fleetwarden.core.events.AgentEventType;
import com.fleetwarden.core.metrics.FleetMetrics;
import com.fleetwarden.core.model.FleetTask;
import com.fleetwarden.core.model.SharedState;
import com.fleetwarden.core.model.TaskStatus;
import com.fleetwarden.core.store.InMemoryTaskStore;
import com.fleetwarden.core.sync.BoardAdapter.IssueState;
import com.fleetwarden.core.sync.BoardAdapter.PullRequestState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ReconciliationEngineTest {

    private static final ProjectSettings ISSUES = new ProjectSettings(ProjectMode.ISSUES, null, "acme", "rockets",
            "acme", false, List.of("fleetwarden"), 60_000, 900_000);
    private static final ProjectSettings KANBAN = new ProjectSettings(ProjectMode.KANBAN, "7", "acme", "rockets",
            "acme", false, List.of("fleetwarden"), 60_000, 900_000);

    private BoardAdapter board;
    private InMemoryTaskStore store;
    private AgentEventBus eventBus;
    private SimpleMeterRegistry registry;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        board = mock(BoardAdapter.class);
        store = new InMemoryTaskStore();
        eventBus = mock(AgentEventBus.class);
        registry = new SimpleMeterRegistry();
        clock = MutableClock.startingAt(1_700_000_000_000L);
    }

    private ReconciliationEngine engine(ProjectSettings settings) {
        return new ReconciliationEngine(board, store, settings, new FleetMetrics(registry), clock, eventBus);
    }

    private static BoardIssue open(String number, String... labels) {
        return new BoardIssue(number, "Issue " + number, "OPEN", List.of(labels), null, "");
    }

    private static PullRequestRef pr(int number, String body) {
        return new PullRequestRef(number, "PR " + number, body, "ve/" + number, "OPEN");
    }

    private void openIssues(BoardIssue... issues) {
        when(board.listIssues(IssueState.OPEN)).thenReturn(List.of(issues));
    }

    private TaskStatus localStatus(String id) {
        return store.findTask(id).orElseThrow().status();
    }

    // -- Cycle outcome -------------------------------------------------------

    @Nested
    @DisplayName("cycle outcome")
    class OutcomeTests {

        @Test
        @DisplayName("is skipped without a repository")
        void skippedWithoutRepository() {
            var settings = new ProjectSettings(ProjectMode.ISSUES, null, ProjectSettings.UNKNOWN, ProjectSettings.UNKNOWN,
                    ProjectSettings.UNKNOWN, true, List.of(), 60_000, 900_000);

            ReconcileSummary summary = engine(settings).reconcileOnce();

            assertEquals(ReconcileSummary.SKIPPED, summary.status());
            verifyNoInteractions(board);
        }

        @Test
        @DisplayName("a rate limit ends the pass as backoff")
        void backoff() {
            when(board.listIssues(IssueState.OPEN)).thenThrow(new BoardBackoffException("GitHub rate limit", 1L));

            ReconcileSummary summary = engine(ISSUES).reconcileOnce();

            assertEquals(ReconcileSummary.BACKOFF, summary.status());
            assertEquals(1.0, registry.get("fleetwarden.sync.cycles").tag("status", "backoff").counter().count());
        }

        @Test
        @DisplayName("a listing failure ends the pass as error")
        void error() {
            when(board.listIssues(IssueState.OPEN))
                    .thenThrow(new GhCommandException("gh CLI failed", List.of(), "HTTP 500", 1));
            ReconciliationEngine engine = engine(ISSUES);

            ReconcileSummary summary = engine.reconcileOnce();

            assertEquals(ReconcileSummary.ERROR, summary.status());
            assertEquals(1, summary.errors());
            assertEquals(summary, engine.getLastSummary().orElseThrow());
        }

        @Test
        @DisplayName("no summary before the first pass")
        void noSummaryYet() {
            assertTrue(engine(ISSUES).getLastSummary().isEmpty());
        }
    }

    // -- Status merge ------------------------------------------------------------

    @Nested
    @DisplayName("status merge")
    class MergeTests {

        @Test
        @DisplayName("imports open remote issues")
        void importsIssues() {
            openIssues(open("1", "inprogress"), open("2"));

            ReconcileSummary summary = engine(ISSUES).reconcileOnce();

            assertTrue(summary.isOk());
            assertEquals(2, summary.checked());
            assertEquals(2, summary.imported());
            assertEquals(TaskStatus.INPROGRESS, localStatus("1"));
            assertEquals(TaskStatus.TODO, localStatus("2"));
        }

        @Test
        @DisplayName("local work in flight is pushed over a remote todo")
        void pushesLocalWork() {
            store.upsert(FleetTask.of("3", "Issue 3", TaskStatus.INPROGRESS));
            openIssues(open("3"));

            ReconcileSummary summary = engine(ISSUES).reconcileOnce();

            verify(board).updateTaskStatus("3", TaskStatus.INPROGRESS);
            assertEquals(1, summary.pushed());
            assertEquals(TaskStatus.INPROGRESS, localStatus("3"));
        }

        @Test
        @DisplayName("otherwise the remote status wins")
        void pullsRemote() {
            store.upsert(FleetTask.of("4", "Issue 4", TaskStatus.TODO));
            openIssues(open("4", "blocked"));

            ReconcileSummary summary = engine(ISSUES).reconcileOnce();

            assertEquals(1, summary.pulled());
            assertEquals(TaskStatus.BLOCKED, localStatus("4"));
            verify(board, never()).updateTaskStatus(anyString(), any());
        }

        @Test
        @DisplayName("a failed push is counted and the pass continues")
        void failedPush() {
            store.upsert(FleetTask.of("5", "Issue 5", TaskStatus.INREVIEW));
            openIssues(open("5"), open("6"));
            doThrow(new GhCommandException("gh CLI failed", List.of(), "HTTP 502 bad gateway", 1))
                    .when(board).updateTaskStatus("5", TaskStatus.INREVIEW);

            ReconcileSummary summary = engine(ISSUES).reconcileOnce();

            assertTrue(summary.isOk());
            assertEquals(1, summary.errors());
            assertEquals(1, summary.imported());
        }
    }

    // -- Pull requests -----------------------------------------------------------

    @Nested
    @DisplayName("pull requests")
    class PullRequestTests {

        @Test
        @DisplayName("a merged PR closes the issues it resolves")
        void mergedClosesIssue() {
            openIssues(open("7"));
            when(board.listPullRequests(PullRequestState.MERGED)).thenReturn(List.of(pr(20, "Fixes #7")));

            ReconcileSummary summary = engine(ISSUES).reconcileOnce();

            verify(board).updateTaskStatus("7", TaskStatus.DONE);
            assertEquals(1, summary.closed());
            assertTrue(store.findTask("7").isEmpty());
        }

        @Test
        @DisplayName("an open PR moves its issue to review")
        void openMovesToReview() {
            openIssues(open("8", "inprogress"), open("9", "blocked"));
            when(board.listPullRequests(PullRequestState.OPEN))
                    .thenReturn(List.of(pr(21, "Closes #8"), pr(22, "Resolves #9")));

            engine(ISSUES).reconcileOnce();

            verify(board).updateTaskStatus("8", TaskStatus.INREVIEW);
            verify(board, never()).updateTaskStatus("9", TaskStatus.INREVIEW);
            assertEquals(TaskStatus.INREVIEW, localStatus("8"));
        }
    }

    // -- Project board -----------------------------------------------------------

    @Nested
    @DisplayName("project board")
    class BoardTests {

        @Test
        @DisplayName("board columns win over issue labels")
        void columnsWin() {
            openIssues(open("10"), open("11", "inprogress"));
            when(board.listProjectItems("7")).thenReturn(List.of(
                    new BoardItem("10", "PVTI_10", "Issue 10", TaskStatus.INPROGRESS, "In Progress"),
                    new BoardItem("11", "PVTI_11", "Issue 11", TaskStatus.INPROGRESS, "In Progress"),
                    new BoardItem("99", "PVTI_99", "Elsewhere", TaskStatus.DONE, "Done")));

            ReconcileSummary summary = engine(KANBAN).reconcileOnce();

            assertEquals(1, summary.projectMismatches());
            verify(board).updateTaskStatus("10", TaskStatus.INPROGRESS);
            verify(board, never()).updateTaskStatus(eq("99"), any());
            assertEquals(TaskStatus.INPROGRESS, localStatus("10"));
        }

        @Test
        @DisplayName("an unavailable board falls back to labels")
        void boardUnavailable() {
            openIssues(open("12", "blocked"));
            when(board.listProjectItems("7")).thenThrow(new BoardBackoffException("Every project owner was rejected", 1L));

            ReconcileSummary summary = engine(KANBAN).reconcileOnce();

            assertTrue(summary.isOk());
            assertEquals(TaskStatus.BLOCKED, localStatus("12"));
        }

        @Test
        @DisplayName("issues mode never reads the board")
        void issuesModeSkipsBoard() {
            engine(ISSUES).reconcileOnce();

            verify(board, never()).listProjectItems(anyString());
        }
    }

    // -- Ownership ---------------------------------------------------------------

    @Nested
    @DisplayName("ownership")
    class OwnershipTests {

        private final SharedState remoteClaim = new SharedState(
                "ws-b/codex", "tok", "2026-03-01T10:00:00Z", "2026-03-01T10:01:00Z", "working", 0);

        @Test
        @DisplayName("a differing board claim is recorded and announced")
        void conflictRecorded() {
            store.upsert(FleetTask.of("13", "Ship it", TaskStatus.INPROGRESS).withSharedStateOwner("ws-a/codex"));
            openIssues(open("13", "inprogress"));
            when(board.readSharedState("13")).thenReturn(Optional.of(remoteClaim));

            ReconcileSummary summary = engine(ISSUES).reconcileOnce();

            assertEquals(1, summary.conflicts());
            @SuppressWarnings("unchecked")
            var conflict = (Map<String, Object>) store.findTask("13").orElseThrow().meta()
                    .get(ReconciliationEngine.CONFLICT_META);
            assertEquals("ws-a/codex", conflict.get("localOwner"));
            assertEquals("ws-b/codex", conflict.get("remoteOwner"));
            assertEquals("2023-11-14T22:13:20Z", conflict.get("detectedAt"));
            verify(eventBus).emit(eq(AgentEventType.TASK_OWNERSHIP_CONFLICT), eq("13"), anyMap());
        }

        @Test
        @DisplayName("an agreeing claim clears an earlier conflict")
        void conflictCleared() {
            store.upsert(FleetTask.of("14", "Ship it", TaskStatus.INPROGRESS)
                    .withSharedStateOwner("ws-b/codex")
                    .withMeta(ReconciliationEngine.CONFLICT_META, Map.of("localOwner", "ws-a/codex")));
            openIssues(open("14", "inprogress"));
            when(board.readSharedState("14")).thenReturn(Optional.of(remoteClaim));

            ReconcileSummary summary = engine(ISSUES).reconcileOnce();

            assertEquals(0, summary.conflicts());
            assertFalse(store.findTask("14").orElseThrow().meta().containsKey(ReconciliationEngine.CONFLICT_META));
            verifyNoInteractions(eventBus);
        }

        @Test
        @DisplayName("a stale local record is never a conflict")
        void staleIsNotConflict() {
            store.upsert(FleetTask.of("15", "Ship it", TaskStatus.INPROGRESS)
                    .withSharedStateOwner("ws-a/codex")
                    .withMeta("stale", true));
            openIssues(open("15", "inprogress"));
            when(board.readSharedState("15")).thenReturn(Optional.of(remoteClaim));

            assertEquals(0, engine(ISSUES).reconcileOnce().conflicts());
        }

        @Test
        @DisplayName("tasks without a local owner skip the claim lookup")
        void noLocalOwner() {
            store.upsert(FleetTask.of("16", "Ship it", TaskStatus.INPROGRESS));
            openIssues(open("16", "inprogress"));

            engine(ISSUES).reconcileOnce();

            verify(board, never()).readSharedState(anyString());
        }

        @Test
        @DisplayName("a status change made while the claim is read is kept")
        void concurrentStatusChangeKept() {
            store.upsert(FleetTask.of("21", "Ship it", TaskStatus.INPROGRESS).withSharedStateOwner("ws-a/codex"));
            openIssues(open("21", "inprogress"));
            when(board.readSharedState("21")).thenAnswer(inv -> {
                store.setTaskStatus("21", TaskStatus.BLOCKED, "agent-event-bus");
                return Optional.of(remoteClaim);
            });

            engine(ISSUES).reconcileOnce();

            FleetTask task = store.findTask("21").orElseThrow();
            assertEquals(TaskStatus.BLOCKED, task.status());
            assertTrue(task.meta().containsKey(ReconciliationEngine.CONFLICT_META));
        }
    }

    // -- Absent tasks ------------------------------------------------------------

    @Nested
    @DisplayName("tasks absent from the open list")
    class SweepTests {

        @Test
        @DisplayName("remotely closed tasks become done")
        void closedRemotely() {
            store.upsert(FleetTask.of("17", "Gone", TaskStatus.INPROGRESS));
            when(board.listIssues(IssueState.CLOSED))
                    .thenReturn(List.of(new BoardIssue("17", "Gone", "CLOSED", List.of(), null, "")));

            ReconcileSummary summary = engine(ISSUES).reconcileOnce();

            assertEquals(1, summary.closed());
            assertEquals(TaskStatus.DONE, localStatus("17"));
            verify(board, never()).getIssue("17");
        }

        @Test
        @DisplayName("deleted issues are dropped locally")
        void missingDropped() {
            store.upsert(FleetTask.of("18", "Deleted", TaskStatus.TODO));
            when(board.getIssue("18")).thenReturn(Optional.empty());

            ReconcileSummary summary = engine(ISSUES).reconcileOnce();

            assertEquals(1, summary.missing());
            assertTrue(store.findTask("18").isEmpty());
        }

        @Test
        @DisplayName("closed issues outside the listing become done")
        void closedOnLookup() {
            store.upsert(FleetTask.of("19", "Old", TaskStatus.TODO));
            when(board.getIssue("19"))
                    .thenReturn(Optional.of(new BoardIssue("19", "Old", "CLOSED", List.of(), null, "")));

            engine(ISSUES).reconcileOnce();

            assertEquals(TaskStatus.DONE, localStatus("19"));
        }

        @Test
        @DisplayName("non-issue and finished tasks are left alone")
        void leavesOthers() {
            store.upsert(FleetTask.of("local-setup", "Local", TaskStatus.TODO));
            store.upsert(FleetTask.of("20", "Done", TaskStatus.DONE));

            ReconcileSummary summary = engine(ISSUES).reconcileOnce();

            verify(board, never()).getIssue(anyString());
            assertEquals(0, summary.missing());
            assertEquals(2, store.size());
        }
    }
}
