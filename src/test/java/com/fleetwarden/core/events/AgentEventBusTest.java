package com.fleetwarden.core.events;

import com.fleetwarden.MutableClock;
import com.fleetwarden.core.classifier.AgentMessage;
import com.fleetwarden.core.classifier.ErrorClassifier;
import com.fleetwarden.core.classifier.ErrorPattern;
import com.fleetwarden.core.classifier.MessageSequenceAnalyzer;
import com.fleetwarden.core.classifier.RecoveryAction;
import com.fleetwarden.core.classifier.RecoveryProperties;
import com.fleetwarden.core.classifier.SequenceAnalysis;
import com.fleetwarden.core.metrics.FleetMetrics;
import com.fleetwarden.core.model.FleetTask;
import com.fleetwarden.core.model.TaskStatus;
import com.fleetwarden.core.store.InMemoryTaskStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link AgentEventBus}.
 */
class AgentEventBusTest {

    private MutableClock clock;
    private BusProperties properties;
    private ErrorClassifier classifier;
    private InMemoryTaskStore store;
    private List<String> notifications;
    private UiBroadcaster broadcaster;
    private ReviewHandoff reviewHandoff;
    private SimpleMeterRegistry registry;
    private AgentEventBus bus;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000_000L);
        properties = new BusProperties();
        classifier = new ErrorClassifier(new RecoveryProperties(), clock);
        store = new InMemoryTaskStore();
        notifications = new CopyOnWriteArrayList<>();
        broadcaster = mock(UiBroadcaster.class);
        reviewHandoff = mock(ReviewHandoff.class);
        registry = new SimpleMeterRegistry();
        bus = newBus();
    }

    @AfterEach
    void tearDown() {
        bus.stop();
    }

    private AgentEventBus newBus() {
        return new AgentEventBus(properties, classifier, store, notifications::add, broadcaster, reviewHandoff,
                new FleetMetrics(registry), clock);
    }

    private List<AgentEventType> typesFor(String taskId) {
        return bus.getEventLog(EventLogFilter.forTask(taskId)).stream().map(AgentEvent::type).toList();
    }

    private void tick() {
        clock.advance(Duration.ofSeconds(1));
    }

    // -- emit -----------------------------------------------------------------

    @Nested
    @DisplayName("emit")
    class EmitTests {

        @Test
        @DisplayName("drops a repeat of the same type and task inside the dedupe window")
        void dedupesWithinWindow() {
            assertTrue(bus.emit(AgentEventType.TASK_QUEUED, "1", Map.of()));
            clock.advanceMillis(499);
            assertFalse(bus.emit(AgentEventType.TASK_QUEUED, "1", Map.of()));
            assertTrue(bus.emit(AgentEventType.TASK_QUEUED, "2", Map.of()));
            assertTrue(bus.emit(AgentEventType.TASK_STARTED, "1", Map.of()));

            clock.advanceMillis(1);
            assertTrue(bus.emit(AgentEventType.TASK_QUEUED, "1", Map.of()));

            assertEquals(4, bus.getEventLog(EventLogFilter.all()).size());
            assertEquals(1.0, registry.counter("fleetwarden.events.deduplicated").count());
        }

        @Test
        @DisplayName("keeps only the newest events once the log is full")
        void capsEventLog() {
            properties.setMaxEventLogSize(3);
            for (int i = 1; i <= 5; i++) {
                bus.emit(AgentEventType.TASK_QUEUED, String.valueOf(i), Map.of());
            }

            List<AgentEvent> log = bus.getEventLog(EventLogFilter.all());

            assertEquals(List.of("3", "4", "5"), log.stream().map(AgentEvent::taskId).toList());
        }

        @Test
        @DisplayName("filters by task, type and limit, newest first on request")
        void filtersEventLog() {
            bus.emit(AgentEventType.TASK_QUEUED, "1", Map.of());
            bus.emit(AgentEventType.TASK_STARTED, "1", Map.of());
            bus.emit(AgentEventType.TASK_STARTED, "2", Map.of());
            tick();
            bus.emit(AgentEventType.TASK_COMPLETED, "1", Map.of());

            assertEquals(3, bus.getEventLog(EventLogFilter.forTask("1")).size());
            assertEquals(2, bus.getEventLog(EventLogFilter.all().withType(AgentEventType.TASK_STARTED)).size());

            List<AgentEvent> latest = bus.getEventLog(EventLogFilter.forTask("1").withLimit(2).reversed());
            assertEquals(List.of(AgentEventType.TASK_COMPLETED, AgentEventType.TASK_STARTED),
                    latest.stream().map(AgentEvent::type).toList());
        }

        @Test
        @DisplayName("a failing listener does not stop recording or other listeners")
        void isolatesListenerFailures() {
            List<AgentEvent> received = new ArrayList<>();
            bus.addListener(event -> { throw new IllegalStateException("boom"); });
            bus.addListener(received::add);

            assertTrue(bus.emit(AgentEventType.TASK_QUEUED, "1", Map.of("title", "x")));

            assertEquals(1, received.size());
            assertEquals(1, bus.getEventLog(EventLogFilter.all()).size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<AgentEvent> received = new ArrayList<>();
            AgentEventBus.Subscription subscription = bus.addListener(received::add);

            subscription.unsubscribe();
            bus.emit(AgentEventType.TASK_QUEUED, "1", Map.of());

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("broadcasts to UI channels unless told not to")
        void broadcastsToUi() {
            bus.emit(AgentEventType.TASK_QUEUED, "1", Map.of("title", "x"));
            bus.emit(AgentEventType.TASK_QUEUED, "2", Map.of(), EmitOptions.NO_BROADCAST);

            verify(broadcaster, times(1)).broadcast(eq(UiBroadcaster.AGENT_CHANNELS), eq("task:queued"), anyMap());
        }

        @Test
        @DisplayName("a failing UI broadcaster does not drop the event")
        void survivesBroadcastFailure() {
            doThrow(new RuntimeException("socket closed")).when(broadcaster).broadcast(anyList(), anyString(), anyMap());

            assertTrue(bus.emit(AgentEventType.TASK_QUEUED, "1", Map.of()));
            assertEquals(1, bus.getEventLog(EventLogFilter.all()).size());
        }
    }

    // -- liveness -------------------------------------------------------------

    @Nested
    @DisplayName("liveness")
    class LivenessTests {

        @Test
        @DisplayName("flags a silent agent stale exactly once")
        void flagsStaleOnce() {
            bus.onAgentHeartbeat("7", "working");
            clock.advance(Duration.ofSeconds(89));
            assertTrue(bus.sweepStale().isEmpty());

            clock.advance(Duration.ofSeconds(1));
            assertEquals(List.of("7"), bus.sweepStale());
            assertTrue(bus.sweepStale().isEmpty());

            LivenessRecord record = bus.getAgentLiveness().get(0);
            assertFalse(record.alive());
            assertEquals(90_000L, record.staleSinceMs());
            assertEquals(1.0, registry.counter("fleetwarden.agents.stale").count());
        }

        @Test
        @DisplayName("a heartbeat after going stale emits agent alive")
        void recoversAfterStale() {
            bus.onAgentHeartbeat("7", "working");
            clock.advance(Duration.ofMinutes(2));
            bus.sweepStale();

            bus.onAgentHeartbeat("7", "back");

            assertTrue(typesFor("7").contains(AgentEventType.AGENT_ALIVE));
            assertTrue(bus.getAgentLiveness().get(0).alive());
            assertNull(bus.getAgentLiveness().get(0).staleSinceMs());
        }
    }

    // -- auto-actions ---------------------------------------------------------

    @Nested
    @DisplayName("auto-actions")
    class AutoActionTests {

        @Test
        @DisplayName("a workflow failure triggers an auto-retry carrying the remediation prompt")
        void autoRetry() {
            bus.onAgentError("3", "error: failed to push some refs", "", null);

            AgentEvent retry = bus.getEventLog(EventLogFilter.forTask("3").withType(AgentEventType.AUTO_RETRY)).get(0);
            assertEquals(1, retry.payload().get("retryCount"));
            assertEquals("push_failure", retry.payload().get("pattern"));
            assertTrue(retry.payload().get("prompt").toString().startsWith("git push failed"));
        }

        @Test
        @DisplayName("token overflow restarts in a new session")
        void newSession() {
            bus.onAgentError("3", "context_length_exceeded", "", null);

            assertTrue(typesFor("3").contains(AgentEventType.AUTO_NEW_SESSION));
            assertFalse(typesFor("3").contains(AgentEventType.AUTO_RETRY));
        }

        @Test
        @DisplayName("auth errors block the task and notify the operator")
        void authBlocks() {
            store.upsert(FleetTask.of("5", "wire up login", TaskStatus.INPROGRESS));

            bus.onAgentError("5", "401 Unauthorized", "", null);

            assertTrue(typesFor("5").contains(AgentEventType.AUTO_BLOCK));
            assertEquals(TaskStatus.BLOCKED, store.findTask("5").orElseThrow().status());
            assertEquals(1, notifications.size());
            assertTrue(notifications.get(0).contains("wire up login"));
        }

        @Test
        @DisplayName("rate limits open a cooldown that suppresses further auto-actions")
        void cooldownSuppresses() {
            bus.onAgentError("4", "429 Too Many Requests", "", null);
            tick();
            bus.onAgentError("4", "error: failed to push some refs", "", null);

            AgentEvent cooldown = bus.getEventLog(EventLogFilter.forTask("4").withType(AgentEventType.AUTO_COOLDOWN)).get(0);
            assertEquals(60_000L, cooldown.payload().get("cooldownMs"));
            assertFalse(typesFor("4").contains(AgentEventType.AUTO_RETRY));
            assertEquals(2, bus.getErrorHistory("4").size());

            clock.advance(Duration.ofMinutes(1));
            bus.onAgentError("4", "--- FAIL: TestX", "", null);
            assertTrue(typesFor("4").contains(AgentEventType.AUTO_RETRY));
        }

        @Test
        @DisplayName("exhausted auto-retries escalate to a block")
        void retryBudgetEscalates() {
            properties.setMaxAutoRetries(2);

            bus.onAgentError("6", "error: failed to push some refs", "", null);
            tick();
            bus.onAgentError("6", "--- FAIL: TestX", "", null);
            tick();
            bus.onAgentError("6", "eslint error: no-unused-vars", "", null);

            assertEquals(2, bus.getEventLog(EventLogFilter.forTask("6").withType(AgentEventType.AUTO_RETRY)).size());
            assertTrue(typesFor("6").contains(AgentEventType.AUTO_BLOCK));
        }

        @Test
        @DisplayName("a rate-limit flood pauses the executor once")
        void executorPause() {
            for (int i = 0; i < 5; i++) {
                bus.onAgentError("t" + i, "429 rate limit exceeded", "", null);
                tick();
            }

            List<AgentEvent> paused = bus.getEventLog(EventLogFilter.forTask(AgentEventBus.SYSTEM_TASK_ID)
                    .withType(AgentEventType.EXECUTOR_PAUSED));
            assertEquals(1, paused.size());
            assertEquals("t3", paused.get(0).payload().get("triggeredBy"));

            bus.onExecutorResumed();
            bus.onAgentError("t9", "429 rate limit exceeded", "", null);
            assertEquals(2, bus.getEventLog(EventLogFilter.forTask(AgentEventBus.SYSTEM_TASK_ID)
                    .withType(AgentEventType.EXECUTOR_PAUSED)).size());
        }

        @Test
        @DisplayName("a failing notifier does not break the block")
        void notifierFailureIsolated() {
            bus = new AgentEventBus(properties, classifier, store, message -> { throw new RuntimeException("down"); },
                    null, null, null, clock);
            store.upsert(FleetTask.of("5", "x", TaskStatus.INPROGRESS));

            bus.onAgentError("5", "invalid api key", "", null);

            assertEquals(TaskStatus.BLOCKED, store.findTask("5").orElseThrow().status());
        }
    }

    // -- lifecycle hooks ------------------------------------------------------

    @Nested
    @DisplayName("lifecycle hooks")
    class HookTests {

        @Test
        @DisplayName("task start resets recovery counters")
        void startResetsCounters() {
            FleetTask task = FleetTask.of("8", "t", TaskStatus.TODO);
            bus.onTaskFailed(task, "--- FAIL: TestX");
            assertEquals(1, classifier.errorCount("8", ErrorPattern.TEST_FAILURE));

            bus.onTaskStarted(task, AgentSlot.of("codex"));

            assertEquals(0, classifier.errorCount("8", ErrorPattern.TEST_FAILURE));
            assertEquals("codex", bus.getEventLog(EventLogFilter.forTask("8")
                    .withType(AgentEventType.TASK_STARTED)).get(0).payload().get("sdk"));
        }

        @Test
        @DisplayName("successful completion with commits requests a review")
        void completionTriggersReview() {
            FleetTask task = FleetTask.of("9", "add cache", TaskStatus.INPROGRESS).withMeta("description", "LRU cache");

            bus.onTaskCompleted(task, new CompletionReport(1, true, true, "ve/9-add-cache", null, 42));

            verify(reviewHandoff).requestReview(
                    new ReviewHandoff.ReviewRequest("9", "add cache", 42, "ve/9-add-cache", "LRU cache"));
            assertTrue(typesFor("9").contains(AgentEventType.AUTO_REVIEW));
        }

        @Test
        @DisplayName("review handoff failure is logged, not thrown")
        void reviewFailureIsolated() {
            doThrow(new RuntimeException("queue full")).when(reviewHandoff).requestReview(any());

            bus.onTaskCompleted(FleetTask.of("9", "x", TaskStatus.INPROGRESS), CompletionReport.succeeded(true, "b"));

            assertFalse(typesFor("9").contains(AgentEventType.AUTO_REVIEW));
        }

        @Test
        @DisplayName("agent completion with commits moves the task to review")
        void agentCompleteMovesToReview() {
            store.upsert(FleetTask.of("10", "x", TaskStatus.INPROGRESS));

            bus.onAgentComplete("10", CompletionReport.succeeded(true, "b"));

            assertEquals(TaskStatus.INREVIEW, store.findTask("10").orElseThrow().status());
        }

        @Test
        @DisplayName("blocked status change notifies")
        void blockedStatusNotifies() {
            store.upsert(FleetTask.of("11", "migrate db", TaskStatus.INPROGRESS));

            bus.onStatusChange("11", TaskStatus.BLOCKED, null);

            assertEquals(List.of(AgentEventType.TASK_STATUS_CHANGE, AgentEventType.TASK_BLOCKED), typesFor("11"));
            assertEquals(TaskStatus.BLOCKED, store.findTask("11").orElseThrow().status());
            assertTrue(notifications.get(0).contains("migrate db"));
        }

        @Test
        @DisplayName("hook results map to passed and failed events")
        void hookResults() {
            bus.onHookResult("12", "pre-push", true, null);
            bus.onHookResult("12", "pre-push", false, null);

            assertEquals(List.of(AgentEventType.HOOK_PASSED, AgentEventType.HOOK_FAILED), typesFor("12"));
        }

        @Test
        @DisplayName("start and stop are idempotent")
        void lifecycleIdempotent() {
            bus.start();
            bus.start();
            assertTrue(bus.isStarted());

            bus.stop();
            bus.stop();
            assertFalse(bus.isStarted());
        }
    }

    // -- end to end -----------------------------------------------------------

    @Test
    @DisplayName("three identical build failures loop, escalate to manual and quote the failure")
    void repeatedBuildFailureEscalates() {
        String failure = "go build failed: undefined reference to main";
        FleetTask task = FleetTask.of("42", "fix bug", TaskStatus.INPROGRESS);
        store.upsert(task);
        List<AgentMessage> transcript = new ArrayList<>();

        for (int i = 0; i < 3; i++) {
            bus.onTaskFailed(task, failure);
            transcript.add(AgentMessage.error(failure));
            tick();
        }

        List<ErrorHistoryEntry> history = bus.getErrorHistory("42");
        assertEquals(List.of(RecoveryAction.RETRY_WITH_PROMPT, RecoveryAction.RETRY_WITH_PROMPT, RecoveryAction.MANUAL),
                history.stream().map(ErrorHistoryEntry::action).toList());
        assertTrue(history.stream().allMatch(e -> e.pattern() == ErrorPattern.BUILD_FAILURE));
        assertTrue(typesFor("42").contains(AgentEventType.ERROR_PATTERN_DETECTED));
        assertTrue(notifications.get(0).contains("fix bug"));

        SequenceAnalysis analysis = new MessageSequenceAnalyzer(new RecoveryProperties()).analyze(transcript);
        assertEquals(ErrorPattern.ERROR_LOOP, analysis.primary());

        AgentEvent retry = bus.getEventLog(EventLogFilter.forTask("42").withType(AgentEventType.AUTO_RETRY)).get(0);
        assertTrue(retry.payload().get("prompt").toString().contains(failure));

        PatternSummary summary = bus.getErrorPatternSummary().get(ErrorPattern.BUILD_FAILURE);
        assertEquals(3, summary.count());
        assertEquals(List.of("42"), summary.tasks());
    }
}
