package com.fleetwarden.core.executor;

import com.fleetwarden.core.events.AgentEventBus;
import com.fleetwarden.core.persistence.SessionSnapshot;
import com.fleetwarden.core.persistence.SessionSnapshotStore;
import com.fleetwarden.core.persistence.StateProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class AgentTurnRunnerTest {

    @TempDir
    Path dir;

    private AgentEventBus eventBus;
    private SessionSnapshotStore snapshots;
    private final List<Long> sleeps = new ArrayList<>();
    private final List<TurnLock.State> statesWhileSleeping = new ArrayList<>();
    private AgentTurnRunner runner;

    /** Executor whose behaviour is scripted per call. */
    private static final class ScriptedClient implements ExecutorClient {
        final AtomicInteger calls = new AtomicInteger();
        volatile Function<Integer, TurnResult> script = n -> new TurnResult("done", List.of(), null, "thread-1");

        @Override
        public String name() {
            return "codex";
        }

        @Override
        public TurnResult execPrompt(String message, TurnOptions options) {
            return script.apply(calls.incrementAndGet());
        }
    }

    private final ScriptedClient client = new ScriptedClient();

    @BeforeEach
    void setUp() {
        eventBus = mock(AgentEventBus.class);
        var state = new StateProperties();
        state.setDir(dir.toString());
        snapshots = new SessionSnapshotStore(state);
        runner = new AgentTurnRunner(client, new StreamRetryPolicy(2, 1_000, 8_000, 0, () -> 0.0),
                Duration.ofSeconds(10), Clock.systemUTC(), millis -> {
                    sleeps.add(millis);
                    statesWhileSleeping.add(runner.lockState());
                }, eventBus, snapshots);
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    // -- Completion --------------------------------------------------------------

    @Test
    @DisplayName("a successful turn records the session and heartbeats the task")
    void success() {
        TurnResult result = runner.run("fix bug", TurnOptions.forTask("42"));

        assertEquals("done", result.finalResponse());
        SessionSnapshot snapshot = snapshots.load("42").orElseThrow();
        assertEquals("thread-1", snapshot.sessionId());
        assertEquals("idle", snapshot.status());
        assertEquals(1, snapshot.turnCount());
        verify(eventBus).onAgentHeartbeat(eq("42"), anyString());
        assertFalse(runner.isBusy());
    }

    @Test
    @DisplayName("turns add up in the snapshot")
    void turnCountAccumulates() {
        runner.run("one", TurnOptions.forTask("42"));
        runner.run("two", TurnOptions.forTask("42"));

        assertEquals(2, snapshots.load("42").orElseThrow().turnCount());
    }

    // -- Retries -------------------------------------------------------------------

    @Nested
    @DisplayName("stream retries")
    class RetryTests {

        @Test
        @DisplayName("transient failures are retried with backoff while the lock stays held")
        void retriesTransient() {
            client.script = n -> {
                if (n < 3) {
                    throw new IllegalStateException("stream disconnected before completion");
                }
                return TurnResult.message("recovered");
            };

            TurnResult result = runner.run("fix bug", TurnOptions.forTask("42"));

            assertEquals("recovered", result.finalResponse());
            assertEquals(List.of(1_000L, 2_000L), sleeps);
            assertEquals(List.of(TurnLock.State.RETRY_PENDING, TurnLock.State.RETRY_PENDING), statesWhileSleeping);
            verify(eventBus, times(3)).onAgentHeartbeat(eq("42"), anyString());
        }

        @Test
        @DisplayName("exhausted retries raise a transport error and report it")
        void exhausted() {
            client.script = n -> { throw new IllegalStateException("socket hang up"); };

            var e = assertThrows(ExecutorTransportException.class,
                    () -> runner.run("fix bug", TurnOptions.forTask("42")));

            assertTrue(e.getMessage().startsWith("Stream disconnected after 2 retries"));
            assertEquals(3, client.calls.get());
            verify(eventBus).onAgentError(eq("42"), anyString(), eq(""), isNull());
            assertEquals("failed", snapshots.load("42").orElseThrow().status());
            assertFalse(runner.isBusy());
        }

        @Test
        @DisplayName("other failures are rethrown without retry")
        void permanentRethrown() {
            client.script = n -> { throw new IllegalArgumentException("HTTP 401 Unauthorized"); };

            var e = assertThrows(IllegalArgumentException.class,
                    () -> runner.run("fix bug", TurnOptions.forTask("42")));

            assertEquals("HTTP 401 Unauthorized", e.getMessage());
            assertEquals(1, client.calls.get());
            assertTrue(sleeps.isEmpty());
        }
    }

    // -- Lock, timeout and cancellation -------------------------------------------

    @Nested
    @DisplayName("lock, timeout and cancellation")
    class ControlTests {

        @Test
        @DisplayName("a second turn is refused while one is in flight")
        void busy() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch finish = new CountDownLatch(1);
            client.script = n -> {
                entered.countDown();
                try {
                    finish.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return TurnResult.message("first");
            };
            CompletableFuture<TurnResult> first =
                    CompletableFuture.supplyAsync(() -> runner.run("one", TurnOptions.forTask("1")));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertThrows(TurnBusyException.class, () -> runner.run("two", TurnOptions.forTask("2")));

            finish.countDown();
            assertEquals("first", first.get(5, TimeUnit.SECONDS).finalResponse());
            assertFalse(runner.isBusy());
        }

        @Test
        @DisplayName("a turn past its budget times out")
        void timeout() {
            client.script = n -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return TurnResult.message("late");
            };
            TurnOptions options = TurnOptions.forTask("42").withTimeout(Duration.ofMillis(100));

            TurnResult result = runner.run("slow", options);

            assertTrue(result.finalResponse().startsWith("Agent timed out after"));
            assertEquals("timeout", options.cancellation().reason());
            assertEquals("failed", snapshots.load("42").orElseThrow().status());
            assertFalse(runner.isBusy());
        }

        @Test
        @DisplayName("an already cancelled turn never reaches the executor")
        void preCancelled() {
            TurnOptions options = TurnOptions.forTask("42");
            options.cancellation().cancel("user");

            TurnResult result = runner.run("fix bug", options);

            assertEquals("Agent stopped: user", result.finalResponse());
            assertEquals(0, client.calls.get());
        }

        @Test
        @DisplayName("cancelling mid-turn stops it")
        void cancelMidTurn() {
            CountDownLatch entered = new CountDownLatch(1);
            client.script = n -> {
                entered.countDown();
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return TurnResult.message("late");
            };
            TurnOptions options = TurnOptions.forTask("42");
            CompletableFuture.runAsync(() -> {
                try {
                    entered.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                options.cancellation().cancel("user");
            });

            TurnResult result = runner.run("fix bug", options);

            assertEquals("Agent stopped: user", result.finalResponse());
            assertFalse(runner.isBusy());
        }
    }
}
