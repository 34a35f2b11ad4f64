package com.fleetwarden.core.executor;

import com.fleetwarden.core.config.Sleeper;
import com.fleetwarden.core.events.AgentEventBus;
import com.fleetwarden.core.logging.MdcContext;
import com.fleetwarden.core.persistence.SessionSnapshot;
import com.fleetwarden.core.persistence.SessionSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs agent turns on one {@link ExecutorClient} with a single-turn lock, a caller timeout,
 * cancellation and bounded retries of transient stream failures.
 * <p>
 * The lock is taken once per {@link #run} and released only when the call returns or throws,
 * so a retry never lets a second caller in.
 */
public class AgentTurnRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentTurnRunner.class);

    private final ExecutorClient client;
    private final StreamRetryPolicy retryPolicy;
    private final Duration defaultTimeout;
    private final Clock clock;
    private final Sleeper sleeper;
    private final AgentEventBus eventBus;
    private final SessionSnapshotStore snapshots;

    private final TurnLock lock = new TurnLock();
    private final ExecutorService turns;

    public AgentTurnRunner(ExecutorClient client, ExecutorProperties properties, Clock clock, Sleeper sleeper,
                           AgentEventBus eventBus, SessionSnapshotStore snapshots) {
        this(client, new StreamRetryPolicy(properties), Duration.ofMillis(properties.getDefaultTimeoutMs()),
                clock, sleeper, eventBus, snapshots);
    }

    AgentTurnRunner(ExecutorClient client, StreamRetryPolicy retryPolicy, Duration defaultTimeout, Clock clock,
                    Sleeper sleeper, AgentEventBus eventBus, SessionSnapshotStore snapshots) {
        this.client = client;
        this.retryPolicy = retryPolicy;
        this.defaultTimeout = defaultTimeout;
        this.clock = clock;
        this.sleeper = sleeper;
        this.eventBus = eventBus;
        this.snapshots = snapshots;
        this.turns = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agent-turn-" + client.name());
            t.setDaemon(true);
            return t;
        });
    }

    public boolean isBusy() {
        return lock.isBusy();
    }

    public TurnLock.State lockState() {
        return lock.state();
    }

    /**
     * Runs one turn.
     * <p>
     * Timeouts and cancellation are reported in the returned result. Exhausted stream retries
     * raise {@link ExecutorTransportException}; any other executor failure is rethrown.
     *
     * @throws TurnBusyException when a turn is already in flight on this executor
     */
    public TurnResult run(String message, TurnOptions options) {
        if (!lock.tryAcquire()) {
            throw new TurnBusyException(client.name());
        }
        MdcContext.setTask(options.taskId(), client.name());
        try {
            Duration timeout = options.timeout() != null ? options.timeout() : defaultTimeout;
            long deadline = clock.millis() + timeout.toMillis();
            CancellationSignal cancellation = options.cancellation();

            for (int attempt = 0; ; attempt++) {
                if (cancellation.isCancelled()) {
                    return stopped(options, cancellation.reason());
                }
                long remaining = deadline - clock.millis();
                if (remaining <= 0) {
                    return timedOut(options, timeout);
                }
                heartbeat(options.taskId(), "turn attempt " + (attempt + 1) + " on " + client.name());

                try {
                    TurnResult result = attempt(message, options, remaining);
                    snapshot(options, result.sessionId(), "idle", result.finalResponse());
                    return result;
                } catch (TimeoutException e) {
                    cancellation.cancel("timeout");
                    return timedOut(options, timeout);
                } catch (CancellationException e) {
                    return stopped(options, cancellation.reason());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (cancellation.isCancelled()) {
                        return stopped(options, cancellation.reason());
                    }
                    if (!retryPolicy.isTransient(cause)) {
                        fail(options, cause.getMessage());
                        throw cause instanceof RuntimeException runtime
                                ? runtime
                                : new ExecutorTransportException(client.name() + " turn failed: " + cause.getMessage(), cause);
                    }
                    if (attempt >= retryPolicy.maxRetries()) {
                        String text = "Stream disconnected after " + retryPolicy.maxRetries() + " retries: " + cause.getMessage();
                        fail(options, text);
                        throw new ExecutorTransportException(text, cause);
                    }
                    waitBeforeRetry(attempt, cause);
                }
            }
        } finally {
            lock.release();
            MdcContext.clearTask();
        }
    }

    private TurnResult attempt(String message, TurnOptions options, long remainingMs)
            throws ExecutionException, TimeoutException {
        Future<TurnResult> future = turns.submit(() -> client.execPrompt(message, options));
        Runnable abort = () -> future.cancel(true);
        options.cancellation().onCancel(abort);
        try {
            return future.get(remainingMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted");
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } finally {
            options.cancellation().removeCallback(abort);
        }
    }

    private void waitBeforeRetry(int attempt, Throwable cause) {
        long delay = retryPolicy.delayMs(attempt);
        log.warn("Transient stream error on {} (attempt {}/{}): {}, retrying in {}ms",
                client.name(), attempt + 1, retryPolicy.maxRetries() + 1, cause.getMessage(), delay);
        lock.markRetryPending();
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorTransportException("Interrupted while waiting to retry " + client.name(), cause);
        } finally {
            lock.resumeRetry();
        }
    }

    private TurnResult timedOut(TurnOptions options, Duration timeout) {
        String text = "Agent timed out after " + timeout.toSeconds() + "s";
        log.warn("{} on task {}", text, options.taskId());
        snapshot(options, null, "failed", text);
        return TurnResult.message(text);
    }

    private TurnResult stopped(TurnOptions options, String reason) {
        log.info("Turn on task {} stopped: {}", options.taskId(), reason);
        snapshot(options, null, "idle", null);
        return TurnResult.message("Agent stopped: " + reason);
    }

    private void fail(TurnOptions options, String error) {
        snapshot(options, null, "failed", error);
        if (eventBus != null && options.taskId() != null) {
            eventBus.onAgentError(options.taskId(), error, "", null);
        }
    }

    private void heartbeat(String taskId, String text) {
        if (eventBus != null && taskId != null) {
            eventBus.onAgentHeartbeat(taskId, text);
        }
    }

    private void snapshot(TurnOptions options, String sessionId, String status, String response) {
        if (snapshots == null || options.taskId() == null) {
            return;
        }
        SessionSnapshot previous = snapshots.load(options.taskId())
                .orElseGet(() -> new SessionSnapshot(options.taskId(), options.sessionId(), client.name(), status, 0, 0, null));
        snapshots.save(previous.afterTurn(sessionId, status, clock.millis(), response));
    }

    @Override
    public void close() {
        turns.shutdownNow();
    }
}
