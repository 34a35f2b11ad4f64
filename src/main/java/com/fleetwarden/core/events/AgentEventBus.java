package com.fleetwarden.core.events;

import com.fleetwarden.core.classifier.ErrorClassification;
import com.fleetwarden.core.classifier.ErrorClassifier;
import com.fleetwarden.core.classifier.ErrorPattern;
import com.fleetwarden.core.classifier.RecoveryAction;
import com.fleetwarden.core.classifier.RecoveryVerdict;
import com.fleetwarden.core.logging.MdcContext;
import com.fleetwarden.core.metrics.FleetMetrics;
import com.fleetwarden.core.model.FleetTask;
import com.fleetwarden.core.model.TaskStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Single ingestion point for agent lifecycle signals.
 * <p>
 * Every signal goes through {@link #emit}: duplicate {@code (type, taskId)} signals inside the
 * dedupe window are dropped, the rest are appended to a bounded event log, pushed to UI clients
 * and delivered to listeners. Failure signals are classified and turned into auto-actions
 * (retry, cooldown, block, notify). A periodic sweep flags agents whose heartbeats stopped.
 * <p>
 * All internal state is guarded by one lock; collaborators are always called outside it and a
 * failing collaborator or listener is logged and skipped.
 */
@Service
public class AgentEventBus {

    private static final Logger log = LoggerFactory.getLogger(AgentEventBus.class);

    /** Task id used for executor-wide events. */
    public static final String SYSTEM_TASK_ID = "system";

    static final String SOURCE = "agent-event-bus";

    /** Dedupe map size above which expired keys are pruned. */
    private static final int DEDUPE_PRUNE_THRESHOLD = 200;

    /** Error-history window inspected for recurring patterns. */
    private static final int TREND_WINDOW = 5;
    private static final int TREND_MIN_OCCURRENCES = 3;

    /** Manual verdicts notify the operator from this error count on. */
    private static final int MANUAL_NOTIFY_THRESHOLD = 3;

    private final BusProperties properties;
    private final ErrorClassifier classifier;
    private final TaskStatusSink taskStatusSink;
    private final Notifier notifier;
    private final UiBroadcaster uiBroadcaster;
    private final ReviewHandoff reviewHandoff;
    private final FleetMetrics metrics;
    private final Clock clock;

    private final Object lock = new Object();

    // Guarded by lock
    private final Deque<AgentEvent> eventLog = new ArrayDeque<>();
    private final Map<String, Long> recentEmits = new HashMap<>();
    private final Map<String, Heartbeat> heartbeats = new LinkedHashMap<>();
    private final Map<String, List<ErrorHistoryEntry>> errorHistory = new LinkedHashMap<>();
    private final Map<String, AutoActionState> autoActionState = new HashMap<>();
    private boolean executorPauseSignalled;
    private boolean started;
    private ScheduledExecutorService staleSweeper;

    private final CopyOnWriteArrayList<Consumer<AgentEvent>> listeners = new CopyOnWriteArrayList<>();

    @Autowired
    public AgentEventBus(BusProperties properties,
                         ErrorClassifier classifier,
                         @Autowired(required = false) TaskStatusSink taskStatusSink,
                         @Autowired(required = false) Notifier notifier,
                         @Autowired(required = false) UiBroadcaster uiBroadcaster,
                         @Autowired(required = false) ReviewHandoff reviewHandoff,
                         @Autowired(required = false) FleetMetrics metrics,
                         Clock clock) {
        this.properties = properties;
        this.classifier = classifier;
        this.taskStatusSink = taskStatusSink;
        this.notifier = notifier != null ? notifier : new LoggingNotifier();
        this.uiBroadcaster = uiBroadcaster;
        this.reviewHandoff = reviewHandoff;
        this.metrics = metrics;
        this.clock = clock;
    }

    // -- Lifecycle ------------------------------------------------------------

    /**
     * Arms the stale sweep. Calling it again while started has no effect.
     */
    @PostConstruct
    public void start() {
        synchronized (lock) {
            if (started) {
                return;
            }
            started = true;
            staleSweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "agent-stale-sweep");
                t.setDaemon(true);
                return t;
            });
            long interval = properties.getStaleCheckIntervalMs();
            staleSweeper.scheduleAtFixedRate(this::sweepSafely, interval, interval, TimeUnit.MILLISECONDS);
        }
        log.info("Agent event bus started (stale-check={}ms, log-cap={})",
                properties.getStaleCheckIntervalMs(), properties.getMaxEventLogSize());
    }

    /**
     * Disarms the stale sweep. Safe to call repeatedly.
     */
    @PreDestroy
    public void stop() {
        ScheduledExecutorService sweeper;
        synchronized (lock) {
            if (!started) {
                return;
            }
            started = false;
            sweeper = staleSweeper;
            staleSweeper = null;
        }
        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Agent event bus stopped");
    }

    public boolean isStarted() {
        synchronized (lock) {
            return started;
        }
    }

    // -- Listeners ------------------------------------------------------------

    /**
     * Registers a listener for every recorded event.
     *
     * @param listener callback; exceptions it throws are logged and ignored
     * @return a handle that removes the listener
     */
    public Subscription addListener(Consumer<AgentEvent> listener) {
        if (listener == null) {
            return () -> {};
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Handle for cancelling a listener registration.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    // -- Core emit ------------------------------------------------------------

    public boolean emit(AgentEventType type, String taskId, Map<String, Object> payload) {
        return emit(type, taskId, payload, EmitOptions.DEFAULT);
    }

    /**
     * Records an event and fans it out.
     *
     * @return {@code false} when the event was dropped as a duplicate
     */
    public boolean emit(AgentEventType type, String taskId, Map<String, Object> payload, EmitOptions options) {
        long now = clock.millis();
        AgentEvent event = new AgentEvent(type, taskId, payload, Instant.ofEpochMilli(now));

        synchronized (lock) {
            String key = type.wireName() + ":" + taskId;
            Long last = recentEmits.get(key);
            if (last != null && now - last < properties.getDedupeWindowMs()) {
                log.debug("Dropped duplicate {} for {} ({}ms after previous)", type.wireName(), taskId, now - last);
                if (metrics != null) {
                    metrics.recordEventDeduplicated();
                }
                return false;
            }
            recentEmits.put(key, now);
            if (recentEmits.size() > DEDUPE_PRUNE_THRESHOLD) {
                long cutoff = now - properties.getDedupeWindowMs() * 2;
                recentEmits.values().removeIf(ts -> ts < cutoff);
            }

            eventLog.addLast(event);
            while (eventLog.size() > properties.getMaxEventLogSize()) {
                eventLog.pollFirst();
            }
        }

        if (metrics != null) {
            metrics.recordEventEmitted(type.wireName());
        }
        if (options == null || !options.skipBroadcast()) {
            broadcastToUi(event);
        }
        for (Consumer<AgentEvent> listener : listeners) {
            deliverSafely(listener, event);
        }
        return true;
    }

    // -- Hooks ----------------------------------------------------------------

    public void onTaskStarted(FleetTask task, AgentSlot slot) {
        String taskId = taskId(task);
        AgentSlot s = slot != null ? slot : AgentSlot.of("unknown");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title(task));
        payload.put("sdk", s.sdk() != null ? s.sdk() : "unknown");
        payload.put("agentInstanceId", s.agentInstanceId());
        payload.put("branch", s.branch());
        payload.put("worktreePath", s.worktreePath());
        emit(AgentEventType.TASK_STARTED, taskId, payload);

        classifier.resetTask(taskId);
        synchronized (lock) {
            autoActionState.put(taskId, new AutoActionState());
        }
    }

    public void onTaskCompleted(FleetTask task, CompletionReport result) {
        String taskId = taskId(task);
        CompletionReport r = result != null ? result : CompletionReport.failed(1);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title(task));
        payload.put("attempts", r.attempts());
        payload.put("success", r.success());
        payload.put("hasCommits", r.hasCommits());
        payload.put("branch", r.branch());
        payload.put("prUrl", r.prUrl());
        payload.put("prNumber", r.prNumber());
        emit(AgentEventType.TASK_COMPLETED, taskId, payload);

        synchronized (lock) {
            autoActionState.remove(taskId);
        }
        if (r.success()) {
            classifier.resetTask(taskId);
            if (r.hasCommits()) {
                triggerAutoReview(task, r);
            }
        }
    }

    public void onTaskFailed(FleetTask task, Throwable error) {
        String message = error == null ? "Unknown error"
                : error.getMessage() != null ? error.getMessage() : error.toString();
        onTaskFailed(task, message);
    }

    /**
     * Records a failed attempt and runs it through classification and auto-actions.
     */
    public void onTaskFailed(FleetTask task, String error) {
        String taskId = taskId(task);
        String message = error != null ? error : "Unknown error";
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title(task));
        payload.put("error", message);
        emit(AgentEventType.TASK_FAILED, taskId, payload);

        ErrorClassification classification = classifier.classify(message, "");
        handleClassification(taskId, classification, message);
    }

    /**
     * Agent self-reported completion. A completion with commits moves the task to review.
     */
    public void onAgentComplete(String taskId, CompletionReport report) {
        CompletionReport r = report != null ? report : CompletionReport.succeeded(false, null);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("hasCommits", r.hasCommits());
        payload.put("branch", r.branch());
        payload.put("prUrl", r.prUrl());
        payload.put("prNumber", r.prNumber());
        emit(AgentEventType.AGENT_COMPLETE, taskId, payload);

        if (r.hasCommits()) {
            setStatusSafely(taskId, TaskStatus.INREVIEW, SOURCE);
        }
    }

    /**
     * Agent self-reported error; {@code output} is the agent's recent output, if any.
     */
    public void onAgentError(String taskId, String error, String output, String reportedPattern) {
        String message = error != null && !error.isBlank() ? error : "Unknown error";
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", message);
        payload.put("pattern", reportedPattern);
        emit(AgentEventType.AGENT_ERROR, taskId, payload);

        ErrorClassification classification = classifier.classify(output != null ? output : "", message);
        handleClassification(taskId, classification, message);
    }

    public void onAgentHeartbeat(String taskId, String message) {
        long now = clock.millis();
        long recoveredAfter = -1;
        synchronized (lock) {
            Heartbeat hb = heartbeats.get(taskId);
            if (hb == null) {
                heartbeats.put(taskId, new Heartbeat(now));
            } else {
                if (hb.staleFlagged) {
                    recoveredAfter = now - hb.lastHeartbeat;
                }
                hb.lastHeartbeat = now;
                hb.staleFlagged = false;
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("alive", true);
        emit(AgentEventType.AGENT_HEARTBEAT, taskId, payload);

        if (recoveredAfter >= 0) {
            log.info("Agent for {} is alive again after {}ms of silence", taskId, recoveredAfter);
            emit(AgentEventType.AGENT_ALIVE, taskId, Map.of("silentForMs", recoveredAfter));
        }
    }

    public void onStatusChange(String taskId, TaskStatus newStatus, String source) {
        String src = source != null && !source.isBlank() ? source : "agent";
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", newStatus.wireName());
        payload.put("source", src);
        emit(AgentEventType.TASK_STATUS_CHANGE, taskId, payload);

        setStatusSafely(taskId, newStatus, src);

        if (newStatus == TaskStatus.BLOCKED) {
            emit(AgentEventType.TASK_BLOCKED, taskId, Map.of("source", src));
            notifySafely("Task blocked: \"" + resolveTitle(taskId) + "\" (source: " + src + ")");
        }
    }

    public void onExecutorPaused(String reason) {
        String r = reason != null && !reason.isBlank() ? reason : "manual";
        emit(AgentEventType.EXECUTOR_PAUSED, SYSTEM_TASK_ID, Map.of("reason", r));
        notifySafely("Executor paused: " + r);
    }

    public void onExecutorResumed() {
        synchronized (lock) {
            executorPauseSignalled = false;
        }
        emit(AgentEventType.EXECUTOR_RESUMED, SYSTEM_TASK_ID, Map.of());
    }

    public void onHookResult(String taskId, String hookEvent, boolean passed, HookDetails details) {
        HookDetails d = details != null ? details : HookDetails.none();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("hookEvent", hookEvent);
        payload.put("hookId", d.hookId());
        payload.put("output", d.output());
        payload.put("durationMs", d.durationMs());
        emit(passed ? AgentEventType.HOOK_PASSED : AgentEventType.HOOK_FAILED, taskId, payload);
    }

    // -- Queries --------------------------------------------------------------

    /**
     * Read-only view of the event log filtered by {@code filter}.
     */
    public List<AgentEvent> getEventLog(EventLogFilter filter) {
        EventLogFilter f = filter != null ? filter : EventLogFilter.all();
        List<AgentEvent> matched = new ArrayList<>();
        synchronized (lock) {
            for (AgentEvent event : eventLog) {
                if (f.matches(event)) {
                    matched.add(event);
                }
            }
        }
        if (f.limit() > 0 && matched.size() > f.limit()) {
            matched = new ArrayList<>(matched.subList(matched.size() - f.limit(), matched.size()));
        }
        if (f.newestFirst()) {
            Collections.reverse(matched);
        }
        return List.copyOf(matched);
    }

    public List<ErrorHistoryEntry> getErrorHistory(String taskId) {
        synchronized (lock) {
            List<ErrorHistoryEntry> history = errorHistory.get(taskId);
            return history == null ? List.of() : List.copyOf(history);
        }
    }

    public Map<ErrorPattern, PatternSummary> getErrorPatternSummary() {
        Map<ErrorPattern, int[]> counts = new EnumMap<>(ErrorPattern.class);
        Map<ErrorPattern, long[]> lastSeen = new EnumMap<>(ErrorPattern.class);
        Map<ErrorPattern, Set<String>> tasks = new EnumMap<>(ErrorPattern.class);
        synchronized (lock) {
            errorHistory.forEach((taskId, entries) -> {
                for (ErrorHistoryEntry entry : entries) {
                    counts.computeIfAbsent(entry.pattern(), p -> new int[1])[0]++;
                    long[] seen = lastSeen.computeIfAbsent(entry.pattern(), p -> new long[1]);
                    seen[0] = Math.max(seen[0], entry.ts());
                    tasks.computeIfAbsent(entry.pattern(), p -> new LinkedHashSet<>()).add(taskId);
                }
            });
        }
        Map<ErrorPattern, PatternSummary> summary = new EnumMap<>(ErrorPattern.class);
        counts.forEach((pattern, count) -> summary.put(pattern,
                new PatternSummary(count[0], lastSeen.get(pattern)[0], List.copyOf(tasks.get(pattern)))));
        return summary;
    }

    public List<LivenessRecord> getAgentLiveness() {
        long now = clock.millis();
        long threshold = properties.getStaleThresholdMs();
        List<LivenessRecord> result = new ArrayList<>();
        synchronized (lock) {
            heartbeats.forEach((taskId, hb) -> {
                long elapsed = now - hb.lastHeartbeat;
                boolean alive = elapsed < threshold;
                result.add(new LivenessRecord(taskId, hb.lastHeartbeat, alive, alive ? null : elapsed));
            });
        }
        return result;
    }

    public BusStatus getStatus() {
        List<LivenessRecord> liveness = getAgentLiveness();
        Map<ErrorPattern, PatternSummary> patterns = getErrorPatternSummary();
        synchronized (lock) {
            return new BusStatus(started, eventLog.size(), heartbeats.size(), errorHistory.size(),
                    autoActionState.size(), listeners.size(), liveness, patterns);
        }
    }

    // -- Stale sweep ----------------------------------------------------------

    /**
     * Emits {@link AgentEventType#AGENT_STALE} once for every agent that crossed the stale
     * threshold since its last heartbeat.
     *
     * @return the task ids flagged by this pass
     */
    public List<String> sweepStale() {
        long now = clock.millis();
        long threshold = properties.getStaleThresholdMs();
        Map<String, long[]> newlyStale = new LinkedHashMap<>();
        synchronized (lock) {
            heartbeats.forEach((taskId, hb) -> {
                long elapsed = now - hb.lastHeartbeat;
                if (elapsed >= threshold && !hb.staleFlagged) {
                    hb.staleFlagged = true;
                    newlyStale.put(taskId, new long[]{hb.lastHeartbeat, elapsed});
                }
            });
        }
        newlyStale.forEach((taskId, info) -> {
            log.warn("Agent for {} is stale: no heartbeat for {}ms", taskId, info[1]);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("lastHeartbeat", info[0]);
            payload.put("staleSinceMs", info[1]);
            emit(AgentEventType.AGENT_STALE, taskId, payload);
            if (metrics != null) {
                metrics.recordAgentStale();
            }
        });
        return List.copyOf(newlyStale.keySet());
    }

    private void sweepSafely() {
        try {
            sweepStale();
        } catch (Exception e) {
            log.warn("Stale sweep failed: {}", e.getMessage(), e);
        }
    }

    // -- Classification and auto-actions --------------------------------------

    private void handleClassification(String taskId, ErrorClassification classification, String rawError) {
        MdcContext.setTask(taskId);
        try {
            RecoveryVerdict verdict = classifier.recordError(taskId, classification);
            if (metrics != null) {
                metrics.recordVerdict(verdict.action().wireName(), verdict.pattern().wireName());
            }

            int retained = properties.getMaxErrorPatternsPerTask();
            synchronized (lock) {
                List<ErrorHistoryEntry> history = errorHistory.computeIfAbsent(taskId, k -> new ArrayList<>());
                history.add(new ErrorHistoryEntry(classification.pattern(), clock.millis(), verdict.action(),
                        classification.confidence(), classification.details(), classification.rawMatch()));
                if (history.size() > retained) {
                    history.subList(0, history.size() - retained).clear();
                }
            }

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("pattern", classification.pattern().wireName());
            payload.put("confidence", classification.confidence());
            payload.put("details", classification.details() != null ? classification.details() : "");
            payload.put("action", verdict.action().wireName());
            payload.put("errorCount", verdict.errorCount());
            emit(AgentEventType.ERROR_CLASSIFIED, taskId, payload);

            detectPatternTrend(taskId);
            executeAutoAction(taskId, verdict.action(), verdict, classification, rawError);
            checkExecutorPause(taskId);
        } finally {
            MdcContext.clearTask();
        }
    }

    private void executeAutoAction(String taskId, RecoveryAction action, RecoveryVerdict verdict,
                                   ErrorClassification classification, String rawError) {
        long now = clock.millis();
        String pattern = classification.pattern().wireName();
        String reason = verdict.reason();

        AutoActionState state;
        synchronized (lock) {
            state = autoActionState.computeIfAbsent(taskId, k -> new AutoActionState());
            if (state.cooldownUntil > now) {
                log.info("{} in cooldown until {}, skipping auto-action {}", taskId,
                        Instant.ofEpochMilli(state.cooldownUntil), action.wireName());
                return;
            }
        }

        switch (action) {
            case RETRY_WITH_PROMPT -> {
                int retryCount;
                synchronized (lock) {
                    if (state.retryCount >= properties.getMaxAutoRetries()) {
                        retryCount = -1;
                    } else {
                        retryCount = ++state.retryCount;
                    }
                }
                if (retryCount < 0) {
                    log.info("{} exhausted auto-retries ({})", taskId, properties.getMaxAutoRetries());
                    executeAutoAction(taskId, RecoveryAction.BLOCK, verdict, classification, rawError);
                    return;
                }
                boolean freshSession = classification.pattern() == ErrorPattern.TOKEN_OVERFLOW
                        || classification.pattern() == ErrorPattern.SESSION_EXPIRED;
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("retryCount", retryCount);
                payload.put("maxRetries", properties.getMaxAutoRetries());
                payload.put("reason", reason != null ? reason : "error detected");
                payload.put("prompt", verdict.prompt());
                payload.put("pattern", pattern);
                emit(freshSession ? AgentEventType.AUTO_NEW_SESSION : AgentEventType.AUTO_RETRY, taskId, payload);
                log.info("Auto-retry #{}/{} for {} ({}){}", retryCount, properties.getMaxAutoRetries(), taskId,
                        pattern, freshSession ? " in a new session" : "");
            }
            case COOLDOWN -> {
                long cooldownMs = verdict.cooldownMs() != null ? verdict.cooldownMs() : 60_000L;
                long until = now + cooldownMs;
                synchronized (lock) {
                    state.cooldownUntil = until;
                }
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("cooldownMs", cooldownMs);
                payload.put("cooldownUntil", until);
                payload.put("reason", reason != null ? reason : "rate limited");
                payload.put("pattern", pattern);
                emit(AgentEventType.AUTO_COOLDOWN, taskId, payload);
                log.info("Cooldown {}ms for {} ({})", cooldownMs, taskId, pattern);
            }
            case BLOCK -> {
                String why = reason != null ? reason : "too many errors";
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("reason", why);
                payload.put("errorCount", verdict.errorCount());
                payload.put("pattern", pattern);
                emit(AgentEventType.AUTO_BLOCK, taskId, payload);
                setStatusSafely(taskId, TaskStatus.BLOCKED, SOURCE);
                notifySafely("Auto-blocked: \"" + resolveTitle(taskId) + "\": " + why);
                log.info("Auto-blocked {}: {}", taskId, why);
            }
            case MANUAL -> {
                log.info("Manual review needed for {}: {}", taskId, reason != null ? reason : rawError);
                if (verdict.errorCount() >= MANUAL_NOTIFY_THRESHOLD) {
                    notifySafely("\"" + resolveTitle(taskId) + "\" needs manual review: "
                            + (reason != null ? reason : "repeated errors"));
                }
            }
        }
    }

    private void detectPatternTrend(String taskId) {
        List<ErrorHistoryEntry> recent;
        int total;
        List<ErrorHistoryEntry> tail = null;
        synchronized (lock) {
            List<ErrorHistoryEntry> history = errorHistory.get(taskId);
            if (history == null || history.size() < TREND_MIN_OCCURRENCES) {
                return;
            }
            total = history.size();
            recent = List.copyOf(history.subList(Math.max(0, total - TREND_WINDOW), total));
            int window = properties.getMaxAutoRetries();
            if (total >= window) {
                tail = List.copyOf(history.subList(total - window, total));
            }
        }

        Map<ErrorPattern, Integer> counts = new EnumMap<>(ErrorPattern.class);
        for (ErrorHistoryEntry entry : recent) {
            counts.merge(entry.pattern(), 1, Integer::sum);
        }
        counts.forEach((pattern, count) -> {
            if (count >= TREND_MIN_OCCURRENCES) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("pattern", pattern.wireName());
                payload.put("frequency", count);
                payload.put("window", recent.size());
                payload.put("message", "\"" + pattern.wireName() + "\" appeared " + count + "/"
                        + recent.size() + " times recently");
                emit(AgentEventType.ERROR_PATTERN_DETECTED, taskId, payload);
            }
        });

        if (tail != null && tail.stream().allMatch(e -> e.action().isEscalation())) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("totalErrors", total);
            payload.put("message", taskId + ": " + total + " errors, all recent unresolvable");
            emit(AgentEventType.ERROR_THRESHOLD_REACHED, taskId, payload);
        }
    }

    private void checkExecutorPause(String taskId) {
        if (!classifier.shouldPauseExecutor()) {
            return;
        }
        synchronized (lock) {
            if (executorPauseSignalled) {
                return;
            }
            executorPauseSignalled = true;
        }
        String reason = "rate limit flood";
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", reason);
        payload.put("triggeredBy", taskId);
        emit(AgentEventType.EXECUTOR_PAUSED, SYSTEM_TASK_ID, payload);
        notifySafely("Executor auto-paused: " + reason);
        log.warn("Executor pause requested: {} (triggered by {})", reason, taskId);
    }

    private void triggerAutoReview(FleetTask task, CompletionReport result) {
        if (reviewHandoff == null) {
            return;
        }
        String taskId = taskId(task);
        try {
            Object description = task != null ? task.meta().get("description") : null;
            reviewHandoff.requestReview(new ReviewHandoff.ReviewRequest(taskId, title(task), result.prNumber(),
                    result.branch(), description != null ? description.toString() : ""));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("title", title(task));
            payload.put("branch", result.branch());
            payload.put("prNumber", result.prNumber());
            emit(AgentEventType.AUTO_REVIEW, taskId, payload);
            log.info("Auto-review queued for {}", taskId);
        } catch (Exception e) {
            log.warn("Auto-review failed for {}: {}", taskId, e.getMessage());
        }
    }

    // -- Collaborator isolation -----------------------------------------------

    private void broadcastToUi(AgentEvent event) {
        if (uiBroadcaster == null) {
            return;
        }
        try {
            uiBroadcaster.broadcast(UiBroadcaster.AGENT_CHANNELS, event.type().wireName(), event.broadcastPayload());
        } catch (Exception e) {
            log.warn("UI broadcast of {} failed: {}", event.type().wireName(), e.getMessage());
        }
    }

    private void deliverSafely(Consumer<AgentEvent> listener, AgentEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            log.warn("Listener threw exception processing event {}: {}",
                    event.type().wireName(), e.getMessage(), e);
        }
    }

    private void setStatusSafely(String taskId, TaskStatus status, String source) {
        if (taskStatusSink == null) {
            return;
        }
        try {
            taskStatusSink.setTaskStatus(taskId, status, source);
        } catch (Exception e) {
            log.warn("Could not set {} to {}: {}", taskId, status.wireName(), e.getMessage());
        }
    }

    private void notifySafely(String message) {
        try {
            notifier.notify(message);
        } catch (Exception e) {
            log.warn("Notification failed: {}", e.getMessage());
        }
    }

    private String resolveTitle(String taskId) {
        if (taskStatusSink == null) {
            return taskId;
        }
        try {
            return taskStatusSink.findTask(taskId)
                    .map(FleetTask::title)
                    .filter(t -> !t.isBlank())
                    .orElse(taskId);
        } catch (Exception e) {
            log.debug("Task lookup for {} failed: {}", taskId, e.getMessage());
            return taskId;
        }
    }

    private static String taskId(FleetTask task) {
        return task != null && task.id() != null ? task.id() : "unknown";
    }

    private static String title(FleetTask task) {
        return task != null && task.title() != null ? task.title() : "";
    }

    // -- Internal state -------------------------------------------------------

    private static final class Heartbeat {
        long lastHeartbeat;
        boolean staleFlagged;

        Heartbeat(long lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
        }
    }

    private static final class AutoActionState {
        int retryCount;
        long cooldownUntil;
    }
}
