package com.fleetwarden.core.classifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a classified failure into a bounded recovery decision.
 * <p>
 * Counters are kept per {@code (taskId, pattern)}. Unrecoverable failures block at once,
 * throttling failures only cool down and never consume retry budget, workflow failures get a
 * remediation prompt until their ceiling and then go to a human. Decisions are returned,
 * never thrown.
 */
@Service
public class ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);

    private final RecoveryProperties properties;
    private final Clock clock;

    private final ConcurrentHashMap<String, RecoveryState> states = new ConcurrentHashMap<>();

    /** Timestamps of recent rate-limit hits across all tasks. */
    private final Deque<Long> rateLimitHits = new ArrayDeque<>();

    private long totalErrors;
    private long totalRecoveries;

    public ErrorClassifier(RecoveryProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public ErrorClassification classify(String text) {
        return PatternLibrary.classify(text);
    }

    public ErrorClassification classify(String output, String error) {
        return PatternLibrary.classify(output, error);
    }

    /**
     * Records one failed attempt and returns the recovery decision for it.
     *
     * @param taskId         the failing task
     * @param classification result of {@link #classify}
     * @return the verdict; never {@code null}
     */
    public RecoveryVerdict recordError(String taskId, ErrorClassification classification) {
        if (taskId == null || taskId.isBlank() || classification == null) {
            return RecoveryVerdict.manual(ErrorPattern.UNKNOWN, "Missing taskId or classification", null, 0);
        }

        ErrorPattern pattern = classification.pattern();
        long now = clock.millis();
        RecoveryState state = states.computeIfAbsent(taskId, k -> new RecoveryState());

        RecoveryVerdict verdict;
        synchronized (state) {
            synchronized (this) {
                totalErrors++;
            }
            if (pattern.isThrottle()) {
                verdict = throttle(state, pattern, now);
            } else {
                int count = state.increment(pattern, now);
                verdict = decide(state, pattern, count, classification.rawMatch());
            }
        }

        log.info("Task {} {} (#{}) -> {}: {}", taskId, pattern.wireName(), verdict.errorCount(),
                verdict.action().wireName(), verdict.reason());
        return verdict;
    }

    private RecoveryVerdict throttle(RecoveryState state, ErrorPattern pattern, long now) {
        long cooldownMs;
        String reason;
        if (pattern == ErrorPattern.RATE_LIMITED) {
            synchronized (rateLimitHits) {
                rateLimitHits.addLast(now);
                pruneRateLimitHits(now);
            }
            cooldownMs = properties.getRateLimitCooldownMs();
            reason = "Rate limited, cooling down for " + cooldownMs + "ms before retry";
        } else {
            cooldownMs = properties.getApiCooldownMs();
            reason = "Transient API error, retrying after " + cooldownMs + "ms";
        }
        state.noteThrottle(pattern, now, cooldownMs);
        return RecoveryVerdict.cooldown(pattern, reason, cooldownMs, state.count(pattern));
    }

    private RecoveryVerdict decide(RecoveryState state, ErrorPattern pattern, int count, String rawMatch) {
        if (pattern.isUnrecoverable()) {
            return RecoveryVerdict.block(pattern, unrecoverableReason(pattern), count);
        }

        int consecutive = state.errorCount();
        if (consecutive >= properties.getMaxConsecutiveErrors()) {
            return RecoveryVerdict.block(pattern,
                    "Task has " + consecutive + " consecutive errors (max "
                            + properties.getMaxConsecutiveErrors() + "), blocking", count);
        }

        String prompt = RecoveryPrompts.forFailure(pattern, rawMatch);

        if (pattern.isWorkflowFailure() || pattern == ErrorPattern.PLAN_STUCK
                || pattern == ErrorPattern.PERMISSION_WAIT) {
            int ceiling = properties.getWorkflowRetryCeiling();
            if (count >= ceiling) {
                return RecoveryVerdict.manual(pattern,
                        label(pattern) + " persists after " + count + " attempts, needs manual review", prompt, count);
            }
            return RecoveryVerdict.retry(pattern,
                    label(pattern) + " (attempt " + count + "/" + ceiling + "), retry with fix prompt", prompt, count);
        }

        switch (pattern) {
            case CODEX_SANDBOX -> {
                int ceiling = properties.getSandboxRetryCeiling();
                if (count >= ceiling) {
                    return RecoveryVerdict.block(pattern,
                            "Sandbox/permission errors persist, check the executor sandbox configuration", count);
                }
                return RecoveryVerdict.retry(pattern,
                        "Sandbox failure (attempt " + count + "/" + ceiling + "), check config", prompt, count);
            }
            case TOKEN_OVERFLOW, SESSION_EXPIRED -> {
                if (count > 1) {
                    return RecoveryVerdict.manual(pattern,
                            label(pattern) + " repeated in a fresh session, needs manual review", prompt, count);
                }
                return RecoveryVerdict.retry(pattern,
                        label(pattern) + ", starting a fresh session on the same worktree", prompt, count);
            }
            case REQUEST_ERROR -> {
                if (count >= 2) {
                    return RecoveryVerdict.block(pattern,
                            "Client request errors persist (400/404/422), the request needs manual investigation", count);
                }
                return RecoveryVerdict.retry(pattern, "Client request error (attempt 1/2), fix request payload", prompt, count);
            }
            default -> {
                int ceiling = properties.getGenericRetryCeiling();
                if (count >= ceiling) {
                    return RecoveryVerdict.manual(pattern,
                            label(pattern) + " repeated " + count + " times, needs manual review", prompt, count);
                }
                long cooldownMs = properties.getDefaultCooldownMs();
                state.noteThrottle(pattern, clock.millis(), cooldownMs);
                return RecoveryVerdict.cooldown(pattern,
                        label(pattern) + " (attempt " + count + "/" + ceiling + "), retry after cooldown", cooldownMs, count);
            }
        }
    }

    private static String unrecoverableReason(ErrorPattern pattern) {
        return switch (pattern) {
            case AUTH_ERROR -> "API authentication failed (invalid/expired/missing key). "
                    + "Fix the API key configuration before retrying.";
            case MODEL_ERROR -> "Model not found or unavailable. Check the configured model name.";
            default -> "Content policy or safety filter violation. The request was rejected and will not succeed on retry.";
        };
    }

    private static String label(ErrorPattern pattern) {
        return pattern.description();
    }

    /**
     * Milliseconds left in the task's cooldown, zero when none is active.
     */
    public long remainingCooldownMs(String taskId) {
        RecoveryState state = states.get(taskId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return Math.max(0, state.cooldownUntil() - clock.millis());
        }
    }

    /** Occurrences of {@code pattern} recorded for the task. */
    public int errorCount(String taskId, ErrorPattern pattern) {
        RecoveryState state = states.get(taskId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.count(pattern);
        }
    }

    /**
     * Clears the task's recovery state; called when a task starts or completes successfully.
     */
    public void resetTask(String taskId) {
        if (taskId == null) {
            return;
        }
        RecoveryState removed = states.remove(taskId);
        if (removed != null) {
            synchronized (this) {
                totalRecoveries += removed.errorCount();
            }
            log.debug("Recovery state reset for task {}", taskId);
        }
    }

    /**
     * True when more rate-limit hits than the configured threshold landed inside the window.
     */
    public boolean shouldPauseExecutor() {
        synchronized (rateLimitHits) {
            pruneRateLimitHits(clock.millis());
            return rateLimitHits.size() > properties.getRateLimitPauseThreshold();
        }
    }

    public ClassifierStats getStats() {
        int hits;
        synchronized (rateLimitHits) {
            pruneRateLimitHits(clock.millis());
            hits = rateLimitHits.size();
        }
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        states.forEach((taskId, state) -> {
            synchronized (state) {
                breakdown.put(taskId, state.errorCount());
            }
        });
        synchronized (this) {
            return new ClassifierStats(totalErrors, totalRecoveries, states.size(), hits, breakdown);
        }
    }

    private void pruneRateLimitHits(long now) {
        long cutoff = now - properties.getRateLimitWindowMs();
        while (!rateLimitHits.isEmpty() && rateLimitHits.peekFirst() <= cutoff) {
            rateLimitHits.pollFirst();
        }
    }
}
