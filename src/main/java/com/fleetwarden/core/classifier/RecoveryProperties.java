package com.fleetwarden.core.classifier;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retry ceilings and cooldown windows for the recovery state machine.
 */
@Component
@ConfigurationProperties(prefix = "fleetwarden.recovery")
public class RecoveryProperties {

    /** Occurrence of a push/test/lint/build failure that escalates to manual. */
    private int workflowRetryCeiling = 3;

    /** Occurrence of a sandbox failure that escalates to block. */
    private int sandboxRetryCeiling = 2;

    /** Occurrence of an unrecognised failure that escalates to manual. */
    private int genericRetryCeiling = 3;

    /** Counted failures across all patterns of one task before it is blocked. */
    private int maxConsecutiveErrors = 5;

    private long rateLimitCooldownMs = 60_000;
    private long apiCooldownMs = 30_000;
    private long defaultCooldownMs = 60_000;

    /** Window in which rate-limit hits are counted for the executor kill-switch. */
    private long rateLimitWindowMs = 300_000;

    /** Rate-limit hits inside the window above which the executor should pause. */
    private int rateLimitPauseThreshold = 3;

    private Sequence sequence = new Sequence();

    public int getWorkflowRetryCeiling() { return workflowRetryCeiling; }
    public void setWorkflowRetryCeiling(int workflowRetryCeiling) { this.workflowRetryCeiling = workflowRetryCeiling; }

    public int getSandboxRetryCeiling() { return sandboxRetryCeiling; }
    public void setSandboxRetryCeiling(int sandboxRetryCeiling) { this.sandboxRetryCeiling = sandboxRetryCeiling; }

    public int getGenericRetryCeiling() { return genericRetryCeiling; }
    public void setGenericRetryCeiling(int genericRetryCeiling) { this.genericRetryCeiling = genericRetryCeiling; }

    public int getMaxConsecutiveErrors() { return maxConsecutiveErrors; }
    public void setMaxConsecutiveErrors(int maxConsecutiveErrors) { this.maxConsecutiveErrors = maxConsecutiveErrors; }

    public long getRateLimitCooldownMs() { return rateLimitCooldownMs; }
    public void setRateLimitCooldownMs(long rateLimitCooldownMs) { this.rateLimitCooldownMs = rateLimitCooldownMs; }

    public long getApiCooldownMs() { return apiCooldownMs; }
    public void setApiCooldownMs(long apiCooldownMs) { this.apiCooldownMs = apiCooldownMs; }

    public long getDefaultCooldownMs() { return defaultCooldownMs; }
    public void setDefaultCooldownMs(long defaultCooldownMs) { this.defaultCooldownMs = defaultCooldownMs; }

    public long getRateLimitWindowMs() { return rateLimitWindowMs; }
    public void setRateLimitWindowMs(long rateLimitWindowMs) { this.rateLimitWindowMs = rateLimitWindowMs; }

    public int getRateLimitPauseThreshold() { return rateLimitPauseThreshold; }
    public void setRateLimitPauseThreshold(int rateLimitPauseThreshold) { this.rateLimitPauseThreshold = rateLimitPauseThreshold; }

    public Sequence getSequence() { return sequence; }
    public void setSequence(Sequence sequence) { this.sequence = sequence; }

    /**
     * Thresholds for behavioural stall detection over a message window.
     */
    public static class Sequence {
        private int toolLoopThreshold = 6;
        private int analysisParalysisThreshold = 10;
        private int noProgressThreshold = 5;
        private int errorLoopThreshold = 3;
        private int rateLimitThreshold = 2;

        public int getToolLoopThreshold() { return toolLoopThreshold; }
        public void setToolLoopThreshold(int toolLoopThreshold) { this.toolLoopThreshold = toolLoopThreshold; }

        public int getAnalysisParalysisThreshold() { return analysisParalysisThreshold; }
        public void setAnalysisParalysisThreshold(int analysisParalysisThreshold) { this.analysisParalysisThreshold = analysisParalysisThreshold; }

        public int getNoProgressThreshold() { return noProgressThreshold; }
        public void setNoProgressThreshold(int noProgressThreshold) { this.noProgressThreshold = noProgressThreshold; }

        public int getErrorLoopThreshold() { return errorLoopThreshold; }
        public void setErrorLoopThreshold(int errorLoopThreshold) { this.errorLoopThreshold = errorLoopThreshold; }

        public int getRateLimitThreshold() { return rateLimitThreshold; }
        public void setRateLimitThreshold(int rateLimitThreshold) { this.rateLimitThreshold = rateLimitThreshold; }
    }
}
