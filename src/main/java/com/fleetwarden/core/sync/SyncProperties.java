package com.fleetwarden.core.sync;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Board synchronisation settings.
 * <p>
 * The project fields ({@code projectMode}, {@code projectId}, ...) are explicit options: when
 * left unset they are resolved from the environment by {@link ProjectSettings#resolve}.
 */
@Component
@ConfigurationProperties(prefix = "fleetwarden.sync")
public class SyncProperties {

    /** Run the reconciliation loop in the background. */
    private boolean enabled = false;

    private long intervalMs = 300_000;
    private long initialDelayMs = 30_000;

    // Explicit options; null means "consult the environment"
    private String projectMode;
    private String projectId;
    private String projectNumber;
    private String projectOwner;
    private String repository;
    private Boolean enforceTaskLabel;
    private List<String> taskLabels;

    private String ghExecutable = "gh";
    private long ghTimeoutMs = 30_000;
    private int issueListLimit = 1000;

    /** Backoff after a rate-limited board call; {@code GH_RATE_LIMIT_RETRY_MS} overrides it. */
    private long rateLimitRetryMs = 60_000;

    /** Wait before rejected owners are retried; {@code GH_PROJECT_OWNER_RETRY_MS} overrides it. */
    private long ownerRetryMs = 900_000;

    /** Delays between attempts of a call that failed with a transient error. */
    private List<Long> transientRetryDelaysMs = new ArrayList<>(List.of(1_000L, 3_000L, 7_000L));

    /** Consecutive failures of one project command before it is backed off. */
    private int commandFailureThreshold = 3;
    private long commandBackoffBaseMs = 60_000;
    private long commandBackoffMaxMs = 1_800_000;

    private long payloadWarningThrottleMs = 300_000;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public long getIntervalMs() { return intervalMs; }
    public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

    public long getInitialDelayMs() { return initialDelayMs; }
    public void setInitialDelayMs(long initialDelayMs) { this.initialDelayMs = initialDelayMs; }

    public String getProjectMode() { return projectMode; }
    public void setProjectMode(String projectMode) { this.projectMode = projectMode; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getProjectNumber() { return projectNumber; }
    public void setProjectNumber(String projectNumber) { this.projectNumber = projectNumber; }

    public String getProjectOwner() { return projectOwner; }
    public void setProjectOwner(String projectOwner) { this.projectOwner = projectOwner; }

    public String getRepository() { return repository; }
    public void setRepository(String repository) { this.repository = repository; }

    public Boolean getEnforceTaskLabel() { return enforceTaskLabel; }
    public void setEnforceTaskLabel(Boolean enforceTaskLabel) { this.enforceTaskLabel = enforceTaskLabel; }

    public List<String> getTaskLabels() { return taskLabels; }
    public void setTaskLabels(List<String> taskLabels) { this.taskLabels = taskLabels; }

    public String getGhExecutable() { return ghExecutable; }
    public void setGhExecutable(String ghExecutable) { this.ghExecutable = ghExecutable; }

    public long getGhTimeoutMs() { return ghTimeoutMs; }
    public void setGhTimeoutMs(long ghTimeoutMs) { this.ghTimeoutMs = ghTimeoutMs; }

    public int getIssueListLimit() { return issueListLimit; }
    public void setIssueListLimit(int issueListLimit) { this.issueListLimit = issueListLimit; }

    public long getRateLimitRetryMs() { return rateLimitRetryMs; }
    public void setRateLimitRetryMs(long rateLimitRetryMs) { this.rateLimitRetryMs = rateLimitRetryMs; }

    public long getOwnerRetryMs() { return ownerRetryMs; }
    public void setOwnerRetryMs(long ownerRetryMs) { this.ownerRetryMs = ownerRetryMs; }

    public List<Long> getTransientRetryDelaysMs() { return transientRetryDelaysMs; }
    public void setTransientRetryDelaysMs(List<Long> transientRetryDelaysMs) { this.transientRetryDelaysMs = transientRetryDelaysMs; }

    public int getCommandFailureThreshold() { return commandFailureThreshold; }
    public void setCommandFailureThreshold(int commandFailureThreshold) { this.commandFailureThreshold = commandFailureThreshold; }

    public long getCommandBackoffBaseMs() { return commandBackoffBaseMs; }
    public void setCommandBackoffBaseMs(long commandBackoffBaseMs) { this.commandBackoffBaseMs = commandBackoffBaseMs; }

    public long getCommandBackoffMaxMs() { return commandBackoffMaxMs; }
    public void setCommandBackoffMaxMs(long commandBackoffMaxMs) { this.commandBackoffMaxMs = commandBackoffMaxMs; }

    public long getPayloadWarningThrottleMs() { return payloadWarningThrottleMs; }
    public void setPayloadWarningThrottleMs(long payloadWarningThrottleMs) { this.payloadWarningThrottleMs = payloadWarningThrottleMs; }
}
