package com.fleetwarden.core.executor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Agent turn settings.
 */
@Component
@ConfigurationProperties(prefix = "fleetwarden.executor")
public class ExecutorProperties {

    /** Budget of one turn including stream retries. */
    private long defaultTimeoutMs = 3_600_000;

    /** Stream-level retries after the first attempt. */
    private int maxStreamRetries = 5;
    private long retryBaseMs = 2_000;
    private long retryMaxMs = 32_000;
    private long retryJitterMs = 1_000;

    public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
    public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }

    public int getMaxStreamRetries() { return maxStreamRetries; }
    public void setMaxStreamRetries(int maxStreamRetries) { this.maxStreamRetries = maxStreamRetries; }

    public long getRetryBaseMs() { return retryBaseMs; }
    public void setRetryBaseMs(long retryBaseMs) { this.retryBaseMs = retryBaseMs; }

    public long getRetryMaxMs() { return retryMaxMs; }
    public void setRetryMaxMs(long retryMaxMs) { this.retryMaxMs = retryMaxMs; }

    public long getRetryJitterMs() { return retryJitterMs; }
    public void setRetryJitterMs(long retryJitterMs) { this.retryJitterMs = retryJitterMs; }
}
