package com.fleetwarden.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One-shot cancellation flag shared between the caller and a running turn.
 */
public class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile String reason;

    /**
     * Fires the signal. Only the first call has an effect.
     */
    public void cancel(String reason) {
        synchronized (this) {
            if (this.reason != null) {
                return;
            }
            this.reason = reason == null ? "cancelled" : reason;
        }
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed: {}", e.getMessage());
            }
        }
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public String reason() {
        return reason;
    }

    /** Runs {@code callback} on cancellation, immediately when already cancelled. */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled()) {
            callbacks.remove(callback);
            callback.run();
        }
    }

    public void removeCallback(Runnable callback) {
        callbacks.remove(callback);
    }
}
