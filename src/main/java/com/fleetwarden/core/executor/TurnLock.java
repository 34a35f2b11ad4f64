package com.fleetwarden.core.executor;

/**
 * Guards an executor against overlapping turns.
 * <p>
 * {@code IDLE -> ACTIVE} on acquire, {@code ACTIVE <-> RETRY_PENDING} around a retry wait,
 * back to {@code IDLE} only through {@link #release()}. A retry therefore never frees the lock
 * for another caller.
 */
public class TurnLock {

    public enum State { IDLE, ACTIVE, RETRY_PENDING }

    private State state = State.IDLE;

    /** @return false when a turn is already in flight */
    public synchronized boolean tryAcquire() {
        if (state != State.IDLE) {
            return false;
        }
        state = State.ACTIVE;
        return true;
    }

    public synchronized void markRetryPending() {
        expect(State.ACTIVE);
        state = State.RETRY_PENDING;
    }

    public synchronized void resumeRetry() {
        expect(State.RETRY_PENDING);
        state = State.ACTIVE;
    }

    public synchronized void release() {
        state = State.IDLE;
    }

    public synchronized State state() {
        return state;
    }

    public synchronized boolean isBusy() {
        return state != State.IDLE;
    }

    private void expect(State expected) {
        if (state != expected) {
            throw new IllegalStateException("Turn lock is " + state + ", expected " + expected);
        }
    }
}
