package com.fleetwarden.core.config;

/**
 * Waits between retry attempts. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleep() {
        return Thread::sleep;
    }
}
