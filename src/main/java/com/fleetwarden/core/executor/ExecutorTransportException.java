package com.fleetwarden.core.executor;

/**
 * The executor could not be reached, or its stream kept failing after every retry.
 */
public class ExecutorTransportException extends RuntimeException {

    public ExecutorTransportException(String message) {
        super(message);
    }

    public ExecutorTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
