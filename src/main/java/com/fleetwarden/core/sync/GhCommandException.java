package com.fleetwarden.core.sync;

import java.util.List;

/**
 * A {@code gh} invocation that failed. Carries stderr so callers can classify the failure.
 */
public class GhCommandException extends RuntimeException {

    private final List<String> args;
    private final String stderr;
    private final int exitCode;

    public GhCommandException(String message, List<String> args, String stderr, int exitCode) {
        super(message);
        this.args = args == null ? List.of() : List.copyOf(args);
        this.stderr = stderr == null ? "" : stderr;
        this.exitCode = exitCode;
    }

    public GhCommandException(String message, Throwable cause) {
        super(message, cause);
        this.args = List.of();
        this.stderr = cause instanceof GhCommandException gh ? gh.stderr : "";
        this.exitCode = -1;
    }

    public List<String> getArgs() {
        return args;
    }

    public String getStderr() {
        return stderr;
    }

    public int getExitCode() {
        return exitCode;
    }

    /** Message and stderr joined, the text every error predicate matches against. */
    public String fullText() {
        String message = getMessage() == null ? "" : getMessage();
        return stderr.isEmpty() ? message : message + "\n" + stderr;
    }
}
