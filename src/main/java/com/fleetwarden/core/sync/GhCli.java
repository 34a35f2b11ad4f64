package com.fleetwarden.core.sync;

import java.util.List;

/**
 * Runs {@code gh} with structured arguments. Authentication is whatever the CLI resolves.
 */
@FunctionalInterface
public interface GhCli {

    /**
     * @param args arguments after the executable name
     * @return captured output of a zero exit
     * @throws GhCommandException on a non-zero exit, a timeout or a launch failure
     */
    GhResult run(List<String> args);

    /**
     * Captured output of one {@code gh} invocation.
     */
    record GhResult(String stdout, String stderr) {

        public GhResult {
            stdout = stdout == null ? "" : stdout;
            stderr = stderr == null ? "" : stderr;
        }

        public static GhResult of(String stdout) {
            return new GhResult(stdout, "");
        }
    }
}
