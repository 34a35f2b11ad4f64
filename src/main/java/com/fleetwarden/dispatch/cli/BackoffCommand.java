package com.fleetwarden.dispatch.cli;

import com.fleetwarden.core.persistence.AutoUpdateState;
import com.fleetwarden.core.persistence.AutoUpdateStateStore;
import com.fleetwarden.core.sync.BackoffState;
import com.fleetwarden.core.sync.BackoffStateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Clock;
import java.time.Instant;

/**
 * CLI command: fleetwarden backoff [--reset]
 * <p>
 * Shows the persisted board backoff and auto-update breaker, or clears both.
 */
@Command(name = "backoff", mixinStandardHelpOptions = true,
        description = "Show or reset persisted board backoff state")
@Component
public class BackoffCommand implements Runnable {

    @Option(names = "--reset", description = "Forget every backoff window and rejected owner")
    private boolean reset;

    private final BackoffStateStore backoffStore;
    private final AutoUpdateStateStore autoUpdateStore;
    private final Clock clock;

    public BackoffCommand(BackoffStateStore backoffStore, AutoUpdateStateStore autoUpdateStore, Clock clock) {
        this.backoffStore = backoffStore;
        this.autoUpdateStore = autoUpdateStore;
        this.clock = clock;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (reset) {
            backoffStore.reset();
            autoUpdateStore.reset();
            ConsoleOutput.success("Backoff state cleared (" + backoffStore.path() + ")");
            return;
        }

        long now = clock.millis();
        BackoffState state = backoffStore.current();
        ConsoleOutput.info("State file: " + backoffStore.path());
        System.out.println("  Rate limit:    " + window(state.rateLimitUntil(), now));
        System.out.println("  Owner retry:   " + window(state.ownerRetryUntil(), now));
        System.out.println("  Bad owners:    " + (state.invalidOwners().isEmpty() ? "-" : String.join(", ", state.invalidOwners())));
        if (state.commandFailures().isEmpty()) {
            System.out.println("  Commands:      no recorded failures");
        } else {
            System.out.println("  Commands:");
            state.commandFailures().forEach((key, failures) -> System.out.printf("    %-24s %d failures, %s%n",
                    key, failures, window(state.backoffUntil(key), now)));
        }

        AutoUpdateState autoUpdate = autoUpdateStore.current();
        if (autoUpdate.isDisabled(now)) {
            ConsoleOutput.warn(autoUpdateStore.disableNotice(autoUpdate));
        } else if (autoUpdate.failureCount() > 0) {
            System.out.println("  Auto-update:   " + autoUpdate.failureCount() + " recent failures");
        }
    }

    private static String window(long until, long now) {
        if (until <= now) {
            return "clear";
        }
        return "until " + Instant.ofEpochMilli(until) + " (" + ConsoleOutput.formatDuration(until - now) + ")";
    }
}
