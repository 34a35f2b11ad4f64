package com.fleetwarden.dispatch.cli;

import com.fleetwarden.core.sync.ReconcileSummary;
import com.fleetwarden.core.sync.ReconciliationEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: fleetwarden reconcile
 * <p>
 * Runs one board reconciliation pass. Exits non-zero unless the pass completed.
 */
@Command(name = "reconcile", mixinStandardHelpOptions = true,
        description = "Run one reconciliation pass against the board")
@Component
public class ReconcileCommand implements Callable<Integer> {

    private final ReconciliationEngine engine;

    public ReconcileCommand(ReconciliationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ReconcileSummary summary = engine.reconcileOnce();
        ConsoleOutput.reconcileSummary(summary);
        if (ReconcileSummary.BACKOFF.equals(summary.status())) {
            ConsoleOutput.info("Board calls are backing off; see 'fleetwarden backoff'");
        }
        return summary.isOk() || ReconcileSummary.SKIPPED.equals(summary.status()) ? 0 : 1;
    }
}
