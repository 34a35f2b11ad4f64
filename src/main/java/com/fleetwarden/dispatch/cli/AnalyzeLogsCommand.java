package com.fleetwarden.dispatch.cli;

import com.fleetwarden.core.classifier.ErrorPattern;
import com.fleetwarden.core.classifier.HistoricalErrorAnalyzer;
import com.fleetwarden.core.classifier.HistoricalErrorAnalyzer.HistoricalReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;

/**
 * CLI command: fleetwarden analyze-logs &lt;dir&gt;
 */
@Command(name = "analyze-logs", mixinStandardHelpOptions = true,
        description = "Summarise failure patterns across recent agent logs")
@Component
public class AnalyzeLogsCommand implements Runnable {

    @Parameters(index = "0", description = "Directory holding agent *.log files")
    private Path logsDir;

    private final HistoricalErrorAnalyzer analyzer;

    public AnalyzeLogsCommand(HistoricalErrorAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        HistoricalReport report = analyzer.analyze(logsDir);
        if (report.patterns().isEmpty()) {
            ConsoleOutput.info("No agent logs found in " + logsDir);
            return;
        }

        System.out.printf("  %-22s %s%n", "PATTERN", "LOGS");
        System.out.println("  " + "-".repeat(30));
        report.patterns().entrySet().stream()
                .sorted(Map.Entry.<ErrorPattern, Integer>comparingByValue(Comparator.reverseOrder()))
                .forEach(e -> System.out.printf("  %-22s %d%n", e.getKey().wireName(), e.getValue()));

        if (!report.recommendations().isEmpty()) {
            System.out.println();
            report.recommendations().forEach(ConsoleOutput::warn);
        }
    }
}
