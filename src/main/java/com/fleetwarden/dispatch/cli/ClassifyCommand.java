package com.fleetwarden.dispatch.cli;

import com.fleetwarden.core.classifier.ErrorClassification;
import com.fleetwarden.core.classifier.ErrorClassifier;
import com.fleetwarden.core.classifier.RecoveryVerdict;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: fleetwarden classify &lt;text&gt;
 * <p>
 * Classifies agent output and shows the recovery decision the supervisor would take.
 * {@code --attempts} replays the same failure to show how the decision escalates.
 */
@Command(name = "classify", mixinStandardHelpOptions = true,
        description = "Classify agent error output and show the recovery decision")
@Component
public class ClassifyCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", description = "Error text to classify")
    private List<String> text;

    @Option(names = {"--file", "-f"}, description = "Read the error text from a file")
    private Path file;

    @Option(names = {"--task", "-t"}, description = "Task id to record against (default: ${DEFAULT-VALUE})",
            defaultValue = "cli")
    private String taskId;

    @Option(names = {"--attempts", "-n"}, description = "Record the failure this many times (default: ${DEFAULT-VALUE})",
            defaultValue = "1")
    private int attempts;

    private final ErrorClassifier classifier;

    public ClassifyCommand(ErrorClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public Integer call() {
        String input;
        try {
            input = file != null ? Files.readString(file, StandardCharsets.UTF_8)
                    : String.join(" ", text == null ? List.of() : text);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 1;
        }
        if (input.isBlank()) {
            ConsoleOutput.error("Nothing to classify: pass the error text or --file");
            return 2;
        }

        ErrorClassification classification = classifier.classify(input);
        ConsoleOutput.info("Pattern: " + classification.pattern().wireName()
                + " (confidence " + classification.confidence() + ")");
        ConsoleOutput.info(classification.details());
        if (classification.rawMatch() != null) {
            System.out.println("  Matched: " + classification.rawMatch());
        }

        RecoveryVerdict verdict = null;
        for (int i = 0; i < Math.max(1, attempts); i++) {
            verdict = classifier.recordError(taskId, classification);
        }
        System.out.println();
        ConsoleOutput.verdict(verdict);
        return 0;
    }
}
