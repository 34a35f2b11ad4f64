package com.fleetwarden.core.classifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Classifies the most recent agent log files in a directory to surface recurring failure modes.
 */
@Service
public class HistoricalErrorAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(HistoricalErrorAnalyzer.class);

    /** Only the newest files (by name) are read. */
    static final int MAX_FILES = 20;

    /**
     * Per-pattern file counts plus operator recommendations.
     */
    public record HistoricalReport(Map<ErrorPattern, Integer> patterns, List<String> recommendations) {
        public int count(ErrorPattern pattern) {
            return patterns.getOrDefault(pattern, 0);
        }
    }

    public HistoricalReport analyze(Path logsDir) {
        var counts = new EnumMap<ErrorPattern, Integer>(ErrorPattern.class);

        List<Path> files;
        try (Stream<Path> listing = Files.list(logsDir)) {
            files = listing
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Cannot list agent logs in {}: {}", logsDir, e.getMessage());
            return new HistoricalReport(Map.of(), List.of());
        }

        List<Path> recent = files.subList(Math.max(0, files.size() - MAX_FILES), files.size());
        for (Path file : recent) {
            try {
                String content = Files.readString(file, StandardCharsets.UTF_8);
                ErrorPattern pattern = PatternLibrary.classify(content).pattern();
                counts.merge(pattern, 1, Integer::sum);
            } catch (IOException e) {
                log.debug("Skipping unreadable log {}: {}", file, e.getMessage());
            }
        }

        var recommendations = new ArrayList<String>();
        if (counts.getOrDefault(ErrorPattern.RATE_LIMITED, 0) > 3) {
            recommendations.add("Frequent rate limiting: consider reducing parallelism or adding delays");
        }
        if (counts.getOrDefault(ErrorPattern.PLAN_STUCK, 0) > 3) {
            recommendations.add("Agents frequently get stuck in planning mode: make instructions say 'implement immediately'");
        }
        if (counts.getOrDefault(ErrorPattern.TOKEN_OVERFLOW, 0) > 2) {
            recommendations.add("Token overflow occurring: split large tasks or summarize context");
        }
        if (counts.getOrDefault(ErrorPattern.AUTH_ERROR, 0) > 0) {
            recommendations.add("Authentication failures found: verify executor API keys");
        }

        log.info("Analyzed {} agent logs in {}: {}", recent.size(), logsDir, counts);
        return new HistoricalReport(Map.copyOf(counts), List.copyOf(recommendations));
    }
}
