package com.fleetwarden.core.classifier;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HistoricalErrorAnalyzerTest {

    @TempDir
    Path logs;

    private final HistoricalErrorAnalyzer analyzer = new HistoricalErrorAnalyzer();

    @Test
    void countsPatternsAndRecommends() throws IOException {
        for (int i = 0; i < 4; i++) {
            Files.writeString(logs.resolve("agent-" + i + ".log"), "429 Too Many Requests");
        }
        Files.writeString(logs.resolve("agent-9.log"), "Error: invalid api key");
        Files.writeString(logs.resolve("notes.txt"), "429 Too Many Requests");

        var report = analyzer.analyze(logs);

        assertEquals(4, report.count(ErrorPattern.RATE_LIMITED));
        assertEquals(1, report.count(ErrorPattern.AUTH_ERROR));
        assertEquals(2, report.recommendations().size());
    }

    @Test
    void onlyReadsNewestFiles() throws IOException {
        for (int i = 0; i < HistoricalErrorAnalyzer.MAX_FILES + 5; i++) {
            Files.writeString(logs.resolve(String.format("agent-%03d.log", i)), "go build failed");
        }

        var report = analyzer.analyze(logs);

        assertEquals(HistoricalErrorAnalyzer.MAX_FILES, report.count(ErrorPattern.BUILD_FAILURE));
    }

    @Test
    void missingDirectoryYieldsEmptyReport() {
        var report = analyzer.analyze(logs.resolve("nope"));

        assertTrue(report.patterns().isEmpty());
        assertTrue(report.recommendations().isEmpty());
    }
}
