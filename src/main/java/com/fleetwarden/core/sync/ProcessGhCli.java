package com.fleetwarden.core.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link GhCli} that shells out to the {@code gh} binary via {@link ProcessBuilder}.
 */
@Component
public class ProcessGhCli implements GhCli {

    private static final Logger log = LoggerFactory.getLogger(ProcessGhCli.class);

    private final String executable;
    private final long timeoutMs;

    public ProcessGhCli(SyncProperties properties) {
        this.executable = properties.getGhExecutable();
        this.timeoutMs = properties.getGhTimeoutMs();
    }

    @Override
    public GhResult run(List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(args);
        log.debug("Running: gh {}", String.join(" ", args));

        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(false).start();
        } catch (IOException e) {
            throw new GhCommandException("gh CLI failed: cannot start " + executable + ": " + e.getMessage(), e);
        }

        // Drain both streams concurrently so a full pipe cannot stall the child
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new GhCommandException("gh CLI failed: timed out after " + timeoutMs + "ms", args, "", -1);
            }
            String out = stdout.get(timeoutMs, TimeUnit.MILLISECONDS);
            String err = stderr.get(timeoutMs, TimeUnit.MILLISECONDS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String firstLine = err.isBlank() ? "exit code " + exitCode : err.strip().lines().findFirst().orElse("");
                throw new GhCommandException("gh CLI failed: " + firstLine, args, err, exitCode);
            }
            return new GhResult(out, err);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new GhCommandException("gh CLI interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new GhCommandException("gh CLI failed: could not read output", e);
        }
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
    }
}
