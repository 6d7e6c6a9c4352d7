package com.codeforge.orchestrator.skill;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command with a working directory and a wall-clock limit.
 *
 * A command that outlives its limit is killed and reported as
 * {@link SkillException.Kind#TIMEOUT}; the caller treats that as recoverable.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    // Observations are truncated past this many characters per stream.
    private static final int MAX_OUTPUT_CHARS = 8_000;

    public ProcessResult run(List<String> command, Path workingDir, int timeoutSec) {
        return run(command, workingDir, timeoutSec, Map.of());
    }

    /**
     * @param defaultEnv variables set for the command unless the environment already defines them
     */
    public ProcessResult run(List<String> command, Path workingDir, int timeoutSec, Map<String, String> defaultEnv) {
        log.debug("Running {} in {} (timeout {}s)", command, workingDir, timeoutSec);
        long start = System.nanoTime();
        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command).directory(workingDir.toFile());
            defaultEnv.forEach(builder.environment()::putIfAbsent);
            process = builder.start();
        } catch (IOException e) {
            throw new SkillException(SkillException.Kind.TOOL_ERROR,
                    "Cannot start '" + command.get(0) + "': " + e.getMessage(), e);
        }
        closeStdin(process);
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

        try {
            if (!process.waitFor(timeoutSec, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new SkillException(SkillException.Kind.TIMEOUT,
                        "'" + String.join(" ", command) + "' timed out after " + timeoutSec + "s");
            }
            double elapsed = (System.nanoTime() - start) / 1e9;
            return new ProcessResult(process.exitValue(),
                    truncate(stdout.join()), truncate(stderr.join()), elapsed);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new SkillException(SkillException.Kind.TOOL_ERROR, "Interrupted while running " + command, e);
        }
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", process.pid(), e.getMessage());
        }
    }

    private static String drain(InputStream in) {
        try (in; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            in.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String truncate(String s) {
        return s.length() <= MAX_OUTPUT_CHARS ? s : s.substring(0, MAX_OUTPUT_CHARS) + "\n... (truncated)";
    }
}
