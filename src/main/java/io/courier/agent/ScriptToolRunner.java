package io.courier.agent;

import io.courier.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs a configured external command with the task description on stdin and
 * returns its combined output.
 */
public final class ScriptToolRunner implements ToolRunner {
    private static final Logger log = LoggerFactory.getLogger(ScriptToolRunner.class);
    private static final int MAX_ERROR_CHARS = 512;

    private final String id;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptToolRunner(String id, List<String> command, long timeoutMs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script runner id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script runner command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String run(String description) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Process process = pb.start();
        try {
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            // the child may never read stdin, so the write must not hold up the timeout
            CompletableFuture.runAsync(() -> writeAll(process.getOutputStream(), description));

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                throw new IOException("script timeout after " + Duration.ofMillis(timeoutMs));
            }
            String combined = output.join();
            if (process.exitValue() == 0) {
                return combined.strip();
            }
            throw new IOException("script exit=" + process.exitValue() + " output=" + Texts.preview(combined, MAX_ERROR_CHARS));
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private void writeAll(OutputStream stdin, String description) {
        try (stdin) {
            stdin.write((description == null ? "" : description).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("Script runner {} stopped accepting input: {}", id, e.getMessage());
        }
    }

    private static String readAll(InputStream in) {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read script output", e);
        }
    }
}
