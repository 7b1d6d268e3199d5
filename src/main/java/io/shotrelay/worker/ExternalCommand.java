package io.shotrelay.worker;

import io.shotrelay.error.TransientTaskException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a capture or diff tool with its combined output going to a file, so a chatty tool cannot
 * fill a pipe and stall.
 */
final class ExternalCommand {
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> command;
    private final long timeoutMs;

    ExternalCommand(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    Result run(List<String> args, Path outputFile) throws InterruptedException {
        List<String> full = new ArrayList<>(command);
        full.addAll(args);
        ProcessBuilder pb = new ProcessBuilder(full);
        pb.redirectErrorStream(true);
        pb.redirectOutput(outputFile.toFile());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new TransientTaskException("spawn failed: " + command.get(0) + ": " + e.getMessage(), e);
        }
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new TransientTaskException(command.get(0) + " timeout after " + Duration.ofMillis(timeoutMs));
            }
            return new Result(process.exitValue(), readOutput(outputFile));
        } catch (IOException e) {
            process.destroyForcibly();
            throw new TransientTaskException(command.get(0) + " execution failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    String name() {
        return command.get(0);
    }

    static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }

    private static String readOutput(Path outputFile) throws IOException {
        return Files.exists(outputFile) ? Files.readString(outputFile, StandardCharsets.UTF_8) : "";
    }

    record Result(int exitCode, String output) {
    }
}
