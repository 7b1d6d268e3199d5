package io.shotrelay.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shotrelay.error.TransientTaskException;
import io.shotrelay.error.ValidationException;
import io.shotrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Captures through an external screenshot tool invoked as {@code <command> <config.json> <output.png>}.
 *
 * <p>The config document is the request's config with {@code targetUrl} set to the page URL;
 * other keys ({@code viewportSize}, {@code userAgent}, {@code clipRect}, {@code cookies},
 * {@code resourceTimeoutMs}, {@code resourcesToIgnore}, {@code injectHeaders}, ...) pass through
 * untouched.
 */
public final class ProcessCaptureEngine implements CaptureEngine {
    private final ExternalCommand command;
    private final Path scratchRoot;

    public ProcessCaptureEngine(List<String> command, long timeoutMs, Path scratchRoot) {
        this.command = new ExternalCommand(command, timeoutMs);
        this.scratchRoot = scratchRoot;
    }

    @Override
    public CaptureOutput capture(CaptureSpec spec) {
        ObjectNode config = captureConfig(spec);
        try (ScratchDir scratch = ScratchDir.create(scratchRoot, "capture-")) {
            Path configFile = scratch.resolve("config.json");
            Path outputFile = scratch.resolve("screenshot.png");
            Path logFile = scratch.resolve("capture.log");
            Files.writeString(configFile, Jsons.toJson(config), StandardCharsets.UTF_8);

            ExternalCommand.Result result = command.run(
                    List.of(configFile.toString(), outputFile.toString()),
                    logFile
            );
            if (result.exitCode() != 0) {
                throw new TransientTaskException(
                        command.name() + " exit=" + result.exitCode() + " output=" + ExternalCommand.truncate(result.output())
                );
            }
            if (!Files.exists(outputFile) || Files.size(outputFile) == 0L) {
                throw new TransientTaskException(command.name() + " produced no screenshot for " + spec.url());
            }
            return new CaptureOutput(Files.readAllBytes(outputFile), result.output());
        } catch (IOException e) {
            throw new TransientTaskException("capture io failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientTaskException("capture interrupted", e);
        }
    }

    static ObjectNode captureConfig(CaptureSpec spec) {
        JsonNode parsed = Jsons.parse(spec.configJson());
        if (!parsed.isObject()) {
            throw new ValidationException("capture config must be a JSON object");
        }
        ObjectNode config = ((ObjectNode) parsed).deepCopy();
        config.put("targetUrl", spec.url());
        return config;
    }
}
