package io.shotrelay.worker;

import io.shotrelay.error.TransientTaskException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Perceptual diff through ImageMagick {@code compare}: exit 0 means the images are the same,
 * 1 means they differ and a highlight image was written, anything else is an error.
 */
public final class ProcessDiffEngine implements DiffEngine {
    private static final List<String> COMPARE_ARGS = List.of(
            "-verbose", "-metric", "RMSE", "-highlight-color", "Red", "-compose", "Src"
    );

    private final ExternalCommand command;
    private final Path scratchRoot;

    public ProcessDiffEngine(List<String> command, long timeoutMs, Path scratchRoot) {
        this.command = new ExternalCommand(command, timeoutMs);
        this.scratchRoot = scratchRoot;
    }

    @Override
    public DiffOutput diff(byte[] before, byte[] after) {
        try (ScratchDir scratch = ScratchDir.create(scratchRoot, "diff-")) {
            Path beforeFile = scratch.resolve("before.png");
            Path afterFile = scratch.resolve("after.png");
            Path diffFile = scratch.resolve("diff.png");
            Path logFile = scratch.resolve("diff.log");
            Files.write(beforeFile, before);
            Files.write(afterFile, after);

            List<String> args = new ArrayList<>(COMPARE_ARGS);
            args.add(beforeFile.toString());
            args.add(afterFile.toString());
            args.add(diffFile.toString());
            ExternalCommand.Result result = command.run(args, logFile);
            return switch (result.exitCode()) {
                case 0 -> new DiffOutput(null, result.output());
                case 1 -> {
                    if (!Files.exists(diffFile)) {
                        throw new TransientTaskException(command.name() + " reported a difference but wrote no diff image");
                    }
                    yield new DiffOutput(Files.readAllBytes(diffFile), result.output());
                }
                default -> throw new TransientTaskException(
                        command.name() + " exit=" + result.exitCode() + " output=" + ExternalCommand.truncate(result.output())
                );
            };
        } catch (IOException e) {
            throw new TransientTaskException("diff io failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientTaskException("diff interrupted", e);
        }
    }
}
