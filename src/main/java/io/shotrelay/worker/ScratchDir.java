package io.shotrelay.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Per-attempt working directory under the data root's scratch space, removed on close.
 */
final class ScratchDir implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScratchDir.class);

    private final Path dir;

    private ScratchDir(Path dir) {
        this.dir = dir;
    }

    static ScratchDir create(Path parent, String prefix) throws IOException {
        Files.createDirectories(parent);
        return new ScratchDir(Files.createTempDirectory(parent, prefix));
    }

    Path resolve(String name) {
        return dir.resolve(name);
    }

    @Override
    public void close() {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete scratch file: {}", p, e);
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean scratch directory: {}", dir, e);
        }
    }
}
