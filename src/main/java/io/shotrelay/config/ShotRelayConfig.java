package io.shotrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ShotRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "shotrelay-settings.json";
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final int DEFAULT_QUEUE_CAPACITY = 100;
    public static final int DEFAULT_MAX_ITEM_ATTEMPTS = 3;
    public static final long DEFAULT_ITEM_RETRY_BACKOFF_MS = 500L;
    public static final long DEFAULT_DRAIN_TIMEOUT_MS = 15_000L;
    public static final int DEFAULT_TASK_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_LEASE_TIMEOUT_MS = 120_000L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 1_000L;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_CAPTURE_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_DIFF_TIMEOUT_MS = 60_000L;
    public static final int DEFAULT_CRAWL_DEPTH = 1;

    private final Path rootDir;

    public ShotRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static ShotRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new ShotRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("shotrelay.db");
    }

    public Path artifactsDir() {
        return rootDir.resolve("artifacts");
    }

    public Path scratchDir() {
        return rootDir.resolve("scratch");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
