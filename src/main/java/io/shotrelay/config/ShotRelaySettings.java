package io.shotrelay.config;

import io.shotrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Tunables for the coordinator, the task queue and the external capture/diff commands.
 *
 * <p>Values come from {@code shotrelay-settings.json} in the data root when present; any field
 * missing from the file keeps its default.
 */
public record ShotRelaySettings(
        int workerThreads,
        int queueCapacity,
        int maxItemAttempts,
        long itemRetryBackoffMs,
        long drainTimeoutMs,
        int taskMaxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long leaseTimeoutMs,
        long pollIntervalMs,
        long sweepIntervalMs,
        List<String> captureCommand,
        long captureTimeoutMs,
        List<String> diffCommand,
        long diffTimeoutMs,
        int crawlDepth
) {
    public ShotRelaySettings {
        captureCommand = List.copyOf(captureCommand);
        diffCommand = List.copyOf(diffCommand);
    }

    public static ShotRelaySettings defaults() {
        return new ShotRelaySettings(
                ShotRelayConfig.DEFAULT_WORKER_THREADS,
                ShotRelayConfig.DEFAULT_QUEUE_CAPACITY,
                ShotRelayConfig.DEFAULT_MAX_ITEM_ATTEMPTS,
                ShotRelayConfig.DEFAULT_ITEM_RETRY_BACKOFF_MS,
                ShotRelayConfig.DEFAULT_DRAIN_TIMEOUT_MS,
                ShotRelayConfig.DEFAULT_TASK_MAX_ATTEMPTS,
                ShotRelayConfig.DEFAULT_BASE_BACKOFF_MS,
                ShotRelayConfig.DEFAULT_MAX_BACKOFF_MS,
                ShotRelayConfig.DEFAULT_LEASE_TIMEOUT_MS,
                ShotRelayConfig.DEFAULT_POLL_INTERVAL_MS,
                ShotRelayConfig.DEFAULT_SWEEP_INTERVAL_MS,
                List.of("phantomjs", "capture.js"),
                ShotRelayConfig.DEFAULT_CAPTURE_TIMEOUT_MS,
                List.of("compare"),
                ShotRelayConfig.DEFAULT_DIFF_TIMEOUT_MS,
                ShotRelayConfig.DEFAULT_CRAWL_DEPTH
        );
    }

    public static ShotRelaySettings load(ShotRelayConfig config) {
        Path file = config.settingsFile();
        ShotRelaySettings defaults = defaults();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    static ShotRelaySettings fromFile(SettingsFile f, ShotRelaySettings d) {
        return new ShotRelaySettings(
                positive(f.workerThreads(), d.workerThreads()),
                f.queueCapacity() == null ? d.queueCapacity() : Math.max(0, f.queueCapacity()),
                positive(f.maxItemAttempts(), d.maxItemAttempts()),
                nonNegative(f.itemRetryBackoffMs(), d.itemRetryBackoffMs()),
                positive(f.drainTimeoutMs(), d.drainTimeoutMs()),
                positive(f.taskMaxAttempts(), d.taskMaxAttempts()),
                nonNegative(f.baseBackoffMs(), d.baseBackoffMs()),
                nonNegative(f.maxBackoffMs(), d.maxBackoffMs()),
                positive(f.leaseTimeoutMs(), d.leaseTimeoutMs()),
                positive(f.pollIntervalMs(), d.pollIntervalMs()),
                positive(f.sweepIntervalMs(), d.sweepIntervalMs()),
                f.captureCommand() == null || f.captureCommand().isEmpty() ? d.captureCommand() : f.captureCommand(),
                positive(f.captureTimeoutMs(), d.captureTimeoutMs()),
                f.diffCommand() == null || f.diffCommand().isEmpty() ? d.diffCommand() : f.diffCommand(),
                positive(f.diffTimeoutMs(), d.diffTimeoutMs()),
                f.crawlDepth() == null ? d.crawlDepth() : Math.max(0, f.crawlDepth())
        );
    }

    private static int positive(Integer raw, int fallback) {
        return raw == null || raw <= 0 ? fallback : raw;
    }

    private static long positive(Long raw, long fallback) {
        return raw == null || raw <= 0L ? fallback : raw;
    }

    private static long nonNegative(Long raw, long fallback) {
        return raw == null || raw < 0L ? fallback : raw;
    }

    record SettingsFile(
            Integer workerThreads,
            Integer queueCapacity,
            Integer maxItemAttempts,
            Long itemRetryBackoffMs,
            Long drainTimeoutMs,
            Integer taskMaxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long leaseTimeoutMs,
            Long pollIntervalMs,
            Long sweepIntervalMs,
            List<String> captureCommand,
            Long captureTimeoutMs,
            List<String> diffCommand,
            Long diffTimeoutMs,
            Integer crawlDepth
    ) {
    }
}
