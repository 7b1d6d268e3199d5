package io.shotrelay.runtime;

import io.shotrelay.config.ShotRelayConfig;
import io.shotrelay.config.ShotRelaySettings;
import io.shotrelay.coordinator.WorkCoordinator;
import io.shotrelay.coordinator.WorkItem;
import io.shotrelay.coordinator.WorkItemKind;
import io.shotrelay.crawler.Crawler;
import io.shotrelay.crawler.LinkCrawler;
import io.shotrelay.lifecycle.LoggingReleaseNotifier;
import io.shotrelay.lifecycle.ReleaseLifecycleManager;
import io.shotrelay.lifecycle.ReleaseNotifier;
import io.shotrelay.model.CaptureRequest;
import io.shotrelay.model.CrawlRequest;
import io.shotrelay.model.TaskStatus;
import io.shotrelay.storage.ArtifactStore;
import io.shotrelay.storage.Database;
import io.shotrelay.storage.TaskQueue;
import io.shotrelay.util.Jsons;
import io.shotrelay.worker.CaptureEngine;
import io.shotrelay.worker.CaptureRequestHandler;
import io.shotrelay.worker.CaptureWorker;
import io.shotrelay.worker.CrawlHandler;
import io.shotrelay.worker.DiffEngine;
import io.shotrelay.worker.DiffWorker;
import io.shotrelay.worker.ProcessCaptureEngine;
import io.shotrelay.worker.ProcessDiffEngine;
import io.shotrelay.worker.TaskItemHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Owns every component for one data root: {@code new -> init -> start -> stop}.
 *
 * <p>{@link #init()} prepares storage and loads settings, which is all the control commands
 * need. {@link #start()} additionally runs the coordinator and the task pump.
 */
public final class ShotRelayRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ShotRelayRuntime.class);

    private final ShotRelayConfig config;
    private final Collaborators collaborators;
    private final Database database;
    private ShotRelaySettings settings;
    private ArtifactStore artifacts;
    private TaskQueue tasks;
    private ReleaseLifecycleManager lifecycle;
    private WorkCoordinator coordinator;
    private TaskPump pump;
    private boolean started;

    public ShotRelayRuntime(ShotRelayConfig config) {
        this(config, Collaborators.defaults());
    }

    public ShotRelayRuntime(ShotRelayConfig config, Collaborators collaborators) {
        this.config = config;
        this.collaborators = collaborators == null ? Collaborators.defaults() : collaborators;
        this.database = new Database(config);
    }

    public synchronized void init() {
        if (lifecycle != null) {
            return;
        }
        database.init();
        settings = ShotRelaySettings.load(config);
        artifacts = new ArtifactStore(config, database);
        tasks = new TaskQueue(database, new TaskQueue.RetryPolicy(
                settings.taskMaxAttempts(), settings.baseBackoffMs(), settings.maxBackoffMs()
        ));
        ReleaseNotifier notifier = collaborators.notifier() == null
                ? new LoggingReleaseNotifier()
                : collaborators.notifier();
        lifecycle = new ReleaseLifecycleManager(database, tasks, artifacts, notifier);

        CaptureEngine captureEngine = collaborators.captureEngine() == null
                ? new ProcessCaptureEngine(settings.captureCommand(), settings.captureTimeoutMs(), config.scratchDir())
                : collaborators.captureEngine();
        DiffEngine diffEngine = collaborators.diffEngine() == null
                ? new ProcessDiffEngine(settings.diffCommand(), settings.diffTimeoutMs(), config.scratchDir())
                : collaborators.diffEngine();
        Crawler crawler = collaborators.crawler() == null ? new LinkCrawler() : collaborators.crawler();

        coordinator = new WorkCoordinator(
                "shotrelay",
                settings.workerThreads(),
                settings.queueCapacity(),
                settings.maxItemAttempts(),
                settings.itemRetryBackoffMs()
        );
        coordinator.register(new CrawlHandler(crawler, lifecycle));
        coordinator.register(new CaptureRequestHandler(lifecycle));
        coordinator.register(new TaskItemHandler(
                new CaptureWorker(captureEngine, artifacts, lifecycle),
                new DiffWorker(diffEngine, artifacts, lifecycle),
                lifecycle
        ));
        pump = new TaskPump(
                tasks,
                lifecycle,
                coordinator,
                "worker-" + UUID.randomUUID().toString().substring(0, 8),
                settings.leaseTimeoutMs(),
                settings.pollIntervalMs(),
                settings.sweepIntervalMs(),
                settings.workerThreads()
        );
        log.info("Runtime initialized: root={}, workers={}", config.rootDir(), settings.workerThreads());
    }

    public synchronized void start() {
        requireInit();
        if (started) {
            return;
        }
        coordinator.start();
        pump.start();
        started = true;
    }

    public synchronized WorkCoordinator.StopSummary stop() {
        if (!started) {
            return new WorkCoordinator.StopSummary(true, 0);
        }
        pump.stop();
        WorkCoordinator.StopSummary summary = coordinator.stop(Duration.ofMillis(settings.drainTimeoutMs()));
        started = false;
        return summary;
    }

    @Override
    public void close() {
        stop();
    }

    public String submitCrawl(CrawlRequest request) {
        requireInit();
        WorkItem item = WorkItem.root(WorkItemKind.CRAWL, Jsons.toJson(request));
        coordinator.submit(item);
        return item.id();
    }

    public String submitCaptureRequest(CaptureRequest request) {
        requireInit();
        WorkItem item = WorkItem.root(WorkItemKind.CAPTURE_REQUEST, Jsons.toJson(request));
        coordinator.submit(item);
        return item.id();
    }

    /**
     * Waits until the coordinator is idle and no task is queued or leased. Returns false on timeout.
     */
    public boolean awaitQuiescent(Duration timeout) throws InterruptedException {
        requireInit();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (coordinator.isIdle()) {
                Map<String, Integer> counts = tasks.countByStatus();
                if (counts.get(TaskStatus.QUEUED.name()) == 0 && counts.get(TaskStatus.LEASED.name()) == 0) {
                    return true;
                }
            }
            Thread.sleep(25L);
        }
        return false;
    }

    public ShotRelayConfig config() {
        return config;
    }

    public ShotRelaySettings settings() {
        requireInit();
        return settings;
    }

    public ArtifactStore artifacts() {
        requireInit();
        return artifacts;
    }

    public TaskQueue tasks() {
        requireInit();
        return tasks;
    }

    public ReleaseLifecycleManager lifecycle() {
        requireInit();
        return lifecycle;
    }

    public WorkCoordinator coordinator() {
        requireInit();
        return coordinator;
    }

    public TaskPump pump() {
        requireInit();
        return pump;
    }

    private synchronized void requireInit() {
        if (lifecycle == null) {
            throw new IllegalStateException("Runtime not initialized; call init() first");
        }
    }

    /**
     * Replaceable external collaborators. A {@code null} field selects the built-in implementation.
     */
    public record Collaborators(
            CaptureEngine captureEngine,
            DiffEngine diffEngine,
            Crawler crawler,
            ReleaseNotifier notifier
    ) {
        public static Collaborators defaults() {
            return new Collaborators(null, null, null, null);
        }
    }
}
