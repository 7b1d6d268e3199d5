package io.shotrelay.testing;

import io.shotrelay.config.ShotRelayConfig;
import io.shotrelay.lifecycle.ReleaseLifecycleManager;
import io.shotrelay.model.ReleaseView;
import io.shotrelay.storage.ArtifactStore;
import io.shotrelay.storage.Database;
import io.shotrelay.storage.TaskQueue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * Storage, task queue and lifecycle manager over a fresh temp data root.
 */
public final class StoreFixture implements AutoCloseable {
    private final Path root;
    private final ShotRelayConfig config;
    private final Database database;
    private final ArtifactStore artifacts;
    private final TaskQueue tasks;
    private final ReleaseLifecycleManager lifecycle;
    private final List<ReleaseView> completed = new CopyOnWriteArrayList<>();

    private StoreFixture(Path root, TaskQueue.RetryPolicy retryPolicy) {
        this.root = root;
        this.config = ShotRelayConfig.fromRoot(root.toString());
        this.database = new Database(config);
        database.init();
        this.artifacts = new ArtifactStore(config, database);
        this.tasks = new TaskQueue(database, retryPolicy);
        this.lifecycle = new ReleaseLifecycleManager(database, tasks, artifacts, completed::add);
    }

    public static StoreFixture create(String prefix) throws IOException {
        return create(prefix, new TaskQueue.RetryPolicy(3, 0L, 0L));
    }

    public static StoreFixture create(String prefix, TaskQueue.RetryPolicy retryPolicy) throws IOException {
        return new StoreFixture(Files.createTempDirectory(prefix), retryPolicy);
    }

    public Path root() {
        return root;
    }

    public ShotRelayConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ArtifactStore artifacts() {
        return artifacts;
    }

    public TaskQueue tasks() {
        return tasks;
    }

    public ReleaseLifecycleManager lifecycle() {
        return lifecycle;
    }

    public List<ReleaseView> completedReleases() {
        return completed;
    }

    /**
     * Creates a build named {@code buildName} with one PROCESSING candidate and returns the
     * candidate's id, for tests that need an owner release for task rows.
     */
    public long release(String buildName) {
        long buildId = lifecycle.createBuild(buildName, false).id();
        return lifecycle.createCandidate(buildId, "candidate", null).id();
    }

    public String image(String label) {
        return artifacts.store(label.getBytes(StandardCharsets.UTF_8), ArtifactStore.IMAGE_PNG);
    }

    public String text(String body) {
        return artifacts.storeText(body, ArtifactStore.TEXT_PLAIN);
    }

    @Override
    public void close() throws IOException {
        deleteRecursively(root);
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
