package io.shotrelay.lifecycle;

import io.shotrelay.error.ConflictException;
import io.shotrelay.error.InvalidStateException;
import io.shotrelay.error.NotFoundException;
import io.shotrelay.error.ValidationException;
import io.shotrelay.model.BuildView;
import io.shotrelay.model.CaptureTaskPayload;
import io.shotrelay.model.DiffTaskPayload;
import io.shotrelay.model.ReleaseStatus;
import io.shotrelay.model.ReleaseView;
import io.shotrelay.model.RunStatus;
import io.shotrelay.model.RunView;
import io.shotrelay.model.TaskType;
import io.shotrelay.model.TaskView;
import io.shotrelay.storage.ArtifactStore;
import io.shotrelay.storage.Database;
import io.shotrelay.storage.ReleaseStore;
import io.shotrelay.storage.TaskQueue;
import io.shotrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State machine for builds, release candidates and their runs.
 *
 * <p>Every mutation holds the build's lock and runs inside one SQLite transaction, so run state,
 * release state and the task rows they spawn or cancel always commit together. A busy database
 * restarts the whole mutation from a fresh read.
 */
public final class ReleaseLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(ReleaseLifecycleManager.class);
    private static final String NO_DIFFERENCE = "no-difference";
    private static final int RECLAIM_BATCH = 200;

    private final Database database;
    private final ReleaseStore store;
    private final TaskQueue tasks;
    private final ArtifactStore artifacts;
    private final ReleaseNotifier notifier;
    private final Clock clock;
    private final ConcurrentHashMap<Long, ReentrantLock> buildLocks = new ConcurrentHashMap<>();

    public ReleaseLifecycleManager(Database database, TaskQueue tasks, ArtifactStore artifacts, ReleaseNotifier notifier) {
        this(database, new ReleaseStore(), tasks, artifacts, notifier, Clock.systemUTC());
    }

    public ReleaseLifecycleManager(
            Database database,
            ReleaseStore store,
            TaskQueue tasks,
            ArtifactStore artifacts,
            ReleaseNotifier notifier,
            Clock clock
    ) {
        this.database = database;
        this.store = store;
        this.tasks = tasks;
        this.artifacts = artifacts;
        this.notifier = notifier == null ? new LoggingReleaseNotifier() : notifier;
        this.clock = clock;
    }

    public BuildView createBuild(String name, boolean isPublic) {
        String buildName = requireText(name, "build name");
        long now = now();
        BuildView created = database.inTransaction("create build", c -> {
            Optional<BuildView> existing = store.findBuildByName(c, buildName);
            if (existing.isPresent()) {
                throw new ConflictException("A build by that name already exists: " + buildName, existing.get().id());
            }
            long id = store.insertBuild(c, buildName, isPublic, now);
            return new BuildView(id, buildName, isPublic, now);
        });
        log.info("Created build: build_id={}, name={}", created.id(), created.name());
        return created;
    }

    public BuildView setBuildVisibility(long buildId, boolean isPublic) {
        return withBuildLock(buildId, "set build visibility", c -> {
            requireBuild(c, buildId);
            store.updateBuildVisibility(c, buildId, isPublic);
            return requireBuild(c, buildId);
        });
    }

    /**
     * Opens a new candidate for {@code name}. A candidate still PROCESSING anywhere in the build is
     * superseded first: its tasks are canceled and it turns BAD, or GOOD when it is the only
     * candidate of its name and the build has no GOOD release yet.
     */
    public ReleaseView createCandidate(long buildId, String name, String url) {
        String releaseName = requireText(name, "release name");
        return withBuildLock(buildId, "create candidate", c -> {
            requireBuild(c, buildId);
            return openCandidate(c, buildId, releaseName, url, now());
        });
    }

    /**
     * Returns the build's PROCESSING candidate for {@code name} when it still accepts runs, or
     * opens a new one.
     */
    public ReleaseView ensureCandidate(long buildId, String name, String url) {
        String releaseName = requireText(name, "release name");
        return withBuildLock(buildId, "ensure candidate", c -> {
            requireBuild(c, buildId);
            Optional<ReleaseView> active = store.findProcessingRelease(c, buildId);
            if (active.isPresent() && active.get().name().equals(releaseName) && !active.get().completed()) {
                return active.get();
            }
            return openCandidate(c, buildId, releaseName, url, now());
        });
    }

    public RunView createOrUpdateRun(long releaseId, String runName, String url, String configJson) {
        return createOrUpdateRun(releaseId, runName, url, configJson, null, null);
    }

    /**
     * Requests a capture for {@code runName}. A new run takes its baseline from the same-named run
     * of the build's last GOOD release, unless {@code refUrl} and {@code refConfigJson} name an
     * explicit baseline to capture. An existing run is reset and captured again; its baseline is
     * kept as it was.
     */
    public RunView createOrUpdateRun(
            long releaseId,
            String runName,
            String url,
            String configJson,
            String refUrl,
            String refConfigJson
    ) {
        String name = requireText(runName, "run name");
        String target = requireText(url, "url");
        boolean hasRefUrl = refUrl != null && !refUrl.isBlank();
        boolean hasRefConfig = refConfigJson != null && !refConfigJson.isBlank();
        if (hasRefUrl != hasRefConfig) {
            throw new ValidationException("ref_url and ref_config must both be specified or not specified");
        }
        String config = artifacts.storeText(requireJson(configJson, "config"), ArtifactStore.APPLICATION_JSON);
        String refConfig = hasRefConfig
                ? artifacts.storeText(requireJson(refConfigJson, "ref_config"), ArtifactStore.APPLICATION_JSON)
                : null;
        long buildId = buildOfRelease(releaseId);

        return withBuildLock(buildId, "create or update run", c -> {
            ReleaseView release = requireRelease(c, releaseId);
            requireAcceptingRuns(release);
            long now = now();
            Optional<RunView> existing = store.findRunByName(c, releaseId, name);
            RunView run;
            if (existing.isPresent()) {
                RunView prior = existing.get();
                int canceled = tasks.cancelByRun(c, prior.id(), now);
                store.resetRunRequest(c, prior.id(), target, config, now);
                if (hasRefUrl) {
                    log.debug("Ignoring baseline override for existing run: run_id={}", prior.id());
                }
                log.info("Updated run: release_id={}, run_name={}, canceled_tasks={}", releaseId, name, canceled);
                run = requireRun(c, prior.id());
            } else {
                ReleaseStore.NewRun row = hasRefUrl
                        ? new ReleaseStore.NewRun(releaseId, name, target, config, refUrl.trim(), null, null, refConfig, true)
                        : baselineFor(c, release, name, target, config);
                long runId = store.insertRun(c, row, now);
                run = requireRun(c, runId);
                log.info("Created run: release_id={}, run_name={}, baseline={}", releaseId, name,
                        run.baselinePending() ? "pending" : (run.refImage() == null ? "none" : run.refImage()));
            }

            enqueueCapture(c, release, run.id(), run.url(), run.config(), false, now);
            if (run.baselinePending()) {
                enqueueCapture(c, release, run.id(), run.refUrl(), run.refConfig(), true, now);
            }
            return run;
        });
    }

    public RunView recordCapture(long runId, String image, String logArtifact, String config) {
        return recordCapture(runId, image, logArtifact, config, false, null);
    }

    /**
     * Stores a capture result. With a {@code lease} the task is completed in the same transaction;
     * a task canceled or re-leased in the meantime raises {@link InvalidStateException} and
     * nothing is recorded.
     */
    public RunView recordCapture(
            long runId,
            String image,
            String logArtifact,
            String config,
            boolean baseline,
            TaskQueue.LeasedTask lease
    ) {
        requireArtifact(image, "image");
        requireOptionalArtifact(logArtifact, "log");
        requireOptionalArtifact(config, "config");
        long buildId = buildOfRun(runId);

        return withBuildLock(buildId, "record capture", c -> {
            RunView run = requireRun(c, runId);
            ReleaseView release = requireRelease(c, run.releaseId());
            long now = now();
            if (lease != null) {
                requireTaskForRun(c, lease.taskId(), runId);
                if (!tasks.complete(c, lease, image, now)) {
                    return run;
                }
            }
            requireOpen(release);
            if (run.status() == RunStatus.FAILED) {
                throw new InvalidStateException("Run " + runId + " is FAILED; request it again to recapture");
            }
            if (baseline) {
                if (!store.updateRunBaseline(c, runId, image, logArtifact, config, now)) {
                    throw new InvalidStateException("Run " + runId + " has no pending baseline");
                }
            } else {
                store.updateRunCapture(c, runId, image, logArtifact, config, now);
            }
            return settle(c, release, requireRun(c, runId), now);
        });
    }

    public RunView recordDiff(long runId, String diffImage, String diffLog) {
        return recordDiff(runId, diffImage, diffLog, null);
    }

    /**
     * Attaches a diff to a run waiting on one. A {@code null} diff image means the engine found no
     * perceptual difference, which approves the run. A diff computed against an image the run no
     * longer has is dropped.
     */
    public RunView recordDiff(long runId, String diffImage, String diffLog, TaskQueue.LeasedTask lease) {
        requireOptionalArtifact(diffImage, "diff image");
        requireOptionalArtifact(diffLog, "diff log");
        long buildId = buildOfRun(runId);

        return withBuildLock(buildId, "record diff", c -> {
            RunView run = requireRun(c, runId);
            ReleaseView release = requireRelease(c, run.releaseId());
            long now = now();
            if (lease != null) {
                TaskView task = requireTaskForRun(c, lease.taskId(), runId);
                if (!tasks.complete(c, lease, diffImage == null ? NO_DIFFERENCE : diffImage, now)) {
                    return run;
                }
                DiffTaskPayload payload = Jsons.mapper().convertValue(Jsons.parse(task.payload()), DiffTaskPayload.class);
                if (!Objects.equals(payload.after(), run.image()) || !Objects.equals(payload.before(), run.refImage())) {
                    log.info("Dropping stale diff: run_id={}, task_id={}", runId, lease.taskId());
                    return run;
                }
            }
            requireOpen(release);
            if (run.status() != RunStatus.DIFF_NEEDED && run.status() != RunStatus.DIFF_APPROVED) {
                throw new InvalidStateException("Run " + runId + " is " + run.status() + "; no diff expected");
            }
            store.updateRunDiff(c, runId, diffImage, diffLog, now);
            if (diffImage == null && run.status() == RunStatus.DIFF_NEEDED) {
                store.updateRunStatus(c, runId, RunStatus.DIFF_APPROVED, now);
            }
            return requireRun(c, runId);
        });
    }

    public RunView approveRun(long runId) {
        long buildId = buildOfRun(runId);
        return withBuildLock(buildId, "approve run", c -> {
            RunView run = requireRun(c, runId);
            requireOpen(requireRelease(c, run.releaseId()));
            if (run.status() == RunStatus.DIFF_APPROVED) {
                return run;
            }
            if (run.status() != RunStatus.DIFF_NEEDED) {
                throw new InvalidStateException("Run " + runId + " is " + run.status() + "; only DIFF_NEEDED can be approved");
            }
            store.updateRunStatus(c, runId, RunStatus.DIFF_APPROVED, now());
            return requireRun(c, runId);
        });
    }

    /**
     * Marks a run FAILED. {@code logArtifact} must reference a stored log explaining the failure.
     */
    public RunView markRunFailed(long runId, String logArtifact) {
        requireArtifact(logArtifact, "log");
        long buildId = buildOfRun(runId);
        return withBuildLock(buildId, "mark run failed", c -> {
            RunView run = requireRun(c, runId);
            requireOpen(requireRelease(c, run.releaseId()));
            long now = now();
            tasks.cancelByRun(c, runId, now);
            store.markRunFailed(c, runId, logArtifact, now);
            log.warn("Run failed: run_id={}, run_name={}", runId, run.name());
            return requireRun(c, runId);
        });
    }

    /**
     * Reports a failed capture or diff attempt made under {@code lease}. Once the task has no
     * attempts left its run turns FAILED with {@code error} stored as the run's log. A lease that
     * has since been reclaimed raises {@link InvalidStateException} and changes nothing.
     */
    public TaskQueue.FailOutcome recordTaskFailure(TaskQueue.LeasedTask lease, String error) {
        String message = error == null || error.isBlank() ? "task failed without output" : error;
        String taskId = lease.taskId();
        TaskView task = tasks.get(taskId).orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
        String logArtifact = artifacts.storeText(message, ArtifactStore.TEXT_PLAIN);
        long buildId = buildOfRelease(task.ownerReleaseId());
        return withBuildLock(buildId, "record task failure", c -> {
            long now = now();
            TaskQueue.FailOutcome outcome = tasks.fail(c, lease, message, now);
            if (outcome.disposition() == TaskQueue.FailDisposition.FAILED) {
                failRunOfTask(c, task, logArtifact, now);
            }
            return outcome;
        });
    }

    /**
     * Runs the lease-expiry sweep and fails the runs of tasks that ran out of attempts.
     */
    public TaskQueue.ReclaimSummary reclaimExpiredLeases(long nowMs) {
        TaskQueue.ReclaimSummary summary = tasks.reclaimExpiredLeases(nowMs, RECLAIM_BATCH);
        for (TaskView task : summary.exhausted()) {
            String logArtifact = artifacts.storeText(
                    task.type() + " task " + task.taskId() + " lease expired after " + task.attemptCount() + " attempts",
                    ArtifactStore.TEXT_PLAIN
            );
            long buildId = buildOfRelease(task.ownerReleaseId());
            withBuildLock(buildId, "fail expired task run", c -> failRunOfTask(c, task, logArtifact, nowMs));
        }
        return summary;
    }

    /**
     * Declares the release's run set final. Blocked while any run is FAILED, waiting on data or
     * waiting on a diff review. The notifier fires once, on the call that completes the release.
     */
    public ReleaseView markComplete(long releaseId) {
        long buildId = buildOfRelease(releaseId);
        Completion completion = withBuildLock(buildId, "mark complete", c -> {
            ReleaseView release = requireRelease(c, releaseId);
            if (release.completed()) {
                return new Completion(release, false);
            }
            requireOpen(release);
            Map<RunStatus, Integer> counts = store.countRunsByStatus(c, releaseId);
            int failed = counts.get(RunStatus.FAILED);
            if (failed > 0) {
                throw new ConflictException("Release " + releaseId + " has " + failed + " failed runs awaiting triage");
            }
            int unresolved = counts.get(RunStatus.DATA_PENDING) + counts.get(RunStatus.DIFF_NEEDED);
            if (unresolved > 0) {
                throw new ConflictException("Release " + releaseId + " has " + unresolved + " unresolved runs");
            }
            boolean stamped = store.markReleaseCompleted(c, releaseId, now());
            return new Completion(requireRelease(c, releaseId), stamped);
        });
        if (completion.firstCompletion()) {
            log.info("Release complete: release_id={}, release_name={}, release_number={}",
                    releaseId, completion.release().name(), completion.release().number());
            try {
                notifier.releaseCompleted(completion.release());
            } catch (RuntimeException e) {
                log.warn("Release notifier failed: release_id={}", releaseId, e);
            }
        }
        return completion.release();
    }

    public ReleaseView promote(long releaseId) {
        return finish(releaseId, ReleaseStatus.GOOD);
    }

    public ReleaseView reject(long releaseId) {
        return finish(releaseId, ReleaseStatus.BAD);
    }

    public Optional<BuildView> build(long buildId) {
        return read("read build", c -> store.findBuild(c, buildId));
    }

    public List<BuildView> builds() {
        return read("list builds", store::listBuilds);
    }

    public Optional<ReleaseView> release(long releaseId) {
        return read("read release", c -> store.findRelease(c, releaseId));
    }

    public List<ReleaseView> releases(long buildId) {
        return read("list releases", c -> store.listReleases(c, buildId));
    }

    public Optional<ReleaseView> activeCandidate(long buildId) {
        return read("read active candidate", c -> store.findProcessingRelease(c, buildId));
    }

    public Optional<ReleaseView> lastGoodRelease(long buildId) {
        return read("read last good release", c -> store.findLastGoodRelease(c, buildId));
    }

    public Optional<RunView> run(long runId) {
        return read("read run", c -> store.findRun(c, runId));
    }

    public List<RunView> runs(long releaseId) {
        return read("list runs", c -> store.listRuns(c, releaseId));
    }

    private ReleaseView openCandidate(Connection c, long buildId, String releaseName, String url, long now) throws SQLException {
        Optional<ReleaseView> active = store.findProcessingRelease(c, buildId);
        if (active.isPresent()) {
            supersede(c, active.get(), now);
        }
        int number = store.maxReleaseNumber(c, buildId, releaseName) + 1;
        long id = store.insertRelease(c, buildId, releaseName, number, url, now);
        log.info("Created release: build_id={}, release_name={}, release_number={}, url={}", buildId, releaseName, number, url);
        return requireRelease(c, id);
    }

    private void supersede(Connection c, ReleaseView previous, long now) throws SQLException {
        int canceled = tasks.cancelByOwner(c, previous.id(), now);
        boolean bootstrap = store.countReleases(c, previous.buildId(), previous.name()) == 1
                && store.findLastGoodRelease(c, previous.buildId()).isEmpty();
        ReleaseStatus next = bootstrap ? ReleaseStatus.GOOD : ReleaseStatus.BAD;
        if (!store.transitionRelease(c, previous.id(), ReleaseStatus.PROCESSING, next, now)) {
            throw new ConflictException("Release " + previous.id() + " changed while superseding it");
        }
        log.info("Superseded release: build_id={}, release_name={}, release_number={}, status={}, canceled_tasks={}",
                previous.buildId(), previous.name(), previous.number(), next, canceled);
    }

    private ReleaseStore.NewRun baselineFor(Connection c, ReleaseView release, String name, String url, String config)
            throws SQLException {
        Optional<ReleaseView> lastGood = store.findLastGoodRelease(c, release.buildId());
        if (lastGood.isPresent()) {
            Optional<RunView> baseline = store.findRunByName(c, lastGood.get().id(), name);
            if (baseline.isPresent()) {
                RunView ref = baseline.get();
                return new ReleaseStore.NewRun(release.id(), name, url, config,
                        ref.url(), ref.image(), ref.log(), ref.config(), false);
            }
        }
        return new ReleaseStore.NewRun(release.id(), name, url, config, null, null, null, null, false);
    }

    private RunView settle(Connection c, ReleaseView release, RunView run, long now) throws SQLException {
        if (run.status() != RunStatus.DATA_PENDING || run.image() == null || run.baselinePending()) {
            return run;
        }
        if (run.refImage() == null || run.refImage().equals(run.image())) {
            store.updateRunStatus(c, run.id(), RunStatus.DIFF_APPROVED, now);
        } else {
            store.updateRunStatus(c, run.id(), RunStatus.DIFF_NEEDED, now);
            DiffTaskPayload payload = new DiffTaskPayload(run.id(), release.id(), run.refImage(), run.image());
            tasks.enqueue(c, TaskType.DIFF, Jsons.toJson(payload), release.id(), run.id(), now);
        }
        return requireRun(c, run.id());
    }

    private void enqueueCapture(Connection c, ReleaseView release, long runId, String url, String config, boolean baseline, long now)
            throws SQLException {
        CaptureTaskPayload payload = new CaptureTaskPayload(runId, release.id(), url, config, baseline);
        tasks.enqueue(c, TaskType.CAPTURE, Jsons.toJson(payload), release.id(), runId, now);
    }

    private Void failRunOfTask(Connection c, TaskView task, String logArtifact, long now) throws SQLException {
        if (task.runId() == null) {
            return null;
        }
        Optional<RunView> run = store.findRun(c, task.runId());
        Optional<ReleaseView> release = store.findRelease(c, task.ownerReleaseId());
        if (run.isEmpty() || release.isEmpty() || release.get().status().terminal()
                || run.get().status() == RunStatus.FAILED) {
            return null;
        }
        tasks.cancelByRun(c, task.runId(), now);
        store.markRunFailed(c, task.runId(), logArtifact, now);
        log.warn("Run failed after task exhausted attempts: run_id={}, task_id={}, type={}",
                task.runId(), task.taskId(), task.type());
        return null;
    }

    private ReleaseView finish(long releaseId, ReleaseStatus status) {
        long buildId = buildOfRelease(releaseId);
        return withBuildLock(buildId, status == ReleaseStatus.GOOD ? "promote release" : "reject release", c -> {
            ReleaseView release = requireRelease(c, releaseId);
            if (release.status().terminal()) {
                throw new InvalidStateException("Release " + releaseId + " is already " + release.status());
            }
            long now = now();
            int canceled = tasks.cancelByOwner(c, releaseId, now);
            if (!store.transitionRelease(c, releaseId, ReleaseStatus.PROCESSING, status, now)) {
                throw new ConflictException("Release " + releaseId + " changed concurrently");
            }
            log.info("Release marked {}: release_id={}, canceled_tasks={}", status, releaseId, canceled);
            return requireRelease(c, releaseId);
        });
    }

    private <T> T withBuildLock(long buildId, String operation, Database.TransactionWork<T> work) {
        ReentrantLock lock = buildLocks.computeIfAbsent(buildId, id -> new ReentrantLock());
        lock.lock();
        try {
            return database.inTransaction(operation, work);
        } finally {
            lock.unlock();
        }
    }

    private <T> T read(String operation, Database.TransactionWork<T> work) {
        try (Connection c = database.openConnection()) {
            return work.run(c);
        } catch (SQLException e) {
            throw new RuntimeException("Failed " + operation, e);
        }
    }

    private long buildOfRelease(long releaseId) {
        return read("resolve release", c -> store.findRelease(c, releaseId))
                .orElseThrow(() -> new NotFoundException("Release not found: " + releaseId))
                .buildId();
    }

    private long buildOfRun(long runId) {
        RunView run = read("resolve run", c -> store.findRun(c, runId))
                .orElseThrow(() -> new NotFoundException("Run not found: " + runId));
        return buildOfRelease(run.releaseId());
    }

    private BuildView requireBuild(Connection c, long buildId) throws SQLException {
        return store.findBuild(c, buildId).orElseThrow(() -> new NotFoundException("Build not found: " + buildId));
    }

    private ReleaseView requireRelease(Connection c, long releaseId) throws SQLException {
        return store.findRelease(c, releaseId).orElseThrow(() -> new NotFoundException("Release not found: " + releaseId));
    }

    private RunView requireRun(Connection c, long runId) throws SQLException {
        return store.findRun(c, runId).orElseThrow(() -> new NotFoundException("Run not found: " + runId));
    }

    private TaskView requireTaskForRun(Connection c, String taskId, long runId) throws SQLException {
        TaskView task = tasks.get(c, taskId).orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
        if (task.runId() == null || task.runId() != runId) {
            throw new ValidationException("Task " + taskId + " does not belong to run " + runId);
        }
        return task;
    }

    private static void requireOpen(ReleaseView release) {
        if (release.status() != ReleaseStatus.PROCESSING) {
            throw new InvalidStateException("Release " + release.id() + " is " + release.status());
        }
    }

    private static void requireAcceptingRuns(ReleaseView release) {
        requireOpen(release);
        if (release.completed()) {
            throw new InvalidStateException("Release " + release.id() + " is complete and accepts no new runs");
        }
    }

    private void requireArtifact(String sha, String field) {
        if (sha == null || sha.isBlank()) {
            throw new ValidationException(field + " artifact is required");
        }
        if (!artifacts.exists(sha)) {
            throw new ValidationException(field + " artifact not found: " + sha);
        }
    }

    private void requireOptionalArtifact(String sha, String field) {
        if (sha != null) {
            requireArtifact(sha, field);
        }
    }

    private static String requireText(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(field + " must not be blank");
        }
        return raw.trim();
    }

    private static String requireJson(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            return "{}";
        }
        try {
            Jsons.parse(raw);
            return raw;
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field + " is not a JSON document: " + e.getMessage());
        }
    }

    private long now() {
        return clock.millis();
    }

    private record Completion(ReleaseView release, boolean firstCompletion) {
    }
}
