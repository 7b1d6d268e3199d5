package io.shotrelay.storage;

import io.shotrelay.error.InvalidStateException;
import io.shotrelay.error.NotFoundException;
import io.shotrelay.model.TaskStatus;
import io.shotrelay.model.TaskType;
import io.shotrelay.model.TaskView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Durable capture/diff task rows with lease, retry and cancel-by-owner semantics.
 *
 * <p>Every public operation is one SQLite transaction. The {@code Connection}-taking overloads let
 * the lifecycle manager fold task bookkeeping into its own transaction so run and task state commit
 * together.
 */
public final class TaskQueue {
    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);
    private static final String TASK_COLUMNS =
            "task_id,type,payload,owner_release_id,run_id,status,attempt_count,available_at_ms,lease_owner,lease_deadline_ms," +
                    "lease_epoch,result,last_error,created_at_ms,updated_at_ms";

    private final Database database;
    private final RetryPolicy retryPolicy;

    public TaskQueue(Database database, RetryPolicy retryPolicy) {
        this.database = database;
        this.retryPolicy = retryPolicy;
    }

    public String enqueue(TaskType type, String payload, long ownerReleaseId) {
        return enqueue(type, payload, ownerReleaseId, now());
    }

    public String enqueue(TaskType type, String payload, long ownerReleaseId, long nowMs) {
        return database.inTransaction("task enqueue", c -> enqueue(c, type, payload, ownerReleaseId, null, nowMs));
    }

    public String enqueue(Connection c, TaskType type, String payload, long ownerReleaseId, Long runId, long nowMs)
            throws SQLException {
        String taskId = "tsk_" + UUID.randomUUID();
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO tasks(task_id,type,payload,owner_release_id,run_id,status,attempt_count,available_at_ms,lease_epoch,created_at_ms,updated_at_ms) " +
                        "VALUES(?,?,?,?,?,?,0,?,0,?,?)")) {
            ps.setString(1, taskId);
            ps.setString(2, type.name());
            ps.setString(3, payload == null ? "{}" : payload);
            ps.setLong(4, ownerReleaseId);
            if (runId == null) {
                ps.setNull(5, Types.INTEGER);
            } else {
                ps.setLong(5, runId);
            }
            ps.setString(6, TaskStatus.QUEUED.name());
            ps.setLong(7, nowMs);
            ps.setLong(8, nowMs);
            ps.setLong(9, nowMs);
            ps.executeUpdate();
        }
        log.debug("Enqueued task: task_id={}, type={}, owner_release_id={}, run_id={}", taskId, type, ownerReleaseId, runId);
        return taskId;
    }

    public Optional<LeasedTask> lease(String workerId, long leaseTimeoutMs) {
        return lease(workerId, leaseTimeoutMs, EnumSet.allOf(TaskType.class), now());
    }

    public Optional<LeasedTask> lease(String workerId, long leaseTimeoutMs, long nowMs) {
        return lease(workerId, leaseTimeoutMs, EnumSet.allOf(TaskType.class), nowMs);
    }

    /**
     * Claims the oldest runnable QUEUED task of the given types. Never blocks; returns empty when
     * nothing is runnable at {@code nowMs}.
     */
    public Optional<LeasedTask> lease(String workerId, long leaseTimeoutMs, Set<TaskType> types, long nowMs) {
        if (types == null || types.isEmpty()) {
            return Optional.empty();
        }
        String select = "SELECT task_id,type,payload,owner_release_id,run_id,attempt_count,lease_epoch FROM tasks " +
                "WHERE status=? AND available_at_ms<=? AND type IN (" + placeholders(types.size()) + ") " +
                "ORDER BY created_at_ms ASC, rowid ASC LIMIT 1";
        String claim = "UPDATE tasks SET status=?,lease_owner=?,lease_deadline_ms=?,lease_epoch=lease_epoch+1,updated_at_ms=? " +
                "WHERE task_id=? AND status=?";
        return database.inTransaction("task lease", c -> {
            String taskId;
            TaskType type;
            String payload;
            long owner;
            Long runId;
            int attempts;
            long epoch;
            try (PreparedStatement ps = c.prepareStatement(select)) {
                ps.setString(1, TaskStatus.QUEUED.name());
                ps.setLong(2, nowMs);
                int idx = 3;
                for (TaskType t : types) {
                    ps.setString(idx++, t.name());
                }
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    taskId = rs.getString("task_id");
                    type = TaskType.fromString(rs.getString("type"));
                    payload = rs.getString("payload");
                    owner = rs.getLong("owner_release_id");
                    long rawRunId = rs.getLong("run_id");
                    runId = rs.wasNull() ? null : rawRunId;
                    attempts = rs.getInt("attempt_count");
                    epoch = rs.getLong("lease_epoch");
                }
            }
            long deadline = nowMs + Math.max(1L, leaseTimeoutMs);
            try (PreparedStatement ps = c.prepareStatement(claim)) {
                ps.setString(1, TaskStatus.LEASED.name());
                ps.setString(2, workerId);
                ps.setLong(3, deadline);
                ps.setLong(4, nowMs);
                ps.setString(5, taskId);
                ps.setString(6, TaskStatus.QUEUED.name());
                if (ps.executeUpdate() == 0) {
                    return Optional.empty();
                }
            }
            return Optional.of(new LeasedTask(taskId, type, payload, owner, runId, attempts, epoch + 1L, workerId, deadline));
        });
    }

    public boolean complete(LeasedTask lease, String result) {
        return complete(lease, result, now());
    }

    public boolean complete(LeasedTask lease, String result, long nowMs) {
        return database.inTransaction("task complete", c -> complete(c, lease, result, nowMs));
    }

    /**
     * Marks a leased task DONE. Returns {@code false} when this lease already completed it with the
     * same result. A task that is no longer held by {@code lease} (canceled, reclaimed, re-leased or
     * finished by another holder) raises {@link InvalidStateException}.
     */
    public boolean complete(Connection c, LeasedTask lease, String result, long nowMs) throws SQLException {
        String taskId = lease.taskId();
        TaskView task = get(c, taskId).orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
        if (task.status() == TaskStatus.DONE && task.leaseEpoch() == lease.leaseEpoch()) {
            if (Objects.equals(task.result(), result)) {
                return false;
            }
            throw new InvalidStateException("Task " + taskId + " already completed with a different result");
        }
        requireHeld(task, lease, "complete");
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE tasks SET status=?,result=?,lease_owner=NULL,lease_deadline_ms=NULL,updated_at_ms=? " +
                        "WHERE task_id=? AND status=? AND lease_epoch=?")) {
            ps.setString(1, TaskStatus.DONE.name());
            ps.setString(2, result);
            ps.setLong(3, nowMs);
            ps.setString(4, taskId);
            ps.setString(5, TaskStatus.LEASED.name());
            ps.setLong(6, lease.leaseEpoch());
            if (ps.executeUpdate() == 0) {
                throw new InvalidStateException("Task " + taskId + " changed state during completion");
            }
        }
        return true;
    }

    public FailOutcome fail(LeasedTask lease, String error) {
        return fail(lease, error, now());
    }

    public FailOutcome fail(LeasedTask lease, String error, long nowMs) {
        return database.inTransaction("task fail", c -> fail(c, lease, error, nowMs));
    }

    public FailOutcome fail(Connection c, LeasedTask lease, String error, long nowMs) throws SQLException {
        String taskId = lease.taskId();
        TaskView task = get(c, taskId).orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
        requireHeld(task, lease, "fail");
        FailOutcome outcome = applyFailure(c, taskId, task.attemptCount(), lease.leaseEpoch(), error, nowMs);
        if (outcome == null) {
            throw new InvalidStateException("Task " + taskId + " changed state during failure");
        }
        return outcome;
    }

    public int cancelByOwner(long releaseId) {
        return cancelByOwner(releaseId, now());
    }

    public int cancelByOwner(long releaseId, long nowMs) {
        return database.inTransaction("task cancel", c -> cancelByOwner(c, releaseId, nowMs));
    }

    public int cancelByOwner(Connection c, long releaseId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE tasks SET status=?,lease_owner=NULL,lease_deadline_ms=NULL,last_error=?,updated_at_ms=? " +
                        "WHERE owner_release_id=? AND status IN (?,?)")) {
            ps.setString(1, TaskStatus.CANCELED.name());
            ps.setString(2, "canceled with owner release");
            ps.setLong(3, nowMs);
            ps.setLong(4, releaseId);
            ps.setString(5, TaskStatus.QUEUED.name());
            ps.setString(6, TaskStatus.LEASED.name());
            int count = ps.executeUpdate();
            if (count > 0) {
                log.info("Canceled {} tasks for release_id={}", count, releaseId);
            }
            return count;
        }
    }

    /**
     * Cancels the outstanding tasks of one run, used when the run is re-requested or failed by hand.
     */
    public int cancelByRun(Connection c, long runId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE tasks SET status=?,lease_owner=NULL,lease_deadline_ms=NULL,last_error=?,updated_at_ms=? " +
                        "WHERE run_id=? AND status IN (?,?)")) {
            ps.setString(1, TaskStatus.CANCELED.name());
            ps.setString(2, "canceled with run");
            ps.setLong(3, nowMs);
            ps.setLong(4, runId);
            ps.setString(5, TaskStatus.QUEUED.name());
            ps.setString(6, TaskStatus.LEASED.name());
            return ps.executeUpdate();
        }
    }

    /**
     * Requeues (or fails, once attempts are exhausted) every leased task whose deadline has passed.
     * Each expiry is applied once: the update is fenced on the lease epoch observed by the scan.
     */
    public ReclaimSummary reclaimExpiredLeases(long nowMs, int limit) {
        List<TaskView> candidates = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + TASK_COLUMNS + " FROM tasks WHERE status=? AND lease_deadline_ms<=? ORDER BY lease_deadline_ms ASC LIMIT ?")) {
            ps.setString(1, TaskStatus.LEASED.name());
            ps.setLong(2, nowMs);
            ps.setInt(3, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    candidates.add(mapTask(rs));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed reclaim scan", e);
        }

        int requeued = 0;
        List<TaskView> exhausted = new ArrayList<>();
        for (TaskView cnd : candidates) {
            FailOutcome outcome = database.inTransaction("task reclaim", c ->
                    applyFailure(c, cnd.taskId(), cnd.attemptCount(), cnd.leaseEpoch(), "lease expired", nowMs));
            if (outcome == null) {
                continue;
            }
            if (outcome.disposition() == FailDisposition.REQUEUED) {
                requeued++;
            } else {
                exhausted.add(get(cnd.taskId()).orElse(cnd));
            }
        }
        if (requeued + exhausted.size() > 0) {
            log.warn("Reclaimed expired leases: requeued={}, failed={}", requeued, exhausted.size());
        }
        return new ReclaimSummary(requeued + exhausted.size(), requeued, exhausted);
    }

    public Optional<TaskView> get(String taskId) {
        try (Connection c = database.openConnection()) {
            return get(c, taskId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read task: " + taskId, e);
        }
    }

    public List<TaskView> listByOwner(long releaseId) {
        List<TaskView> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + TASK_COLUMNS + " FROM tasks WHERE owner_release_id=? ORDER BY created_at_ms ASC, rowid ASC")) {
            ps.setLong(1, releaseId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapTask(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks for release: " + releaseId, e);
        }
    }

    public Map<String, Integer> countByStatus() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (TaskStatus s : TaskStatus.values()) {
            out.put(s.name(), 0);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(*) AS n FROM tasks GROUP BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString("status"), rs.getInt("n"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks", e);
        }
    }

    private static void requireHeld(TaskView task, LeasedTask lease, String action) {
        if (task.status() != TaskStatus.LEASED) {
            throw new InvalidStateException("Task " + task.taskId() + " cannot " + action + " from " + task.status());
        }
        if (task.leaseEpoch() != lease.leaseEpoch() || !Objects.equals(task.leaseOwner(), lease.leaseOwner())) {
            throw new InvalidStateException("Task " + task.taskId() + " lease " + lease.leaseEpoch() + " held by "
                    + lease.leaseOwner() + " was superseded by lease " + task.leaseEpoch() + " held by " + task.leaseOwner());
        }
    }

    private FailOutcome applyFailure(Connection c, String taskId, int attemptCount, long leaseEpoch, String error, long nowMs)
            throws SQLException {
        int nextAttempt = attemptCount + 1;
        boolean exhausted = attemptCount >= retryPolicy.maxAttempts();
        long availableAt = exhausted ? nowMs : nowMs + computeBackoffMs(nextAttempt);
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE tasks SET status=?,attempt_count=?,available_at_ms=?,lease_owner=NULL,lease_deadline_ms=NULL,last_error=?,updated_at_ms=? " +
                        "WHERE task_id=? AND status=? AND lease_epoch=?")) {
            ps.setString(1, exhausted ? TaskStatus.FAILED.name() : TaskStatus.QUEUED.name());
            ps.setInt(2, nextAttempt);
            ps.setLong(3, availableAt);
            ps.setString(4, error);
            ps.setLong(5, nowMs);
            ps.setString(6, taskId);
            ps.setString(7, TaskStatus.LEASED.name());
            ps.setLong(8, leaseEpoch);
            if (ps.executeUpdate() == 0) {
                return null;
            }
        }
        if (exhausted) {
            log.warn("Task failed permanently: task_id={}, attempts={}, error={}", taskId, nextAttempt, error);
            return new FailOutcome(taskId, FailDisposition.FAILED, nextAttempt, null);
        }
        log.info("Task requeued: task_id={}, attempts={}, available_at_ms={}", taskId, nextAttempt, availableAt);
        return new FailOutcome(taskId, FailDisposition.REQUEUED, nextAttempt, availableAt);
    }

    private long computeBackoffMs(int attempt) {
        long base = retryPolicy.baseBackoffMs();
        long max = retryPolicy.maxBackoffMs();
        if (max <= 0L) {
            return 0L;
        }
        long backoff = base;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= max / 2L) {
                backoff = max;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, max);
        long jitter = ThreadLocalRandom.current().nextLong(0L, 251L);
        return Math.min(max, backoff + jitter);
    }

    public Optional<TaskView> get(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + TASK_COLUMNS + " FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapTask(rs));
            }
        }
    }

    private TaskView mapTask(ResultSet rs) throws SQLException {
        long deadline = rs.getLong("lease_deadline_ms");
        Long leaseDeadline = rs.wasNull() ? null : deadline;
        long rawRunId = rs.getLong("run_id");
        Long runId = rs.wasNull() ? null : rawRunId;
        return new TaskView(
                rs.getString("task_id"),
                TaskType.fromString(rs.getString("type")),
                rs.getString("payload"),
                rs.getLong("owner_release_id"),
                runId,
                TaskStatus.valueOf(rs.getString("status")),
                rs.getInt("attempt_count"),
                rs.getLong("available_at_ms"),
                rs.getString("lease_owner"),
                leaseDeadline,
                rs.getLong("lease_epoch"),
                rs.getString("result"),
                rs.getString("last_error"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private String placeholders(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append('?');
        }
        return sb.toString();
    }

    private static long now() {
        return Instant.now().toEpochMilli();
    }

    /**
     * {@code maxAttempts} is the number of failed attempts after which the next failure is final; a
     * task therefore runs at most {@code maxAttempts + 1} times.
     */
    public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        public RetryPolicy {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("maxAttempts must be >= 0");
            }
        }
    }

    public record LeasedTask(String taskId, TaskType type, String payload, long ownerReleaseId, Long runId, int attemptCount,
                             long leaseEpoch, String leaseOwner, long leaseDeadlineMs) {}

    public enum FailDisposition { REQUEUED, FAILED }

    public record FailOutcome(String taskId, FailDisposition disposition, int attemptCount, Long availableAtMs) {}

    public record ReclaimSummary(int reclaimed, int requeued, List<TaskView> exhausted) {}
}
