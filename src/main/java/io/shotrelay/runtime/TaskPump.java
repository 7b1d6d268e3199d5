package io.shotrelay.runtime;

import io.shotrelay.coordinator.WorkCoordinator;
import io.shotrelay.coordinator.WorkItem;
import io.shotrelay.coordinator.WorkItemKind;
import io.shotrelay.error.CoordinatorStoppedException;
import io.shotrelay.lifecycle.ReleaseLifecycleManager;
import io.shotrelay.storage.TaskQueue;
import io.shotrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Feeds leased tasks from the task queue into the coordinator and runs the lease-expiry sweep.
 *
 * <p>Tasks are leased only while the coordinator holds fewer than {@code maxInFlight} outstanding
 * items, so leases are not burned while items wait in the input queue.
 */
public final class TaskPump {
    private static final Logger log = LoggerFactory.getLogger(TaskPump.class);

    private final TaskQueue tasks;
    private final ReleaseLifecycleManager lifecycle;
    private final WorkCoordinator coordinator;
    private final String workerId;
    private final long leaseTimeoutMs;
    private final long pollIntervalMs;
    private final long sweepIntervalMs;
    private final int maxInFlight;
    private final Object tickLock = new Object();
    private ScheduledExecutorService scheduler;
    private long lastSweepMs = Long.MIN_VALUE;

    public TaskPump(
            TaskQueue tasks,
            ReleaseLifecycleManager lifecycle,
            WorkCoordinator coordinator,
            String workerId,
            long leaseTimeoutMs,
            long pollIntervalMs,
            long sweepIntervalMs,
            int maxInFlight
    ) {
        this.tasks = tasks;
        this.lifecycle = lifecycle;
        this.coordinator = coordinator;
        this.workerId = workerId;
        this.leaseTimeoutMs = leaseTimeoutMs;
        this.pollIntervalMs = Math.max(10L, pollIntervalMs);
        this.sweepIntervalMs = Math.max(10L, sweepIntervalMs);
        this.maxInFlight = Math.max(1, maxInFlight);
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "shotrelay-task-pump");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::tick, 0L, pollIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Task pump started: worker_id={}, poll_interval_ms={}, lease_timeout_ms={}",
                workerId, pollIntervalMs, leaseTimeoutMs);
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }

    /**
     * One pump cycle at {@code nowMs}: sweep expired leases when due, then lease tasks up to the
     * coordinator's free capacity. Returns the number of tasks dispatched.
     */
    public int pumpOnce(long nowMs) {
        synchronized (tickLock) {
            if (lastSweepMs == Long.MIN_VALUE || nowMs - lastSweepMs >= sweepIntervalMs) {
                lifecycle.reclaimExpiredLeases(nowMs);
                lastSweepMs = nowMs;
            }
            int dispatched = 0;
            while (hasCapacity()) {
                Optional<TaskQueue.LeasedTask> leased = tasks.lease(workerId, leaseTimeoutMs, nowMs);
                if (leased.isEmpty()) {
                    break;
                }
                try {
                    coordinator.submit(WorkItem.root(WorkItemKind.TASK, Jsons.toJson(leased.get())));
                } catch (CoordinatorStoppedException e) {
                    log.info("Coordinator stopped; leased task left to expire: task_id={}", leased.get().taskId());
                    break;
                }
                dispatched++;
            }
            return dispatched;
        }
    }

    private boolean hasCapacity() {
        WorkCoordinator.Snapshot snapshot = coordinator.snapshot();
        return snapshot.state() == WorkCoordinator.State.RUNNING
                && snapshot.outstanding() < maxInFlight;
    }

    private void tick() {
        try {
            pumpOnce(Instant.now().toEpochMilli());
        } catch (RuntimeException e) {
            log.warn("Task pump cycle failed", e);
        }
    }
}
