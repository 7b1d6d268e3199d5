package io.shotrelay.coordinator;

import io.shotrelay.error.CoordinatorStoppedException;
import io.shotrelay.error.ErrorKind;
import io.shotrelay.error.ShotRelayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed pool of workers pulling {@link WorkItem}s from one input queue and dispatching each to the
 * handler registered for its kind.
 *
 * <p>Lifecycle is {@code new -> register -> start -> stop}. With a positive queue capacity,
 * {@link #submit} blocks while that many submitted items are waiting. Items produced by handlers
 * and retries bypass the capacity so workers never wait on themselves.
 */
public final class WorkCoordinator {
    private static final Logger log = LoggerFactory.getLogger(WorkCoordinator.class);
    private static final long POLL_MS = 100L;
    private static final long MAX_RETRY_BACKOFF_MS = 30_000L;

    public enum State { NEW, RUNNING, STOPPING, STOPPED }

    private final String name;
    private final int workers;
    private final int maxItemAttempts;
    private final long retryBackoffMs;
    private final BlockingQueue<Pending> queue = new LinkedBlockingQueue<>();
    private final Semaphore admission;
    private final Map<WorkItemKind, WorkItemHandler> handlers = new EnumMap<>(WorkItemKind.class);
    private final List<ItemListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, WorkItem> pendingRetries = new ConcurrentHashMap<>();
    private final AtomicInteger outstanding = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong submittedTotal = new AtomicLong();
    private final AtomicLong succeededTotal = new AtomicLong();
    private final AtomicLong retriedTotal = new AtomicLong();
    private final AtomicLong failedTotal = new AtomicLong();
    private final Object lifecycleLock = new Object();
    private volatile State state = State.NEW;
    private ExecutorService pool;
    private ScheduledExecutorService retryTimer;

    public WorkCoordinator(String name, int workers, int queueCapacity, int maxItemAttempts, long retryBackoffMs) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        if (maxItemAttempts < 1) {
            throw new IllegalArgumentException("maxItemAttempts must be >= 1");
        }
        this.name = name;
        this.workers = workers;
        this.maxItemAttempts = maxItemAttempts;
        this.retryBackoffMs = Math.max(0L, retryBackoffMs);
        this.admission = queueCapacity > 0 ? new Semaphore(queueCapacity) : null;
    }

    public void register(WorkItemHandler handler) {
        synchronized (lifecycleLock) {
            if (state != State.NEW) {
                throw new IllegalStateException("Handlers must be registered before start: " + handler.kind());
            }
            handlers.put(handler.kind(), handler);
        }
    }

    public void addListener(ItemListener listener) {
        listeners.add(listener);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (state == State.RUNNING) {
                return;
            }
            if (state != State.NEW) {
                throw new CoordinatorStoppedException("Coordinator " + name + " was stopped and cannot restart");
            }
            AtomicInteger threadSeq = new AtomicInteger();
            pool = Executors.newFixedThreadPool(workers, r -> {
                Thread t = new Thread(r, name + "-worker-" + threadSeq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            retryTimer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, name + "-retry");
                t.setDaemon(true);
                return t;
            });
            state = State.RUNNING;
            for (int i = 0; i < workers; i++) {
                pool.execute(this::workerLoop);
            }
            log.info("Coordinator started: name={}, workers={}, handlers={}", name, workers, handlers.keySet());
        }
    }

    /**
     * Queues an item for execution. Blocks for capacity when the queue is bounded.
     *
     * @throws CoordinatorStoppedException once {@link #stop} has been requested
     */
    public void submit(WorkItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        requireAccepting();
        if (admission != null) {
            try {
                while (!admission.tryAcquire(POLL_MS, TimeUnit.MILLISECONDS)) {
                    requireAccepting();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for queue capacity", e);
            }
            if (state == State.STOPPING || state == State.STOPPED) {
                admission.release();
                throw new CoordinatorStoppedException("Coordinator " + name + " is stopped");
            }
        }
        outstanding.incrementAndGet();
        submittedTotal.incrementAndGet();
        queue.add(new Pending(item, admission != null));
    }

    /**
     * Stops accepting items, waits up to {@code drainTimeout} for queued and in-flight items to
     * finish, then interrupts the workers. Items abandoned at that point are reported as failed.
     */
    public StopSummary stop(Duration drainTimeout) {
        synchronized (lifecycleLock) {
            if (state == State.NEW) {
                state = State.STOPPED;
                return new StopSummary(true, abandonQueued());
            }
            if (state != State.RUNNING) {
                return new StopSummary(outstanding.get() == 0, 0);
            }
            state = State.STOPPING;
        }
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        while (outstanding.get() > 0 && System.nanoTime() < deadline) {
            try {
                Thread.sleep(10L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        boolean drained = outstanding.get() == 0;
        synchronized (lifecycleLock) {
            state = State.STOPPED;
            retryTimer.shutdownNow();
        }
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Coordinator workers did not terminate: name={}", name);
            }
            if (!retryTimer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Coordinator retry timer did not terminate: name={}", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int abandoned = abandonQueued();
        for (WorkItem item : new ArrayList<>(pendingRetries.values())) {
            if (pendingRetries.remove(item.id()) != null) {
                abandon(item);
                abandoned++;
            }
        }
        log.info("Coordinator stopped: name={}, drained={}, abandoned={}", name, drained, abandoned);
        return new StopSummary(drained, abandoned);
    }

    public State state() {
        return state;
    }

    /**
     * True when nothing is queued, running or waiting for a retry.
     */
    public boolean isIdle() {
        return outstanding.get() == 0;
    }

    public Snapshot snapshot() {
        return new Snapshot(
                name,
                state,
                workers,
                queue.size(),
                inFlight.get(),
                outstanding.get(),
                submittedTotal.get(),
                succeededTotal.get(),
                retriedTotal.get(),
                failedTotal.get()
        );
    }

    private void workerLoop() {
        while (state != State.STOPPED) {
            Pending next;
            try {
                next = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (next == null) {
                continue;
            }
            if (next.admitted()) {
                admission.release();
            }
            inFlight.incrementAndGet();
            try {
                process(next.item());
            } finally {
                inFlight.decrementAndGet();
                outstanding.decrementAndGet();
            }
        }
    }

    private void process(WorkItem item) {
        HandlerResult result = invoke(item);
        if (result.success()) {
            succeededTotal.incrementAndGet();
            for (WorkItem child : result.children()) {
                outstanding.incrementAndGet();
                submittedTotal.incrementAndGet();
                queue.add(new Pending(child, false));
            }
            notifyListeners(item, result, Outcome.SUCCEEDED);
            return;
        }
        if (result.retryable() && item.attempt() < maxItemAttempts && scheduleRetry(item.nextAttempt())) {
            retriedTotal.incrementAndGet();
            log.info("Retrying work item: coordinator={}, item_id={}, kind={}, attempt={}, error={}",
                    name, item.id(), item.kind(), item.attempt(), result.error());
            notifyListeners(item, result, Outcome.RETRYING);
            return;
        }
        failedTotal.incrementAndGet();
        log.warn("Work item failed permanently: coordinator={}, item_id={}, kind={}, attempts={}, error_kind={}, error={}",
                name, item.id(), item.kind(), item.attempt(), result.errorKind(), result.error());
        notifyListeners(item, result, Outcome.FAILED);
    }

    private HandlerResult invoke(WorkItem item) {
        WorkItemHandler handler = handlers.get(item.kind());
        if (handler == null) {
            return HandlerResult.fail(ErrorKind.VALIDATION, "No handler registered for " + item.kind());
        }
        try {
            HandlerResult result = handler.handle(item);
            return result == null ? HandlerResult.fail(ErrorKind.TRANSIENT, "Handler returned no result") : result;
        } catch (ShotRelayException e) {
            return HandlerResult.fail(e.kind(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (state == State.STOPPED) {
                return HandlerResult.fail(ErrorKind.COORDINATOR_STOPPED, "Interrupted by coordinator stop");
            }
            return HandlerResult.fail(ErrorKind.TRANSIENT, "Interrupted");
        } catch (Exception e) {
            log.debug("Handler threw: coordinator={}, item_id={}", name, item.id(), e);
            return HandlerResult.fail(ErrorKind.TRANSIENT, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Returns {@code false} when the coordinator has stopped and the item must fail instead. Runs
     * under the lifecycle lock so {@link #stop} cannot shut the retry timer down in between.
     */
    private boolean scheduleRetry(WorkItem retry) {
        synchronized (lifecycleLock) {
            if (state == State.STOPPED) {
                return false;
            }
            long delay = retryDelayMs(retry.attempt());
            outstanding.incrementAndGet();
            if (delay == 0L) {
                queue.add(new Pending(retry, false));
                return true;
            }
            pendingRetries.put(retry.id(), retry);
            try {
                retryTimer.schedule(() -> {
                    if (pendingRetries.remove(retry.id()) != null) {
                        queue.add(new Pending(retry, false));
                    }
                }, delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                pendingRetries.remove(retry.id());
                outstanding.decrementAndGet();
                log.warn("Retry timer rejected work item: coordinator={}, item_id={}", name, retry.id());
                return false;
            }
            return true;
        }
    }

    private long retryDelayMs(int attempt) {
        if (retryBackoffMs == 0L) {
            return 0L;
        }
        long delay = retryBackoffMs;
        for (int i = 2; i < attempt && delay < MAX_RETRY_BACKOFF_MS; i++) {
            delay *= 2L;
        }
        return Math.min(delay, MAX_RETRY_BACKOFF_MS);
    }

    private int abandonQueued() {
        List<Pending> left = new ArrayList<>();
        queue.drainTo(left);
        for (Pending pending : left) {
            if (pending.admitted()) {
                admission.release();
            }
            abandon(pending.item());
        }
        return left.size();
    }

    private void abandon(WorkItem item) {
        outstanding.decrementAndGet();
        failedTotal.incrementAndGet();
        HandlerResult result = HandlerResult.fail(ErrorKind.COORDINATOR_STOPPED, "Coordinator stopped before the item ran");
        log.warn("Work item abandoned at stop: coordinator={}, item_id={}, kind={}", name, item.id(), item.kind());
        notifyListeners(item, result, Outcome.FAILED);
    }

    private void notifyListeners(WorkItem item, HandlerResult result, Outcome outcome) {
        for (ItemListener listener : listeners) {
            try {
                switch (outcome) {
                    case SUCCEEDED -> listener.succeeded(item, result);
                    case RETRYING -> listener.retrying(item, result);
                    case FAILED -> listener.failed(item, result);
                }
            } catch (RuntimeException e) {
                log.warn("Item listener failed: coordinator={}, item_id={}", name, item.id(), e);
            }
        }
    }

    private void requireAccepting() {
        State current = state;
        if (current == State.STOPPING || current == State.STOPPED) {
            throw new CoordinatorStoppedException("Coordinator " + name + " is stopped");
        }
    }

    private enum Outcome { SUCCEEDED, RETRYING, FAILED }

    private record Pending(WorkItem item, boolean admitted) {
    }

    public record StopSummary(boolean drained, int abandoned) {
    }

    public record Snapshot(
            String name,
            State state,
            int workers,
            int queued,
            int inFlight,
            int outstanding,
            long submitted,
            long succeeded,
            long retried,
            long failed
    ) {
    }
}
