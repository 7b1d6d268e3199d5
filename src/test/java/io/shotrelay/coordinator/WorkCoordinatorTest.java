package io.shotrelay.coordinator;

import io.shotrelay.error.CoordinatorStoppedException;
import io.shotrelay.error.ErrorKind;
import io.shotrelay.error.TransientTaskException;
import io.shotrelay.error.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class WorkCoordinatorTest {

    @Test
    void childrenAreDispatchedToTheirOwnHandlers() throws Exception {
        WorkCoordinator coordinator = new WorkCoordinator("test-children", 2, 0, 3, 0L);
        List<String> captured = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(3);
        coordinator.register(new Handler(WorkItemKind.CRAWL, item -> HandlerResult.ok("crawled", List.of(
                WorkItem.child(WorkItemKind.CAPTURE_REQUEST, "/a"),
                WorkItem.child(WorkItemKind.CAPTURE_REQUEST, "/b"),
                WorkItem.child(WorkItemKind.CAPTURE_REQUEST, "/c")
        ))));
        coordinator.register(new Handler(WorkItemKind.CAPTURE_REQUEST, item -> {
            captured.add(item.payload());
            done.countDown();
            return HandlerResult.ok("captured " + item.payload());
        }));
        coordinator.start();
        try {
            coordinator.submit(WorkItem.root(WorkItemKind.CRAWL, "https://a.example/"));

            Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(List.of("/a", "/b", "/c"), captured.stream().sorted().toList());
        } finally {
            coordinator.stop(Duration.ofSeconds(5));
        }
        WorkCoordinator.Snapshot snapshot = coordinator.snapshot();
        Assertions.assertEquals(4L, snapshot.submitted());
        Assertions.assertEquals(4L, snapshot.succeeded());
        Assertions.assertEquals(WorkCoordinator.State.STOPPED, snapshot.state());
    }

    @Test
    void transientFailuresAreRetriedUntilExhausted() throws Exception {
        WorkCoordinator coordinator = new WorkCoordinator("test-retry", 1, 0, 3, 0L);
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch failed = new CountDownLatch(1);
        List<Integer> retryAttempts = new CopyOnWriteArrayList<>();
        List<ErrorKind> failureKinds = new CopyOnWriteArrayList<>();
        coordinator.register(new Handler(WorkItemKind.TASK, item -> {
            calls.incrementAndGet();
            throw new TransientTaskException("capture timed out");
        }));
        coordinator.addListener(new ItemListener() {
            @Override
            public void retrying(WorkItem item, HandlerResult result) {
                retryAttempts.add(item.attempt());
            }

            @Override
            public void failed(WorkItem item, HandlerResult result) {
                failureKinds.add(result.errorKind());
                failed.countDown();
            }
        });
        coordinator.start();
        try {
            coordinator.submit(WorkItem.root(WorkItemKind.TASK, "{}"));

            Assertions.assertTrue(failed.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(3, calls.get());
            Assertions.assertEquals(List.of(1, 2), retryAttempts);
            Assertions.assertEquals(List.of(ErrorKind.TRANSIENT), failureKinds);
            Assertions.assertEquals(2L, coordinator.snapshot().retried());
            Assertions.assertEquals(1L, coordinator.snapshot().failed());
        } finally {
            coordinator.stop(Duration.ofSeconds(5));
        }
    }

    @Test
    void nonRetryableFailuresAndMissingHandlersFailOnce() throws Exception {
        WorkCoordinator coordinator = new WorkCoordinator("test-no-retry", 1, 0, 5, 0L);
        AtomicInteger calls = new AtomicInteger();
        List<ErrorKind> kinds = new CopyOnWriteArrayList<>();
        CountDownLatch failed = new CountDownLatch(3);
        coordinator.register(new Handler(WorkItemKind.CAPTURE_REQUEST, item -> {
            calls.incrementAndGet();
            if (item.payload().equals("throw")) {
                throw new ValidationException("bad request");
            }
            return HandlerResult.fail(ErrorKind.CONFLICT, "already exists");
        }));
        coordinator.addListener(new ItemListener() {
            @Override
            public void failed(WorkItem item, HandlerResult result) {
                kinds.add(result.errorKind());
                failed.countDown();
            }
        });
        coordinator.start();
        try {
            coordinator.submit(WorkItem.root(WorkItemKind.CAPTURE_REQUEST, "throw"));
            coordinator.submit(WorkItem.root(WorkItemKind.CAPTURE_REQUEST, "conflict"));
            coordinator.submit(WorkItem.root(WorkItemKind.CRAWL, "{}"));

            Assertions.assertTrue(failed.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(2, calls.get());
            Assertions.assertEquals(0L, coordinator.snapshot().retried());
            Assertions.assertTrue(kinds.containsAll(List.of(ErrorKind.VALIDATION, ErrorKind.CONFLICT)));
        } finally {
            coordinator.stop(Duration.ofSeconds(5));
        }
    }

    @Test
    void startIsIdempotentAndRegisterAfterStartIsRejected() {
        WorkCoordinator coordinator = new WorkCoordinator("test-start", 1, 0, 1, 0L);
        coordinator.start();
        try {
            coordinator.start();
            Assertions.assertEquals(WorkCoordinator.State.RUNNING, coordinator.state());
            Assertions.assertThrows(IllegalStateException.class,
                    () -> coordinator.register(new Handler(WorkItemKind.TASK, item -> HandlerResult.ok("x"))));
        } finally {
            coordinator.stop(Duration.ofSeconds(1));
        }
        Assertions.assertThrows(CoordinatorStoppedException.class, coordinator::start);
    }

    @Test
    void stopDrainsInFlightItemsAndRejectsNewOnes() throws Exception {
        WorkCoordinator coordinator = new WorkCoordinator("test-drain", 1, 0, 1, 0L);
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();
        coordinator.register(new Handler(WorkItemKind.TASK, item -> {
            started.countDown();
            Thread.sleep(200L);
            finished.incrementAndGet();
            return HandlerResult.ok("done");
        }));
        coordinator.start();
        coordinator.submit(WorkItem.root(WorkItemKind.TASK, "1"));
        coordinator.submit(WorkItem.root(WorkItemKind.TASK, "2"));
        Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));

        WorkCoordinator.StopSummary summary = coordinator.stop(Duration.ofSeconds(5));

        Assertions.assertTrue(summary.drained());
        Assertions.assertEquals(0, summary.abandoned());
        Assertions.assertEquals(2, finished.get());
        Assertions.assertThrows(CoordinatorStoppedException.class,
                () -> coordinator.submit(WorkItem.root(WorkItemKind.TASK, "3")));
        Assertions.assertTrue(coordinator.isIdle());
    }

    @Test
    void drainTimeoutAbandonsQueuedItemsAsFailed() throws Exception {
        WorkCoordinator coordinator = new WorkCoordinator("test-abandon", 1, 0, 1, 0L);
        CountDownLatch started = new CountDownLatch(1);
        List<ErrorKind> failures = new CopyOnWriteArrayList<>();
        coordinator.register(new Handler(WorkItemKind.TASK, item -> {
            started.countDown();
            Thread.sleep(10_000L);
            return HandlerResult.ok("late");
        }));
        coordinator.addListener(new ItemListener() {
            @Override
            public void failed(WorkItem item, HandlerResult result) {
                failures.add(result.errorKind());
            }
        });
        coordinator.start();
        coordinator.submit(WorkItem.root(WorkItemKind.TASK, "slow"));
        coordinator.submit(WorkItem.root(WorkItemKind.TASK, "waiting"));
        Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));

        WorkCoordinator.StopSummary summary = coordinator.stop(Duration.ofMillis(100));

        Assertions.assertFalse(summary.drained());
        Assertions.assertEquals(1, summary.abandoned());
        // the interrupted in-flight item and the queued one
        Assertions.assertEquals(List.of(ErrorKind.COORDINATOR_STOPPED, ErrorKind.COORDINATOR_STOPPED), failures);
        Assertions.assertEquals(2L, coordinator.snapshot().failed());
        Assertions.assertTrue(coordinator.isIdle());
        Assertions.assertEquals(WorkCoordinator.State.STOPPED, coordinator.state());
    }

    @Test
    void retriesRacingStopAreAllSettled() throws Exception {
        WorkCoordinator coordinator = new WorkCoordinator("test-retry-stop", 4, 0, 1_000, 1L);
        AtomicInteger settled = new AtomicInteger();
        coordinator.register(new Handler(WorkItemKind.TASK, item -> {
            throw new TransientTaskException("capture timed out");
        }));
        coordinator.addListener(new ItemListener() {
            @Override
            public void failed(WorkItem item, HandlerResult result) {
                settled.incrementAndGet();
            }
        });
        coordinator.start();
        for (int i = 0; i < 50; i++) {
            coordinator.submit(WorkItem.root(WorkItemKind.TASK, Integer.toString(i)));
        }
        Thread.sleep(50L);

        coordinator.stop(Duration.ofMillis(20));

        Assertions.assertTrue(coordinator.isIdle(), "outstanding=" + coordinator.snapshot().outstanding());
        Assertions.assertEquals(50, settled.get());
        Assertions.assertEquals(50L, coordinator.snapshot().failed());
    }

    @Test
    void boundedQueueAppliesBackPressureToSubmitters() throws Exception {
        WorkCoordinator coordinator = new WorkCoordinator("test-capacity", 1, 1, 1, 0L);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        coordinator.register(new Handler(WorkItemKind.TASK, item -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return HandlerResult.ok("ok");
        }));
        coordinator.start();
        try {
            coordinator.submit(WorkItem.root(WorkItemKind.TASK, "running"));
            Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
            coordinator.submit(WorkItem.root(WorkItemKind.TASK, "queued"));

            CountDownLatch thirdAccepted = new CountDownLatch(1);
            Thread submitter = new Thread(() -> {
                coordinator.submit(WorkItem.root(WorkItemKind.TASK, "blocked"));
                thirdAccepted.countDown();
            });
            submitter.start();
            Assertions.assertFalse(thirdAccepted.await(300, TimeUnit.MILLISECONDS));

            release.countDown();
            Assertions.assertTrue(thirdAccepted.await(5, TimeUnit.SECONDS));
            submitter.join(5_000L);
        } finally {
            release.countDown();
            coordinator.stop(Duration.ofSeconds(5));
        }
        Assertions.assertEquals(3L, coordinator.snapshot().succeeded());
    }

    private interface Body {
        HandlerResult run(WorkItem item) throws Exception;
    }

    private static final class Handler implements WorkItemHandler {
        private final WorkItemKind kind;
        private final Body body;

        Handler(WorkItemKind kind, Body body) {
            this.kind = kind;
            this.body = body;
        }

        @Override
        public WorkItemKind kind() {
            return kind;
        }

        @Override
        public HandlerResult handle(WorkItem item) throws Exception {
            return body.run(item);
        }
    }
}
