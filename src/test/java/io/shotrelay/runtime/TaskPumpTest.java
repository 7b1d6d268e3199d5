package io.shotrelay.runtime;

import io.shotrelay.coordinator.HandlerResult;
import io.shotrelay.coordinator.WorkCoordinator;
import io.shotrelay.coordinator.WorkItem;
import io.shotrelay.coordinator.WorkItemHandler;
import io.shotrelay.coordinator.WorkItemKind;
import io.shotrelay.model.ReleaseView;
import io.shotrelay.model.RunStatus;
import io.shotrelay.model.RunView;
import io.shotrelay.model.TaskStatus;
import io.shotrelay.model.TaskView;
import io.shotrelay.storage.TaskQueue;
import io.shotrelay.testing.StoreFixture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

final class TaskPumpTest {

    @Test
    void sweepRequeuesExpiredLeaseAndFailsRunOnceExhausted() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-pump-sweep-", new TaskQueue.RetryPolicy(1, 0L, 0L))) {
            long buildId = f.lifecycle().createBuild("site-A", false).id();
            ReleaseView candidate = f.lifecycle().createCandidate(buildId, "homepage", null);
            RunView run = f.lifecycle().createOrUpdateRun(candidate.id(), "index", "https://a.example/", "{}");
            WorkCoordinator idle = new WorkCoordinator("test-pump-idle", 1, 0, 1, 0L);
            TaskPump pump = new TaskPump(f.tasks(), f.lifecycle(), idle, "pump-1", 1_000L, 10L, 10L, 1);
            long now = System.currentTimeMillis();

            String taskId = f.tasks().lease("crashed-worker", 100L, now).orElseThrow().taskId();
            Assertions.assertEquals(0, pump.pumpOnce(now + 200L));
            TaskView requeued = f.tasks().get(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.QUEUED, requeued.status());
            Assertions.assertEquals(1, requeued.attemptCount());

            f.tasks().lease("crashed-worker", 100L, now + 300L).orElseThrow();
            pump.pumpOnce(now + 1_000L);

            Assertions.assertEquals(TaskStatus.FAILED, f.tasks().get(taskId).orElseThrow().status());
            RunView failed = f.lifecycle().run(run.id()).orElseThrow();
            Assertions.assertEquals(RunStatus.FAILED, failed.status());
            Assertions.assertTrue(f.artifacts().readText(failed.log()).contains("lease expired"));
        }
    }

    @Test
    void leasesOnlyUpToFreeWorkerCapacity() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-pump-capacity-")) {
            long buildId = f.lifecycle().createBuild("site-A", false).id();
            ReleaseView candidate = f.lifecycle().createCandidate(buildId, "homepage", null);
            for (String page : new String[]{"a", "b", "c"}) {
                f.lifecycle().createOrUpdateRun(candidate.id(), page, "https://a.example/" + page, "{}");
            }
            CountDownLatch release = new CountDownLatch(1);
            WorkCoordinator coordinator = new WorkCoordinator("test-pump-capacity", 2, 0, 1, 0L);
            coordinator.register(new WorkItemHandler() {
                @Override
                public WorkItemKind kind() {
                    return WorkItemKind.TASK;
                }

                @Override
                public HandlerResult handle(WorkItem item) throws Exception {
                    release.await(5, TimeUnit.SECONDS);
                    return HandlerResult.ok("held");
                }
            });
            coordinator.start();
            try {
                TaskPump pump = new TaskPump(f.tasks(), f.lifecycle(), coordinator, "pump-1", 60_000L, 10L, 60_000L, 2);

                Assertions.assertEquals(2, pump.pumpOnce(System.currentTimeMillis()));
                Assertions.assertEquals(0, pump.pumpOnce(System.currentTimeMillis()));
                Assertions.assertEquals(1, f.tasks().countByStatus().get("QUEUED"));
                Assertions.assertEquals(2, f.tasks().countByStatus().get("LEASED"));
            } finally {
                release.countDown();
                coordinator.stop(Duration.ofSeconds(5));
            }
        }
    }
}
