package io.shotrelay.worker;

import io.shotrelay.coordinator.HandlerResult;
import io.shotrelay.coordinator.WorkItem;
import io.shotrelay.coordinator.WorkItemKind;
import io.shotrelay.error.ValidationException;
import io.shotrelay.lifecycle.ReleaseLifecycleManager;
import io.shotrelay.model.ReleaseView;
import io.shotrelay.model.RunStatus;
import io.shotrelay.model.RunView;
import io.shotrelay.model.TaskStatus;
import io.shotrelay.model.TaskType;
import io.shotrelay.model.TaskView;
import io.shotrelay.storage.TaskQueue;
import io.shotrelay.testing.FakeCaptureEngine;
import io.shotrelay.testing.FakeDiffEngine;
import io.shotrelay.testing.StoreFixture;
import io.shotrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;

final class TaskItemHandlerTest {

    @Test
    void captureTaskStoresScreenshotAndSettlesRun() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-capture-task-")) {
            FakeCaptureEngine capture = new FakeCaptureEngine();
            TaskItemHandler handler = handler(f, capture, new FakeDiffEngine());
            ReleaseView candidate = candidate(f);
            RunView run = f.lifecycle().createOrUpdateRun(
                    candidate.id(), "index", "https://a.example/", "{\"viewportSize\":{\"width\":1024}}");
            TaskQueue.LeasedTask task = f.tasks().lease("w", 60_000L).orElseThrow();

            HandlerResult result = handler.handle(item(task));

            Assertions.assertTrue(result.success(), result.output());
            RunView captured = f.lifecycle().run(run.id()).orElseThrow();
            Assertions.assertEquals(RunStatus.DIFF_APPROVED, captured.status());
            Assertions.assertEquals("png:https://a.example/",
                    new String(f.artifacts().read(captured.image()), StandardCharsets.UTF_8));
            Assertions.assertEquals("captured https://a.example/", f.artifacts().readText(captured.log()));
            Assertions.assertEquals("{\"viewportSize\":{\"width\":1024}}", capture.captured().get(0).configJson());
            TaskView done = f.tasks().get(task.taskId()).orElseThrow();
            Assertions.assertEquals(TaskStatus.DONE, done.status());
            Assertions.assertEquals(captured.image(), done.result());
        }
    }

    @Test
    void changedCaptureFlowsThroughDiffTask() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-diff-task-")) {
            FakeCaptureEngine capture = new FakeCaptureEngine().render("https://a.example/", "v1");
            FakeDiffEngine diff = new FakeDiffEngine();
            TaskItemHandler handler = handler(f, capture, diff);
            ReleaseLifecycleManager lifecycle = f.lifecycle();

            ReleaseView first = candidate(f);
            lifecycle.createOrUpdateRun(first.id(), "index", "https://a.example/", "{}");
            handler.handle(item(f.tasks().lease("w", 60_000L).orElseThrow()));
            lifecycle.promote(first.id());

            capture.render("https://a.example/", "v2");
            ReleaseView second = lifecycle.createCandidate(first.buildId(), "homepage", null);
            RunView run = lifecycle.createOrUpdateRun(second.id(), "index", "https://a.example/", "{}");
            handler.handle(item(f.tasks().lease("w", 60_000L).orElseThrow()));
            Assertions.assertEquals(RunStatus.DIFF_NEEDED, lifecycle.run(run.id()).orElseThrow().status());

            TaskQueue.LeasedTask diffTask = f.tasks()
                    .lease("w", 60_000L, EnumSet.of(TaskType.DIFF), System.currentTimeMillis())
                    .orElseThrow();
            HandlerResult result = handler.handle(item(diffTask));

            Assertions.assertTrue(result.success());
            RunView diffed = lifecycle.run(run.id()).orElseThrow();
            Assertions.assertEquals(RunStatus.DIFF_NEEDED, diffed.status());
            Assertions.assertEquals("diff:v1->v2", new String(f.artifacts().read(diffed.diffImage()), StandardCharsets.UTF_8));
            Assertions.assertEquals("1234 (0.25)", f.artifacts().readText(diffed.diffLog()));
            Assertions.assertEquals(1, diff.calls());
        }
    }

    @Test
    void failedAttemptIsHandedBackToTheTaskQueue() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-task-retry-", new TaskQueue.RetryPolicy(1, 0L, 0L))) {
            FakeCaptureEngine capture = new FakeCaptureEngine().failTimes("https://a.example/", 5);
            TaskItemHandler handler = handler(f, capture, new FakeDiffEngine());
            ReleaseView candidate = candidate(f);
            RunView run = f.lifecycle().createOrUpdateRun(candidate.id(), "index", "https://a.example/", "{}");

            TaskQueue.LeasedTask first = f.tasks().lease("w", 60_000L).orElseThrow();
            HandlerResult retry = handler.handle(item(first));
            Assertions.assertTrue(retry.success());
            TaskView requeued = f.tasks().get(first.taskId()).orElseThrow();
            Assertions.assertEquals(TaskStatus.QUEUED, requeued.status());
            Assertions.assertEquals(1, requeued.attemptCount());

            handler.handle(item(f.tasks().lease("w", 60_000L).orElseThrow()));

            RunView failed = f.lifecycle().run(run.id()).orElseThrow();
            Assertions.assertEquals(RunStatus.FAILED, failed.status());
            Assertions.assertEquals("page load timed out: https://a.example/", f.artifacts().readText(failed.log()));
            Assertions.assertEquals(TaskStatus.FAILED, f.tasks().get(first.taskId()).orElseThrow().status());
        }
    }

    @Test
    void resultOfTaskCanceledMidFlightIsDiscarded() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-task-canceled-")) {
            TaskItemHandler handler = handler(f, new FakeCaptureEngine(), new FakeDiffEngine());
            ReleaseView candidate = candidate(f);
            RunView run = f.lifecycle().createOrUpdateRun(candidate.id(), "index", "https://a.example/", "{}");
            TaskQueue.LeasedTask task = f.tasks().lease("w", 60_000L).orElseThrow();
            f.lifecycle().createCandidate(candidate.buildId(), "homepage", null);

            HandlerResult result = handler.handle(item(task));

            Assertions.assertTrue(result.success());
            Assertions.assertTrue(result.output().startsWith("discarded"));
            Assertions.assertNull(f.lifecycle().run(run.id()).orElseThrow().image());
            Assertions.assertEquals(TaskStatus.CANCELED, f.tasks().get(task.taskId()).orElseThrow().status());
        }
    }

    @Test
    void malformedTaskItemIsAValidationFailure() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-task-malformed-")) {
            TaskItemHandler handler = handler(f, new FakeCaptureEngine(), new FakeDiffEngine());

            Assertions.assertThrows(ValidationException.class,
                    () -> handler.handle(WorkItem.root(WorkItemKind.TASK, "not json")));
        }
    }

    private static TaskItemHandler handler(StoreFixture f, CaptureEngine capture, DiffEngine diff) {
        return new TaskItemHandler(
                new CaptureWorker(capture, f.artifacts(), f.lifecycle()),
                new DiffWorker(diff, f.artifacts(), f.lifecycle()),
                f.lifecycle()
        );
    }

    private static ReleaseView candidate(StoreFixture f) {
        long buildId = f.lifecycle().createBuild("site-A", false).id();
        return f.lifecycle().createCandidate(buildId, "homepage", null);
    }

    private static WorkItem item(TaskQueue.LeasedTask task) {
        return WorkItem.root(WorkItemKind.TASK, Jsons.toJson(task));
    }
}
