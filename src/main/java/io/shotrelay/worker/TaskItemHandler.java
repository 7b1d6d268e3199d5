package io.shotrelay.worker;

import io.shotrelay.coordinator.HandlerResult;
import io.shotrelay.coordinator.WorkItem;
import io.shotrelay.coordinator.WorkItemHandler;
import io.shotrelay.coordinator.WorkItemKind;
import io.shotrelay.error.InvalidStateException;
import io.shotrelay.error.NotFoundException;
import io.shotrelay.error.TransientTaskException;
import io.shotrelay.error.ValidationException;
import io.shotrelay.lifecycle.ReleaseLifecycleManager;
import io.shotrelay.storage.TaskQueue;
import io.shotrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs leased capture and diff tasks.
 *
 * <p>Task retries belong to the task queue: an attempt that fails is reported through
 * {@link ReleaseLifecycleManager#recordTaskFailure} and the work item itself still succeeds. A
 * result for a task canceled mid-flight is discarded.
 */
public final class TaskItemHandler implements WorkItemHandler {
    private static final Logger log = LoggerFactory.getLogger(TaskItemHandler.class);

    private final CaptureWorker captureWorker;
    private final DiffWorker diffWorker;
    private final ReleaseLifecycleManager lifecycle;

    public TaskItemHandler(CaptureWorker captureWorker, DiffWorker diffWorker, ReleaseLifecycleManager lifecycle) {
        this.captureWorker = captureWorker;
        this.diffWorker = diffWorker;
        this.lifecycle = lifecycle;
    }

    @Override
    public WorkItemKind kind() {
        return WorkItemKind.TASK;
    }

    @Override
    public HandlerResult handle(WorkItem item) {
        TaskQueue.LeasedTask task;
        try {
            task = Jsons.fromJson(item.payload(), TaskQueue.LeasedTask.class);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        try {
            String output = switch (task.type()) {
                case CAPTURE -> captureWorker.execute(task);
                case DIFF -> diffWorker.execute(task);
            };
            return HandlerResult.ok(output);
        } catch (TransientTaskException | NotFoundException | ValidationException e) {
            return reportFailure(task, e.getMessage());
        } catch (InvalidStateException e) {
            log.info("Discarding task result: task_id={}, type={}, reason={}", task.taskId(), task.type(), e.getMessage());
            return HandlerResult.ok("discarded: " + e.getMessage());
        }
    }

    private HandlerResult reportFailure(TaskQueue.LeasedTask task, String error) {
        log.warn("Task attempt failed: task_id={}, type={}, attempt={}, error={}",
                task.taskId(), task.type(), task.attemptCount() + 1, error);
        try {
            TaskQueue.FailOutcome outcome = lifecycle.recordTaskFailure(task, error);
            return HandlerResult.ok("task " + outcome.disposition() + " after attempt " + outcome.attemptCount());
        } catch (InvalidStateException e) {
            log.info("Task no longer leased, failure dropped: task_id={}, reason={}", task.taskId(), e.getMessage());
            return HandlerResult.ok("discarded: " + e.getMessage());
        }
    }
}
