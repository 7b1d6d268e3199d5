package io.shotrelay.worker;

import io.shotrelay.lifecycle.ReleaseLifecycleManager;
import io.shotrelay.model.CaptureTaskPayload;
import io.shotrelay.model.RunView;
import io.shotrelay.storage.ArtifactStore;
import io.shotrelay.storage.TaskQueue;
import io.shotrelay.util.Jsons;

/**
 * Executes a leased CAPTURE task: screenshots the page, stores image and log, and hands both to
 * the lifecycle manager together with the lease.
 */
public final class CaptureWorker {
    private final CaptureEngine engine;
    private final ArtifactStore artifacts;
    private final ReleaseLifecycleManager lifecycle;

    public CaptureWorker(CaptureEngine engine, ArtifactStore artifacts, ReleaseLifecycleManager lifecycle) {
        this.engine = engine;
        this.artifacts = artifacts;
        this.lifecycle = lifecycle;
    }

    public String execute(TaskQueue.LeasedTask task) {
        CaptureTaskPayload payload = Jsons.fromJson(task.payload(), CaptureTaskPayload.class);
        String configJson = payload.config() == null ? "{}" : artifacts.readText(payload.config());

        CaptureOutput output = engine.capture(new CaptureSpec(payload.url(), configJson));
        String image = artifacts.store(output.image(), ArtifactStore.IMAGE_PNG);
        String log = artifacts.storeText(output.log() == null ? "" : output.log(), ArtifactStore.TEXT_PLAIN);

        RunView run = lifecycle.recordCapture(payload.runId(), image, log, payload.config(), payload.baseline(), task);
        return (payload.baseline() ? "baseline " : "") + "capture recorded: run_id=" + run.id() + ", status=" + run.status();
    }
}
