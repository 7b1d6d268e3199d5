package io.shotrelay.worker;

import io.shotrelay.lifecycle.ReleaseLifecycleManager;
import io.shotrelay.model.DiffTaskPayload;
import io.shotrelay.model.RunView;
import io.shotrelay.storage.ArtifactStore;
import io.shotrelay.storage.TaskQueue;
import io.shotrelay.util.Jsons;

public final class DiffWorker {
    private final DiffEngine engine;
    private final ArtifactStore artifacts;
    private final ReleaseLifecycleManager lifecycle;

    public DiffWorker(DiffEngine engine, ArtifactStore artifacts, ReleaseLifecycleManager lifecycle) {
        this.engine = engine;
        this.artifacts = artifacts;
        this.lifecycle = lifecycle;
    }

    public String execute(TaskQueue.LeasedTask task) {
        DiffTaskPayload payload = Jsons.fromJson(task.payload(), DiffTaskPayload.class);
        byte[] before = artifacts.read(payload.before());
        byte[] after = artifacts.read(payload.after());

        DiffOutput output = engine.diff(before, after);
        String diffImage = output.identical() ? null : artifacts.store(output.diffImage(), ArtifactStore.IMAGE_PNG);
        String diffLog = artifacts.storeText(output.log() == null ? "" : output.log(), ArtifactStore.TEXT_PLAIN);

        RunView run = lifecycle.recordDiff(payload.runId(), diffImage, diffLog, task);
        return "diff recorded: run_id=" + run.id() + ", status=" + run.status() + ", identical=" + output.identical();
    }
}
