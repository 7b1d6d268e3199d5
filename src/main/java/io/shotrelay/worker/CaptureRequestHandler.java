package io.shotrelay.worker;

import io.shotrelay.coordinator.HandlerResult;
import io.shotrelay.coordinator.WorkItem;
import io.shotrelay.coordinator.WorkItemHandler;
import io.shotrelay.coordinator.WorkItemKind;
import io.shotrelay.error.ValidationException;
import io.shotrelay.lifecycle.ReleaseLifecycleManager;
import io.shotrelay.model.CaptureRequest;
import io.shotrelay.model.ReleaseView;
import io.shotrelay.model.RunView;
import io.shotrelay.util.Jsons;

/**
 * Turns a capture request into a run of the build's active candidate, opening the candidate when
 * needed. The run's CAPTURE task is enqueued by the lifecycle manager.
 */
public final class CaptureRequestHandler implements WorkItemHandler {
    private final ReleaseLifecycleManager lifecycle;

    public CaptureRequestHandler(ReleaseLifecycleManager lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public WorkItemKind kind() {
        return WorkItemKind.CAPTURE_REQUEST;
    }

    @Override
    public HandlerResult handle(WorkItem item) {
        CaptureRequest request;
        try {
            request = Jsons.fromJson(item.payload(), CaptureRequest.class);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        ReleaseView release = lifecycle.ensureCandidate(request.buildId(), request.releaseName(), request.url());
        RunView run = lifecycle.createOrUpdateRun(release.id(), request.runName(), request.url(), request.configJson());
        return HandlerResult.ok("run requested: release_id=" + release.id() + ", run_id=" + run.id() + ", run_name=" + run.name());
    }
}
