package io.shotrelay.coordinator;

import java.util.UUID;

/**
 * A unit of workflow handed to the {@link WorkCoordinator}. {@code root} marks the seed item of a
 * workflow (e.g. the crawl a user asked for); items produced by handlers are children.
 */
public record WorkItem(
        String id,
        WorkItemKind kind,
        String payload,
        boolean root,
        int attempt
) {
    public static WorkItem root(WorkItemKind kind, String payload) {
        return new WorkItem("wi_" + UUID.randomUUID(), kind, payload, true, 1);
    }

    public static WorkItem child(WorkItemKind kind, String payload) {
        return new WorkItem("wi_" + UUID.randomUUID(), kind, payload, false, 1);
    }

    public WorkItem nextAttempt() {
        return new WorkItem(id, kind, payload, root, attempt + 1);
    }
}
