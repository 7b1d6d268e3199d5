package io.shotrelay.coordinator;

public interface WorkItemHandler {
    WorkItemKind kind();

    HandlerResult handle(WorkItem item) throws Exception;
}
