package io.shotrelay.coordinator;

public enum WorkItemKind {
    CRAWL,
    CAPTURE_REQUEST,
    TASK
}
