package io.shotrelay.coordinator;

/**
 * Observes item outcomes. Callbacks run on coordinator threads and must not block.
 */
public interface ItemListener {
    default void succeeded(WorkItem item, HandlerResult result) {
    }

    default void retrying(WorkItem item, HandlerResult result) {
    }

    default void failed(WorkItem item, HandlerResult result) {
    }
}
