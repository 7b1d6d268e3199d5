package io.shotrelay.coordinator;

import io.shotrelay.error.ErrorKind;

import java.util.List;

/**
 * Outcome of one handler invocation. Failures carry an {@link ErrorKind}; the coordinator retries
 * only retryable kinds.
 */
public record HandlerResult(
        boolean success,
        String output,
        List<WorkItem> children,
        ErrorKind errorKind,
        String error
) {
    public HandlerResult {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static HandlerResult ok(String output) {
        return new HandlerResult(true, output, List.of(), null, null);
    }

    public static HandlerResult ok(String output, List<WorkItem> children) {
        return new HandlerResult(true, output, children, null, null);
    }

    public static HandlerResult fail(ErrorKind kind, String error) {
        return new HandlerResult(false, null, List.of(), kind, error);
    }

    public boolean retryable() {
        return !success && errorKind != null && errorKind.retryable();
    }
}
