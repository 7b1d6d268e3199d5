package io.shotrelay.error;

public enum ErrorKind {
    VALIDATION(false),
    CONFLICT(false),
    INVALID_STATE(false),
    NOT_FOUND(false),
    TRANSIENT(true),
    COORDINATOR_STOPPED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
