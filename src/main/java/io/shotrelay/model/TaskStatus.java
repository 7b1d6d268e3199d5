package io.shotrelay.model;

public enum TaskStatus {
    QUEUED,
    LEASED,
    DONE,
    FAILED,
    CANCELED;

    public boolean outstanding() {
        return this == QUEUED || this == LEASED;
    }
}
