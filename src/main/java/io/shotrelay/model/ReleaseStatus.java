package io.shotrelay.model;

public enum ReleaseStatus {
    PROCESSING,
    GOOD,
    BAD;

    public boolean terminal() {
        return this != PROCESSING;
    }
}
