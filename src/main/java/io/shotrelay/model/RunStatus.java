package io.shotrelay.model;

public enum RunStatus {
    DATA_PENDING,
    DIFF_NEEDED,
    DIFF_APPROVED,
    FAILED
}
