package io.shotrelay.model;

import java.util.Locale;

public enum TaskType {
    CAPTURE,
    DIFF;

    public static TaskType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("task type must not be blank");
        }
        return TaskType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
