package io.shotrelay.model;

public record DiffTaskPayload(
        long runId,
        long releaseId,
        String before,
        String after
) {
}
