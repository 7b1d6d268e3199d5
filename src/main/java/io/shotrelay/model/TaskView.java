package io.shotrelay.model;

public record TaskView(
        String taskId,
        TaskType type,
        String payload,
        long ownerReleaseId,
        Long runId,
        TaskStatus status,
        int attemptCount,
        long availableAtMs,
        String leaseOwner,
        Long leaseDeadlineMs,
        long leaseEpoch,
        String result,
        String lastError,
        long createdAtMs,
        long updatedAtMs
) {
}
