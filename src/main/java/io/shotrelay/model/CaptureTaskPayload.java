package io.shotrelay.model;

/**
 * Payload of a CAPTURE task. {@code config} is the artifact hash of the capture config document;
 * {@code baseline} marks a capture that fills the run's reference fields instead of its own.
 */
public record CaptureTaskPayload(
        long runId,
        long releaseId,
        String url,
        String config,
        boolean baseline
) {
}
