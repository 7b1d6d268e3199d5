package io.shotrelay.model;

/**
 * A page the crawler (or an operator) wants screenshotted. {@code runName} identifies the run
 * across releases, so it must be stable for the same page.
 */
public record CaptureRequest(
        long buildId,
        String releaseName,
        String runName,
        String url,
        String configJson
) {
}
