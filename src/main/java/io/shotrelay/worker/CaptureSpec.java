package io.shotrelay.worker;

/**
 * What to screenshot: the page URL and the capture config document (viewport, cookies, resources
 * to ignore and so on) as JSON.
 */
public record CaptureSpec(
        String url,
        String configJson
) {
}
