package io.shotrelay.model;

import java.util.List;

/**
 * Seed of a site crawl: every page found under {@code rootUrl} becomes a run in the release named
 * {@code releaseName} (a timestamp when absent).
 */
public record CrawlRequest(
        long buildId,
        String rootUrl,
        String releaseName,
        int depth,
        List<String> ignorePrefixes,
        String configJson
) {
    public CrawlRequest {
        ignorePrefixes = ignorePrefixes == null ? List.of() : List.copyOf(ignorePrefixes);
    }
}
