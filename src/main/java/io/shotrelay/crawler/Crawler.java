package io.shotrelay.crawler;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * Discovers the pages of a site to screenshot. The root itself is always part of the result.
 */
public interface Crawler {
    List<URI> crawl(URI root, int depth, List<String> ignorePrefixes) throws IOException, InterruptedException;
}
