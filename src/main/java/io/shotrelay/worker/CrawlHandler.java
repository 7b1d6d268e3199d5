package io.shotrelay.worker;

import io.shotrelay.coordinator.HandlerResult;
import io.shotrelay.coordinator.WorkItem;
import io.shotrelay.coordinator.WorkItemHandler;
import io.shotrelay.coordinator.WorkItemKind;
import io.shotrelay.crawler.Crawler;
import io.shotrelay.error.TransientTaskException;
import io.shotrelay.error.ValidationException;
import io.shotrelay.lifecycle.ReleaseLifecycleManager;
import io.shotrelay.model.CaptureRequest;
import io.shotrelay.model.CrawlRequest;
import io.shotrelay.model.ReleaseView;
import io.shotrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Crawls a site and emits one capture request per page found, all for the same candidate.
 */
public final class CrawlHandler implements WorkItemHandler {
    private static final Logger log = LoggerFactory.getLogger(CrawlHandler.class);
    private static final DateTimeFormatter RELEASE_NAME_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final Crawler crawler;
    private final ReleaseLifecycleManager lifecycle;
    private final Clock clock;

    public CrawlHandler(Crawler crawler, ReleaseLifecycleManager lifecycle) {
        this(crawler, lifecycle, Clock.systemUTC());
    }

    public CrawlHandler(Crawler crawler, ReleaseLifecycleManager lifecycle, Clock clock) {
        this.crawler = crawler;
        this.lifecycle = lifecycle;
        this.clock = clock;
    }

    @Override
    public WorkItemKind kind() {
        return WorkItemKind.CRAWL;
    }

    @Override
    public HandlerResult handle(WorkItem item) throws InterruptedException {
        CrawlRequest request;
        URI root;
        try {
            request = Jsons.fromJson(item.payload(), CrawlRequest.class);
            if (request.rootUrl() == null || request.rootUrl().isBlank()) {
                throw new ValidationException("Crawl root URL is required");
            }
            root = URI.create(request.rootUrl().trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid crawl request: " + e.getMessage());
        }
        if (root.getScheme() == null || root.getHost() == null) {
            throw new ValidationException("Crawl root must be an absolute URL: " + request.rootUrl());
        }
        String releaseName = request.releaseName() == null || request.releaseName().isBlank()
                ? RELEASE_NAME_FORMAT.format(clock.instant())
                : request.releaseName();
        ReleaseView release = lifecycle.ensureCandidate(request.buildId(), releaseName, request.rootUrl());

        List<URI> pages;
        try {
            pages = crawler.crawl(root, Math.max(0, request.depth()), request.ignorePrefixes());
        } catch (IOException e) {
            throw new TransientTaskException("Crawl of " + root + " failed: " + e.getMessage(), e);
        }

        List<WorkItem> children = new ArrayList<>();
        for (URI page : pages) {
            CaptureRequest capture = new CaptureRequest(
                    request.buildId(), release.name(), runName(page), page.toString(), request.configJson()
            );
            children.add(WorkItem.child(WorkItemKind.CAPTURE_REQUEST, Jsons.toJson(capture)));
        }
        log.info("Crawl finished: build_id={}, release_id={}, root={}, pages={}",
                request.buildId(), release.id(), root, pages.size());
        return HandlerResult.ok("crawled " + pages.size() + " pages for release " + release.id(), children);
    }

    static String runName(URI page) {
        String path = page.getRawPath() == null || page.getRawPath().isEmpty() ? "/" : page.getRawPath();
        return page.getRawQuery() == null ? path : path + "?" + page.getRawQuery();
    }
}
