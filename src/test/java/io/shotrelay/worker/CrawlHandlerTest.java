package io.shotrelay.worker;

import io.shotrelay.coordinator.HandlerResult;
import io.shotrelay.coordinator.WorkItem;
import io.shotrelay.coordinator.WorkItemKind;
import io.shotrelay.crawler.Crawler;
import io.shotrelay.error.TransientTaskException;
import io.shotrelay.error.ValidationException;
import io.shotrelay.model.CaptureRequest;
import io.shotrelay.model.CrawlRequest;
import io.shotrelay.model.ReleaseView;
import io.shotrelay.model.RunView;
import io.shotrelay.testing.StoreFixture;
import io.shotrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

final class CrawlHandlerTest {

    @Test
    void crawlEmitsOneCaptureRequestPerPage() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-crawl-")) {
            long buildId = f.lifecycle().createBuild("site-A", false).id();
            Crawler crawler = (root, depth, ignore) -> List.of(
                    root, root.resolve("/about"), root.resolve("/search?q=shoes"));
            Clock clock = Clock.fixed(Instant.parse("2024-03-05T06:07:08Z"), ZoneOffset.UTC);
            CrawlHandler handler = new CrawlHandler(crawler, f.lifecycle(), clock);

            HandlerResult result = handler.handle(WorkItem.root(WorkItemKind.CRAWL, Jsons.toJson(
                    new CrawlRequest(buildId, "https://a.example/", null, 1, null, "{}"))));

            Assertions.assertTrue(result.success());
            ReleaseView candidate = f.lifecycle().activeCandidate(buildId).orElseThrow();
            Assertions.assertEquals("20240305-060708", candidate.name());
            Assertions.assertTrue(result.children().stream().allMatch(child -> child.kind() == WorkItemKind.CAPTURE_REQUEST));
            List<CaptureRequest> requests = result.children().stream()
                    .map(child -> Jsons.fromJson(child.payload(), CaptureRequest.class))
                    .toList();
            Assertions.assertEquals(List.of("/", "/about", "/search?q=shoes"),
                    requests.stream().map(CaptureRequest::runName).toList());
            Assertions.assertTrue(requests.stream().allMatch(r -> r.releaseName().equals(candidate.name())));
            Assertions.assertTrue(result.children().stream().noneMatch(WorkItem::root));
        }
    }

    @Test
    void captureRequestsJoinTheSameCandidate() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-capture-request-")) {
            long buildId = f.lifecycle().createBuild("site-A", false).id();
            CaptureRequestHandler handler = new CaptureRequestHandler(f.lifecycle());

            handler.handle(WorkItem.child(WorkItemKind.CAPTURE_REQUEST, Jsons.toJson(
                    new CaptureRequest(buildId, "nightly", "/", "https://a.example/", "{}"))));
            handler.handle(WorkItem.child(WorkItemKind.CAPTURE_REQUEST, Jsons.toJson(
                    new CaptureRequest(buildId, "nightly", "/about", "https://a.example/about", "{}"))));

            List<ReleaseView> releases = f.lifecycle().releases(buildId);
            Assertions.assertEquals(1, releases.size());
            List<RunView> runs = f.lifecycle().runs(releases.get(0).id());
            Assertions.assertEquals(List.of("/", "/about"), runs.stream().map(RunView::name).toList());
            Assertions.assertEquals(2, f.tasks().listByOwner(releases.get(0).id()).size());
        }
    }

    @Test
    void invalidRootIsRejectedAndCrawlErrorsAreTransient() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-crawl-errors-")) {
            long buildId = f.lifecycle().createBuild("site-A", false).id();
            Crawler failing = (root, depth, ignore) -> {
                throw new IOException("connection refused");
            };
            CrawlHandler handler = new CrawlHandler(failing, f.lifecycle());

            Assertions.assertThrows(ValidationException.class, () -> handler.handle(WorkItem.root(WorkItemKind.CRAWL,
                    Jsons.toJson(new CrawlRequest(buildId, "not a url", "r", 1, null, "{}")))));
            Assertions.assertThrows(ValidationException.class, () -> handler.handle(WorkItem.root(WorkItemKind.CRAWL,
                    Jsons.toJson(new CrawlRequest(buildId, " ", "r", 1, null, "{}")))));
            Assertions.assertThrows(TransientTaskException.class, () -> handler.handle(WorkItem.root(WorkItemKind.CRAWL,
                    Jsons.toJson(new CrawlRequest(buildId, "https://a.example/", "r", 1, null, "{}")))));
        }
    }

    @Test
    void runNameIsPathAndQuery() {
        Assertions.assertEquals("/", CrawlHandler.runName(URI.create("https://a.example")));
        Assertions.assertEquals("/docs/intro", CrawlHandler.runName(URI.create("https://a.example/docs/intro")));
        Assertions.assertEquals("/list?page=2", CrawlHandler.runName(URI.create("https://a.example/list?page=2")));
    }
}
