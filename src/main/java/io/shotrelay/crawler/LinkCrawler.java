package io.shotrelay.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Breadth-first crawler following {@code href} links that stay under the root URL.
 *
 * <p>Depth 0 returns only the root. Links are resolved against the page they appear on, stripped
 * of fragments, and kept only when they share the root's scheme and authority and start with the
 * root's URL prefix. URLs starting with any ignore prefix are skipped.
 */
public final class LinkCrawler implements Crawler {
    private static final Logger log = LoggerFactory.getLogger(LinkCrawler.class);
    private static final Pattern HREF = Pattern.compile("href\\s*=\\s*[\"']([^\"'<>\\s]+)[\"']", Pattern.CASE_INSENSITIVE);
    private static final int DEFAULT_MAX_PAGES = 500;

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final int maxPages;

    public LinkCrawler() {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .connectTimeout(Duration.ofSeconds(10))
                        .build(),
                Duration.ofSeconds(20),
                DEFAULT_MAX_PAGES);
    }

    public LinkCrawler(HttpClient httpClient, Duration requestTimeout, int maxPages) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.maxPages = Math.max(1, maxPages);
    }

    @Override
    public List<URI> crawl(URI root, int depth, List<String> ignorePrefixes) throws IOException, InterruptedException {
        URI start = normalize(root);
        String prefix = start.toString();
        Set<URI> seen = new LinkedHashSet<>();
        Deque<Frontier> frontier = new ArrayDeque<>();
        seen.add(start);
        frontier.add(new Frontier(start, 0));

        while (!frontier.isEmpty()) {
            Frontier next = frontier.poll();
            if (next.depth() >= depth) {
                continue;
            }
            String html = fetchHtml(next.uri(), next.uri().equals(start));
            if (html == null) {
                continue;
            }
            for (URI link : extractLinks(next.uri(), html)) {
                if (seen.size() >= maxPages) {
                    log.warn("Crawl page limit reached: root={}, limit={}", start, maxPages);
                    return new ArrayList<>(seen);
                }
                if (!link.toString().startsWith(prefix) || ignored(link, ignorePrefixes) || !seen.add(link)) {
                    continue;
                }
                frontier.add(new Frontier(link, next.depth() + 1));
            }
        }
        return new ArrayList<>(seen);
    }

    private String fetchHtml(URI uri, boolean root) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "text/html")
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            if (root) {
                throw e;
            }
            log.info("Skipping unreachable page: url={}, error={}", uri, e.getMessage());
            return null;
        }
        if (response.statusCode() / 100 != 2) {
            if (root) {
                throw new IOException("crawl root returned status=" + response.statusCode());
            }
            log.info("Skipping page: url={}, status={}", uri, response.statusCode());
            return null;
        }
        String contentType = response.headers().firstValue("Content-Type").orElse("text/html");
        if (!contentType.toLowerCase(Locale.ROOT).contains("html")) {
            return null;
        }
        return response.body();
    }

    static List<URI> extractLinks(URI base, String html) {
        List<URI> out = new ArrayList<>();
        Matcher m = HREF.matcher(html);
        while (m.find()) {
            String raw = m.group(1).trim();
            String lower = raw.toLowerCase(Locale.ROOT);
            if (raw.isEmpty() || raw.startsWith("#") || lower.startsWith("javascript:") || lower.startsWith("mailto:")) {
                continue;
            }
            try {
                URI resolved = base.resolve(new URI(raw.replace("&amp;", "&")));
                String scheme = resolved.getScheme();
                if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                    continue;
                }
                out.add(normalize(resolved));
            } catch (URISyntaxException | IllegalArgumentException e) {
                log.debug("Ignoring malformed link: base={}, href={}", base, raw);
            }
        }
        return out;
    }

    private static boolean ignored(URI link, List<String> ignorePrefixes) {
        if (ignorePrefixes == null) {
            return false;
        }
        String text = link.toString();
        for (String prefix : ignorePrefixes) {
            if (prefix != null && !prefix.isBlank() && text.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static URI normalize(URI uri) {
        try {
            String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
            return new URI(uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority() + path
                    + (uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery()));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Cannot normalize URL: " + uri, e);
        }
    }

    private record Frontier(URI uri, int depth) {
    }
}
