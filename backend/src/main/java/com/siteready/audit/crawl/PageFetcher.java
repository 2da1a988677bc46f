package com.siteready.audit.crawl;

import com.siteready.audit.content.MarkdownPipeline;
import com.siteready.audit.http.PoliteHttpClient;
import com.siteready.audit.model.CrawlResult;
import com.siteready.audit.model.HttpFetchResult;
import com.siteready.audit.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final PoliteHttpClient httpClient;
    private final MarkdownPipeline markdownPipeline;

    public PageFetcher(PoliteHttpClient httpClient, MarkdownPipeline markdownPipeline) {
        this.httpClient = httpClient;
        this.markdownPipeline = markdownPipeline;
    }

    public CrawlResult fetch(String url, Duration timeout) {
        HttpFetchResult fetch = httpClient.get(url, PoliteHttpClient.HTML_ACCEPT, timeout);
        if (!fetch.isSuccessful()) {
            log.warn("Crawl of {} failed: {}", url, fetch.describeFailure());
            return CrawlResult.failure(url, fetch.statusCode(), fetch.describeFailure());
        }

        String html = fetch.body() == null ? "" : fetch.body();
        try {
            String markdown = markdownPipeline.toMarkdown(html);
            List<String> links = sameSiteLinks(html, fetch.finalUrlOrRequested());
            return new CrawlResult(url, true, fetch.statusCode(), html, markdown, links, null);
        } catch (RuntimeException e) {
            log.warn("Could not process page {}: {}", url, e.getMessage());
            return CrawlResult.failure(url, fetch.statusCode(), "Content processing failed: " + e.getMessage());
        }
    }

    /**
     * Absolute, fragment-free http(s) links on the same site as the page's final URL, in
     * document order.
     */
    static List<String> sameSiteLinks(String html, String pageUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html, pageUrl);
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String absolute = UrlUtils.stripFragment(anchor.absUrl("href"));
            if (absolute == null || absolute.isBlank() || !UrlUtils.isHttpUrl(absolute)) {
                continue;
            }
            if (UrlUtils.isSameSite(pageUrl, absolute)) {
                links.add(absolute);
            }
        }
        return new ArrayList<>(links);
    }
}
