package com.siteready.audit.sitemap;

import com.siteready.audit.http.PoliteHttpClient;
import com.siteready.audit.model.HttpFetchResult;
import com.siteready.audit.model.SitemapDiscoveryResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Breadth-first sitemap walk: seed sitemaps first, then the children of sitemap indexes down to
 * {@code maxDepth}, stopping at {@code maxChildSitemaps} children or {@code maxUrls} page URLs.
 */
@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);

    private final PoliteHttpClient httpClient;

    public SitemapService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public SitemapDiscoveryResult discover(
        List<String> seedSitemaps,
        int maxDepth,
        int maxChildSitemaps,
        int maxUrls,
        Duration timeout
    ) {
        ArrayDeque<SitemapTask> queue = new ArrayDeque<>();
        LinkedHashSet<String> queued = new LinkedHashSet<>();
        for (String seed : seedSitemaps) {
            String normalized = normalizeSitemapUrl(seed);
            if (normalized != null && queued.add(normalized)) {
                queue.addLast(new SitemapTask(normalized, 0));
            }
        }

        LinkedHashSet<String> discoveredUrls = new LinkedHashSet<>();
        List<String> fetchedSitemaps = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        int childSitemapsQueued = 0;

        while (!queue.isEmpty() && discoveredUrls.size() < maxUrls) {
            SitemapTask current = queue.removeFirst();
            if (current.depth() > maxDepth) {
                continue;
            }

            HttpFetchResult fetch = httpClient.get(current.url(), PoliteHttpClient.XML_ACCEPT, timeout);
            if (!fetch.isSuccessful()) {
                increment(errors, errorKey(fetch));
                continue;
            }
            String xmlPayload;
            try {
                xmlPayload = extractXmlPayload(current.url(), fetch);
            } catch (IOException e) {
                log.debug("Could not gunzip sitemap {}: {}", current.url(), e.getMessage());
                increment(errors, "gzip_decode_error");
                continue;
            }
            if (xmlPayload == null || xmlPayload.isBlank()) {
                increment(errors, "empty_sitemap_payload");
                continue;
            }

            Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
            fetchedSitemaps.add(current.url());

            if (current.depth() < maxDepth) {
                for (Element loc : xml.select("sitemap > loc")) {
                    String child = normalizeSitemapUrl(loc.text());
                    if (child == null || childSitemapsQueued >= maxChildSitemaps || !queued.add(child)) {
                        continue;
                    }
                    queue.addLast(new SitemapTask(child, current.depth() + 1));
                    childSitemapsQueued++;
                }
            }

            for (Element urlElement : xml.select("url")) {
                Element locElement = urlElement.selectFirst("loc");
                if (locElement == null) {
                    continue;
                }
                String loc = locElement.text().trim();
                if (loc.isEmpty()) {
                    continue;
                }
                if (discoveredUrls.size() >= maxUrls) {
                    break;
                }
                discoveredUrls.add(loc);
            }
        }

        if (!errors.isEmpty()) {
            log.debug("Sitemap discovery errors: {}", errors);
        }
        return new SitemapDiscoveryResult(fetchedSitemaps, new ArrayList<>(discoveredUrls), errors);
    }

    private String errorKey(HttpFetchResult fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode();
        }
        if (fetch.statusCode() > 0) {
            return "http_" + fetch.statusCode();
        }
        return "unknown_error";
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.put(key, errors.getOrDefault(key, 0) + 1);
    }

    private String extractXmlPayload(String sitemapUrl, HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null && fetch.body() != null) {
            bodyBytes = fetch.body().getBytes(StandardCharsets.UTF_8);
        }
        if (bodyBytes == null) {
            return fetch.body();
        }

        if (isGzipPayload(sitemapUrl, fetch, bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private boolean isGzipPayload(String sitemapUrl, HttpFetchResult fetch, byte[] bodyBytes) {
        boolean magicBytes = bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
        if (magicBytes) {
            return true;
        }
        // plain XML served under a .gz name or gzip encoding is read as-is
        String requestedUrl = sitemapUrl == null ? "" : sitemapUrl.toLowerCase(Locale.ROOT);
        String resolvedUrl = fetch.finalUrlOrRequested() == null
            ? ""
            : fetch.finalUrlOrRequested().toLowerCase(Locale.ROOT);
        boolean named = requestedUrl.endsWith(".gz") || resolvedUrl.endsWith(".gz");
        boolean encoded = fetch.contentEncoding() != null
            && fetch.contentEncoding().toLowerCase(Locale.ROOT).contains("gzip");
        return (named || encoded) && bodyBytes.length >= 2 && bodyBytes[0] != '<';
    }

    private String normalizeSitemapUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String normalized = url.trim();
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return null;
        }
        return normalized;
    }

    private record SitemapTask(String url, int depth) {
    }
}
