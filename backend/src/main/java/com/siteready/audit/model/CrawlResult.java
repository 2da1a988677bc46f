package com.siteready.audit.model;

import java.util.List;

public record CrawlResult(
    String url,
    boolean success,
    int statusCode,
    String html,
    String markdown,
    List<String> links,
    String error
) {
    public CrawlResult {
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static CrawlResult failure(String url, int statusCode, String error) {
        return new CrawlResult(url, false, statusCode, null, null, List.of(), error);
    }
}
