package com.siteready.audit.model;

import java.util.List;

public record RslReport(
    Double crawlDelay,
    List<String> sitemapUrls,
    List<String> aiSpecificAgents,
    String summary
) {
    public RslReport {
        sitemapUrls = sitemapUrls == null ? List.of() : List.copyOf(sitemapUrls);
        aiSpecificAgents = aiSpecificAgents == null ? List.of() : List.copyOf(aiSpecificAgents);
    }

    public static RslReport unavailable(String summary) {
        return new RslReport(null, List.of(), List.of(), summary);
    }

    public boolean hasCrawlDelay() {
        return crawlDelay != null;
    }
}
