package com.siteready.audit.model;

import java.util.List;
import java.util.Map;

public record SitemapDiscoveryResult(
    List<String> fetchedSitemaps,
    List<String> discoveredUrls,
    Map<String, Integer> errors
) {
}
