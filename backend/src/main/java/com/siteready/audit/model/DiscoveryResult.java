package com.siteready.audit.model;

import java.util.List;

public record DiscoveryResult(
    DiscoveryMethod method,
    int candidatesFound,
    List<String> sampledUrls,
    String summary
) {
    public DiscoveryResult {
        sampledUrls = sampledUrls == null ? List.of() : List.copyOf(sampledUrls);
    }

    public static DiscoveryResult timedOut() {
        return new DiscoveryResult(DiscoveryMethod.TIMEOUT, 0, List.of(), "Timed out");
    }
}
