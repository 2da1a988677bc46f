package com.siteready.audit.model;

import com.siteready.audit.scoring.ReadinessScoring;
import com.siteready.audit.util.UrlUtils;

import java.time.Duration;
import java.util.List;

public record AuditTarget(
    String url,
    int maxPages,
    Duration requestTimeout,
    List<String> agents,
    Duration crawlDelay,
    Duration deadline
) {
    public AuditTarget {
        if (!UrlUtils.isHttpUrl(url)) {
            throw new IllegalArgumentException("Not an http(s) URL with a host: " + url);
        }
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be at least 1");
        }
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(15) : requestTimeout;
        agents = agents == null || agents.isEmpty() ? ReadinessScoring.DEFAULT_AGENTS : List.copyOf(agents);
        crawlDelay = crawlDelay == null || crawlDelay.isNegative() ? Duration.ZERO : crawlDelay;
        deadline = deadline == null ? Duration.ofSeconds(90) : deadline;
    }

    public static AuditTarget of(String url) {
        return new AuditTarget(url, 10, null, null, Duration.ofSeconds(1), null);
    }

    public String domain() {
        return UrlUtils.host(url);
    }

    public String origin() {
        return UrlUtils.origin(url);
    }
}
