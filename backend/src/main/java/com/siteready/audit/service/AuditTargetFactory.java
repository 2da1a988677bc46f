package com.siteready.audit.service;

import com.siteready.audit.model.AuditTarget;
import com.siteready.audit.util.UrlUtils;
import com.siteready.config.SiteReadyProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class AuditTargetFactory {
    private final SiteReadyProperties properties;

    public AuditTargetFactory(SiteReadyProperties properties) {
        this.properties = properties;
    }

    public AuditTarget create(String url) {
        return create(url, null);
    }

    /**
     * @throws IllegalArgumentException when the URL is blank or has no host
     */
    public AuditTarget create(String url, Integer maxPages) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        int pages = maxPages == null ? properties.getMaxPages() : maxPages;
        return new AuditTarget(
            UrlUtils.ensureScheme(url),
            pages,
            Duration.ofSeconds(properties.getRequestTimeoutSeconds()),
            properties.getAgents(),
            Duration.ofMillis(properties.getCrawlDelayMs()),
            Duration.ofSeconds(properties.getSiteDeadlineSeconds())
        );
    }
}
