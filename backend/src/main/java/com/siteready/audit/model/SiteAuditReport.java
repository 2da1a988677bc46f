package com.siteready.audit.model;

import java.util.List;

public record SiteAuditReport(
    String url,
    String domain,
    double overallScore,
    RobotsReport robots,
    ContextFileReport contextFile,
    StructuredDataReport structuredData,
    ContentReport content,
    RslReport rsl,
    ContentUsageReport contentUsage,
    EeatReport eeat,
    DiscoveryResult discovery,
    List<PageScore> pages,
    int pagesAttempted,
    int pagesFailed,
    List<String> errors
) implements ReadinessReport {
    public SiteAuditReport {
        pages = pages == null ? List.of() : List.copyOf(pages);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * The report returned when a run is abandoned at its deadline; nothing from the partial run
     * is kept.
     */
    public static SiteAuditReport timedOut(AuditTarget target) {
        String summary = "Timed out";
        return new SiteAuditReport(
            target.url(),
            target.domain(),
            0,
            RobotsReport.notFound(summary),
            ContextFileReport.notFound(summary),
            StructuredDataReport.empty(summary),
            ContentReport.empty(summary),
            RslReport.unavailable(summary),
            null,
            EeatReport.empty(summary),
            DiscoveryResult.timedOut(),
            List.of(),
            0,
            0,
            List.of("Audit timed out after " + target.deadline().toSeconds() + "s")
        );
    }
}
