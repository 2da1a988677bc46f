package com.siteready.audit.model;

import java.util.List;

public record AuditReport(
    String url,
    double overallScore,
    RobotsReport robots,
    ContextFileReport contextFile,
    StructuredDataReport structuredData,
    ContentReport content,
    RslReport rsl,
    ContentUsageReport contentUsage,
    EeatReport eeat,
    List<String> errors
) implements ReadinessReport {
    public AuditReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
