package com.siteready.audit.model;

import java.util.List;
import java.util.Map;

public record BatchAuditReport(
    List<String> urls,
    List<ReadinessReport> reports,
    Map<String, String> errors
) {
    public BatchAuditReport {
        urls = urls == null ? List.of() : List.copyOf(urls);
        reports = reports == null ? List.of() : List.copyOf(reports);
        errors = errors == null ? Map.of() : errors;
    }
}
