package com.siteready.audit.model;

import com.siteready.audit.scoring.ReadinessScoring;

public record ContextFileReport(
    boolean found,
    String url,
    boolean fullFound,
    String fullUrl,
    double score,
    String summary
) implements PillarReport {
    public static ContextFileReport notFound(String summary) {
        return new ContextFileReport(false, null, false, null, 0, summary);
    }

    @Override
    public double maxScore() {
        return ReadinessScoring.CONTEXT_FILE_MAX;
    }
}
