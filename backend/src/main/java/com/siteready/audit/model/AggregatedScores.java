package com.siteready.audit.model;

public record AggregatedScores(
    StructuredDataReport structuredData,
    ContentReport content,
    double overallScore
) {
}
