package com.siteready.audit.model;

import com.siteready.audit.scoring.ReadinessScoring;

import java.util.List;

public record StructuredDataReport(
    int blocksFound,
    List<StructuredDataItem> items,
    double score,
    String summary
) implements PillarReport {
    public StructuredDataReport {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static StructuredDataReport empty(String summary) {
        return new StructuredDataReport(0, List.of(), 0, summary);
    }

    @Override
    public double maxScore() {
        return ReadinessScoring.STRUCTURED_DATA_MAX;
    }
}
