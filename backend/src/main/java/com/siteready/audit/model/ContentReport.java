package com.siteready.audit.model;

import com.siteready.audit.scoring.ReadinessScoring;

public record ContentReport(
    int wordCount,
    int charCount,
    boolean hasHeadings,
    boolean hasLists,
    boolean hasCodeBlocks,
    int headingCount,
    boolean headingHierarchyValid,
    Double readabilityGrade,
    int chunkCount,
    int avgChunkWords,
    int chunksInSweetSpot,
    double answerFirstRatio,
    double score,
    String summary
) implements PillarReport {
    public static ContentReport empty(String summary) {
        return new ContentReport(0, 0, false, false, false, 0, true, null, 0, 0, 0, 0.0, 0, summary);
    }

    @Override
    public double maxScore() {
        return ReadinessScoring.CONTENT_MAX;
    }
}
