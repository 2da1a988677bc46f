package com.siteready.audit.model;

public interface PillarReport {
    double score();

    double maxScore();

    String summary();
}
