package com.siteready.audit.model;

import java.util.List;

public interface ReadinessReport {
    String url();

    double overallScore();

    List<String> errors();
}
