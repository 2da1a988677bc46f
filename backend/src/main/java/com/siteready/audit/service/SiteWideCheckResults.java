package com.siteready.audit.service;

import com.siteready.audit.model.ContentUsageReport;
import com.siteready.audit.model.ContextFileReport;
import com.siteready.audit.model.CrawlResult;
import com.siteready.audit.model.RobotsReport;

import java.util.List;

public record SiteWideCheckResults(
    RobotsReport robots,
    String rawRobots,
    ContextFileReport contextFile,
    ContentUsageReport contentUsage,
    CrawlResult seed,
    List<String> errors
) {
    public SiteWideCheckResults {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
