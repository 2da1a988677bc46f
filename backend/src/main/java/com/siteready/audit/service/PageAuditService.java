package com.siteready.audit.service;

import com.siteready.audit.model.AuditReport;
import com.siteready.audit.model.AuditTarget;
import com.siteready.audit.model.CrawlResult;
import com.siteready.audit.model.PageScore;
import com.siteready.audit.robots.RslAnalyzer;
import com.siteready.audit.scoring.PageScorer;
import com.siteready.audit.scoring.ReadinessScoring;
import com.siteready.audit.signals.EeatAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class PageAuditService {
    private static final Logger log = LoggerFactory.getLogger(PageAuditService.class);

    private final SiteWideChecks siteWideChecks;
    private final PageScorer pageScorer;

    public PageAuditService(SiteWideChecks siteWideChecks, PageScorer pageScorer) {
        this.siteWideChecks = siteWideChecks;
        this.pageScorer = pageScorer;
    }

    public AuditReport audit(AuditTarget target) {
        SiteWideCheckResults checks = siteWideChecks.run(target);
        List<String> errors = new ArrayList<>(checks.errors());

        CrawlResult seed = checks.seed();
        if (!seed.success()) {
            errors.add("Crawl error: " + seed.error());
        }
        PageScore page = pageScorer.score(seed);

        double overall = ReadinessScoring.round1(
            checks.robots().score()
                + checks.contextFile().score()
                + page.structuredData().score()
                + page.content().score()
        );
        log.info("Page audit {} done: overall={}, errors={}", target.url(), overall, errors.size());
        return new AuditReport(
            target.url(),
            overall,
            checks.robots(),
            checks.contextFile(),
            page.structuredData(),
            page.content(),
            RslAnalyzer.analyze(checks.rawRobots()),
            checks.contentUsage(),
            EeatAnalyzer.analyze(seed.success() ? seed.html() : "", target.url()),
            errors
        );
    }
}
