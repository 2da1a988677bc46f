package com.siteready.audit.service;

import com.siteready.audit.crawl.CrawlBatchService;
import com.siteready.audit.discovery.PageDiscoveryService;
import com.siteready.audit.model.AggregatedScores;
import com.siteready.audit.model.AuditTarget;
import com.siteready.audit.model.CrawlResult;
import com.siteready.audit.model.DiscoveryResult;
import com.siteready.audit.model.EeatReport;
import com.siteready.audit.model.PageScore;
import com.siteready.audit.model.RslReport;
import com.siteready.audit.model.SiteAuditReport;
import com.siteready.audit.robots.RslAnalyzer;
import com.siteready.audit.scoring.PageScorer;
import com.siteready.audit.scoring.ScoreAggregator;
import com.siteready.audit.signals.EeatAnalyzer;
import com.siteready.audit.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class SiteAuditService {
    private static final Logger log = LoggerFactory.getLogger(SiteAuditService.class);

    private final SiteWideChecks siteWideChecks;
    private final PageDiscoveryService pageDiscoveryService;
    private final CrawlBatchService crawlBatchService;
    private final PageScorer pageScorer;
    private final ScoreAggregator scoreAggregator;
    private final ExecutorService auditRunExecutor;

    public SiteAuditService(
        SiteWideChecks siteWideChecks,
        PageDiscoveryService pageDiscoveryService,
        CrawlBatchService crawlBatchService,
        PageScorer pageScorer,
        ScoreAggregator scoreAggregator,
        @Qualifier("auditRunExecutor") ExecutorService auditRunExecutor
    ) {
        this.siteWideChecks = siteWideChecks;
        this.pageDiscoveryService = pageDiscoveryService;
        this.crawlBatchService = crawlBatchService;
        this.pageScorer = pageScorer;
        this.scoreAggregator = scoreAggregator;
        this.auditRunExecutor = auditRunExecutor;
    }

    public SiteAuditReport audit(AuditTarget target) {
        Future<SiteAuditReport> run = auditRunExecutor.submit(() -> runPipeline(target));
        try {
            return run.get(target.deadline().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            run.cancel(true);
            log.warn("Site audit of {} abandoned after {}s deadline", target.url(), target.deadline().toSeconds());
            return SiteAuditReport.timedOut(target);
        } catch (InterruptedException e) {
            run.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while auditing " + target.url(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Site audit of " + target.url() + " failed", e.getCause());
        }
    }

    SiteAuditReport runPipeline(AuditTarget target) {
        long startedAt = System.nanoTime();
        List<String> errors = new ArrayList<>();
        transition(target, AuditState.INIT, AuditState.SITE_WIDE_CHECKS);

        SiteWideCheckResults checks = siteWideChecks.run(target);
        errors.addAll(checks.errors());
        CrawlResult seed = checks.seed();

        transition(target, AuditState.SITE_WIDE_CHECKS, AuditState.DISCOVERY);
        DiscoveryResult discovery = pageDiscoveryService.discover(
            target.url(),
            target.maxPages(),
            checks.rawRobots(),
            seed.success() ? seed.links() : List.of(),
            target.requestTimeout()
        );

        transition(target, AuditState.DISCOVERY, AuditState.BATCH_CRAWL);
        String seedKey = UrlUtils.normalize(target.url());
        List<String> remaining = discovery.sampledUrls().stream()
            .filter(url -> !UrlUtils.normalize(url).equals(seedKey))
            .toList();
        List<CrawlResult> crawled = crawlBatchService.crawlAll(remaining, target.crawlDelay(), target.requestTimeout());

        transition(target, AuditState.BATCH_CRAWL, AuditState.PAGE_SCORING);
        List<PageScore> pages = new ArrayList<>(crawled.size() + 1);
        if (!seed.success()) {
            errors.add("Seed crawl error: " + seed.error());
        }
        pages.add(pageScorer.score(seed));
        for (CrawlResult result : crawled) {
            pages.add(pageScorer.score(result));
        }

        transition(target, AuditState.PAGE_SCORING, AuditState.AGGREGATION);
        AggregatedScores aggregated = scoreAggregator.aggregate(pages, checks.robots(), checks.contextFile());
        int pagesFailed = (int) pages.stream().filter(page -> !page.errors().isEmpty()).count();
        RslReport rsl = RslAnalyzer.analyze(checks.rawRobots());
        EeatReport eeat = EeatAnalyzer.analyze(seed.success() ? seed.html() : "", target.url());

        transition(target, AuditState.AGGREGATION, AuditState.DONE);
        log.info(
            "Site audit {} done: overall={}, pages={}, failed={}, method={}, errors={}, elapsedMs={}",
            target.url(),
            aggregated.overallScore(),
            pages.size(),
            pagesFailed,
            discovery.method().label(),
            errors.size(),
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt)
        );
        return new SiteAuditReport(
            target.url(),
            target.domain(),
            aggregated.overallScore(),
            checks.robots(),
            checks.contextFile(),
            aggregated.structuredData(),
            aggregated.content(),
            rsl,
            checks.contentUsage(),
            eeat,
            discovery,
            pages,
            pages.size(),
            pagesFailed,
            errors
        );
    }

    private void transition(AuditTarget target, AuditState from, AuditState to) {
        log.info("Site audit {}: {} -> {}", target.url(), from, to);
    }
}
