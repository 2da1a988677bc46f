package com.siteready.audit.service;

import com.siteready.audit.contextfile.ContextFileProbe;
import com.siteready.audit.crawl.PageFetcher;
import com.siteready.audit.model.AuditTarget;
import com.siteready.audit.model.ContentUsageReport;
import com.siteready.audit.model.ContextFileReport;
import com.siteready.audit.model.CrawlResult;
import com.siteready.audit.model.RobotsCheckResult;
import com.siteready.audit.model.RobotsReport;
import com.siteready.audit.robots.RobotsCheckService;
import com.siteready.audit.signals.ContentUsageCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

@Service
public class SiteWideChecks {
    private static final Logger log = LoggerFactory.getLogger(SiteWideChecks.class);
    static final String CHECK_FAILED = "Check failed";

    private final RobotsCheckService robotsCheckService;
    private final ContextFileProbe contextFileProbe;
    private final ContentUsageCheck contentUsageCheck;
    private final PageFetcher pageFetcher;
    private final ExecutorService checkExecutor;

    public SiteWideChecks(
        RobotsCheckService robotsCheckService,
        ContextFileProbe contextFileProbe,
        ContentUsageCheck contentUsageCheck,
        PageFetcher pageFetcher,
        @Qualifier("checkExecutor") ExecutorService checkExecutor
    ) {
        this.robotsCheckService = robotsCheckService;
        this.contextFileProbe = contextFileProbe;
        this.contentUsageCheck = contentUsageCheck;
        this.pageFetcher = pageFetcher;
        this.checkExecutor = checkExecutor;
    }

    public SiteWideCheckResults run(AuditTarget target) {
        CompletableFuture<TaskOutcome<RobotsCheckResult>> robotsFuture =
            submit("robots", target, () -> robotsCheckService.check(target));
        CompletableFuture<TaskOutcome<ContextFileReport>> contextFuture =
            submit("context file", target, () -> contextFileProbe.probe(target));
        CompletableFuture<TaskOutcome<ContentUsageReport>> contentUsageFuture =
            submit("content usage", target, () -> contentUsageCheck.check(target));
        CompletableFuture<TaskOutcome<CrawlResult>> seedFuture =
            submit("seed crawl", target, () -> pageFetcher.fetch(target.url(), target.requestTimeout()));

        List<String> errors = new ArrayList<>();

        TaskOutcome<RobotsCheckResult> robotsOutcome = robotsFuture.join();
        RobotsReport robots;
        String rawRobots = null;
        if (robotsOutcome.isSuccess()) {
            robots = robotsOutcome.value().report();
            rawRobots = robotsOutcome.value().rawText();
        } else {
            robots = RobotsReport.notFound(CHECK_FAILED);
            errors.add("Robots check failed: " + robotsOutcome.error());
        }

        TaskOutcome<ContextFileReport> contextOutcome = contextFuture.join();
        ContextFileReport contextFile;
        if (contextOutcome.isSuccess()) {
            contextFile = contextOutcome.value();
        } else {
            contextFile = ContextFileReport.notFound(CHECK_FAILED);
            errors.add("Context file check failed: " + contextOutcome.error());
        }

        // null when the check itself failed; the report then carries no Content-Usage section
        TaskOutcome<ContentUsageReport> contentUsageOutcome = contentUsageFuture.join();
        ContentUsageReport contentUsage = null;
        if (contentUsageOutcome.isSuccess()) {
            contentUsage = contentUsageOutcome.value();
        } else {
            errors.add("Content-Usage check failed: " + contentUsageOutcome.error());
        }

        TaskOutcome<CrawlResult> seedOutcome = seedFuture.join();
        CrawlResult seed = seedOutcome.isSuccess()
            ? seedOutcome.value()
            : CrawlResult.failure(target.url(), 0, seedOutcome.error());

        return new SiteWideCheckResults(robots, rawRobots, contextFile, contentUsage, seed, errors);
    }

    private <T> CompletableFuture<TaskOutcome<T>> submit(String name, AuditTarget target, Supplier<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return TaskOutcome.success(task.get());
            } catch (RuntimeException e) {
                log.warn("Site-wide {} check for {} failed: {}", name, target.url(), e.toString());
                return TaskOutcome.<T>failure(e);
            }
        }, checkExecutor);
    }
}
