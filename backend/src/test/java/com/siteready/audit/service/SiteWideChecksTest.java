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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SiteWideChecksTest {
    private static final AuditTarget TARGET = AuditTarget.of("https://example.com/");

    @Mock
    private RobotsCheckService robotsCheckService;
    @Mock
    private ContextFileProbe contextFileProbe;
    @Mock
    private ContentUsageCheck contentUsageCheck;
    @Mock
    private PageFetcher pageFetcher;

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void collectsAllFourResults() {
        RobotsReport robots = new RobotsReport(true, List.of(), 25, "0/0 AI agents allowed");
        ContextFileReport contextFile = ContextFileReport.notFound("llms.txt not found");
        ContentUsageReport contentUsage = ContentUsageReport.notFound("Content-Usage header not found");
        CrawlResult seed = new CrawlResult("https://example.com/", true, 200, "<p>x</p>", "x\n", List.of(), null);
        when(robotsCheckService.check(TARGET)).thenReturn(new RobotsCheckResult(robots, "User-agent: *"));
        when(contextFileProbe.probe(TARGET)).thenReturn(contextFile);
        when(contentUsageCheck.check(TARGET)).thenReturn(contentUsage);
        when(pageFetcher.fetch(eq("https://example.com/"), any(Duration.class))).thenReturn(seed);

        SiteWideCheckResults results = checks().run(TARGET);

        assertThat(results.robots()).isEqualTo(robots);
        assertThat(results.rawRobots()).isEqualTo("User-agent: *");
        assertThat(results.contextFile()).isEqualTo(contextFile);
        assertThat(results.contentUsage()).isEqualTo(contentUsage);
        assertThat(results.seed()).isEqualTo(seed);
        assertThat(results.errors()).isEmpty();
    }

    @Test
    void failingChecksBecomeFailedReports() {
        when(robotsCheckService.check(TARGET)).thenThrow(new IllegalStateException("robots parser crashed"));
        when(contextFileProbe.probe(TARGET)).thenThrow(new IllegalStateException("lookup crashed"));
        when(contentUsageCheck.check(TARGET)).thenThrow(new IllegalStateException("HEAD crashed"));
        when(pageFetcher.fetch(eq("https://example.com/"), any(Duration.class)))
            .thenThrow(new IllegalStateException("fetch crashed"));

        SiteWideCheckResults results = checks().run(TARGET);

        assertThat(results.robots().summary()).isEqualTo(SiteWideChecks.CHECK_FAILED);
        assertThat(results.robots().score()).isZero();
        assertThat(results.rawRobots()).isNull();
        assertThat(results.contextFile().summary()).isEqualTo(SiteWideChecks.CHECK_FAILED);
        assertThat(results.errors()).containsExactly(
            "Robots check failed: robots parser crashed",
            "Context file check failed: lookup crashed",
            "Content-Usage check failed: HEAD crashed"
        );
        assertThat(results.contentUsage()).isNull();
        assertThat(results.seed().success()).isFalse();
        assertThat(results.seed().error()).isEqualTo("fetch crashed");
    }

    @Test
    void failedContentUsageCheckLeavesOtherResultsIntact() {
        RobotsReport robots = new RobotsReport(true, List.of(), 25, "0/0 AI agents allowed");
        ContextFileReport contextFile = ContextFileReport.notFound("llms.txt not found");
        CrawlResult seed = new CrawlResult("https://example.com/", true, 200, "<p>x</p>", "x\n", List.of(), null);
        when(robotsCheckService.check(TARGET)).thenReturn(new RobotsCheckResult(robots, "User-agent: *"));
        when(contextFileProbe.probe(TARGET)).thenReturn(contextFile);
        when(contentUsageCheck.check(TARGET)).thenThrow(new IllegalStateException("HEAD crashed"));
        when(pageFetcher.fetch(eq("https://example.com/"), any(Duration.class))).thenReturn(seed);

        SiteWideCheckResults results = checks().run(TARGET);

        assertThat(results.robots()).isEqualTo(robots);
        assertThat(results.contextFile()).isEqualTo(contextFile);
        assertThat(results.seed()).isEqualTo(seed);
        assertThat(results.contentUsage()).isNull();
        assertThat(results.errors()).containsExactly("Content-Usage check failed: HEAD crashed");
    }

    private SiteWideChecks checks() {
        return new SiteWideChecks(robotsCheckService, contextFileProbe, contentUsageCheck, pageFetcher, executor);
    }
}
