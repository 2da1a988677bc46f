package com.siteready.audit.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteready.audit.content.ContentDensityScorer;
import com.siteready.audit.model.AuditReport;
import com.siteready.audit.model.AuditTarget;
import com.siteready.audit.model.ContentUsageReport;
import com.siteready.audit.model.ContextFileReport;
import com.siteready.audit.model.CrawlResult;
import com.siteready.audit.model.RobotsReport;
import com.siteready.audit.scoring.PageScorer;
import com.siteready.audit.structured.StructuredDataScanner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PageAuditServiceTest {
    private static final AuditTarget TARGET = AuditTarget.of("https://example.com/pricing");

    @Mock
    private SiteWideChecks siteWideChecks;

    @Test
    void sumsFourPillars() {
        CrawlResult seed = new CrawlResult(
            "https://example.com/pricing",
            true,
            200,
            "<meta name=\"author\" content=\"Dana Lee\">"
                + "<script type=\"application/ld+json\">{\"@type\":\"Product\"}</script>",
            "# Pricing\n\n- Free\n- Pro\n",
            List.of(),
            null
        );
        when(siteWideChecks.run(TARGET)).thenReturn(new SiteWideCheckResults(
            new RobotsReport(true, List.of(), 19.2, "10/13 AI agents allowed"),
            "User-agent: *\nSitemap: https://example.com/sitemap.xml\n",
            ContextFileReport.notFound("llms.txt not found"),
            new ContentUsageReport(true, "search=yes", null, true, "Content-Usage: search=yes; search=allowed"),
            seed,
            List.of()
        ));

        AuditReport report = service().audit(TARGET);

        // 19.2 robots + 0 context + 13 structured (8 + 5 Product) + 12 content (7 headings + 5 lists)
        assertThat(report.overallScore()).isEqualTo(44.2);
        assertThat(report.structuredData().score()).isEqualTo(13.0);
        assertThat(report.content().score()).isEqualTo(12.0);
        assertThat(report.rsl().sitemapUrls()).containsExactly("https://example.com/sitemap.xml");
        assertThat(report.contentUsage().allowsSearch()).isTrue();
        assertThat(report.eeat().authorName()).isEqualTo("Dana Lee");
        assertThat(report.eeat().summary()).isEqualTo("E-E-A-T signals: author: Dana Lee");
        assertThat(report.errors()).isEmpty();
    }

    @Test
    void crawlFailureKeepsSiteWideScores() {
        when(siteWideChecks.run(TARGET)).thenReturn(new SiteWideCheckResults(
            new RobotsReport(true, List.of(), 25, "13/13 AI agents allowed"),
            null,
            new ContextFileReport(true, "https://example.com/llms.txt", false, null, 10, "Found llms.txt at https://example.com/llms.txt"),
            null,
            CrawlResult.failure("https://example.com/pricing", 0, "timeout"),
            List.of()
        ));

        AuditReport report = service().audit(TARGET);

        assertThat(report.overallScore()).isEqualTo(35.0);
        assertThat(report.errors()).containsExactly("Crawl error: timeout");
        assertThat(report.content().summary()).isEqualTo("Crawl failed");
        assertThat(report.rsl().summary()).isEqualTo("No robots.txt available for RSL analysis");
        assertThat(report.contentUsage()).isNull();
        assertThat(report.eeat().summary()).isEqualTo("No HTML content for E-E-A-T analysis");
    }

    private PageAuditService service() {
        PageScorer scorer = new PageScorer(new StructuredDataScanner(new ObjectMapper()), new ContentDensityScorer());
        return new PageAuditService(siteWideChecks, scorer);
    }
}
