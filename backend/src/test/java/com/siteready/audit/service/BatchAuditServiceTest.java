package com.siteready.audit.service;

import com.siteready.audit.model.AuditReport;
import com.siteready.audit.model.AuditTarget;
import com.siteready.audit.model.BatchAuditReport;
import com.siteready.audit.model.ContentReport;
import com.siteready.audit.model.ContentUsageReport;
import com.siteready.audit.model.ContextFileReport;
import com.siteready.audit.model.EeatReport;
import com.siteready.audit.model.ReadinessReport;
import com.siteready.audit.model.RobotsReport;
import com.siteready.audit.model.RslReport;
import com.siteready.audit.model.SiteAuditReport;
import com.siteready.audit.model.StructuredDataReport;
import com.siteready.config.SiteReadyProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchAuditServiceTest {

    @Mock
    private SiteAuditService siteAuditService;
    @Mock
    private PageAuditService pageAuditService;

    private final ExecutorService executor = Executors.newFixedThreadPool(6);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void pageModeKeepsInputOrderAndIsolatesFailures() {
        when(pageAuditService.audit(any(AuditTarget.class))).thenAnswer(invocation -> {
            AuditTarget target = invocation.getArgument(0);
            if (target.url().contains("broken")) {
                throw new IllegalStateException("boom");
            }
            return report(target.url());
        });

        BatchAuditReport batch = service(new SiteReadyProperties()).audit(
            List.of("https://a.example.com/", "https://broken.example.com/", "https://c.example.com/", "not a url"),
            AuditMode.PAGE,
            null
        );

        assertThat(batch.reports()).extracting(ReadinessReport::url)
            .containsExactly("https://a.example.com/", "https://c.example.com/");
        assertThat(batch.errors()).containsOnlyKeys("https://broken.example.com/", "not a url");
        assertThat(batch.errors().get("https://broken.example.com/")).isEqualTo("boom");
        verify(siteAuditService, never()).audit(any());
    }

    @Test
    void siteModePassesPageBudget() {
        SiteAuditReport siteReport = SiteAuditReport.timedOut(AuditTarget.of("https://a.example.com/"));
        when(siteAuditService.audit(argThat(target -> target.maxPages() == 4))).thenReturn(siteReport);

        BatchAuditReport batch = service(new SiteReadyProperties())
            .audit(List.of("a.example.com"), AuditMode.SITE, 4);

        assertThat(batch.reports()).containsExactly(siteReport);
        assertThat(batch.errors()).isEmpty();
    }

    @Test
    void neverExceedsConfiguredConcurrency() {
        SiteReadyProperties properties = new SiteReadyProperties();
        properties.getBatch().setConcurrency(2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(pageAuditService.audit(any(AuditTarget.class))).thenAnswer(invocation -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            inFlight.decrementAndGet();
            AuditTarget target = invocation.getArgument(0);
            return report(target.url());
        });

        BatchAuditReport batch = service(properties).audit(
            List.of("https://1.example.com/", "https://2.example.com/", "https://3.example.com/",
                "https://4.example.com/", "https://5.example.com/"),
            AuditMode.PAGE,
            null
        );

        assertThat(batch.reports()).hasSize(5);
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
    }

    private BatchAuditService service(SiteReadyProperties properties) {
        return new BatchAuditService(
            siteAuditService,
            pageAuditService,
            new AuditTargetFactory(properties),
            properties,
            executor
        );
    }

    private AuditReport report(String url) {
        return new AuditReport(
            url,
            10,
            RobotsReport.notFound("robots.txt returned HTTP 404"),
            new ContextFileReport(true, url + "llms.txt", false, null, 10, "Found llms.txt at " + url + "llms.txt"),
            StructuredDataReport.empty("No JSON-LD found"),
            ContentReport.empty("No content extracted"),
            RslReport.unavailable("No robots.txt available for RSL analysis"),
            ContentUsageReport.notFound("Content-Usage header not found"),
            EeatReport.empty("No E-E-A-T signals detected"),
            List.of()
        );
    }
}
