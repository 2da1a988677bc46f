package com.siteready.audit.signals;

import com.siteready.audit.http.PoliteHttpClient;
import com.siteready.audit.model.AuditTarget;
import com.siteready.audit.model.ContentUsageReport;
import com.siteready.config.SiteReadyProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class ContentUsageCheckTest {
    private MockWebServer server;
    private ExecutorService executor;
    private ContentUsageCheck check;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        check = new ContentUsageCheck(new PoliteHttpClient(new SiteReadyProperties(), executor));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void readsTrainingAndSearchPreferencesFromHeadResponse() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Usage", "training=no, search=Yes"));

        ContentUsageReport report = check.check(AuditTarget.of(server.url("/article").toString()));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("HEAD");
        assertThat(request.getPath()).isEqualTo("/article");
        assertThat(report.headerFound()).isTrue();
        assertThat(report.headerValue()).isEqualTo("training=no, search=Yes");
        assertThat(report.allowsTraining()).isFalse();
        assertThat(report.allowsSearch()).isTrue();
        assertThat(report.summary()).isEqualTo("Content-Usage: training=no, search=Yes; training=blocked; search=allowed");
    }

    @Test
    void missingHeaderIsReported() {
        server.enqueue(new MockResponse().setResponseCode(200));

        ContentUsageReport report = check.check(AuditTarget.of(server.url("/").toString()));

        assertThat(report.headerFound()).isFalse();
        assertThat(report.summary()).isEqualTo("Content-Usage header not found");
    }

    @Test
    void nonOkStatusIsTreatedAsMissing() {
        server.enqueue(new MockResponse().setResponseCode(404).setHeader("Content-Usage", "training=no"));

        ContentUsageReport report = check.check(AuditTarget.of(server.url("/").toString()));

        assertThat(report.headerFound()).isFalse();
        assertThat(report.summary()).isEqualTo("Content-Usage header not found (non-200 response)");
    }

    @Test
    void unreachableHostGivesFailedCheck() throws Exception {
        String url = server.url("/").toString();
        server.shutdown();

        ContentUsageReport report = check.check(AuditTarget.of(url));

        assertThat(report.headerFound()).isFalse();
        assertThat(report.summary()).startsWith("Content-Usage check failed: io_error");
    }

    @Test
    void unknownValuesAndKeysAreLeftUnset() {
        ContentUsageReport report = ContentUsageCheck.parse("Training = maybe; ads=no");

        assertThat(report.headerFound()).isTrue();
        assertThat(report.allowsTraining()).isNull();
        assertThat(report.allowsSearch()).isNull();
        assertThat(report.summary()).isEqualTo("Content-Usage: Training = maybe; ads=no");
    }
}
