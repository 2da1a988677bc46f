package com.siteready.audit.structured;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteready.audit.model.StructuredDataItem;
import com.siteready.audit.model.StructuredDataReport;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredDataScannerTest {
    private final StructuredDataScanner scanner = new StructuredDataScanner(new ObjectMapper());

    @Test
    void countsObjectsAndSkipsMalformedBlocks() {
        String html = """
            <html><head>
            <script type="application/ld+json">{"@context":"https://schema.org","@type":"Organization","name":"Acme","url":"https://acme.test"}</script>
            <script type="application/ld+json">[{"@type":"FAQPage","mainEntity":[]},{"@type":"BreadcrumbList"}]</script>
            <script type="application/ld+json">{ not json </script>
            </head><body></body></html>
            """;

        StructuredDataReport report = scanner.scan(html);

        assertThat(report.blocksFound()).isEqualTo(3);
        assertThat(report.items()).extracting(StructuredDataItem::type)
            .containsExactly("Organization", "FAQPage", "BreadcrumbList");
        assertThat(report.items().get(0).properties()).containsExactly("name", "url");
        // 8 base + 3 Organization + 5 FAQPage + 3 BreadcrumbList
        assertThat(report.score()).isEqualTo(19.0);
        assertThat(report.summary()).isEqualTo("3 JSON-LD block(s) found");
    }

    @Test
    void missingTypeIsUnknownAndScoreIsCapped() {
        String html = """
            <script type="application/ld+json">{"name":"untyped"}</script>
            <script type="application/ld+json">{"@type":"Article"}</script>
            <script type="application/ld+json">{"@type":"Product"}</script>
            <script type="application/ld+json">{"@type":"Recipe"}</script>
            <script type="application/ld+json">{"@type":"HowTo"}</script>
            """;

        StructuredDataReport report = scanner.scan(html);

        assertThat(report.items().get(0).type()).isEqualTo("Unknown");
        assertThat(report.score()).isEqualTo(25.0);
    }

    @Test
    void duplicateTypesScoreOnce() {
        String html = """
            <script type="application/ld+json">{"@type":"Article"}</script>
            <script type="application/ld+json">{"@type":"Article"}</script>
            """;

        StructuredDataReport report = scanner.scan(html);

        assertThat(report.blocksFound()).isEqualTo(2);
        assertThat(report.score()).isEqualTo(13.0);
    }

    @Test
    void pageWithoutJsonLdScoresZero() {
        StructuredDataReport report = scanner.scan("<html><body><p>Hello</p></body></html>");

        assertThat(report.blocksFound()).isZero();
        assertThat(report.score()).isZero();
        assertThat(report.summary()).isEqualTo("No JSON-LD found");
        assertThat(scanner.scan("  ").summary()).isEqualTo("No HTML to analyze");
    }
}
