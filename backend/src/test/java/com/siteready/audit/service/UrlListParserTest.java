package com.siteready.audit.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class UrlListParserTest {

    @Test
    void parsesPlainTextSkippingCommentsAndBlanks() {
        String raw = """
            # sites to audit
            https://example.com/

            example.org
              http://insecure.example.net/page
            """;

        assertThat(UrlListParser.parseText(raw)).containsExactly(
            "https://example.com/",
            "https://example.org",
            "http://insecure.example.net/page"
        );
    }

    @Test
    void parsesCsvFirstColumnAndSkipsHeader() throws Exception {
        String raw = """
            url,owner
            example.com,marketing
            "https://docs.example.com/start",docs
            ,nobody
            """;

        assertThat(UrlListParser.parseCsv(raw)).containsExactly(
            "https://example.com",
            "https://docs.example.com/start"
        );
    }

    @Test
    void picksFormatFromFileExtension(@TempDir Path dir) throws Exception {
        Path csv = dir.resolve("sites.csv");
        Files.writeString(csv, "Website\nexample.com\n");
        Path txt = dir.resolve("sites.txt");
        Files.writeString(txt, "example.com,not-a-column\n");

        assertThat(UrlListParser.parse(csv)).containsExactly("https://example.com");
        assertThat(UrlListParser.parse(txt)).containsExactly("https://example.com,not-a-column");
    }
}
