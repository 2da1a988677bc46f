package com.siteready.audit.model;

import java.util.List;

public record PageScore(
    String url,
    StructuredDataReport structuredData,
    ContentReport content,
    List<String> errors
) {
    public PageScore {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static PageScore failed(String url, String error) {
        return new PageScore(
            url,
            StructuredDataReport.empty("Crawl failed"),
            ContentReport.empty("Crawl failed"),
            List.of(error == null || error.isBlank() ? "Unknown crawl error" : error)
        );
    }

    /**
     * A page counts toward aggregation when it carries no errors, or when it produced words
     * despite an error.
     */
    public boolean isSuccessful() {
        return errors.isEmpty() || content.wordCount() > 0;
    }
}
