package com.siteready.audit.model;

/**
 * The page's {@code Content-Usage} response header (IETF aipref draft). Reported, never scored.
 * {@code allowsTraining} and {@code allowsSearch} are null when the header does not say.
 */
public record ContentUsageReport(
    boolean headerFound,
    String headerValue,
    Boolean allowsTraining,
    Boolean allowsSearch,
    String summary
) {
    public static ContentUsageReport notFound(String summary) {
        return new ContentUsageReport(false, null, null, null, summary);
    }
}
