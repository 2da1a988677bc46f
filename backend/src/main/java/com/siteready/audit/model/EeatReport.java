package com.siteready.audit.model;

import java.util.List;

public record EeatReport(
    boolean hasAuthor,
    String authorName,
    boolean hasDate,
    boolean hasAboutPage,
    boolean hasContactInfo,
    boolean hasCitations,
    int citationCount,
    List<String> trustSignals,
    String summary
) {
    public EeatReport {
        trustSignals = trustSignals == null ? List.of() : List.copyOf(trustSignals);
    }

    public static EeatReport empty(String summary) {
        return new EeatReport(false, null, false, false, false, false, 0, List.of(), summary);
    }
}
