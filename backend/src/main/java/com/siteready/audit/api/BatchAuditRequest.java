package com.siteready.audit.api;

import java.util.List;

public record BatchAuditRequest(
    List<String> urls,
    String mode,
    Integer maxPages
) {
}
