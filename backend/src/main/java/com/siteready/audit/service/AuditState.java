package com.siteready.audit.service;

public enum AuditState {
    INIT,
    SITE_WIDE_CHECKS,
    DISCOVERY,
    BATCH_CRAWL,
    PAGE_SCORING,
    AGGREGATION,
    DONE
}
