package com.siteready.audit.content;

public enum ExtractionStrategy {
    READABILITY,
    MAIN,
    ARTICLE,
    ROLE_MAIN,
    BODY,
    RAW
}
