package com.siteready.audit.service;

import java.util.Locale;

public enum AuditMode {
    SITE,
    PAGE;

    public static AuditMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return SITE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "site" -> SITE;
            case "page", "single" -> PAGE;
            default -> throw new IllegalArgumentException("Unknown audit mode: " + value);
        };
    }
}
