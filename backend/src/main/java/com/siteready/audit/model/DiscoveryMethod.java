package com.siteready.audit.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiscoveryMethod {
    SITEMAP("sitemap"),
    SPIDER("spider"),
    TIMEOUT("timeout");

    private final String label;

    DiscoveryMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
