package com.siteready.audit.model;

import java.util.List;

public record StructuredDataItem(String type, List<String> properties) {
    public StructuredDataItem {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }
}
