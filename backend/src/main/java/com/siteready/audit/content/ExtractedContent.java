package com.siteready.audit.content;

public record ExtractedContent(String html, ExtractionStrategy strategy) {
}
