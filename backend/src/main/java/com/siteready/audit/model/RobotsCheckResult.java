package com.siteready.audit.model;

public record RobotsCheckResult(RobotsReport report, String rawText) {
}
