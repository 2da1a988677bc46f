package com.siteready.audit.robots;

import com.siteready.audit.model.RslReport;
import com.siteready.audit.scoring.ReadinessScoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public final class RslAnalyzer {
    private static final Set<String> AI_AGENT_TOKENS = ReadinessScoring.DEFAULT_AGENTS.stream()
        .map(agent -> agent.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());

    private RslAnalyzer() {
    }

    public static RslReport analyze(String rawRobots) {
        if (rawRobots == null) {
            return RslReport.unavailable("No robots.txt available for RSL analysis");
        }

        Double crawlDelay = null;
        List<String> sitemapUrls = new ArrayList<>();
        List<String> aiAgents = new ArrayList<>();

        for (String rawLine : rawRobots.split("\\R")) {
            String line = rawLine.trim();
            int colonIdx = line.indexOf(':');
            if (colonIdx <= 0) {
                continue;
            }
            String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colonIdx + 1).trim();
            switch (key) {
                case "sitemap" -> {
                    if (!value.isEmpty()) {
                        sitemapUrls.add(value);
                    }
                }
                case "crawl-delay" -> {
                    if (crawlDelay == null) {
                        crawlDelay = parseDelay(value);
                    }
                }
                case "user-agent" -> {
                    if (AI_AGENT_TOKENS.contains(value.toLowerCase(Locale.ROOT)) && !aiAgents.contains(value)) {
                        aiAgents.add(value);
                    }
                }
                default -> {
                }
            }
        }

        List<String> parts = new ArrayList<>();
        if (crawlDelay != null) {
            parts.add("Crawl-delay: " + crawlDelay + "s");
        }
        if (!sitemapUrls.isEmpty()) {
            parts.add(sitemapUrls.size() + " Sitemap URL(s)");
        }
        if (!aiAgents.isEmpty()) {
            parts.add("AI-specific rules for: " + String.join(", ", aiAgents));
        }
        String summary = parts.isEmpty() ? "No RSL signals found" : String.join("; ", parts);
        return new RslReport(crawlDelay, sitemapUrls, aiAgents, summary);
    }

    private static Double parseDelay(String value) {
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
