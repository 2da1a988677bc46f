package com.siteready.audit.scoring;

import com.siteready.audit.model.AgentAccess;
import com.siteready.audit.model.StructuredDataItem;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pillar maxima and the scoring rules that map pillar findings to points. The four maxima sum
 * to 100.
 */
public final class ReadinessScoring {
    public static final double ROBOTS_MAX = 25;
    public static final double CONTEXT_FILE_MAX = 10;
    public static final double STRUCTURED_DATA_MAX = 25;
    public static final double CONTENT_MAX = 40;

    public static final List<WordTier> CONTENT_WORD_TIERS = List.of(
        new WordTier(1500, 25),
        new WordTier(800, 20),
        new WordTier(400, 15),
        new WordTier(150, 8)
    );
    public static final int CONTENT_HEADING_BONUS = 7;
    public static final int CONTENT_LIST_BONUS = 5;
    public static final int CONTENT_CODE_BONUS = 3;

    public static final int STRUCTURED_DATA_BASE = 8;
    public static final int STRUCTURED_DATA_HIGH_VALUE_BONUS = 5;
    public static final int STRUCTURED_DATA_STANDARD_BONUS = 3;
    public static final Set<String> HIGH_VALUE_TYPES = Set.of("FAQPage", "HowTo", "Article", "Product", "Recipe");

    public static final List<String> DEFAULT_AGENTS = List.of(
        "GPTBot",
        "ChatGPT-User",
        "Google-Extended",
        "ClaudeBot",
        "PerplexityBot",
        "Amazonbot",
        "OAI-SearchBot",
        "DeepSeek-AI",
        "Grok",
        "Meta-ExternalAgent",
        "cohere-ai",
        "AI2Bot",
        "ByteSpider"
    );

    private ReadinessScoring() {
    }

    public static double robotsScore(List<AgentAccess> agents) {
        if (agents == null || agents.isEmpty()) {
            return 0;
        }
        long allowed = agents.stream().filter(AgentAccess::allowed).count();
        return round1(ROBOTS_MAX * allowed / agents.size());
    }

    public static double contextFileScore(boolean found, boolean fullFound) {
        return found || fullFound ? CONTEXT_FILE_MAX : 0;
    }

    public static double structuredDataScore(List<StructuredDataItem> items) {
        if (items == null || items.isEmpty()) {
            return 0;
        }
        Set<String> uniqueTypes = new LinkedHashSet<>();
        for (StructuredDataItem item : items) {
            uniqueTypes.add(item.type());
        }
        int score = STRUCTURED_DATA_BASE;
        for (String type : uniqueTypes) {
            score += HIGH_VALUE_TYPES.contains(type) ? STRUCTURED_DATA_HIGH_VALUE_BONUS : STRUCTURED_DATA_STANDARD_BONUS;
        }
        return Math.min(STRUCTURED_DATA_MAX, score);
    }

    public static double contentScore(int wordCount, boolean hasHeadings, boolean hasLists, boolean hasCodeBlocks) {
        int score = 0;
        for (WordTier tier : CONTENT_WORD_TIERS) {
            if (wordCount >= tier.minWords()) {
                score = tier.points();
                break;
            }
        }
        if (hasHeadings) {
            score += CONTENT_HEADING_BONUS;
        }
        if (hasLists) {
            score += CONTENT_LIST_BONUS;
        }
        if (hasCodeBlocks) {
            score += CONTENT_CODE_BONUS;
        }
        return Math.min(CONTENT_MAX, score);
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public record WordTier(int minWords, int points) {
    }
}
