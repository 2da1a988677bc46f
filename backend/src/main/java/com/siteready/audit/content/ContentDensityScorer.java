package com.siteready.audit.content;

import com.siteready.audit.model.ContentReport;
import com.siteready.audit.scoring.ReadinessScoring;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class ContentDensityScorer {
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s", Pattern.MULTILINE);
    private static final Pattern HEADING_LINE = Pattern.compile("^#{1,6}\\s.*$", Pattern.MULTILINE);
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*[-*+]\\s", Pattern.MULTILINE);
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiou]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s", Pattern.UNICODE_CHARACTER_CLASS);

    static final int READABILITY_MIN_WORDS = 30;
    static final int SWEET_SPOT_MIN_WORDS = 50;
    static final int SWEET_SPOT_MAX_WORDS = 150;

    public ContentReport score(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return ContentReport.empty("No content extracted");
        }

        String[] words = words(markdown);
        int wordCount = words.length;
        boolean hasHeadings = HEADING.matcher(markdown).find();
        boolean hasLists = LIST_ITEM.matcher(markdown).find();
        boolean hasCodeBlocks = markdown.contains("```");

        List<Integer> headingLevels = headingLevels(markdown);
        List<Integer> chunkWords = chunkWordCounts(markdown);
        int chunkCount = chunkWords.size();
        int avgChunkWords = chunkCount == 0 ? 0 : chunkWords.stream().mapToInt(Integer::intValue).sum() / chunkCount;
        int chunksInSweetSpot = (int) chunkWords.stream()
            .filter(count -> count >= SWEET_SPOT_MIN_WORDS && count <= SWEET_SPOT_MAX_WORDS)
            .count();

        StringBuilder summary = new StringBuilder().append(wordCount).append(" words");
        if (hasHeadings) {
            summary.append(", has headings");
        }
        if (hasLists) {
            summary.append(", has lists");
        }
        if (hasCodeBlocks) {
            summary.append(", has code blocks");
        }

        return new ContentReport(
            wordCount,
            markdown.length(),
            hasHeadings,
            hasLists,
            hasCodeBlocks,
            headingLevels.size(),
            isHierarchyValid(headingLevels),
            readabilityGrade(markdown, words),
            chunkCount,
            avgChunkWords,
            chunksInSweetSpot,
            answerFirstRatio(markdown),
            ReadinessScoring.contentScore(wordCount, hasHeadings, hasLists, hasCodeBlocks),
            summary.toString()
        );
    }

    private static String[] words(String text) {
        return Arrays.stream(WHITESPACE.split(text))
            .filter(word -> !word.isEmpty())
            .toArray(String[]::new);
    }

    private static boolean hasText(String text) {
        return words(text).length > 0;
    }

    private static String trimText(String text) {
        return EDGE_WHITESPACE.matcher(text).replaceAll("");
    }

    private List<Integer> headingLevels(String markdown) {
        List<Integer> levels = new ArrayList<>();
        Matcher matcher = HEADING.matcher(markdown);
        while (matcher.find()) {
            levels.add(matcher.group(1).length());
        }
        return levels;
    }

    /**
     * A heading may go at most one level deeper than the heading before it; going back up is
     * always fine.
     */
    static boolean isHierarchyValid(List<Integer> levels) {
        for (int i = 1; i < levels.size(); i++) {
            if (levels.get(i) > levels.get(i - 1) + 1) {
                return false;
            }
        }
        return true;
    }

    private List<Integer> chunkWordCounts(String markdown) {
        List<Integer> counts = new ArrayList<>();
        for (String chunk : HEADING_LINE.split(markdown)) {
            if (hasText(chunk)) {
                counts.add(words(chunk).length);
            }
        }
        return counts;
    }

    /**
     * Share of heading-delimited sections whose first sentence is not a question, to two decimals.
     */
    static double answerFirstRatio(String markdown) {
        List<String> sections = new ArrayList<>();
        for (String section : HEADING_LINE.split(markdown)) {
            if (hasText(section)) {
                sections.add(trimText(section));
            }
        }
        if (sections.isEmpty()) {
            return 0.0;
        }
        int answerFirst = 0;
        for (String section : sections) {
            String first = trimText(SENTENCE_BREAK.split(section, 2)[0]);
            if (!first.isEmpty() && !first.endsWith("?")) {
                answerFirst++;
            }
        }
        return ReadinessScoring.round2((double) answerFirst / sections.size());
    }

    /**
     * Flesch-Kincaid grade level, or null below the minimum word count.
     */
    static Double readabilityGrade(String text, String[] words) {
        if (words.length < READABILITY_MIN_WORDS) {
            return null;
        }
        int sentences = 0;
        for (String sentence : SENTENCE_END.split(text)) {
            if (hasText(sentence)) {
                sentences++;
            }
        }
        sentences = Math.max(1, sentences);
        int syllables = 0;
        for (String word : words) {
            syllables += syllables(word);
        }
        double grade = 0.39 * ((double) words.length / sentences)
            + 11.8 * ((double) syllables / words.length)
            - 15.59;
        return ReadinessScoring.round1(grade);
    }

    private static int syllables(String word) {
        Matcher matcher = VOWEL_GROUP.matcher(word);
        int groups = 0;
        while (matcher.find()) {
            groups++;
        }
        return Math.max(1, groups);
    }
}
