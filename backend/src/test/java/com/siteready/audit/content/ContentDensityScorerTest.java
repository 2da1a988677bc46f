package com.siteready.audit.content;

import com.siteready.audit.model.ContentReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ContentDensityScorerTest {
    private final ContentDensityScorer scorer = new ContentDensityScorer();

    @Test
    void scoresStructureBonuses() {
        ContentReport report = scorer.score("# Title\n\nSome words here.\n\n- item\n");

        assertThat(report.wordCount()).isEqualTo(7);
        assertThat(report.hasHeadings()).isTrue();
        assertThat(report.hasLists()).isTrue();
        assertThat(report.hasCodeBlocks()).isFalse();
        assertThat(report.score()).isEqualTo(12.0);
        assertThat(report.summary()).isEqualTo("7 words, has headings, has lists");
        assertThat(report.readabilityGrade()).isNull();
    }

    @Test
    void wordTiersAndCap() {
        String longText = "word ".repeat(1500) + "\n# H\n\n- a\n\n```\ncode\n```\n";

        ContentReport report = scorer.score(longText);

        assertThat(report.score()).isEqualTo(40.0);
        assertThat(scorer.score("word ".repeat(800)).score()).isEqualTo(20.0);
        assertThat(scorer.score("word ".repeat(400)).score()).isEqualTo(15.0);
        assertThat(scorer.score("word ".repeat(150)).score()).isEqualTo(8.0);
        assertThat(scorer.score("word ".repeat(149)).score()).isZero();
    }

    @Test
    void chunksSplitOnHeadings() {
        String markdown = "# A\n\n" + "alpha ".repeat(60) + "\n\n## B\n\n" + "beta ".repeat(10) + "\n";

        ContentReport report = scorer.score(markdown);

        assertThat(report.chunkCount()).isEqualTo(2);
        assertThat(report.chunksInSweetSpot()).isEqualTo(1);
        assertThat(report.avgChunkWords()).isEqualTo(35);
        assertThat(report.headingCount()).isEqualTo(2);
        assertThat(report.headingHierarchyValid()).isTrue();
    }

    @Test
    void skippedHeadingLevelIsInvalid() {
        assertThat(scorer.score("# A\n\n### B\n").headingHierarchyValid()).isFalse();
        assertThat(ContentDensityScorer.isHierarchyValid(List.of(1, 2, 3, 1, 2))).isTrue();
    }

    @Test
    void readabilityGradeNeedsThirtyWords() {
        ContentReport report = scorer.score("The cat sat on the mat. ".repeat(6));

        assertThat(report.wordCount()).isEqualTo(36);
        assertThat(report.readabilityGrade()).isCloseTo(-1.45, within(0.1));
    }

    @Test
    void nonBreakingSpacesSeparateWords() {
        assertThat(scorer.score("one\u00a0two\u00a0three four").wordCount()).isEqualTo(4);
        assertThat(scorer.score("\u00a0\u00a0alpha beta\u00a0").wordCount()).isEqualTo(2);
        assertThat(scorer.score("word\u00a0".repeat(150)).score()).isEqualTo(8.0);
    }

    @Test
    void answerFirstRatioCountsSectionsOpeningWithAStatement() {
        String markdown = """
            # Intro

            SiteReady audits pages. It scores them.

            ## FAQ

            What does it check? Robots and content.

            ## Notes

            Short answer.
            """;

        assertThat(scorer.score(markdown).answerFirstRatio()).isEqualTo(0.67);
        assertThat(ContentDensityScorer.answerFirstRatio("Is it ready?")).isZero();
        assertThat(ContentDensityScorer.answerFirstRatio("# A\n\n## B\n")).isZero();
        assertThat(ContentDensityScorer.answerFirstRatio("Plain statement")).isEqualTo(1.0);
    }

    @Test
    void emptyMarkdownScoresZero() {
        ContentReport report = scorer.score("");

        assertThat(report.score()).isZero();
        assertThat(report.answerFirstRatio()).isZero();
        assertThat(report.summary()).isEqualTo("No content extracted");
    }
}
