package com.siteready.audit.discovery;

import com.siteready.audit.util.UrlUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class PageSamplerTest {
    private static final String SEED = "https://example.com/";

    @Test
    void seedComesFirstAndBudgetIsRespected() {
        List<String> candidates = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            candidates.add("https://example.com/section" + (i % 7) + "/page" + i);
        }

        List<String> sample = new PageSampler(new Random(7)).sample(candidates, SEED, 10);

        assertThat(sample).hasSize(10);
        assertThat(sample.get(0)).isEqualTo(SEED);
        assertThat(sample).doesNotHaveDuplicates();
    }

    @Test
    void spreadsAcrossSections() {
        List<String> candidates = new ArrayList<>();
        for (String section : List.of("blog", "docs", "pricing")) {
            for (int i = 0; i < 5; i++) {
                candidates.add("https://example.com/" + section + "/item" + i);
            }
        }

        List<String> sample = new PageSampler(new Random(1)).sample(candidates, SEED, 4);

        assertThat(sample.subList(1, 4))
            .extracting(UrlUtils::firstPathSegment)
            .containsExactly("blog", "docs", "pricing");
    }

    @Test
    void seedVariantsAreNotSampledTwice() {
        List<String> candidates = List.of("https://example.com", "https://example.com/about", "https://example.com/about/");

        List<String> sample = new PageSampler(new Random(3)).sample(candidates, SEED, 10);

        assertThat(sample).hasSize(2);
        assertThat(sample.get(0)).isEqualTo(SEED);
        assertThat(UrlUtils.normalize(sample.get(1))).isEqualTo("https://example.com/about");
    }

    @Test
    void budgetOfOneIsJustTheSeed() {
        assertThat(new PageSampler().sample(List.of("https://example.com/a"), SEED, 1)).containsExactly(SEED);
    }

    @Test
    void sameRandomSeedGivesSameSample() {
        List<String> candidates = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            candidates.add("https://example.com/s" + (i % 3) + "/p" + i);
        }

        List<String> first = new PageSampler(new Random(99)).sample(new ArrayList<>(candidates), SEED, 8);
        List<String> second = new PageSampler(new Random(99)).sample(new ArrayList<>(candidates), SEED, 8);

        assertThat(first).isEqualTo(second);
    }
}
