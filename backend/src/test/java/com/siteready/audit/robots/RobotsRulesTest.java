package com.siteready.audit.robots;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RobotsRulesTest {

    @Test
    void namedGroupOverridesWildcard() {
        String robots = """
            User-agent: *
            Disallow: /

            User-agent: GPTBot
            Allow: /
            """;
        RobotsRules rules = RobotsRules.parse(robots);

        assertThat(rules.isAllowed("GPTBot", "/")).isTrue();
        assertThat(rules.isAllowed("ClaudeBot", "/")).isFalse();
        assertThat(rules.isAllowed("/")).isFalse();
    }

    @Test
    void agentMatchingIgnoresCaseAndVersionSuffix() {
        String robots = """
            User-agent: gptbot/1.2
            Disallow: /private
            """;
        RobotsRules rules = RobotsRules.parse(robots);

        assertThat(rules.isAllowed("GPTBot", "/private/page")).isFalse();
        assertThat(rules.isAllowed("GPTBot", "/public")).isTrue();
    }

    @Test
    void tokenMatchIsExactNotSubstring() {
        String robots = """
            User-agent: ChatGPT-User
            Disallow: /
            """;
        RobotsRules rules = RobotsRules.parse(robots);

        assertThat(rules.isAllowed("GPTBot", "/")).isTrue();
        assertThat(rules.isAllowed("ChatGPT-User", "/")).isFalse();
    }

    @Test
    void noApplicableGroupAllowsEverything() {
        String robots = """
            User-agent: Bingbot
            Disallow: /
            """;
        RobotsRules rules = RobotsRules.parse(robots);

        assertThat(rules.isAllowed("ClaudeBot", "/anything")).isTrue();
        assertThat(RobotsRules.parse("").isAllowed("ClaudeBot", "/")).isTrue();
        assertThat(RobotsRules.parse(null).isAllowed("/")).isTrue();
    }

    @Test
    void longestMatchWinsAndAllowWinsTie() {
        String robots = """
            User-agent: *
            Disallow: /docs
            Allow: /docs/public
            Disallow: /same
            Allow: /same
            """;
        RobotsRules rules = RobotsRules.parse(robots);

        assertThat(rules.isAllowed("/docs/internal")).isFalse();
        assertThat(rules.isAllowed("/docs/public/page")).isTrue();
        assertThat(rules.isAllowed("/same")).isTrue();
    }

    @Test
    void equalLengthTieIsAllowedWhateverTheRuleOrder() {
        RobotsRules disallowFirst = RobotsRules.parse("User-agent: GPTBot\nDisallow: /\nAllow: /\n");
        RobotsRules allowFirst = RobotsRules.parse("User-agent: GPTBot\nAllow: /\nDisallow: /\n");

        assertThat(disallowFirst.isAllowed("GPTBot", "/")).isTrue();
        assertThat(disallowFirst.isAllowed("GPTBot", "/pricing")).isTrue();
        assertThat(allowFirst.isAllowed("GPTBot", "/")).isTrue();
        assertThat(allowFirst.isAllowed("GPTBot", "/pricing")).isTrue();
    }

    @Test
    void wildcardAndAnchorPatterns() {
        String robots = """
            User-agent: *
            Disallow: /*.pdf$
            Disallow: /search*q=
            """;
        RobotsRules rules = RobotsRules.parse(robots);

        assertThat(rules.isAllowed("/files/report.pdf")).isFalse();
        assertThat(rules.isAllowed("/files/report.pdf?x=1")).isTrue();
        assertThat(rules.isAllowed("/search?q=term")).isFalse();
    }

    @Test
    void consecutiveUserAgentsShareOneGroupAndSitemapsAreCollected() {
        String robots = """
            # AI crawlers
            User-agent: GPTBot
            User-agent: ClaudeBot
            Disallow: /

            Sitemap: https://example.com/sitemap.xml
            """;
        RobotsRules rules = RobotsRules.parse(robots);

        assertThat(rules.getGroups()).hasSize(1);
        assertThat(rules.getGroups().get(0).agents()).containsExactly("gptbot", "claudebot");
        assertThat(rules.isAllowed("ClaudeBot", "/")).isFalse();
        assertThat(rules.getSitemapUrls()).containsExactly("https://example.com/sitemap.xml");
    }

    @Test
    void emptyDisallowBlocksNothing() {
        String robots = """
            User-agent: *
            Disallow:
            """;
        assertThat(RobotsRules.parse(robots).isAllowed("GPTBot", "/")).isTrue();
    }
}
