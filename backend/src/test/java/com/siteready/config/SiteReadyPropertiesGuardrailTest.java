package com.siteready.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SiteReadyPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        SiteReadyProperties properties = new SiteReadyProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("siteready/0.1"));
    }

    @Test
    void concurrencyBudgetsAndDelaysAreClamped() {
        SiteReadyProperties properties = new SiteReadyProperties();
        properties.setGlobalConcurrency(0);
        properties.setCrawlConcurrency(-2);
        properties.setMaxPages(0);
        properties.setCrawlDelayMs(-10);
        properties.setMaxBodyBytes(10);
        properties.getBatch().setConcurrency(0);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getCrawlConcurrency());
        assertEquals(1, properties.getMaxPages());
        assertEquals(0, properties.getCrawlDelayMs());
        assertEquals(1024, properties.getMaxBodyBytes());
        assertEquals(1, properties.getBatch().getConcurrency());
    }

    @Test
    void blankDiscoveryAgentFallsBackToGptBot() {
        SiteReadyProperties properties = new SiteReadyProperties();
        properties.setDiscoveryAgent(" ");
        assertEquals("GPTBot", properties.getDiscoveryAgent());
    }
}
