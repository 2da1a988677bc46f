package com.siteready;

import com.siteready.audit.api.AuditController;
import com.siteready.audit.service.SiteAuditService;
import com.siteready.config.SiteReadyProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class SiteReadyApplicationTest {

    @Autowired
    private AuditController controller;

    @Autowired
    private SiteAuditService siteAuditService;

    @Autowired
    private SiteReadyProperties properties;

    @Test
    void contextWiresAuditStackWithConfiguredDefaults() {
        assertThat(controller).isNotNull();
        assertThat(siteAuditService).isNotNull();
        assertThat(properties.getMaxPages()).isEqualTo(10);
        assertThat(properties.getSiteDeadlineSeconds()).isEqualTo(90);
        assertThat(properties.getDiscoveryAgent()).isEqualTo("GPTBot");
        assertThat(properties.getExtraction().getStripSelectors()).contains("nav", "[aria-hidden=true]");
        assertThat(properties.getCli().isRun()).isFalse();
    }
}
