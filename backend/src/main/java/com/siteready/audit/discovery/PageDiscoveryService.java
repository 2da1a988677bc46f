package com.siteready.audit.discovery;

import com.siteready.audit.model.DiscoveryMethod;
import com.siteready.audit.model.DiscoveryResult;
import com.siteready.audit.model.SitemapDiscoveryResult;
import com.siteready.audit.robots.RobotsRules;
import com.siteready.audit.sitemap.SitemapService;
import com.siteready.audit.util.UrlUtils;
import com.siteready.config.SiteReadyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the pages a site audit samples: sitemap first, the seed page's own links otherwise.
 * Candidates are kept on the seed's site ({@code www.} and scheme differences allowed), filtered
 * through robots.txt for the discovery agent, deduplicated, and sampled down to the page budget
 * with the seed first.
 */
@Service
public class PageDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(PageDiscoveryService.class);

    private final SitemapService sitemapService;
    private final PageSampler pageSampler;
    private final SiteReadyProperties properties;

    public PageDiscoveryService(
        SitemapService sitemapService,
        PageSampler pageSampler,
        SiteReadyProperties properties
    ) {
        this.sitemapService = sitemapService;
        this.pageSampler = pageSampler;
        this.properties = properties;
    }

    public DiscoveryResult discover(
        String seedUrl,
        int maxPages,
        String robotsText,
        List<String> seedLinks,
        Duration timeout
    ) {
        RobotsRules rules = robotsText == null || robotsText.isBlank() ? null : RobotsRules.parse(robotsText);
        String agent = properties.getDiscoveryAgent();

        DiscoveryMethod method = DiscoveryMethod.SITEMAP;
        List<String> candidates = sitemapCandidates(seedUrl, rules, timeout);
        Filtered filtered = filter(candidates, seedUrl, rules, agent);
        if (filtered.kept().isEmpty()) {
            if (!candidates.isEmpty()) {
                log.info("Sitemap for {} listed {} URLs but none on site and allowed; using seed links", seedUrl, candidates.size());
            }
            method = DiscoveryMethod.SPIDER;
            candidates = seedLinks == null ? List.of() : seedLinks;
            filtered = filter(candidates, seedUrl, rules, agent);
        }
        int candidatesFound = candidates.size();

        List<String> sampled = pageSampler.sample(filtered.kept(), seedUrl, maxPages);
        log.info(
            "Discovery for {}: method={}, found={}, offSite={}, blockedFor{}={}, sampled={}",
            seedUrl,
            method.label(),
            candidatesFound,
            filtered.offSite(),
            agent,
            filtered.blocked(),
            sampled.size()
        );
        String summary = "method=" + method.label() + ", found=" + candidatesFound + ", sampled=" + sampled.size();
        return new DiscoveryResult(method, candidatesFound, sampled, summary);
    }

    private Filtered filter(List<String> candidates, String seedUrl, RobotsRules rules, String agent) {
        List<String> kept = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int offSite = 0;
        int blocked = 0;
        for (String url : candidates) {
            if (!UrlUtils.isSameSite(seedUrl, url)) {
                offSite++;
                continue;
            }
            if (rules != null && !rules.isAllowed(agent, UrlUtils.pathAndQuery(url))) {
                blocked++;
                continue;
            }
            if (seen.add(UrlUtils.normalize(url))) {
                kept.add(url);
            }
        }
        return new Filtered(kept, offSite, blocked);
    }

    /**
     * Walks the default sitemap locations, then robots.txt hints, and keeps the URLs of the
     * first location that yields any.
     */
    private List<String> sitemapCandidates(String seedUrl, RobotsRules rules, Duration timeout) {
        String origin = UrlUtils.origin(seedUrl);
        Set<String> seeds = new LinkedHashSet<>();
        seeds.add(origin + "/sitemap.xml");
        seeds.add(origin + "/sitemap_index.xml");
        if (rules != null) {
            seeds.addAll(rules.getSitemapUrls());
        }

        SiteReadyProperties.Sitemap limits = properties.getSitemap();
        for (String seed : seeds) {
            try {
                SitemapDiscoveryResult result = sitemapService.discover(
                    List.of(seed),
                    limits.getMaxDepth(),
                    limits.getMaxChildSitemaps(),
                    limits.getMaxUrls(),
                    timeout
                );
                if (!result.discoveredUrls().isEmpty()) {
                    return result.discoveredUrls();
                }
            } catch (RuntimeException e) {
                log.warn("Sitemap discovery failed at {}: {}", seed, e.getMessage());
            }
        }
        return List.of();
    }

    private record Filtered(List<String> kept, int offSite, int blocked) {
    }
}
