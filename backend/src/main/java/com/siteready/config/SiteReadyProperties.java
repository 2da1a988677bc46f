package com.siteready.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "siteready")
public class SiteReadyProperties {
    private static final String DEFAULT_USER_AGENT = "siteready/0.1 (+https://github.com/siteready/siteready)";
    private static final String DEFAULT_DISCOVERY_AGENT = "GPTBot";

    private String userAgent;
    private int requestTimeoutSeconds = 15;
    private int requestMaxRetries = 0;
    private int requestRetryBaseDelayMs = 250;
    private int requestRetryMaxDelayMs = 2000;
    private int maxBodyBytes = 5_000_000;
    private int globalConcurrency = 8;
    private int maxPages = 10;
    private int crawlDelayMs = 1000;
    private int crawlConcurrency = 3;
    private int siteDeadlineSeconds = 90;
    private String discoveryAgent = DEFAULT_DISCOVERY_AGENT;
    private List<String> agents = new ArrayList<>();
    private Sitemap sitemap = new Sitemap();
    private Extraction extraction = new Extraction();
    private Batch batch = new Batch();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public int getMaxBodyBytes() {
        return Math.max(1024, maxBodyBytes);
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = Math.max(1024, maxBodyBytes);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getMaxPages() {
        return Math.max(1, maxPages);
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = Math.max(1, maxPages);
    }

    public int getCrawlDelayMs() {
        return Math.max(0, crawlDelayMs);
    }

    public void setCrawlDelayMs(int crawlDelayMs) {
        this.crawlDelayMs = Math.max(0, crawlDelayMs);
    }

    public int getCrawlConcurrency() {
        return Math.max(1, crawlConcurrency);
    }

    public void setCrawlConcurrency(int crawlConcurrency) {
        this.crawlConcurrency = Math.max(1, crawlConcurrency);
    }

    public int getSiteDeadlineSeconds() {
        return Math.max(1, siteDeadlineSeconds);
    }

    public void setSiteDeadlineSeconds(int siteDeadlineSeconds) {
        this.siteDeadlineSeconds = Math.max(1, siteDeadlineSeconds);
    }

    public String getDiscoveryAgent() {
        return discoveryAgent == null || discoveryAgent.isBlank() ? DEFAULT_DISCOVERY_AGENT : discoveryAgent.trim();
    }

    public void setDiscoveryAgent(String discoveryAgent) {
        this.discoveryAgent = discoveryAgent;
    }

    public List<String> getAgents() {
        return agents;
    }

    public void setAgents(List<String> agents) {
        this.agents = agents == null ? new ArrayList<>() : agents;
    }

    public Sitemap getSitemap() {
        return sitemap;
    }

    public void setSitemap(Sitemap sitemap) {
        this.sitemap = sitemap;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Sitemap {
        private int maxDepth = 1;
        private int maxChildSitemaps = 10;
        private int maxUrls = 500;

        public int getMaxDepth() {
            return Math.max(0, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = Math.max(0, maxDepth);
        }

        public int getMaxChildSitemaps() {
            return Math.max(0, maxChildSitemaps);
        }

        public void setMaxChildSitemaps(int maxChildSitemaps) {
            this.maxChildSitemaps = Math.max(0, maxChildSitemaps);
        }

        public int getMaxUrls() {
            return Math.max(1, maxUrls);
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = Math.max(1, maxUrls);
        }
    }

    public static class Extraction {
        private List<String> stripSelectors = new ArrayList<>(List.of(
            "script",
            "style",
            "noscript",
            "template",
            "iframe",
            "svg",
            "nav",
            "header",
            "footer",
            "aside",
            "form",
            "[role=navigation]",
            "[aria-hidden=true]",
            "[class*=cookie]",
            "[id*=cookie]",
            "[class*=advert]",
            "[class*=banner]"
        ));

        public List<String> getStripSelectors() {
            return stripSelectors;
        }

        public void setStripSelectors(List<String> stripSelectors) {
            this.stripSelectors = stripSelectors == null ? new ArrayList<>() : stripSelectors;
        }
    }

    public static class Batch {
        private int concurrency = 3;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }
    }

    public static class Cli {
        private boolean run = false;
        private String mode = "site";
        private String url = "";
        private String urlFile = "";
        private boolean exitAfterRun = false;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUrlFile() {
            return urlFile;
        }

        public void setUrlFile(String urlFile) {
            this.urlFile = urlFile;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
