package com.siteready.audit.crawl;

import com.siteready.audit.model.CrawlResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

@Service
public class CrawlBatchService {
    private static final Logger log = LoggerFactory.getLogger(CrawlBatchService.class);

    private final PageFetcher pageFetcher;
    private final ExecutorService crawlExecutor;

    public CrawlBatchService(PageFetcher pageFetcher, @Qualifier("crawlExecutor") ExecutorService crawlExecutor) {
        this.pageFetcher = pageFetcher;
        this.crawlExecutor = crawlExecutor;
    }

    public List<CrawlResult> crawlAll(List<String> urls, Duration delay, Duration timeout) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        long delayMs = delay == null ? 0 : Math.max(0, delay.toMillis());
        List<CompletableFuture<CrawlResult>> futures = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            long staggerMs = delayMs * i;
            Executor executor = staggerMs > 0
                ? CompletableFuture.delayedExecutor(staggerMs, TimeUnit.MILLISECONDS, crawlExecutor)
                : crawlExecutor;
            futures.add(CompletableFuture.supplyAsync(() -> crawlOne(url, timeout), executor));
        }

        List<CrawlResult> results = new ArrayList<>(urls.size());
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            CrawlResult result;
            try {
                result = futures.get(i).join();
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Crawl task for {} failed: {}", urls.get(i), cause.toString());
                result = CrawlResult.failure(urls.get(i), 0, "Crawl task failed: " + cause.getMessage());
            }
            if (!result.success()) {
                failed++;
            }
            results.add(result);
        }
        log.info("Crawl batch finished: pages={}, failed={}, delayMs={}", urls.size(), failed, delayMs);
        return results;
    }

    private CrawlResult crawlOne(String url, Duration timeout) {
        try {
            return pageFetcher.fetch(url, timeout);
        } catch (RuntimeException e) {
            log.warn("Crawl of {} threw: {}", url, e.toString());
            return CrawlResult.failure(url, 0, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }
}
