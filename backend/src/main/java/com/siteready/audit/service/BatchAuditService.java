package com.siteready.audit.service;

import com.siteready.audit.model.AuditTarget;
import com.siteready.audit.model.BatchAuditReport;
import com.siteready.audit.model.ReadinessReport;
import com.siteready.config.SiteReadyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

@Service
public class BatchAuditService {
    private static final Logger log = LoggerFactory.getLogger(BatchAuditService.class);

    private final SiteAuditService siteAuditService;
    private final PageAuditService pageAuditService;
    private final AuditTargetFactory targetFactory;
    private final SiteReadyProperties properties;
    private final ExecutorService batchExecutor;

    public BatchAuditService(
        SiteAuditService siteAuditService,
        PageAuditService pageAuditService,
        AuditTargetFactory targetFactory,
        SiteReadyProperties properties,
        @Qualifier("batchExecutor") ExecutorService batchExecutor
    ) {
        this.siteAuditService = siteAuditService;
        this.pageAuditService = pageAuditService;
        this.targetFactory = targetFactory;
        this.properties = properties;
        this.batchExecutor = batchExecutor;
    }

    public BatchAuditReport audit(List<String> urls, AuditMode mode, Integer maxPages) {
        Semaphore permits = new Semaphore(properties.getBatch().getConcurrency());
        List<CompletableFuture<TaskOutcome<ReadinessReport>>> futures = new ArrayList<>(urls.size());
        for (String url : urls) {
            futures.add(CompletableFuture.supplyAsync(() -> auditOne(url, mode, maxPages, permits), batchExecutor));
        }

        List<ReadinessReport> reports = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            TaskOutcome<ReadinessReport> outcome = futures.get(i).join();
            if (outcome.isSuccess()) {
                reports.add(outcome.value());
            } else {
                errors.put(urls.get(i), outcome.error());
            }
        }
        log.info("Batch audit finished: urls={}, reports={}, errors={}, mode={}", urls.size(), reports.size(), errors.size(), mode);
        return new BatchAuditReport(urls, reports, errors);
    }

    private TaskOutcome<ReadinessReport> auditOne(String url, AuditMode mode, Integer maxPages, Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.failure(e);
        }
        try {
            AuditTarget target = targetFactory.create(url, maxPages);
            ReadinessReport report = mode == AuditMode.PAGE
                ? pageAuditService.audit(target)
                : siteAuditService.audit(target);
            return TaskOutcome.success(report);
        } catch (RuntimeException e) {
            log.warn("Batch audit of {} failed: {}", url, e.toString());
            return TaskOutcome.failure(e);
        } finally {
            permits.release();
        }
    }
}
