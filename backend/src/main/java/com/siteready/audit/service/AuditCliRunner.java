package com.siteready.audit.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteready.audit.model.BatchAuditReport;
import com.siteready.audit.model.ReadinessReport;
import com.siteready.config.SiteReadyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class AuditCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(AuditCliRunner.class);

    private final SiteReadyProperties properties;
    private final SiteAuditService siteAuditService;
    private final PageAuditService pageAuditService;
    private final BatchAuditService batchAuditService;
    private final AuditTargetFactory targetFactory;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public AuditCliRunner(
        SiteReadyProperties properties,
        SiteAuditService siteAuditService,
        PageAuditService pageAuditService,
        BatchAuditService batchAuditService,
        AuditTargetFactory targetFactory,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.siteAuditService = siteAuditService;
        this.pageAuditService = pageAuditService;
        this.batchAuditService = batchAuditService;
        this.targetFactory = targetFactory;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        SiteReadyProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        AuditMode mode = AuditMode.fromString(cli.getMode());
        if (cli.getUrlFile() != null && !cli.getUrlFile().isBlank()) {
            List<String> urls = readUrlFile(cli.getUrlFile());
            BatchAuditReport batch = batchAuditService.audit(urls, mode, null);
            for (ReadinessReport report : batch.reports()) {
                log.info("Audit {}: overall={}, errors={}", report.url(), report.overallScore(), report.errors().size());
            }
            batch.errors().forEach((url, error) -> log.warn("Audit {} failed: {}", url, error));
            log.info("Batch summary: urls={}, reports={}, failed={}", urls.size(), batch.reports().size(), batch.errors().size());
        } else if (cli.getUrl() != null && !cli.getUrl().isBlank()) {
            ReadinessReport report = mode == AuditMode.PAGE
                ? pageAuditService.audit(targetFactory.create(cli.getUrl()))
                : siteAuditService.audit(targetFactory.create(cli.getUrl()));
            log.info("Audit {}: overall={}, errors={}", report.url(), report.overallScore(), report.errors());
            log.info("Report:\n{}", toJson(report));
        } else {
            log.warn("siteready.cli.run is set but neither siteready.cli.url nor siteready.cli.url-file is configured");
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    private List<String> readUrlFile(String file) {
        try {
            return UrlListParser.parse(Path.of(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read URL list " + file, e);
        }
    }

    private String toJson(ReadinessReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize report for {}", report.url(), e);
            return String.valueOf(report);
        }
    }
}
