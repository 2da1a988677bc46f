package com.siteready.audit.api;

import com.siteready.audit.model.AuditReport;
import com.siteready.audit.model.BatchAuditReport;
import com.siteready.audit.model.SiteAuditReport;
import com.siteready.audit.service.AuditMode;
import com.siteready.audit.service.AuditTargetFactory;
import com.siteready.audit.service.BatchAuditService;
import com.siteready.audit.service.PageAuditService;
import com.siteready.audit.service.SiteAuditService;
import com.siteready.audit.util.UrlUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
public class AuditController {
    private final PageAuditService pageAuditService;
    private final SiteAuditService siteAuditService;
    private final BatchAuditService batchAuditService;
    private final AuditTargetFactory targetFactory;

    public AuditController(
        PageAuditService pageAuditService,
        SiteAuditService siteAuditService,
        BatchAuditService batchAuditService,
        AuditTargetFactory targetFactory
    ) {
        this.pageAuditService = pageAuditService;
        this.siteAuditService = siteAuditService;
        this.batchAuditService = batchAuditService;
        this.targetFactory = targetFactory;
    }

    @GetMapping("/page")
    public AuditReport auditPage(@RequestParam(name = "url") String url) {
        return pageAuditService.audit(targetFactory.create(url));
    }

    @GetMapping("/site")
    public SiteAuditReport auditSite(
        @RequestParam(name = "url") String url,
        @RequestParam(name = "maxPages", required = false) Integer maxPages
    ) {
        return siteAuditService.audit(targetFactory.create(url, maxPages));
    }

    @PostMapping("/batch")
    public BatchAuditReport auditBatch(@RequestBody BatchAuditRequest request) {
        if (request == null || request.urls() == null || request.urls().isEmpty()) {
            throw new IllegalArgumentException("urls must not be empty");
        }
        List<String> urls = request.urls().stream()
            .filter(url -> url != null && !url.isBlank())
            .map(url -> UrlUtils.ensureScheme(url.strip()))
            .toList();
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("urls must not be empty");
        }
        return batchAuditService.audit(urls, AuditMode.fromString(request.mode()), request.maxPages());
    }
}
