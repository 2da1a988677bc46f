package com.siteready.audit.scoring;

import com.siteready.audit.content.ContentDensityScorer;
import com.siteready.audit.model.CrawlResult;
import com.siteready.audit.model.PageScore;
import com.siteready.audit.structured.StructuredDataScanner;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PageScorer {
    private final StructuredDataScanner structuredDataScanner;
    private final ContentDensityScorer contentDensityScorer;

    public PageScorer(StructuredDataScanner structuredDataScanner, ContentDensityScorer contentDensityScorer) {
        this.structuredDataScanner = structuredDataScanner;
        this.contentDensityScorer = contentDensityScorer;
    }

    public PageScore score(CrawlResult result) {
        if (!result.success()) {
            return PageScore.failed(result.url(), result.error());
        }
        return new PageScore(
            result.url(),
            structuredDataScanner.scan(result.html()),
            contentDensityScorer.score(result.markdown()),
            List.of()
        );
    }
}
