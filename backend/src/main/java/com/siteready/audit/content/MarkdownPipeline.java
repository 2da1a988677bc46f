package com.siteready.audit.content;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MarkdownPipeline {
    private static final Logger log = LoggerFactory.getLogger(MarkdownPipeline.class);

    private final ContentExtractor contentExtractor;
    private final HtmlSanitizer htmlSanitizer;
    private final MarkdownConverter markdownConverter;

    public MarkdownPipeline(
        ContentExtractor contentExtractor,
        HtmlSanitizer htmlSanitizer,
        MarkdownConverter markdownConverter
    ) {
        this.contentExtractor = contentExtractor;
        this.htmlSanitizer = htmlSanitizer;
        this.markdownConverter = markdownConverter;
    }

    public String toMarkdown(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        ExtractedContent extracted = contentExtractor.extract(html);
        log.debug("Main content chosen by {} ({} chars of HTML)", extracted.strategy(), extracted.html().length());
        String sanitized = htmlSanitizer.sanitize(extracted.html());
        return markdownConverter.convert(sanitized);
    }
}
