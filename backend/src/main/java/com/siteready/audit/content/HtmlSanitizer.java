package com.siteready.audit.content;

import com.siteready.config.SiteReadyProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Strips navigation, chrome and other non-content elements from an extracted fragment using the
 * configured CSS selectors.
 */
@Component
public class HtmlSanitizer {
    private static final Logger log = LoggerFactory.getLogger(HtmlSanitizer.class);

    private final List<String> stripSelectors;

    @Autowired
    public HtmlSanitizer(SiteReadyProperties properties) {
        this(properties.getExtraction().getStripSelectors());
    }

    HtmlSanitizer(List<String> stripSelectors) {
        this.stripSelectors = List.copyOf(stripSelectors);
    }

    public String sanitize(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(html);
        document.outputSettings().prettyPrint(false);
        for (String selector : stripSelectors) {
            if (selector == null || selector.isBlank()) {
                continue;
            }
            try {
                document.body().select(selector).remove();
            } catch (Selector.SelectorParseException e) {
                log.warn("Ignoring invalid strip selector '{}': {}", selector, e.getMessage());
            }
        }
        return document.body().html();
    }
}
