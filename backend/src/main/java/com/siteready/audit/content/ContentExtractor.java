package com.siteready.audit.content;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Picks the main-content fragment of a page. Each step of the chain must carry strictly more
 * visible text than its threshold to win; the last two steps always produce something.
 */
@Component
public class ContentExtractor {
    private static final Logger log = LoggerFactory.getLogger(ContentExtractor.class);

    static final int READABILITY_MIN_CHARS = 100;
    static final int LANDMARK_MIN_CHARS = 50;
    private static final Pattern BODY_TAG = Pattern.compile("<body[\\s>/]", Pattern.CASE_INSENSITIVE);

    private final ReadabilityExtractor readabilityExtractor;

    public ContentExtractor(ReadabilityExtractor readabilityExtractor) {
        this.readabilityExtractor = readabilityExtractor;
    }

    public ExtractedContent extract(String html) {
        if (html == null || html.isBlank()) {
            return new ExtractedContent(html == null ? "" : html, ExtractionStrategy.RAW);
        }

        Optional<Element> readable = tryReadability(html);
        if (readable.isPresent()) {
            return new ExtractedContent(readable.get().outerHtml(), ExtractionStrategy.READABILITY);
        }

        Document document = Jsoup.parse(html);
        Element main = document.selectFirst("main");
        if (main != null && visibleTextLength(main) > LANDMARK_MIN_CHARS) {
            return new ExtractedContent(main.outerHtml(), ExtractionStrategy.MAIN);
        }

        Element article = longest(document.select("article"));
        if (article != null && visibleTextLength(article) > LANDMARK_MIN_CHARS) {
            return new ExtractedContent(article.outerHtml(), ExtractionStrategy.ARTICLE);
        }

        Element roleMain = document.selectFirst("[role=main]");
        if (roleMain != null && visibleTextLength(roleMain) > LANDMARK_MIN_CHARS) {
            return new ExtractedContent(roleMain.outerHtml(), ExtractionStrategy.ROLE_MAIN);
        }

        // jsoup always synthesizes a body, so only honour one the markup actually declared
        if (BODY_TAG.matcher(html).find()) {
            return new ExtractedContent(document.body().outerHtml(), ExtractionStrategy.BODY);
        }
        return new ExtractedContent(html, ExtractionStrategy.RAW);
    }

    private Optional<Element> tryReadability(String html) {
        try {
            return readabilityExtractor.extract(html)
                .filter(element -> visibleTextLength(element) > READABILITY_MIN_CHARS);
        } catch (RuntimeException e) {
            log.debug("Readability extraction failed, falling back to landmarks", e);
            return Optional.empty();
        }
    }

    private Element longest(Elements elements) {
        Element best = null;
        int bestLength = -1;
        for (Element element : elements) {
            int length = visibleTextLength(element);
            if (length > bestLength) {
                best = element;
                bestLength = length;
            }
        }
        return best;
    }

    /**
     * Sum of the trimmed lengths of every text node under {@code root}. Script and style bodies
     * are data nodes in jsoup and never counted.
     */
    static int visibleTextLength(Node root) {
        AtomicInteger total = new AtomicInteger();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                total.addAndGet(textNode.getWholeText().strip().length());
            }
        }, root);
        return total.get();
    }
}
