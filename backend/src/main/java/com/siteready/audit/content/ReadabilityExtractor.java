package com.siteready.audit.content;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Boilerplate removal in the Arc90 readability style: paragraphs vote for their parent and
 * grandparent, class and id names push candidates up or down, link-heavy candidates are
 * penalized, and the best candidate is returned together with its strong siblings.
 */
@Component
public class ReadabilityExtractor {
    private static final Pattern UNLIKELY_CANDIDATES = Pattern.compile(
        "banner|breadcrumbs|combx|comment|community|cover-wrap|disqus|extra|footer|gdpr|header|legends|menu"
            + "|related|remark|replies|rss|shoutbox|sidebar|skyscraper|social|sponsor|supplemental|ad-break"
            + "|agegate|pagination|pager|popup|cookie",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern MAYBE_CANDIDATE = Pattern.compile(
        "and|article|body|column|content|main|shadow",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern POSITIVE = Pattern.compile(
        "article|body|content|entry|hentry|h-entry|main|page|post|text|blog|story",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern NEGATIVE = Pattern.compile(
        "-ad-|hidden|banner|combx|comment|com-|contact|foot|footer|footnote|gdpr|masthead|media|meta|outbrain"
            + "|promo|related|scroll|share|shoutbox|sidebar|skyscraper|sponsor|shopping|tags|tool|widget",
        Pattern.CASE_INSENSITIVE
    );
    private static final String NOISE_SELECTOR = "script, style, noscript, template, iframe, svg, form, nav";
    private static final String SCORABLE_SELECTOR = "p, pre, td, blockquote";
    private static final int MIN_PARAGRAPH_CHARS = 25;
    private static final int CLASS_WEIGHT = 25;

    public Optional<Element> extract(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);
        Element body = document.body();
        body.select(NOISE_SELECTOR).remove();
        removeUnlikelyCandidates(body);

        Map<Element, Double> scores = new IdentityHashMap<>();
        List<Element> candidates = new ArrayList<>();
        for (Element paragraph : body.select(SCORABLE_SELECTOR)) {
            String text = paragraph.text();
            if (text.length() < MIN_PARAGRAPH_CHARS) {
                continue;
            }
            Element parent = paragraph.parent();
            if (parent == null) {
                continue;
            }
            double contentScore = 1 + countCommas(text) + Math.min(Math.floor(text.length() / 100.0), 3);
            addScore(scores, candidates, parent, contentScore);
            Element grandParent = parent.parent();
            if (grandParent != null && grandParent != document) {
                addScore(scores, candidates, grandParent, contentScore / 2);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        Element top = null;
        double topScore = Double.NEGATIVE_INFINITY;
        for (Element candidate : candidates) {
            double adjusted = scores.get(candidate) * (1 - linkDensity(candidate));
            scores.put(candidate, adjusted);
            if (adjusted > topScore) {
                top = candidate;
                topScore = adjusted;
            }
        }
        return Optional.of(collectArticle(top, topScore, scores));
    }

    private void removeUnlikelyCandidates(Element body) {
        List<Element> unlikely = new ArrayList<>();
        for (Element element : body.getAllElements()) {
            String tag = element.normalName();
            if (element == body || tag.equals("html") || tag.equals("a") || tag.equals("article") || tag.equals("main")) {
                continue;
            }
            String matchString = element.className() + " " + element.id();
            if (matchString.isBlank()) {
                continue;
            }
            if (UNLIKELY_CANDIDATES.matcher(matchString).find() && !MAYBE_CANDIDATE.matcher(matchString).find()) {
                unlikely.add(element);
            }
        }
        for (Element element : unlikely) {
            if (element.parent() != null) {
                element.remove();
            }
        }
    }

    private void addScore(Map<Element, Double> scores, List<Element> candidates, Element element, double delta) {
        Double current = scores.get(element);
        if (current == null) {
            current = initialScore(element);
            candidates.add(element);
        }
        scores.put(element, current + delta);
    }

    private double initialScore(Element element) {
        double score = switch (element.normalName()) {
            case "div", "article", "main" -> 5;
            case "pre", "td", "blockquote" -> 3;
            case "address", "ol", "ul", "dl", "dd", "dt", "li", "form" -> -3;
            case "h1", "h2", "h3", "h4", "h5", "h6", "th" -> -5;
            default -> 0;
        };
        return score + classWeight(element);
    }

    private int classWeight(Element element) {
        int weight = 0;
        String className = element.className();
        if (!className.isBlank()) {
            if (NEGATIVE.matcher(className).find()) {
                weight -= CLASS_WEIGHT;
            }
            if (POSITIVE.matcher(className).find()) {
                weight += CLASS_WEIGHT;
            }
        }
        String id = element.id();
        if (!id.isBlank()) {
            if (NEGATIVE.matcher(id).find()) {
                weight -= CLASS_WEIGHT;
            }
            if (POSITIVE.matcher(id).find()) {
                weight += CLASS_WEIGHT;
            }
        }
        return weight;
    }

    private Element collectArticle(Element top, double topScore, Map<Element, Double> scores) {
        Element article = new Element("div");
        Element parent = top.parent();
        if (parent == null) {
            article.appendChild(top.clone());
            return article;
        }
        double threshold = Math.max(10, topScore * 0.2);
        for (Element sibling : parent.children()) {
            if (sibling == top) {
                article.appendChild(sibling.clone());
                continue;
            }
            Double siblingScore = scores.get(sibling);
            if (siblingScore != null && siblingScore >= threshold) {
                article.appendChild(sibling.clone());
            } else if (sibling.normalName().equals("p")) {
                String text = sibling.text();
                double density = linkDensity(sibling);
                if ((text.length() > 80 && density < 0.25)
                    || (!text.isEmpty() && density == 0 && text.toLowerCase(Locale.ROOT).matches(".*\\.( |$).*"))) {
                    article.appendChild(sibling.clone());
                }
            }
        }
        return article;
    }

    private double linkDensity(Element element) {
        int textLength = element.text().length();
        if (textLength == 0) {
            return 0;
        }
        int linkLength = 0;
        for (Element link : element.select("a")) {
            linkLength += link.text().length();
        }
        return (double) linkLength / textLength;
    }

    private int countCommas(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == ',') {
                count++;
            }
        }
        return count;
    }
}
