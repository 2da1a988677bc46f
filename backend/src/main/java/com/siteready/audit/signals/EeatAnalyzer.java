package com.siteready.audit.signals;

import com.siteready.audit.model.EeatReport;
import com.siteready.audit.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class EeatAnalyzer {
    private static final Pattern ABOUT = Pattern.compile("/about(?:-us)?(?:/|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTACT = Pattern.compile("/contact(?:-us)?(?:/|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRIVACY = Pattern.compile("privacy", Pattern.CASE_INSENSITIVE);
    private static final Pattern TERMS = Pattern.compile("terms", Pattern.CASE_INSENSITIVE);
    private static final Set<String> DATE_META_PROPERTIES = Set.of(
        "article:published_time",
        "article:modified_time",
        "datePublished",
        "dateModified",
        "og:updated_time"
    );
    private static final Set<String> DATE_META_NAMES = Set.of("date", "dcterms.date", "dc.date");
    private static final List<String> BYLINE_CLASSES = List.of("byline", "author", "post-author");

    static final String PRIVACY_POLICY = "privacy policy";
    static final String TERMS_OF_SERVICE = "terms of service";

    private EeatAnalyzer() {
    }

    public static EeatReport analyze(String html, String pageUrl) {
        if (html == null || html.isBlank()) {
            return EeatReport.empty("No HTML content for E-E-A-T analysis");
        }

        Document document = Jsoup.parse(html);
        Author author = author(document);
        boolean hasDate = hasDate(document);
        boolean hasAbout = false;
        boolean hasContact = false;
        int citations = 0;
        List<String> trust = new ArrayList<>();
        String baseAuthority = authority(pageUrl);

        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href");
            if (ABOUT.matcher(href).find()) {
                hasAbout = true;
            }
            if (href.startsWith("mailto:") || href.startsWith("tel:") || CONTACT.matcher(href).find()) {
                hasContact = true;
            }
            if (isCitation(href, baseAuthority)) {
                citations++;
            }
            String combined = href + " " + anchor.text().strip().toLowerCase(Locale.ROOT);
            if (PRIVACY.matcher(combined).find() && !trust.contains(PRIVACY_POLICY)) {
                trust.add(PRIVACY_POLICY);
            }
            if (TERMS.matcher(combined).find() && !trust.contains(TERMS_OF_SERVICE)) {
                trust.add(TERMS_OF_SERVICE);
            }
        }

        List<String> found = new ArrayList<>();
        if (author.found()) {
            found.add(author.name() != null ? "author: " + author.name() : "author found");
        }
        if (hasDate) {
            found.add("publication date");
        }
        if (hasAbout) {
            found.add("about page");
        }
        if (hasContact) {
            found.add("contact info");
        }
        if (citations > 0) {
            found.add(citations + " external citation(s)");
        }
        if (!trust.isEmpty()) {
            found.add("trust: " + String.join(", ", trust));
        }
        String summary = found.isEmpty()
            ? "No E-E-A-T signals detected"
            : "E-E-A-T signals: " + String.join(", ", found);

        return new EeatReport(
            author.found(),
            author.name(),
            hasDate,
            hasAbout,
            hasContact,
            citations > 0,
            citations,
            trust,
            summary
        );
    }

    private static Author author(Document document) {
        Element meta = document.selectFirst("meta[name=author]");
        if (meta != null && !meta.attr("content").isBlank()) {
            return new Author(true, meta.attr("content").strip());
        }

        for (Element anchor : document.select("a[rel]")) {
            for (String rel : anchor.attr("rel").toLowerCase(Locale.ROOT).split("\\s+")) {
                if (rel.equals("author")) {
                    return new Author(true, blankToNull(anchor.text()));
                }
            }
        }

        Element itemprop = document.selectFirst("[itemprop=author]");
        if (itemprop != null) {
            Element name = itemprop.selectFirst("[itemprop=name]");
            return new Author(true, name == null ? null : blankToNull(name.text()));
        }

        for (String byline : BYLINE_CLASSES) {
            if (document.selectFirst("[class~=(?i)" + byline + "]") != null) {
                return new Author(true, null);
            }
        }
        return new Author(false, null);
    }

    private static boolean hasDate(Document document) {
        for (Element meta : document.select("meta[property]")) {
            if (DATE_META_PROPERTIES.contains(meta.attr("property"))) {
                return true;
            }
        }
        for (Element meta : document.select("meta[name]")) {
            if (DATE_META_NAMES.contains(meta.attr("name"))) {
                return true;
            }
        }
        return document.selectFirst("time[datetime]") != null;
    }

    /**
     * Absolute links to another host count as citations; relative links never do.
     */
    private static boolean isCitation(String href, String baseAuthority) {
        URI uri = UrlUtils.safeUri(href);
        if (uri == null || uri.getScheme() == null || uri.getRawAuthority() == null) {
            return false;
        }
        return baseAuthority == null || !baseAuthority.equalsIgnoreCase(uri.getRawAuthority());
    }

    private static String authority(String pageUrl) {
        URI uri = UrlUtils.safeUri(pageUrl);
        return uri == null ? null : uri.getRawAuthority();
    }

    private static String blankToNull(String value) {
        String stripped = value == null ? "" : value.strip();
        return stripped.isEmpty() ? null : stripped;
    }

    private record Author(boolean found, String name) {
    }
}
