package com.siteready.audit.content;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Component
public class MarkdownConverter {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String LANGUAGE_PREFIX = "language-";

    public String convert(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(html);
        StringBuilder out = new StringBuilder();
        renderChildren(document.body(), out, 0);
        return tidy(out.toString());
    }

    private void renderChildren(Element element, StringBuilder out, int listDepth) {
        for (Node child : element.childNodes()) {
            renderNode(child, out, listDepth);
        }
    }

    private void renderNode(Node node, StringBuilder out, int listDepth) {
        if (node instanceof TextNode text) {
            out.append(WHITESPACE.matcher(text.getWholeText()).replaceAll(" "));
            return;
        }
        if (!(node instanceof Element element)) {
            return;
        }
        switch (element.normalName()) {
            case "script", "style", "noscript", "template", "head", "title", "meta", "link" -> {
            }
            case "h1", "h2", "h3", "h4", "h5", "h6" -> renderHeading(element, out, listDepth);
            case "p", "div", "section", "main", "article", "header", "footer", "aside", "nav", "figure",
                "figcaption", "address", "details", "summary", "dl", "dt", "dd", "form", "fieldset" ->
                renderBlock(element, out, listDepth);
            case "br" -> out.append('\n');
            case "hr" -> out.append("\n\n---\n\n");
            case "ul", "ol" -> renderList(element, out, listDepth);
            case "li" -> out.append("\n- ").append(inline(element, listDepth)).append('\n');
            case "pre" -> renderCodeBlock(element, out);
            case "code" -> renderInlineCode(element, out);
            case "a" -> renderLink(element, out, listDepth);
            case "img" -> renderImage(element, out);
            case "strong", "b" -> wrap(element, out, "**", listDepth);
            case "em", "i" -> wrap(element, out, "*", listDepth);
            case "blockquote" -> renderBlockquote(element, out, listDepth);
            case "table" -> renderTable(element, out, listDepth);
            default -> renderChildren(element, out, listDepth);
        }
    }

    private void renderHeading(Element element, StringBuilder out, int listDepth) {
        String text = inline(element, listDepth);
        if (text.isEmpty()) {
            return;
        }
        int level = element.normalName().charAt(1) - '0';
        out.append("\n\n").append("#".repeat(level)).append(' ').append(text).append("\n\n");
    }

    private void renderBlock(Element element, StringBuilder out, int listDepth) {
        StringBuilder inner = new StringBuilder();
        renderChildren(element, inner, listDepth);
        String content = inner.toString().strip();
        if (!content.isEmpty()) {
            out.append("\n\n").append(content).append("\n\n");
        }
    }

    private void renderList(Element list, StringBuilder out, int depth) {
        boolean ordered = list.normalName().equals("ol");
        int index = ordered ? startIndex(list) : 1;
        StringBuilder items = new StringBuilder();
        for (Element child : list.children()) {
            if (!child.normalName().equals("li")) {
                continue;
            }
            String marker = ordered ? (index++) + ". " : "- ";
            renderListItem(child, marker, depth, items);
        }
        if (items.length() == 0) {
            return;
        }
        if (depth == 0) {
            out.append("\n\n").append(items).append("\n\n");
        } else {
            out.append(items);
        }
    }

    private void renderListItem(Element item, String marker, int depth, StringBuilder items) {
        StringBuilder content = new StringBuilder();
        StringBuilder nested = new StringBuilder();
        for (Node child : item.childNodes()) {
            if (child instanceof Element element
                && (element.normalName().equals("ul") || element.normalName().equals("ol"))) {
                renderList(element, nested, depth + 1);
            } else {
                renderNode(child, content, depth);
            }
        }
        String text = WHITESPACE.matcher(content).replaceAll(" ").strip();
        items.append("  ".repeat(depth)).append(marker).append(text).append('\n');
        items.append(nested);
    }

    private int startIndex(Element list) {
        String start = list.attr("start").trim();
        if (start.isEmpty()) {
            return 1;
        }
        try {
            return Integer.parseInt(start);
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private void renderCodeBlock(Element pre, StringBuilder out) {
        Element code = pre.selectFirst("code");
        Element source = code != null ? code : pre;
        String body = source.wholeText();
        while (body.startsWith("\n")) {
            body = body.substring(1);
        }
        body = body.stripTrailing();
        String language = language(source);
        if (language.isEmpty() && code != null) {
            language = language(pre);
        }
        out.append("\n\n```").append(language).append('\n').append(body).append("\n```\n\n");
    }

    private String language(Element element) {
        for (String className : element.classNames()) {
            if (className.startsWith(LANGUAGE_PREFIX)) {
                return className.substring(LANGUAGE_PREFIX.length());
            }
        }
        return "";
    }

    private void renderInlineCode(Element element, StringBuilder out) {
        String text = WHITESPACE.matcher(element.wholeText()).replaceAll(" ").strip();
        if (text.isEmpty()) {
            return;
        }
        String fence = text.contains("`") ? "``" : "`";
        out.append(fence).append(text).append(fence);
    }

    private void renderLink(Element element, StringBuilder out, int listDepth) {
        String text = inline(element, listDepth);
        String href = element.attr("href").strip();
        if (text.isEmpty()) {
            return;
        }
        if (href.isEmpty() || href.startsWith("javascript:")) {
            out.append(text);
            return;
        }
        out.append('[').append(text).append("](").append(href).append(')');
    }

    private void renderImage(Element element, StringBuilder out) {
        String src = element.attr("src").strip();
        if (src.isEmpty()) {
            return;
        }
        out.append("![").append(element.attr("alt").strip()).append("](").append(src).append(')');
    }

    private void wrap(Element element, StringBuilder out, String marker, int listDepth) {
        String text = inline(element, listDepth);
        if (!text.isEmpty()) {
            out.append(marker).append(text).append(marker);
        }
    }

    private void renderBlockquote(Element element, StringBuilder out, int listDepth) {
        StringBuilder inner = new StringBuilder();
        renderChildren(element, inner, listDepth);
        String content = tidy(inner.toString()).strip();
        if (content.isEmpty()) {
            return;
        }
        List<String> quoted = new ArrayList<>();
        for (String line : content.split("\n", -1)) {
            quoted.add(line.isEmpty() ? ">" : "> " + line);
        }
        out.append("\n\n").append(String.join("\n", quoted)).append("\n\n");
    }

    private void renderTable(Element table, StringBuilder out, int listDepth) {
        List<List<String>> rows = new ArrayList<>();
        int columns = 0;
        for (Element row : table.select("tr")) {
            List<String> cells = new ArrayList<>();
            for (Element cell : row.children()) {
                if (cell.normalName().equals("th") || cell.normalName().equals("td")) {
                    cells.add(inline(cell, listDepth).replace("|", "\\|"));
                }
            }
            if (!cells.isEmpty()) {
                rows.add(cells);
                columns = Math.max(columns, cells.size());
            }
        }
        if (rows.isEmpty()) {
            return;
        }
        out.append("\n\n");
        appendRow(out, rows.get(0), columns);
        List<String> separator = new ArrayList<>();
        for (int i = 0; i < columns; i++) {
            separator.add("---");
        }
        appendRow(out, separator, columns);
        for (int i = 1; i < rows.size(); i++) {
            appendRow(out, rows.get(i), columns);
        }
        out.append('\n');
    }

    private void appendRow(StringBuilder out, List<String> cells, int columns) {
        out.append('|');
        for (int i = 0; i < columns; i++) {
            String cell = i < cells.size() ? cells.get(i) : "";
            out.append(' ').append(cell).append(" |");
        }
        out.append('\n');
    }

    private String inline(Element element, int listDepth) {
        StringBuilder inner = new StringBuilder();
        renderChildren(element, inner, listDepth);
        return WHITESPACE.matcher(inner).replaceAll(" ").strip();
    }

    static String tidy(String raw) {
        List<String> lines = new ArrayList<>();
        boolean previousBlank = false;
        for (String line : raw.split("\n", -1)) {
            String trimmed = line.stripTrailing();
            boolean blank = trimmed.isEmpty();
            if (blank && previousBlank) {
                continue;
            }
            lines.add(trimmed);
            previousBlank = blank;
        }
        String joined = String.join("\n", lines).strip();
        return joined.isEmpty() ? "" : joined + "\n";
    }
}
