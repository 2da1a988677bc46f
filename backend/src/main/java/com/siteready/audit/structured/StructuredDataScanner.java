package com.siteready.audit.structured;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteready.audit.model.StructuredDataItem;
import com.siteready.audit.model.StructuredDataReport;
import com.siteready.audit.scoring.ReadinessScoring;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

@Component
public class StructuredDataScanner {
    private static final Logger log = LoggerFactory.getLogger(StructuredDataScanner.class);
    private static final String UNKNOWN_TYPE = "Unknown";

    private final ObjectMapper objectMapper;

    public StructuredDataScanner(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StructuredDataReport scan(String html) {
        if (html == null || html.isBlank()) {
            return StructuredDataReport.empty("No HTML to analyze");
        }

        Document document = Jsoup.parse(html);
        List<StructuredDataItem> items = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                JsonNode root = objectMapper.readTree(payload);
                collectItems(root, items);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
            }
        }

        int blocksFound = items.size();
        String summary = blocksFound > 0 ? blocksFound + " JSON-LD block(s) found" : "No JSON-LD found";
        return new StructuredDataReport(blocksFound, items, ReadinessScoring.structuredDataScore(items), summary);
    }

    private void collectItems(JsonNode root, List<StructuredDataItem> out) {
        if (root == null || root.isNull()) {
            return;
        }
        if (root.isArray()) {
            for (JsonNode child : root) {
                if (child.isObject()) {
                    out.add(toItem(child));
                }
            }
            return;
        }
        if (root.isObject()) {
            out.add(toItem(root));
        }
    }

    private StructuredDataItem toItem(JsonNode node) {
        List<String> properties = new ArrayList<>();
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!name.startsWith("@")) {
                properties.add(name);
            }
        }
        return new StructuredDataItem(typeOf(node.get("@type")), properties);
    }

    private String typeOf(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull() || typeNode.isMissingNode()) {
            return UNKNOWN_TYPE;
        }
        if (typeNode.isArray()) {
            List<String> types = new ArrayList<>();
            for (JsonNode child : typeNode) {
                types.add(child.asText());
            }
            return String.join(", ", types);
        }
        if (typeNode.isValueNode()) {
            return typeNode.asText();
        }
        return typeNode.toString();
    }
}
