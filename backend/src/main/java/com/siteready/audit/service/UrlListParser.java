package com.siteready.audit.service;

import com.siteready.audit.util.UrlUtils;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class UrlListParser {
    private static final Set<String> HEADER_CELLS = Set.of("url", "urls", "uri", "link", "website");

    private UrlListParser() {
    }

    public static List<String> parse(Path path) throws IOException {
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".csv") ? parseCsv(raw) : parseText(raw);
    }

    public static List<String> parseText(String raw) {
        List<String> urls = new ArrayList<>();
        if (raw == null) {
            return urls;
        }
        for (String line : raw.split("\\R")) {
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            urls.add(UrlUtils.ensureScheme(stripped));
        }
        return urls;
    }

    public static List<String> parseCsv(String raw) throws IOException {
        List<String> urls = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return urls;
        }
        try (Reader reader = new StringReader(raw); CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                if (record.size() == 0) {
                    continue;
                }
                String cell = record.get(0).strip();
                if (cell.isEmpty() || cell.startsWith("#") || HEADER_CELLS.contains(cell.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                urls.add(UrlUtils.ensureScheme(cell));
            }
        }
        return urls;
    }

    private static CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }
}
