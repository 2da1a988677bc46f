package com.siteready.audit.signals;

import com.siteready.audit.http.PoliteHttpClient;
import com.siteready.audit.model.AuditTarget;
import com.siteready.audit.model.ContentUsageReport;
import com.siteready.audit.model.HttpHeadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class ContentUsageCheck {
    private static final Logger log = LoggerFactory.getLogger(ContentUsageCheck.class);
    static final String HEADER = "Content-Usage";
    private static final Pattern KEY_VALUE = Pattern.compile("(\\w+)\\s*=\\s*(\\w+)", Pattern.UNICODE_CHARACTER_CLASS);

    private final PoliteHttpClient httpClient;

    public ContentUsageCheck(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public ContentUsageReport check(AuditTarget target) {
        HttpHeadResult head = httpClient.head(target.url(), target.requestTimeout());
        if (head.errorCode() != null) {
            log.debug("Content-Usage HEAD for {} failed: {}", target.url(), head.describeFailure());
            return ContentUsageReport.notFound("Content-Usage check failed: " + head.describeFailure());
        }
        if (head.statusCode() != 200) {
            return ContentUsageReport.notFound("Content-Usage header not found (non-200 response)");
        }
        String raw = head.firstHeader(HEADER);
        if (raw == null || raw.isBlank()) {
            return ContentUsageReport.notFound("Content-Usage header not found");
        }
        return parse(raw.strip());
    }

    static ContentUsageReport parse(String raw) {
        Map<String, String> pairs = new HashMap<>();
        Matcher matcher = KEY_VALUE.matcher(raw);
        while (matcher.find()) {
            pairs.put(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2));
        }
        Boolean training = yesNo(pairs.get("training"));
        Boolean search = yesNo(pairs.get("search"));

        List<String> parts = new ArrayList<>();
        parts.add(HEADER + ": " + raw);
        if (training != null) {
            parts.add("training=" + (training ? "allowed" : "blocked"));
        }
        if (search != null) {
            parts.add("search=" + (search ? "allowed" : "blocked"));
        }
        return new ContentUsageReport(true, raw, training, search, String.join("; ", parts));
    }

    private static Boolean yesNo(String value) {
        if (value == null) {
            return null;
        }
        String lower = value.strip().toLowerCase(Locale.ROOT);
        if (lower.equals("yes")) {
            return Boolean.TRUE;
        }
        if (lower.equals("no")) {
            return Boolean.FALSE;
        }
        return null;
    }
}
