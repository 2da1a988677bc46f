package com.siteready.audit.contextfile;

import com.siteready.audit.http.PoliteHttpClient;
import com.siteready.audit.model.AuditTarget;
import com.siteready.audit.model.ContextFileReport;
import com.siteready.audit.model.HttpFetchResult;
import com.siteready.audit.scoring.ReadinessScoring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
public class ContextFileProbe {
    private static final Logger log = LoggerFactory.getLogger(ContextFileProbe.class);

    static final List<String> CONTEXT_FILE_PATHS = List.of("/llms.txt", "/.well-known/llms.txt");
    static final List<String> FULL_CONTEXT_FILE_PATHS = List.of("/llms-full.txt", "/.well-known/llms-full.txt");

    private final PoliteHttpClient httpClient;

    public ContextFileProbe(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public ContextFileReport probe(AuditTarget target) {
        String origin = target.origin();
        String found = firstAvailable(origin, CONTEXT_FILE_PATHS, target.requestTimeout());
        String fullFound = firstAvailable(origin, FULL_CONTEXT_FILE_PATHS, target.requestTimeout());

        double score = ReadinessScoring.contextFileScore(found != null, fullFound != null);
        String summary;
        if (found != null && fullFound != null) {
            summary = "Found llms.txt at " + found + " and llms-full.txt at " + fullFound;
        } else if (found != null) {
            summary = "Found llms.txt at " + found;
        } else if (fullFound != null) {
            summary = "Found llms-full.txt at " + fullFound;
        } else {
            summary = "llms.txt not found";
        }
        return new ContextFileReport(found != null, found, fullFound != null, fullFound, score, summary);
    }

    private String firstAvailable(String origin, List<String> paths, Duration timeout) {
        for (String path : paths) {
            String candidate = origin + path;
            HttpFetchResult fetch = httpClient.get(candidate, PoliteHttpClient.TEXT_ACCEPT, timeout);
            if (fetch.isOk() && fetch.body() != null && !fetch.body().isBlank()) {
                return candidate;
            }
            log.debug("No context file at {} ({})", candidate, fetch.describeFailure());
        }
        return null;
    }
}
