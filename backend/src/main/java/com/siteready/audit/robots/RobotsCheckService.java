package com.siteready.audit.robots;

import com.siteready.audit.http.PoliteHttpClient;
import com.siteready.audit.model.AgentAccess;
import com.siteready.audit.model.AuditTarget;
import com.siteready.audit.model.HttpFetchResult;
import com.siteready.audit.model.RobotsCheckResult;
import com.siteready.audit.model.RobotsReport;
import com.siteready.audit.scoring.ReadinessScoring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class RobotsCheckService {
    private static final Logger log = LoggerFactory.getLogger(RobotsCheckService.class);
    private static final String ROOT_PATH = "/";

    private final PoliteHttpClient httpClient;

    public RobotsCheckService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public RobotsCheckResult check(AuditTarget target) {
        String robotsUrl = target.origin() + "/robots.txt";
        HttpFetchResult fetch = httpClient.get(robotsUrl, PoliteHttpClient.TEXT_ACCEPT, target.requestTimeout());
        if (fetch.errorCode() != null) {
            log.debug("robots.txt fetch failed for {}: {}", robotsUrl, fetch.describeFailure());
            return new RobotsCheckResult(
                RobotsReport.notFound("Failed to fetch robots.txt: " + fetch.describeFailure()),
                null
            );
        }
        if (fetch.statusCode() != 200) {
            log.debug("robots.txt returned HTTP {} for {}", fetch.statusCode(), robotsUrl);
            return new RobotsCheckResult(
                RobotsReport.notFound("robots.txt returned HTTP " + fetch.statusCode()),
                null
            );
        }

        String rawText = fetch.body() == null ? "" : fetch.body();
        RobotsRules rules;
        try {
            rules = RobotsRules.parse(rawText);
        } catch (RuntimeException e) {
            log.debug("robots.txt at {} could not be parsed", robotsUrl, e);
            return new RobotsCheckResult(RobotsReport.notFound("robots.txt could not be parsed"), null);
        }

        List<AgentAccess> access = evaluate(rules, target.agents());
        long allowed = access.stream().filter(AgentAccess::allowed).count();
        RobotsReport report = new RobotsReport(
            true,
            access,
            ReadinessScoring.robotsScore(access),
            allowed + "/" + access.size() + " AI agents allowed"
        );
        return new RobotsCheckResult(report, rawText);
    }

    static List<AgentAccess> evaluate(RobotsRules rules, List<String> agents) {
        List<AgentAccess> access = new ArrayList<>(agents.size());
        for (String agent : agents) {
            boolean allowed = rules.isAllowed(agent, ROOT_PATH);
            access.add(new AgentAccess(agent, allowed, allowed ? "Allowed" : "Blocked by robots.txt"));
        }
        return access;
    }
}
