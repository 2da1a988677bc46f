package com.siteready.audit.model;

import com.siteready.audit.scoring.ReadinessScoring;

import java.util.List;

public record RobotsReport(
    boolean found,
    List<AgentAccess> agents,
    double score,
    String summary
) implements PillarReport {
    public RobotsReport {
        agents = agents == null ? List.of() : List.copyOf(agents);
    }

    public static RobotsReport notFound(String summary) {
        return new RobotsReport(false, List.of(), 0, summary);
    }

    public long allowedCount() {
        return agents.stream().filter(AgentAccess::allowed).count();
    }

    @Override
    public double maxScore() {
        return ReadinessScoring.ROBOTS_MAX;
    }
}
