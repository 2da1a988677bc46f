package com.siteready.audit.model;

public record AgentAccess(String agent, boolean allowed, String reason) {
}
