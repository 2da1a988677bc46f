package com.siteready.audit.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsed robots.txt: user-agent groups with their Allow/Disallow rules, plus the Sitemap
 * directives found anywhere in the file.
 *
 * <p>An agent is governed by every group that names its product token; when no group names it,
 * the {@code *} groups apply; with no applicable group everything is allowed. Within the
 * applicable rules the longest matching path wins and Allow wins a tie.
 */
public class RobotsRules {
  private static final String WILDCARD_AGENT = "*";

  private final List<Group> groups;
  private final List<String> sitemapUrls;

  public RobotsRules(List<Group> groups, List<String> sitemapUrls) {
    this.groups = groups;
    this.sitemapUrls = sitemapUrls;
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of(), List.of());
  }

  public List<String> getSitemapUrls() {
    return sitemapUrls;
  }

  public List<Group> getGroups() {
    return groups;
  }

  public boolean isAllowed(String pathAndQuery) {
    return isAllowed(WILDCARD_AGENT, pathAndQuery);
  }

  public boolean isAllowed(String agent, String pathAndQuery) {
    List<Rule> rules = rulesFor(agent);
    if (rules.isEmpty()) {
      return true;
    }

    Rule bestMatch = null;
    int bestMatchLength = -1;
    String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
    for (Rule rule : rules) {
      if (!rule.matches(subject)) {
        continue;
      }
      int length = rule.path().length();
      if (length > bestMatchLength) {
        bestMatch = rule;
        bestMatchLength = length;
      } else if (length == bestMatchLength
          && bestMatch != null
          && rule.allow()
          && !bestMatch.allow()) {
        bestMatch = rule;
      }
    }
    return bestMatch == null || bestMatch.allow();
  }

  List<Rule> rulesFor(String agent) {
    String token = productToken(agent);
    List<Rule> specific = new ArrayList<>();
    boolean namedByGroup = false;
    if (!token.isEmpty() && !WILDCARD_AGENT.equals(token)) {
      for (Group group : groups) {
        if (group.agents().contains(token)) {
          namedByGroup = true;
          specific.addAll(group.rules());
        }
      }
    }
    if (namedByGroup) {
      return specific;
    }
    List<Rule> wildcard = new ArrayList<>();
    for (Group group : groups) {
      if (group.agents().contains(WILDCARD_AGENT)) {
        wildcard.addAll(group.rules());
      }
    }
    return wildcard;
  }

  public static RobotsRules parse(String robotsText) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }

    List<String> sitemaps = new ArrayList<>();
    List<Group> parsedGroups = new ArrayList<>();

    Group currentGroup = null;
    boolean lastDirectiveWasUserAgent = false;

    String[] lines = robotsText.split("\\R");
    for (String rawLine : lines) {
      String noComment = stripComment(rawLine);
      String line = noComment.trim();
      if (line.isEmpty()) {
        currentGroup = null;
        lastDirectiveWasUserAgent = false;
        continue;
      }
      int colonIdx = line.indexOf(':');
      if (colonIdx <= 0) {
        continue;
      }

      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      if ("user-agent".equals(key)) {
        if (!lastDirectiveWasUserAgent || currentGroup == null) {
          currentGroup = new Group(new ArrayList<>(), new ArrayList<>());
          parsedGroups.add(currentGroup);
        }
        String agentToken = productToken(value);
        if (!agentToken.isEmpty()) {
          currentGroup.agents().add(agentToken);
        }
        lastDirectiveWasUserAgent = true;
        continue;
      }

      lastDirectiveWasUserAgent = false;
      if ("sitemap".equals(key)) {
        if (!value.isBlank()) {
          sitemaps.add(value);
        }
        continue;
      }

      if (currentGroup == null) {
        continue;
      }
      if (("allow".equals(key) || "disallow".equals(key)) && !value.isBlank()) {
        currentGroup.rules().add(new Rule(value, "allow".equals(key)));
      }
    }

    return new RobotsRules(parsedGroups, sitemaps);
  }

  static String productToken(String agent) {
    if (agent == null) {
      return "";
    }
    String trimmed = agent.trim();
    int slash = trimmed.indexOf('/');
    if (slash >= 0) {
      trimmed = trimmed.substring(0, slash).trim();
    }
    return trimmed.toLowerCase(Locale.ROOT);
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  public record Group(List<String> agents, List<Rule> rules) {
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String normalizedPath = path.startsWith("/") ? path : "/" + path;
      if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
        return testPath.startsWith(normalizedPath);
      }
      StringBuilder regex = new StringBuilder("^");
      for (int i = 0; i < normalizedPath.length(); i++) {
        char c = normalizedPath.charAt(i);
        if (c == '*') {
          regex.append(".*");
        } else if (c == '$') {
          regex.append("$");
        } else {
          regex.append(Pattern.quote(Character.toString(c)));
        }
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }
  }
}
