package dev.sitedigest.crawl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Immutable robots.txt rules grouped by user-agent token.
 *
 * <p>Only simple path-prefix rules are supported. Filtering decisions consult the wildcard ({@code
 * *}) group alone; other groups are parsed and kept but never used to allow or reject a path. An
 * allow prefix that matches always wins over a matching disallow prefix, and any single matching
 * prefix of either kind is enough (no longest-match ranking).
 */
public final class RobotsRuleSet {

  public static final String WILDCARD_AGENT = "*";

  private static final RobotsRuleSet EMPTY = new RobotsRuleSet(Map.of());

  private final Map<String, AgentRules> rulesByAgent;

  private RobotsRuleSet(Map<String, AgentRules> rulesByAgent) {
    this.rulesByAgent = Map.copyOf(rulesByAgent);
  }

  /** Rule set that disallows nothing. Used when robots.txt is missing or unreadable. */
  public static RobotsRuleSet empty() {
    return EMPTY;
  }

  /**
   * Parse robots.txt content. Directive keywords are case-insensitive, {@code #} starts a comment,
   * blank lines are ignored, and each Allow/Disallow applies to the most recent User-agent line.
   * Directives that appear before any User-agent line belong to the wildcard group.
   *
   * @param robotsTxt raw file content, may be null
   * @return parsed rule set, empty for null or blank input
   */
  public static RobotsRuleSet parse(@Nullable String robotsTxt) {
    if (robotsTxt == null || robotsTxt.isBlank()) {
      return EMPTY;
    }

    Map<String, List<String>> allow = new LinkedHashMap<>();
    Map<String, List<String>> disallow = new LinkedHashMap<>();
    String currentAgent = WILDCARD_AGENT;

    for (String rawLine : robotsTxt.split("\\R")) {
      String line = stripComment(rawLine).trim();
      if (line.isEmpty()) {
        continue;
      }
      int colonIdx = line.indexOf(':');
      if (colonIdx <= 0) {
        continue;
      }
      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      switch (key) {
        case "user-agent" -> {
          currentAgent = value.toLowerCase(Locale.ROOT);
          allow.computeIfAbsent(currentAgent, k -> new ArrayList<>());
          disallow.computeIfAbsent(currentAgent, k -> new ArrayList<>());
        }
        case "allow" -> {
          if (!value.isEmpty()) {
            allow.computeIfAbsent(currentAgent, k -> new ArrayList<>()).add(value);
          }
        }
        case "disallow" -> {
          // An empty Disallow means "nothing is disallowed"
          if (!value.isEmpty()) {
            disallow.computeIfAbsent(currentAgent, k -> new ArrayList<>()).add(value);
          }
        }
        default -> {
          // Sitemap, Crawl-delay and unknown directives are not used
        }
      }
    }

    Map<String, AgentRules> rules = new LinkedHashMap<>();
    for (String agent : allow.keySet()) {
      rules.put(agent, new AgentRules(allow.get(agent), disallow.getOrDefault(agent, List.of())));
    }
    for (String agent : disallow.keySet()) {
      rules.putIfAbsent(agent, new AgentRules(List.of(), disallow.get(agent)));
    }
    return new RobotsRuleSet(rules);
  }

  /**
   * Decide whether a URL path may be fetched under the wildcard group.
   *
   * @param path URL path, optionally followed by {@code ?query}, e.g. {@code /search?q=x}; null or
   *     blank is treated as {@code /}
   * @return false only if some disallow prefix matches and no allow prefix matches
   */
  public boolean isPathAllowed(@Nullable String path) {
    return isAnyFormAllowed(List.of(path == null || path.isBlank() ? "/" : path));
  }

  /**
   * Decide for a path written in several equivalent forms, e.g. percent-encoded and decoded. An
   * allow prefix matching any form permits the path; otherwise a disallow prefix matching any form
   * rejects it.
   *
   * @param pathForms spellings of the same path and query
   * @return false only if some disallow prefix matches a form and no allow prefix matches any
   */
  public boolean isAnyFormAllowed(List<String> pathForms) {
    AgentRules wildcard = rulesByAgent.get(WILDCARD_AGENT);
    if (wildcard == null) {
      return true;
    }
    if (matchesAny(wildcard.allow(), pathForms)) {
      return true;
    }
    return !matchesAny(wildcard.disallow(), pathForms);
  }

  private static boolean matchesAny(List<String> prefixes, List<String> subjects) {
    for (String prefix : prefixes) {
      for (String subject : subjects) {
        if (subject.startsWith(prefix)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Rules parsed for one user-agent token.
   *
   * @param agent lowercase user-agent token as written in robots.txt
   * @return the agent's rules, or empty rules if the agent has no group
   */
  public AgentRules rulesFor(String agent) {
    return rulesByAgent.getOrDefault(
        agent.toLowerCase(Locale.ROOT), new AgentRules(List.of(), List.of()));
  }

  public boolean isEmpty() {
    return rulesByAgent.values().stream()
        .allMatch(r -> r.allow().isEmpty() && r.disallow().isEmpty());
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  /** Ordered allow and disallow path prefixes for a single user-agent group. */
  public record AgentRules(List<String> allow, List<String> disallow) {
    public AgentRules {
      allow = allow == null ? List.of() : List.copyOf(allow);
      disallow = disallow == null ? List.of() : List.copyOf(disallow);
    }
  }
}
