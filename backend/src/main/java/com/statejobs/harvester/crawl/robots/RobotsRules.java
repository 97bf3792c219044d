package com.statejobs.harvester.crawl.robots;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Allow/disallow rules of one robots.txt that apply to the harvester. A group
 * naming the harvester's product token wins over the wildcard group.
 */
public class RobotsRules {
  private final List<Rule> rules;
  private final Duration crawlDelay;

  public RobotsRules(List<Rule> rules, Duration crawlDelay) {
    this.rules = List.copyOf(rules);
    this.crawlDelay = crawlDelay;
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of(), null);
  }

  public static RobotsRules disallowAll() {
    return new RobotsRules(List.of(new Rule("/", false)), null);
  }

  public Duration getCrawlDelay() {
    return crawlDelay;
  }

  public boolean isAllowed(String pathAndQuery) {
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
      boolean longer = length > bestMatchLength;
      boolean allowWinsTie = length == bestMatchLength && bestMatch != null && rule.allow() && !bestMatch.allow();
      if (longer || allowWinsTie) {
        bestMatch = rule;
        bestMatchLength = length;
      }
    }
    return bestMatch == null || bestMatch.allow();
  }

  public static RobotsRules parse(String robotsText, String userAgent) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }
    String productToken = productToken(userAgent);

    Group wildcard = new Group();
    Group named = new Group();
    List<String> currentAgents = new ArrayList<>();
    boolean lastDirectiveWasUserAgent = false;

    for (String rawLine : robotsText.split("\\R")) {
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

      if ("user-agent".equals(key)) {
        if (!lastDirectiveWasUserAgent) {
          currentAgents.clear();
        }
        currentAgents.add(value.toLowerCase(Locale.ROOT));
        lastDirectiveWasUserAgent = true;
        continue;
      }
      lastDirectiveWasUserAgent = false;

      Group target = null;
      if (!productToken.isEmpty() && currentAgents.stream().anyMatch(agent -> !agent.isEmpty() && !"*".equals(agent) && productToken.startsWith(agent))) {
        target = named;
      } else if (currentAgents.contains("*")) {
        target = wildcard;
      }
      if (target == null) {
        continue;
      }
      if (("allow".equals(key) || "disallow".equals(key)) && !value.isBlank()) {
        target.rules.add(new Rule(value, "allow".equals(key)));
        target.seen = true;
      } else if ("disallow".equals(key)) {
        target.seen = true;
      } else if ("crawl-delay".equals(key)) {
        target.crawlDelay = parseDelay(value);
        target.seen = true;
      }
    }

    Group chosen = named.seen ? named : wildcard;
    return new RobotsRules(chosen.rules, chosen.crawlDelay);
  }

  static String productToken(String userAgent) {
    if (userAgent == null || userAgent.isBlank()) {
      return "";
    }
    String first = userAgent.trim().split("[\\s/]", 2)[0];
    return first.toLowerCase(Locale.ROOT);
  }

  private static Duration parseDelay(String value) {
    try {
      double seconds = Double.parseDouble(value);
      if (seconds <= 0) {
        return null;
      }
      return Duration.ofMillis(Math.round(seconds * 1000));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  private static final class Group {
    private final List<Rule> rules = new ArrayList<>();
    private Duration crawlDelay;
    private boolean seen;
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
