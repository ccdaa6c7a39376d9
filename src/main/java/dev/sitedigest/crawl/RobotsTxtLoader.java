package dev.sitedigest.crawl;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Fetches and parses {@code /robots.txt} for a crawl run. Loading is best-effort: any fetch or
 * parse failure yields {@link RobotsRuleSet#empty()} and a warning, never a crawl-level error.
 */
@Component
public class RobotsTxtLoader {

  private static final Logger log = LoggerFactory.getLogger(RobotsTxtLoader.class);

  private final RestClient restClient;

  @Autowired
  public RobotsTxtLoader(RestClient.Builder restClientBuilder, CrawlProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.robotsTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.robotsTimeoutMs()));
    this.restClient =
        restClientBuilder
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
            .build();
  }

  RobotsTxtLoader(RestClient restClient) {
    this.restClient = restClient;
  }

  /**
   * Load robots rules for a site.
   *
   * @param baseOrigin scheme://host[:port] of the crawled site
   * @return parsed rules, or an empty rule set if robots.txt is unavailable
   */
  public RobotsRuleSet load(String baseOrigin) {
    String robotsUrl = baseOrigin + "/robots.txt";
    log.debug("Checking robots.txt at {}", robotsUrl);
    String content;
    try {
      content = restClient.get().uri(robotsUrl).retrieve().body(String.class);
    } catch (Exception e) {
      log.warn("Could not fetch robots.txt at {}: {}", robotsUrl, e.getMessage());
      return RobotsRuleSet.empty();
    }

    try {
      RobotsRuleSet rules = RobotsRuleSet.parse(content);
      RobotsRuleSet.AgentRules wildcard = rules.rulesFor(RobotsRuleSet.WILDCARD_AGENT);
      log.debug(
          "Loaded robots.txt for {}: {} disallow, {} allow rules for '*'",
          baseOrigin,
          wildcard.disallow().size(),
          wildcard.allow().size());
      return rules;
    } catch (RuntimeException e) {
      log.warn("Could not parse robots.txt at {}: {}", robotsUrl, e.getMessage());
      return RobotsRuleSet.empty();
    }
  }
}
