package dev.sitedigest.crawl;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Default crawl settings under {@code sitedigest.crawl}. Request-level values override these per
 * run through {@link CrawlOptions#fromDefaults(CrawlProperties)}.
 */
@ConfigurationProperties(prefix = "sitedigest.crawl")
public record CrawlProperties(
        int depth,
        String selector,
        int maxPages,
        boolean respectRobotsTxt,
        long waitTimeMs,
        long pageTimeoutMs,
        int robotsTimeoutMs,
        String userAgent
) {}
