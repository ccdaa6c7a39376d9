package dev.sitedigest.crawl;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sitedigest.crawl4ai")
public record Crawl4AiProperties(
        String baseUrl,
        int connectTimeoutMs,
        int readTimeoutMs,
        Retry retry
) {
    public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
