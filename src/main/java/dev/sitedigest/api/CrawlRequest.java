package dev.sitedigest.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/crawl}. Absent values fall back to the configured crawl defaults.
 *
 * @param url seed URL
 * @param depth maximum link depth from the seed
 * @param selector CSS selector for content extraction
 * @param maxPages page ceiling
 * @param respectRobotsTxt whether robots.txt rules apply
 * @param waitTimeMs settle delay before content is captured
 * @param aiProcessing synthesis settings; when present the crawl is synthesized
 */
public record CrawlRequest(
    @NotBlank(message = "URL is required") String url,
    @Nullable Integer depth,
    @Nullable String selector,
    @Nullable Integer maxPages,
    @Nullable Boolean respectRobotsTxt,
    @Nullable Long waitTimeMs,
    @Valid @Nullable AiProcessing aiProcessing) {

  /** Synthesis overrides; each absent value uses the configured default. */
  public record AiProcessing(
      @Nullable String task,
      @Nullable String model,
      @Nullable Integer maxTokens,
      @Nullable Double temperature) {}
}
