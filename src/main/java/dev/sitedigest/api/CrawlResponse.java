package dev.sitedigest.api;

import java.time.Instant;

/**
 * Body of a successful {@code POST /api/crawl}.
 *
 * @param success always true; failures are reported as Problem Details
 * @param results the page records, or the synthesis result when AI processing was requested
 * @param meta crawl timing and page count
 */
public record CrawlResponse(boolean success, Object results, Meta meta) {

  public static CrawlResponse of(Object results, Instant crawledAt, int pagesProcessed) {
    return new CrawlResponse(true, results, new Meta(crawledAt, pagesProcessed));
  }

  public record Meta(Instant crawledAt, int pagesProcessed) {}
}
