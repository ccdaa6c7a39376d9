package dev.sitedigest.crawl;

/** Lifecycle of a single crawl run. */
public enum CrawlState {
  /** Seed validated, robots rules loaded, frontier seeded. */
  INIT,
  /** Dequeuing and fetching until the frontier is empty or the page ceiling is hit. */
  DRAINING,
  /** No more work; the accumulated page records are returned. */
  DONE
}
