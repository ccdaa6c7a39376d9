package dev.sitedigest.crawl;

import org.jspecify.annotations.Nullable;

/**
 * Immutable settings for one crawl run.
 *
 * @param depth maximum link-follow depth; pages at this depth are fetched but not expanded
 * @param selector CSS selector of the element whose text is extracted
 * @param maxPages hard ceiling on the number of page records produced
 * @param respectRobotsTxt whether robots.txt rules are loaded and enforced
 * @param waitTimeMs settle delay after navigation
 * @param pageTimeoutMs per-page navigation timeout
 */
public record CrawlOptions(
    int depth,
    String selector,
    int maxPages,
    boolean respectRobotsTxt,
    long waitTimeMs,
    long pageTimeoutMs) {

  public static final int DEFAULT_DEPTH = 1;
  public static final String DEFAULT_SELECTOR = "body";
  public static final int DEFAULT_MAX_PAGES = 100;
  public static final long DEFAULT_WAIT_TIME_MS = 1000;
  public static final long DEFAULT_PAGE_TIMEOUT_MS = 30_000;

  public CrawlOptions {
    if (depth < 0) {
      throw new IllegalArgumentException("depth must be >= 0, was " + depth);
    }
    if (maxPages < 0) {
      throw new IllegalArgumentException("maxPages must be >= 0, was " + maxPages);
    }
    if (waitTimeMs < 0 || pageTimeoutMs <= 0) {
      throw new IllegalArgumentException("waitTimeMs must be >= 0 and pageTimeoutMs > 0");
    }
    selector = selector == null || selector.isBlank() ? DEFAULT_SELECTOR : selector;
  }

  /** Options with the built-in defaults: depth 1, whole body, 100 pages, robots respected. */
  public static CrawlOptions withDefaults() {
    return new CrawlOptions(
        DEFAULT_DEPTH,
        DEFAULT_SELECTOR,
        DEFAULT_MAX_PAGES,
        true,
        DEFAULT_WAIT_TIME_MS,
        DEFAULT_PAGE_TIMEOUT_MS);
  }

  /**
   * Options taken from configured defaults.
   *
   * @param properties values bound from {@code sitedigest.crawl.*}
   * @return crawl options reflecting the configuration
   */
  public static CrawlOptions fromDefaults(CrawlProperties properties) {
    return new CrawlOptions(
        properties.depth(),
        properties.selector(),
        properties.maxPages(),
        properties.respectRobotsTxt(),
        properties.waitTimeMs(),
        properties.pageTimeoutMs() > 0 ? properties.pageTimeoutMs() : DEFAULT_PAGE_TIMEOUT_MS);
  }

  /** Copy with the non-null overrides applied. */
  public CrawlOptions withOverrides(
      @Nullable Integer depth,
      @Nullable String selector,
      @Nullable Integer maxPages,
      @Nullable Boolean respectRobotsTxt,
      @Nullable Long waitTimeMs) {
    return new CrawlOptions(
        depth != null ? depth : this.depth,
        selector != null && !selector.isBlank() ? selector : this.selector,
        maxPages != null ? maxPages : this.maxPages,
        respectRobotsTxt != null ? respectRobotsTxt : this.respectRobotsTxt,
        waitTimeMs != null ? waitTimeMs : this.waitTimeMs,
        this.pageTimeoutMs);
  }

  RenderOptions toRenderOptions() {
    return new RenderOptions(pageTimeoutMs, waitTimeMs, selector);
  }
}
