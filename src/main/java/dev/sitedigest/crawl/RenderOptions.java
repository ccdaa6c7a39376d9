package dev.sitedigest.crawl;

/**
 * Per-page rendering parameters passed to a {@link RenderSession}.
 *
 * @param timeoutMs navigation timeout for this page; exceeding it is a {@link RenderException}
 * @param waitTimeMs settle delay after navigation before content is captured
 * @param selector CSS selector of the element whose text becomes the page content
 */
public record RenderOptions(long timeoutMs, long waitTimeMs, String selector) {

  public RenderOptions {
    selector = selector == null || selector.isBlank() ? CrawlOptions.DEFAULT_SELECTOR : selector;
  }
}
