package dev.sitedigest.crawl;

import java.time.Instant;

/**
 * Structured result of successfully rendering one URL. One record exists per distinct crawled URL
 * and records are returned in crawl order.
 *
 * @param url normalized URL that was fetched
 * @param title document title, empty if the page has none
 * @param description meta description, empty if the page has none
 * @param content readable text extracted from the selected element
 * @param renderedHtml full rendered HTML of the page
 * @param crawledAt when the page was rendered
 */
public record PageRecord(
    String url,
    String title,
    String description,
    String content,
    String renderedHtml,
    Instant crawledAt) {

  public PageRecord {
    title = title == null ? "" : title;
    description = description == null ? "" : description;
    content = content == null ? "" : content;
    renderedHtml = renderedHtml == null ? "" : renderedHtml;
  }
}
