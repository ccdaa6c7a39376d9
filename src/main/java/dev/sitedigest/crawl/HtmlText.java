package dev.sitedigest.crawl;

import org.jspecify.annotations.Nullable;
import org.jsoup.Jsoup;

/**
 * HTML to text conversion, used when the renderer produced HTML but no readable Markdown for the
 * selected element.
 */
public final class HtmlText {

  private HtmlText() {
    // utility class
  }

  /**
   * Parse the HTML and return its visible text. Script and style bodies and comments are dropped,
   * entities are decoded, whitespace is collapsed and non-breaking spaces become plain spaces.
   *
   * @param html raw HTML, may be null
   * @return plain text, empty for null input
   */
  public static String sanitize(@Nullable String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    return Jsoup.parse(html).text().replace('\u00A0', ' ').trim();
  }
}
