package dev.sitedigest.crawl;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Output of rendering one URL.
 *
 * @param title document title
 * @param content readable text of the selected element
 * @param metaDescription content of {@code <meta name="description">}
 * @param html full rendered HTML
 * @param outboundLinks raw hrefs found on the page, absolute or relative, unfiltered
 */
public record RenderedPage(
    @Nullable String title,
    @Nullable String content,
    @Nullable String metaDescription,
    @Nullable String html,
    List<String> outboundLinks) {

  public RenderedPage {
    outboundLinks = outboundLinks == null ? List.of() : List.copyOf(outboundLinks);
  }
}
