package dev.sitedigest.crawl;

/** Browser context scoped to one crawl run. */
public interface RenderSession extends AutoCloseable {

  /**
   * Render one page.
   *
   * @param url absolute URL to navigate to
   * @param options timeout, settle delay and content selector
   * @return rendered page content and outbound links
   * @throws RenderException on timeout, navigation failure or renderer error
   */
  RenderedPage render(String url, RenderOptions options);

  @Override
  void close();
}
