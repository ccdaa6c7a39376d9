package dev.sitedigest.crawl;

/**
 * Capability that turns a URL into rendered text, title, metadata and outbound links.
 *
 * <p>A crawl run opens one {@link RenderSession} and closes it on every exit path.
 */
public interface PageRenderer {

  RenderSession openSession();
}
