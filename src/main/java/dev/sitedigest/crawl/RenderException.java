package dev.sitedigest.crawl;

/** Raised when a single page cannot be rendered (navigation failure, timeout, renderer error). */
public class RenderException extends RuntimeException {

  private final String url;

  public RenderException(String url, String message) {
    super(message);
    this.url = url;
  }

  public RenderException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
