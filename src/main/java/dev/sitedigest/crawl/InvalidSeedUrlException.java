package dev.sitedigest.crawl;

/** The seed URL of a crawl request is not an absolute http(s) URL. Raised before any fetch. */
public class InvalidSeedUrlException extends IllegalArgumentException {

  private final String seedUrl;

  public InvalidSeedUrlException(String seedUrl) {
    super("Invalid URL: " + seedUrl);
    this.seedUrl = seedUrl;
  }

  public String getSeedUrl() {
    return seedUrl;
  }
}
