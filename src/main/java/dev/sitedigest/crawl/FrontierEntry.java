package dev.sitedigest.crawl;

/**
 * A pending unit of crawl work: a normalized URL and the link distance from the seed.
 *
 * @param url normalized absolute URL
 * @param depth number of link hops from the seed URL (seed is 0)
 */
public record FrontierEntry(String url, int depth) {

  public FrontierEntry {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("url must not be blank");
    }
    if (depth < 0) {
      throw new IllegalArgumentException("depth must be >= 0, was " + depth);
    }
  }
}
