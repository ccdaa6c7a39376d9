package dev.sitedigest.crawl;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives a {@link Frontier} against a {@link PageRenderer} until the frontier is drained or the
 * page ceiling is reached.
 *
 * <p>A run moves through {@link CrawlState#INIT}, {@link CrawlState#DRAINING} and {@link
 * CrawlState#DONE}. Traversal is breadth-first and sequential: one page finishes rendering before
 * the next entry is dequeued. A page that fails to render is logged and stays visited; it is never
 * retried and never aborts the run. Each run owns its own frontier, visited set and robots rules.
 */
@Service
public class CrawlOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(CrawlOrchestrator.class);

  private final PageRenderer pageRenderer;
  private final RobotsTxtLoader robotsTxtLoader;
  private final Clock clock;

  public CrawlOrchestrator(PageRenderer pageRenderer, RobotsTxtLoader robotsTxtLoader, Clock clock) {
    this.pageRenderer = pageRenderer;
    this.robotsTxtLoader = robotsTxtLoader;
    this.clock = clock;
  }

  /**
   * Crawl a site from a seed URL.
   *
   * @param seedUrl absolute http(s) URL to start from
   * @param options depth, page ceiling, robots policy and rendering settings
   * @return page records in crawl order, possibly empty if nothing could be rendered
   * @throws InvalidSeedUrlException if the seed is not an absolute http(s) URL
   */
  public List<PageRecord> crawl(String seedUrl, CrawlOptions options) {
    // INIT
    String seed = validateSeed(seedUrl);
    String baseOrigin = UrlNormalizer.originOf(seed);
    RobotsRuleSet robots =
        options.respectRobotsTxt() ? robotsTxtLoader.load(baseOrigin) : RobotsRuleSet.empty();
    Frontier frontier = Frontier.seededWith(seed);
    RenderOptions renderOptions = options.toRenderOptions();

    log.info(
        "Starting crawl of {} (state: {}, maxDepth={}, maxPages={}, respectRobotsTxt={})",
        seed,
        CrawlState.INIT,
        options.depth(),
        options.maxPages(),
        options.respectRobotsTxt());

    List<PageRecord> results = new ArrayList<>();
    AtomicInteger produced = new AtomicInteger();

    try (RenderSession session = pageRenderer.openSession()) {
      log.debug("Crawl of {} entering {}", seed, CrawlState.DRAINING);
      while (!frontier.isEmpty() && produced.get() < options.maxPages()) {
        FrontierEntry entry = frontier.poll();
        if (entry == null) {
          break;
        }
        if (!shouldFetch(entry, frontier, baseOrigin, robots, options)) {
          continue;
        }

        log.debug(
            "Crawling [{}/{}] depth {}: {}",
            results.size() + 1,
            options.maxPages(),
            entry.depth(),
            entry.url());
        processPage(session, entry, frontier, baseOrigin, options, renderOptions, produced, results);
      }
    }

    log.info(
        "Crawl complete (state: {}): {} pages crawled from {}, {} URLs visited, {} left in frontier",
        CrawlState.DONE,
        results.size(),
        seed,
        frontier.visitedCount(),
        frontier.pendingCount());
    return results;
  }

  private String validateSeed(String seedUrl) {
    if (seedUrl == null || seedUrl.isBlank()) {
      throw new InvalidSeedUrlException(String.valueOf(seedUrl));
    }
    try {
      URI uri = new URI(seedUrl.trim());
      String scheme = uri.getScheme();
      if (!uri.isAbsolute()
          || uri.getHost() == null
          || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
        throw new InvalidSeedUrlException(seedUrl);
      }
    } catch (URISyntaxException e) {
      throw new InvalidSeedUrlException(seedUrl);
    }
    return UrlNormalizer.normalize(seedUrl.trim());
  }

  /** Dequeue-time checks. Marks the URL visited only when it is going to be fetched. */
  private boolean shouldFetch(
      FrontierEntry entry,
      Frontier frontier,
      String baseOrigin,
      RobotsRuleSet robots,
      CrawlOptions options) {
    String url = entry.url();
    if (frontier.isVisited(url)) {
      return false;
    }
    if (entry.depth() > options.depth()) {
      log.debug("Skipping {} - depth {} beyond max {}", url, entry.depth(), options.depth());
      return false;
    }
    if (!UrlScopeFilter.isInScope(url, baseOrigin)) {
      log.debug("Skipping {} - different origin", url);
      return false;
    }
    if (!UrlScopeFilter.isAllowed(url, robots)) {
      log.debug("Skipping {} - disallowed by robots.txt", url);
      return false;
    }
    return frontier.markVisited(url);
  }

  private void processPage(
      RenderSession session,
      FrontierEntry entry,
      Frontier frontier,
      String baseOrigin,
      CrawlOptions options,
      RenderOptions renderOptions,
      AtomicInteger produced,
      List<PageRecord> results) {
    RenderedPage page;
    try {
      page = session.render(entry.url(), renderOptions);
    } catch (RenderException e) {
      log.warn("Failed to render {}: {}", entry.url(), e.getMessage());
      return;
    } catch (RuntimeException e) {
      log.error("Error processing {}: {}", entry.url(), e.getMessage());
      return;
    }

    if (!claimPageSlot(produced, options.maxPages())) {
      log.debug("Page ceiling reached, dropping result for {}", entry.url());
      return;
    }
    results.add(
        new PageRecord(
            entry.url(),
            page.title(),
            page.metaDescription(),
            page.content(),
            page.html(),
            clock.instant()));

    if (entry.depth() < options.depth()) {
      enqueueDiscoveredLinks(entry, page, frontier, baseOrigin);
    }
  }

  private void enqueueDiscoveredLinks(
      FrontierEntry parent, RenderedPage page, Frontier frontier, String baseOrigin) {
    Set<String> links = new LinkedHashSet<>();
    for (String href : page.outboundLinks()) {
      String resolved = UrlNormalizer.resolve(parent.url(), href);
      if (resolved != null) {
        links.add(resolved);
      }
    }

    int newUrlCount = 0;
    for (String link : links) {
      if (!UrlScopeFilter.isInScope(link, baseOrigin)) {
        continue;
      }
      if (frontier.enqueueIfUnvisited(link, parent.depth() + 1)) {
        newUrlCount++;
      }
    }
    if (newUrlCount > 0) {
      log.debug("Enqueued {} links from {} at depth {}", newUrlCount, parent.url(), parent.depth() + 1);
    }
  }

  /** Atomic increment-and-compare so the ceiling holds even if completions race. */
  private static boolean claimPageSlot(AtomicInteger produced, int maxPages) {
    int current;
    do {
      current = produced.get();
      if (current >= maxPages) {
        return false;
      }
    } while (!produced.compareAndSet(current, current + 1));
    return true;
  }
}
