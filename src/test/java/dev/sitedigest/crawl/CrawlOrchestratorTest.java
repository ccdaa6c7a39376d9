package dev.sitedigest.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CrawlOrchestratorTest {

  private static final String ORIGIN = "https://example.com";
  private static final String SEED = ORIGIN + "/";
  private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

  @Mock private RobotsTxtLoader robotsTxtLoader;

  private FakeSite site;
  private CrawlOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    site = new FakeSite();
    orchestrator =
        new CrawlOrchestrator(site, robotsTxtLoader, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static CrawlOptions options(int depth, int maxPages) {
    return new CrawlOptions(depth, "body", maxPages, false, 0, 30_000);
  }

  private static List<String> urls(List<PageRecord> pages) {
    return pages.stream().map(PageRecord::url).toList();
  }

  @Nested
  class Traversal {

    @Test
    void depthZeroFetchesOnlySeed() {
      site.page(SEED, "/a", "/b");

      List<PageRecord> pages = orchestrator.crawl(SEED, options(0, 100));

      assertThat(urls(pages)).containsExactly(SEED);
      assertThat(site.renderedUrls).containsExactly(SEED);
    }

    @Test
    void pagesAreFetchedBreadthFirst() {
      site.page(SEED, "/a", "/b")
          .page(ORIGIN + "/a", "/c")
          .page(ORIGIN + "/b", "/d")
          .page(ORIGIN + "/c")
          .page(ORIGIN + "/d");

      List<PageRecord> pages = orchestrator.crawl(SEED, options(2, 100));

      assertThat(urls(pages))
          .containsExactly(SEED, ORIGIN + "/a", ORIGIN + "/b", ORIGIN + "/c", ORIGIN + "/d");
    }

    @Test
    void linksBeyondMaxDepthAreNotFetched() {
      site.page(SEED, "/a").page(ORIGIN + "/a", "/b").page(ORIGIN + "/b", "/c");

      List<PageRecord> pages = orchestrator.crawl(SEED, options(1, 100));

      assertThat(urls(pages)).containsExactly(SEED, ORIGIN + "/a");
      assertThat(site.renderedUrls).doesNotContain(ORIGIN + "/b");
    }

    @Test
    void onlySameOriginLinksAreFollowed() {
      site.page(
          SEED,
          "https://other.com/page",
          "https://docs.example.com/",
          "http://example.com/insecure",
          "https://example.com:8443/port",
          "/inside");
      site.page(ORIGIN + "/inside");

      List<PageRecord> pages = orchestrator.crawl(SEED, options(1, 100));

      assertThat(urls(pages)).containsExactly(SEED, ORIGIN + "/inside");
      assertThat(site.renderedUrls).allMatch(url -> url.startsWith(ORIGIN + "/"));
    }

    @Test
    void eachUrlIsFetchedAtMostOnce() {
      site.page(SEED, "/a", "/a#section", "/a/", "/a?utm_source=feed", "/b")
          .page(ORIGIN + "/a", "/", "/b", SEED)
          .page(ORIGIN + "/b", "/a", "/");

      List<PageRecord> pages = orchestrator.crawl(SEED, options(3, 100));

      assertThat(urls(pages)).containsExactly(SEED, ORIGIN + "/a", ORIGIN + "/b");
      assertThat(site.renderedUrls).doesNotHaveDuplicates();
    }

    @Test
    void relativeLinksResolveAgainstPageUrl() {
      site.page(ORIGIN + "/docs/intro", "setup", "../about", "mailto:team@example.com")
          .page(ORIGIN + "/docs/setup")
          .page(ORIGIN + "/about");

      List<PageRecord> pages = orchestrator.crawl(ORIGIN + "/docs/intro", options(1, 100));

      assertThat(urls(pages))
          .containsExactly(ORIGIN + "/docs/intro", ORIGIN + "/docs/setup", ORIGIN + "/about");
    }

    @Test
    void seedIsNormalizedBeforeFetching() {
      site.page(SEED);

      List<PageRecord> pages = orchestrator.crawl("HTTPS://Example.com#top", options(0, 100));

      assertThat(urls(pages)).containsExactly(SEED);
    }
  }

  @Nested
  class PageCeiling {

    @Test
    void stopsAtMaxPagesOnLargeSite() {
      List<String> hrefs = new ArrayList<>();
      for (int i = 1; i < 50; i++) {
        hrefs.add("/p" + i);
        site.page(ORIGIN + "/p" + i);
      }
      site.page(SEED, hrefs.toArray(String[]::new));

      List<PageRecord> pages = orchestrator.crawl(SEED, options(1, 5));

      assertThat(pages).hasSize(5);
      assertThat(site.renderedUrls).hasSize(5);
    }

    @Test
    void zeroMaxPagesReturnsNothing() {
      site.page(SEED);

      assertThat(orchestrator.crawl(SEED, options(1, 0))).isEmpty();
      assertThat(site.renderedUrls).isEmpty();
    }

    @Test
    void failedPagesDoNotCountTowardCeiling() {
      site.page(SEED, "/broken", "/a", "/b").page(ORIGIN + "/a").page(ORIGIN + "/b");
      site.failing.add(ORIGIN + "/broken");

      List<PageRecord> pages = orchestrator.crawl(SEED, options(1, 3));

      assertThat(urls(pages)).containsExactly(SEED, ORIGIN + "/a", ORIGIN + "/b");
    }
  }

  @Nested
  class Robots {

    @Test
    void disallowedPathsAreNeverFetched() {
      when(robotsTxtLoader.load(ORIGIN))
          .thenReturn(RobotsRuleSet.parse("User-agent: *\nDisallow: /private\n"));
      site.page(SEED, "/private/secret", "/public").page(ORIGIN + "/public");

      List<PageRecord> pages =
          orchestrator.crawl(SEED, new CrawlOptions(1, "body", 100, true, 0, 30_000));

      assertThat(urls(pages)).containsExactly(SEED, ORIGIN + "/public");
      assertThat(site.renderedUrls).noneMatch(url -> url.contains("/private"));
    }

    @Test
    void disallowedSeedYieldsNoPages() {
      when(robotsTxtLoader.load(ORIGIN)).thenReturn(RobotsRuleSet.parse("User-agent: *\nDisallow: /\n"));
      site.page(SEED, "/a");

      List<PageRecord> pages =
          orchestrator.crawl(SEED, new CrawlOptions(1, "body", 100, true, 0, 30_000));

      assertThat(pages).isEmpty();
      assertThat(site.sessionsClosed).isEqualTo(1);
    }

    @Test
    void robotsAreIgnoredWhenDisabled() {
      site.page(SEED, "/private/secret").page(ORIGIN + "/private/secret");

      List<PageRecord> pages = orchestrator.crawl(SEED, options(1, 100));

      assertThat(urls(pages)).containsExactly(SEED, ORIGIN + "/private/secret");
      verifyNoInteractions(robotsTxtLoader);
    }
  }

  @Nested
  class Failures {

    @Test
    void renderFailureIsSkippedAndNeverRetried() {
      site.page(SEED, "/a", "/b").page(ORIGIN + "/b", "/a").page(ORIGIN + "/a");
      site.failing.add(ORIGIN + "/a");

      List<PageRecord> pages = orchestrator.crawl(SEED, options(2, 100));

      assertThat(urls(pages)).containsExactly(SEED, ORIGIN + "/b");
      assertThat(site.renderedUrls).containsExactly(SEED, ORIGIN + "/a", ORIGIN + "/b");
    }

    @Test
    void unexpectedRendererErrorDoesNotAbortRun() {
      site.page(SEED, "/a", "/b").page(ORIGIN + "/b");
      site.exploding.add(ORIGIN + "/a");

      List<PageRecord> pages = orchestrator.crawl(SEED, options(1, 100));

      assertThat(urls(pages)).containsExactly(SEED, ORIGIN + "/b");
    }

    @Test
    void seedFailureYieldsEmptyResultAndClosesSession() {
      site.failing.add(SEED);

      List<PageRecord> pages = orchestrator.crawl(SEED, options(1, 100));

      assertThat(pages).isEmpty();
      assertThat(site.sessionsOpened).isEqualTo(1);
      assertThat(site.sessionsClosed).isEqualTo(1);
    }

    @Test
    void sessionIsClosedWhenRunAbortsWithError() {
      site.page(SEED, "/a").page(ORIGIN + "/a");
      site.fatal.add(ORIGIN + "/a");

      assertThatThrownBy(() -> orchestrator.crawl(SEED, options(1, 100)))
          .isInstanceOf(LinkageError.class);

      assertThat(site.sessionsOpened).isEqualTo(1);
      assertThat(site.sessionsClosed).isEqualTo(1);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"not a url", "/relative/path", "ftp://example.com/file", "example.com"})
    void invalidSeedIsRejectedBeforeAnySessionOpens(String seed) {
      assertThatThrownBy(() -> orchestrator.crawl(seed, options(1, 100)))
          .isInstanceOf(InvalidSeedUrlException.class)
          .hasMessageStartingWith("Invalid URL");

      assertThat(site.sessionsOpened).isZero();
      verifyNoInteractions(robotsTxtLoader);
    }
  }

  @Test
  void sessionIsClosedAfterSuccessfulRun() {
    site.page(SEED, "/a").page(ORIGIN + "/a");

    orchestrator.crawl(SEED, options(1, 100));

    assertThat(site.sessionsOpened).isEqualTo(1);
    assertThat(site.sessionsClosed).isEqualTo(1);
  }

  @Test
  void pageRecordCarriesRenderedFields() {
    site.page(SEED);

    PageRecord page = orchestrator.crawl(SEED, options(0, 100)).get(0);

    assertThat(page.url()).isEqualTo(SEED);
    assertThat(page.title()).isEqualTo("Title of " + SEED);
    assertThat(page.description()).isEqualTo("Description of " + SEED);
    assertThat(page.content()).isEqualTo("Content of " + SEED);
    assertThat(page.renderedHtml()).isEqualTo("<html></html>");
    assertThat(page.crawledAt()).isEqualTo(NOW);
  }

  /** In-memory site graph keyed by normalized URL. Unknown URLs fail like a 404. */
  private static final class FakeSite implements PageRenderer {

    private final Map<String, List<String>> links = new LinkedHashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final Set<String> exploding = new HashSet<>();
    private final Set<String> fatal = new HashSet<>();
    private final List<String> renderedUrls = new ArrayList<>();
    private int sessionsOpened;
    private int sessionsClosed;

    FakeSite page(String url, String... hrefs) {
      links.put(url, Arrays.asList(hrefs));
      return this;
    }

    @Override
    public RenderSession openSession() {
      sessionsOpened++;
      return new RenderSession() {
        @Override
        public RenderedPage render(String url, RenderOptions options) {
          renderedUrls.add(url);
          if (fatal.contains(url)) {
            throw new LinkageError("renderer binary missing");
          }
          if (exploding.contains(url)) {
            throw new IllegalStateException("browser crashed");
          }
          List<String> hrefs = links.get(url);
          if (failing.contains(url) || hrefs == null) {
            throw new RenderException(url, "navigation failed");
          }
          return new RenderedPage(
              "Title of " + url, "Content of " + url, "Description of " + url, "<html></html>", hrefs);
        }

        @Override
        public void close() {
          sessionsClosed++;
        }
      };
    }
  }
}
