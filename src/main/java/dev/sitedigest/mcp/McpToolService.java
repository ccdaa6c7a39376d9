package dev.sitedigest.mcp;

import dev.sitedigest.crawl.CrawlOptions;
import dev.sitedigest.crawl.CrawlOrchestrator;
import dev.sitedigest.crawl.CrawlProperties;
import dev.sitedigest.crawl.InvalidSeedUrlException;
import dev.sitedigest.crawl.PageRecord;
import dev.sitedigest.synthesis.GenerationParams;
import dev.sitedigest.synthesis.SynthesisPipeline;
import dev.sitedigest.synthesis.SynthesisProperties;
import dev.sitedigest.synthesis.SynthesisResult;
import dev.sitedigest.synthesis.SynthesisTask;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing crawling and synthesis as tool methods.
 *
 * <p>Tool methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * @see PageDigestFormatter
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final CrawlOrchestrator crawlOrchestrator;
  private final SynthesisPipeline synthesisPipeline;
  private final PageDigestFormatter formatter;
  private final CrawlProperties crawlProperties;
  private final SynthesisProperties synthesisProperties;

  public McpToolService(
      CrawlOrchestrator crawlOrchestrator,
      SynthesisPipeline synthesisPipeline,
      PageDigestFormatter formatter,
      CrawlProperties crawlProperties,
      SynthesisProperties synthesisProperties) {
    this.crawlOrchestrator = crawlOrchestrator;
    this.synthesisPipeline = synthesisPipeline;
    this.formatter = formatter;
    this.crawlProperties = crawlProperties;
    this.synthesisProperties = synthesisProperties;
  }

  /** Crawls a site and returns a token-budgeted digest of the rendered pages. */
  @Tool(
      name = "crawl_site",
      description =
          "Crawl a website starting from a URL, following same-origin links breadth-first. "
              + "Returns the title, URL and extracted text of each page crawled.")
  public String crawlSite(
      @ToolParam(description = "Absolute http(s) URL to start crawling from") @Nullable String url,
      @ToolParam(description = "Maximum link depth from the start URL (default 1)", required = false)
          @Nullable Integer depth,
      @ToolParam(description = "Maximum number of pages to crawl (default 100)", required = false)
          @Nullable Integer maxPages,
      @ToolParam(description = "CSS selector for the content to extract (default body)", required = false)
          @Nullable String selector) {
    try {
      if (url == null || url.isBlank()) {
        return "Error: URL is required. Provide an absolute http(s) URL.";
      }
      List<PageRecord> pages = crawlOrchestrator.crawl(url, options(depth, maxPages, selector));
      if (pages.isEmpty()) {
        return "No pages could be crawled from " + url + ".";
      }
      return "Crawled %d page(s) from %s.\n\n%s".formatted(pages.size(), url, formatter.format(pages));
    } catch (InvalidSeedUrlException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.warn("crawl_site failed for {}: {}", url, e.getMessage());
      return "Error crawling site: " + e.getMessage();
    }
  }

  /** Crawls a site and synthesizes the pages for a task. */
  @Tool(
      name = "crawl_and_process",
      description =
          "Crawl a website and process the content with a language model. "
              + "Tasks: summarize (default), extract, analyze, questions, or any free-form instruction verb.")
  public String crawlAndProcess(
      @ToolParam(description = "Absolute http(s) URL to start crawling from") @Nullable String url,
      @ToolParam(description = "Processing task, e.g. 'summarize' or 'analyze'", required = false)
          @Nullable String task,
      @ToolParam(description = "Maximum link depth from the start URL (default 1)", required = false)
          @Nullable Integer depth,
      @ToolParam(description = "Maximum number of pages to crawl (default 100)", required = false)
          @Nullable Integer maxPages) {
    try {
      if (url == null || url.isBlank()) {
        return "Error: URL is required. Provide an absolute http(s) URL.";
      }
      if (!synthesisPipeline.isAvailable()) {
        return "Error: Generation API key not configured. Set ANTHROPIC_API_KEY or use crawl_site.";
      }
      List<PageRecord> pages = crawlOrchestrator.crawl(url, options(depth, maxPages, null));
      String taskName = task == null || task.isBlank() ? SynthesisTask.DEFAULT_TASK : task;
      GenerationParams params = synthesisProperties.defaultParams();
      SynthesisResult result = synthesisPipeline.synthesize(pages, taskName, params);
      if (result.skipped() || result.meta() == null) {
        return "Error: " + result.error();
      }
      return "%s\n\n---\nTask: %s | Model: %s | Pages: %d | Chunks: %d"
          .formatted(
              result.result(),
              result.task(),
              result.meta().model(),
              result.meta().pagesProcessed(),
              result.meta().chunksProcessed());
    } catch (InvalidSeedUrlException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.warn("crawl_and_process failed for {}: {}", url, e.getMessage());
      return "Error processing site: " + e.getMessage();
    }
  }

  private CrawlOptions options(
      @Nullable Integer depth, @Nullable Integer maxPages, @Nullable String selector) {
    return CrawlOptions.fromDefaults(crawlProperties)
        .withOverrides(depth, selector, maxPages, null, null);
  }
}
