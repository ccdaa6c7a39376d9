package dev.sitedigest.api;

import dev.sitedigest.crawl.CrawlOptions;
import dev.sitedigest.crawl.CrawlOrchestrator;
import dev.sitedigest.crawl.CrawlProperties;
import dev.sitedigest.crawl.PageRecord;
import dev.sitedigest.synthesis.GenerationParams;
import dev.sitedigest.synthesis.SynthesisPipeline;
import dev.sitedigest.synthesis.SynthesisProperties;
import dev.sitedigest.synthesis.SynthesisTask;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Crawl-and-synthesize endpoint plus a liveness check. */
@RestController
@RequestMapping("/api")
public class CrawlController {

  private static final Logger log = LoggerFactory.getLogger(CrawlController.class);

  private final CrawlOrchestrator crawlOrchestrator;
  private final SynthesisPipeline synthesisPipeline;
  private final CrawlProperties crawlProperties;
  private final SynthesisProperties synthesisProperties;
  private final Clock clock;
  private final String version;

  public CrawlController(
      CrawlOrchestrator crawlOrchestrator,
      SynthesisPipeline synthesisPipeline,
      CrawlProperties crawlProperties,
      SynthesisProperties synthesisProperties,
      Clock clock,
      @Value("${sitedigest.version:1.0.0}") String version) {
    this.crawlOrchestrator = crawlOrchestrator;
    this.synthesisPipeline = synthesisPipeline;
    this.crawlProperties = crawlProperties;
    this.synthesisProperties = synthesisProperties;
    this.clock = clock;
    this.version = version;
  }

  /**
   * Crawl a site and optionally synthesize the pages.
   *
   * @param request seed URL, crawl overrides and optional AI processing settings
   * @return page records, or the synthesis result when {@code aiProcessing} is present
   */
  @PostMapping("/crawl")
  public ResponseEntity<CrawlResponse> crawl(@Valid @RequestBody CrawlRequest request) {
    CrawlOptions options =
        CrawlOptions.fromDefaults(crawlProperties)
            .withOverrides(
                request.depth(),
                request.selector(),
                request.maxPages(),
                request.respectRobotsTxt(),
                request.waitTimeMs());
    log.info("Crawl requested for {}", request.url());

    List<PageRecord> pages = crawlOrchestrator.crawl(request.url(), options);
    Instant crawledAt = clock.instant();

    CrawlRequest.AiProcessing ai = request.aiProcessing();
    if (ai == null) {
      return ResponseEntity.ok(CrawlResponse.of(pages, crawledAt, pages.size()));
    }

    String task = ai.task() != null && !ai.task().isBlank() ? ai.task() : SynthesisTask.DEFAULT_TASK;
    GenerationParams params =
        new GenerationParams(
            ai.model() != null && !ai.model().isBlank() ? ai.model() : synthesisProperties.model(),
            ai.maxTokens() != null ? ai.maxTokens() : synthesisProperties.maxTokens(),
            ai.temperature() != null ? ai.temperature() : synthesisProperties.temperature());
    return ResponseEntity.ok(
        CrawlResponse.of(synthesisPipeline.synthesize(pages, task, params), crawledAt, pages.size()));
  }

  @GetMapping("/healthcheck")
  public ResponseEntity<Map<String, Object>> healthcheck() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "ok");
    body.put("version", version);
    body.put("generationAvailable", synthesisPipeline.isAvailable());
    return ResponseEntity.ok(body);
  }
}
