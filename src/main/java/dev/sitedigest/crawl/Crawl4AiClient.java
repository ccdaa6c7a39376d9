package dev.sitedigest.crawl;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HTTP client for the Crawl4AI sidecar, which renders pages in headless Chromium.
 */
@Service
public class Crawl4AiClient {

    private static final Logger log = LoggerFactory.getLogger(Crawl4AiClient.class);

    private final RestClient restClient;

    public Crawl4AiClient(@Qualifier("crawl4AiRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Render a single URL via the Crawl4AI sidecar.
     * Each request is stateless; no browser session outlives it on the sidecar.
     * Retries on transient RestClientException with exponential backoff.
     *
     * @param url     absolute URL to render
     * @param options navigation timeout, settle delay and content selector
     * @return the rendered page
     * @throws RenderException if the sidecar reports a failure or is unreachable after retries
     */
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${sitedigest.crawl4ai.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${sitedigest.crawl4ai.retry.delay-ms}",
                    multiplierExpression = "${sitedigest.crawl4ai.retry.multiplier}"
            )
    )
    public RenderedPage render(String url, RenderOptions options) {
        Crawl4AiRequest request = buildRequest(url, options);

        Crawl4AiResponse response = restClient.post()
                .uri("/crawl")
                .body(request)
                .retrieve()
                .body(Crawl4AiResponse.class);

        if (response == null || !response.success() || response.results().isEmpty()) {
            throw new RenderException(url, "Crawl4AI returned no results for " + url);
        }

        Crawl4AiPageResult page = response.results().get(0);
        if (!page.success()) {
            throw new RenderException(url, page.error_message() != null
                    ? page.error_message()
                    : "Crawl4AI reported failure for " + url);
        }

        String content = extractMarkdown(page.markdown());
        if (content == null || content.isBlank()) {
            content = HtmlText.sanitize(page.html());
        }

        return new RenderedPage(
                page.metadataValue("title"),
                content,
                page.metadataValue("description"),
                page.html(),
                page.linkHrefs());
    }

    @Recover
    RenderedPage recoverRender(RestClientException e, String url, RenderOptions options) {
        log.warn("Crawl4AI request failed after retries for {}: {}", url, e.getMessage());
        throw new RenderException(url, e.getMessage(), e);
    }

    /**
     * Prefer fitMarkdown (boilerplate-removed) over rawMarkdown.
     */
    private String extractMarkdown(Crawl4AiMarkdown markdown) {
        if (markdown == null) {
            return null;
        }
        if (markdown.fitMarkdown() != null && !markdown.fitMarkdown().isBlank()) {
            return markdown.fitMarkdown();
        }
        return markdown.rawMarkdown();
    }

    private Crawl4AiRequest buildRequest(String url, RenderOptions options) {
        Map<String, Object> runParams = new HashMap<>();
        runParams.put("cache_mode", "bypass");
        runParams.put("css_selector", options.selector());
        runParams.put("page_timeout", options.timeoutMs());
        runParams.put("wait_until", "networkidle");
        runParams.put("delay_before_return_html", options.waitTimeMs() / 1000.0);

        return new Crawl4AiRequest(
                List.of(url),
                Map.of("type", "BrowserConfig", "params", Map.of("headless", true)),
                Map.of("type", "CrawlerRunConfig", "params", runParams)
        );
    }
}
