package dev.sitedigest.crawl;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to drive the Crawl4AI headless-browser sidecar.
 *
 * <p>Timeouts come from {@code sitedigest.crawl4ai.*}. The read timeout is a backstop above the
 * per-page navigation timeout sent with each request.
 */
@Configuration
public class Crawl4AiConfig {

    /**
     * Creates a pre-configured {@link RestClient} targeting the Crawl4AI sidecar.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties sidecar base URL and timeouts
     * @return a named REST client bean for injection into {@link Crawl4AiClient}
     */
    @Bean
    public RestClient crawl4AiRestClient(RestClient.Builder builder, Crawl4AiProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        return builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
