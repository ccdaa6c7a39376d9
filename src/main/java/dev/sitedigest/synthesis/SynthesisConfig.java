package dev.sitedigest.synthesis;

import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the {@link SynthesisPipeline}. The generation client is only built when an API key is
 * configured; without one the pipeline returns skipped results.
 */
@Configuration
public class SynthesisConfig {

  private static final Logger log = LoggerFactory.getLogger(SynthesisConfig.class);

  @Bean
  public SynthesisPipeline synthesisPipeline(SynthesisProperties properties, Clock clock) {
    GenerationClient client = null;
    if (properties.hasApiKey()) {
      client =
          new LangChain4jGenerationClient(
              properties.apiKey(), Duration.ofMillis(properties.timeoutMs()));
    } else {
      log.warn("No generation API key configured; AI processing requests will be skipped");
    }
    return new SynthesisPipeline(client, properties.maxChunkChars(), clock);
  }
}
