package dev.sitedigest.synthesis;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under {@code sitedigest.synthesis}. A blank {@code apiKey} disables generation and makes
 * every synthesis run return a skipped result.
 */
@ConfigurationProperties(prefix = "sitedigest.synthesis")
public record SynthesisProperties(
    @Nullable String apiKey,
    String model,
    int maxTokens,
    double temperature,
    int maxChunkChars,
    long timeoutMs) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }

  public GenerationParams defaultParams() {
    return new GenerationParams(model, maxTokens, temperature);
  }
}
