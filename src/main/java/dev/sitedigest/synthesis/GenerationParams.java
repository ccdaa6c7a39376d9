package dev.sitedigest.synthesis;

/**
 * Generation settings for one synthesis run.
 *
 * @param model model identifier, e.g. {@code claude-3-sonnet-20240229}
 * @param maxOutputTokens upper bound on generated tokens per call
 * @param temperature sampling temperature
 */
public record GenerationParams(String model, int maxOutputTokens, double temperature) {

  public GenerationParams {
    if (model == null || model.isBlank()) {
      throw new IllegalArgumentException("model must not be blank");
    }
    if (maxOutputTokens <= 0) {
      throw new IllegalArgumentException("maxOutputTokens must be positive, was " + maxOutputTokens);
    }
  }
}
