package dev.sitedigest.synthesis;

/** Language-model capability: prompt in, generated text out. */
public interface GenerationClient {

  /**
   * Generate a completion for a single user prompt.
   *
   * @param prompt full prompt text
   * @param params model, output token limit and temperature
   * @return generated text
   * @throws GenerationException on quota, auth, network or empty-response failures
   */
  String generate(String prompt, GenerationParams params);
}
