package dev.sitedigest.synthesis;

/** A generation call failed. Recovered by the pipeline, never surfaced to callers. */
public class GenerationException extends RuntimeException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
