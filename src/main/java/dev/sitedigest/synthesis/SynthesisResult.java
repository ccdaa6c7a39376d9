package dev.sitedigest.synthesis;

import dev.sitedigest.crawl.PageRecord;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of one synthesis run.
 *
 * <p>A skipped result ({@link #skipped()} is true) means generation was not configured: it carries
 * the untouched page records and an explanatory {@link #error()}, but no text or metadata. Callers
 * treat it as a degraded success, not a failure.
 *
 * @param task task selector as requested
 * @param result final synthesized text, null when skipped
 * @param meta run metadata, null when skipped
 * @param originalResults page records the run was given
 * @param skipped whether generation was unavailable
 * @param error reason for skipping, null otherwise
 */
public record SynthesisResult(
    String task,
    @Nullable String result,
    @Nullable SynthesisMeta meta,
    List<PageRecord> originalResults,
    boolean skipped,
    @Nullable String error) {

  public SynthesisResult {
    originalResults = originalResults == null ? List.of() : List.copyOf(originalResults);
  }

  public static SynthesisResult completed(
      String task, String result, SynthesisMeta meta, List<PageRecord> originalResults) {
    return new SynthesisResult(task, result, meta, originalResults, false, null);
  }

  public static SynthesisResult skipped(
      String task, String reason, List<PageRecord> originalResults) {
    return new SynthesisResult(task, null, null, originalResults, true, reason);
  }
}
