package dev.sitedigest.synthesis;

import dev.sitedigest.crawl.PageRecord;
import dev.sitedigest.synthesis.chunking.TextChunker;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns crawled pages into one synthesized text.
 *
 * <p>Pages are rendered into a single document, split with {@link TextChunker}, and each chunk is
 * sent to the {@link GenerationClient} in order. When there is more than one chunk, a final call
 * merges the per-chunk outputs. A failed chunk call leaves an inline error placeholder in its slot
 * and a failed merge falls back to the concatenated per-chunk outputs, so a run that starts always
 * completes.
 */
public class SynthesisPipeline {

  static final String NOT_CONFIGURED = "Generation API key not configured";

  private static final String PAGE_SEPARATOR = "\n---\n\n";
  private static final String CHUNK_OUTPUT_SEPARATOR = "\n\n";

  private static final Logger log = LoggerFactory.getLogger(SynthesisPipeline.class);

  private final @Nullable GenerationClient generationClient;
  private final int maxChunkChars;
  private final Clock clock;

  /**
   * @param generationClient model access, or null when generation is not configured
   * @param maxChunkChars chunk ceiling in characters
   * @param clock source of {@code processedAt}
   */
  public SynthesisPipeline(
      @Nullable GenerationClient generationClient, int maxChunkChars, Clock clock) {
    if (maxChunkChars <= 0) {
      throw new IllegalArgumentException("maxChunkChars must be positive, was " + maxChunkChars);
    }
    this.generationClient = generationClient;
    this.maxChunkChars = maxChunkChars;
    this.clock = clock;
  }

  public boolean isAvailable() {
    return generationClient != null;
  }

  /**
   * Synthesize crawled pages for a task.
   *
   * @param pages page records in crawl order
   * @param task task selector; see {@link SynthesisTask}
   * @param params model, output token limit and temperature for every call of this run
   * @return completed result, or a skipped result carrying the pages when generation is unavailable
   */
  public SynthesisResult synthesize(List<PageRecord> pages, String task, GenerationParams params) {
    String taskName = task == null || task.isBlank() ? SynthesisTask.DEFAULT_TASK : task;
    if (generationClient == null) {
      return SynthesisResult.skipped(taskName, NOT_CONFIGURED, pages);
    }

    String document = combinePages(pages);
    List<String> chunks = TextChunker.chunk(document, maxChunkChars);
    log.info(
        "Synthesizing {} pages as {} chunk(s) for task '{}' with {}",
        pages.size(),
        chunks.size(),
        taskName,
        params.model());

    List<String> outputs = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      outputs.add(processChunk(generationClient, i, chunks.get(i), taskName, params));
    }

    String joined = String.join(CHUNK_OUTPUT_SEPARATOR, outputs);
    String finalText = outputs.size() > 1 ? combineOutputs(generationClient, joined, params) : joined;

    SynthesisMeta meta =
        new SynthesisMeta(params.model(), clock.instant(), pages.size(), chunks.size());
    return SynthesisResult.completed(taskName, finalText, meta, pages);
  }

  /** Render pages as one document: a header per page, blocks separated by a horizontal rule. */
  static String combinePages(List<PageRecord> pages) {
    List<String> blocks = new ArrayList<>(pages.size());
    for (PageRecord page : pages) {
      blocks.add(
          "## Page: %s (%s)\n\n%s\n\n".formatted(page.title(), page.url(), page.content()));
    }
    return String.join(PAGE_SEPARATOR, blocks);
  }

  private String processChunk(
      GenerationClient client, int index, String chunk, String task, GenerationParams params) {
    log.debug(
        "Processing chunk {} (~{} tokens)", index + 1, TextChunker.estimateTokens(chunk));
    try {
      return client.generate(TaskPrompts.forChunk(task, chunk), params);
    } catch (RuntimeException e) {
      log.warn("Chunk {} failed: {}", index + 1, e.getMessage());
      return "[Error processing chunk %d: %s]".formatted(index + 1, e.getMessage());
    }
  }

  private String combineOutputs(GenerationClient client, String joined, GenerationParams params) {
    try {
      return client.generate(TaskPrompts.forCombine(joined), params);
    } catch (RuntimeException e) {
      log.warn("Combining chunk outputs failed, returning them concatenated: {}", e.getMessage());
      return joined;
    }
  }
}
