package dev.sitedigest.synthesis.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits arbitrarily large text into size-bounded chunks for generation calls.
 *
 * <p>Splitting falls back by granularity: blank-line paragraphs first, then sentences (a {@code
 * .}, {@code !} or {@code ?} followed by whitespace), then fixed-size character slices. Only the
 * last level cuts through words. Paragraphs are rejoined with a blank line and sentences with a
 * single space, so concatenating the chunks reproduces the source apart from whitespace at split
 * points. Every chunk is at most {@code maxChunkSize} characters.
 */
public final class TextChunker {

  /** Characters per chunk for synthesis; comfortably below the model's input window. */
  public static final int DEFAULT_MAX_CHUNK_SIZE = 100_000;

  private static final double CHARS_PER_TOKEN = 4.0;

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

  private static final String PARAGRAPH_SEPARATOR = "\n\n";
  private static final String SENTENCE_SEPARATOR = " ";

  private TextChunker() {
    // utility class
  }

  /**
   * Chunk text into ordered parts of at most {@code maxChunkSize} characters.
   *
   * @param text the text to split; null is treated as empty
   * @param maxChunkSize maximum characters per chunk, must be positive
   * @return ordered chunks; a single element holding {@code text} unchanged when it already fits
   * @throws IllegalArgumentException if {@code maxChunkSize} is not positive
   */
  public static List<String> chunk(String text, int maxChunkSize) {
    if (maxChunkSize <= 0) {
      throw new IllegalArgumentException("maxChunkSize must be positive, was " + maxChunkSize);
    }
    String source = text == null ? "" : text;
    if (source.length() <= maxChunkSize) {
      return List.of(source);
    }

    List<String> result = new ArrayList<>();
    StringBuilder current = new StringBuilder();

    for (String para : PARAGRAPH_BREAK.split(source)) {
      String trimmed = para.trim();
      if (trimmed.isEmpty()) {
        continue;
      }

      if (trimmed.length() > maxChunkSize) {
        // Oversized paragraph is never merged with neighbours
        flush(current, result);
        result.addAll(splitBySentences(trimmed, maxChunkSize));
      } else if (current.isEmpty()) {
        current.append(trimmed);
      } else if (current.length() + PARAGRAPH_SEPARATOR.length() + trimmed.length()
          <= maxChunkSize) {
        current.append(PARAGRAPH_SEPARATOR).append(trimmed);
      } else {
        flush(current, result);
        current.append(trimmed);
      }
    }
    flush(current, result);

    // Whitespace-only input longer than the ceiling
    if (result.isEmpty()) {
      result.add("");
    }
    return result;
  }

  /**
   * Rough token estimate for logging and budgeting (about four characters per token for English).
   *
   * @param text the text to estimate
   * @return estimated token count, 0 for null
   */
  public static int estimateTokens(String text) {
    if (text == null) {
      return 0;
    }
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  static List<String> splitBySentences(String paragraph, int maxChunkSize) {
    List<String> result = new ArrayList<>();
    StringBuilder current = new StringBuilder();

    for (String sentence : SENTENCE_BREAK.split(paragraph)) {
      if (sentence.isEmpty()) {
        continue;
      }

      if (sentence.length() > maxChunkSize) {
        flush(current, result);
        result.addAll(sliceByLength(sentence, maxChunkSize));
      } else if (current.isEmpty()) {
        current.append(sentence);
      } else if (current.length() + SENTENCE_SEPARATOR.length() + sentence.length()
          <= maxChunkSize) {
        current.append(SENTENCE_SEPARATOR).append(sentence);
      } else {
        flush(current, result);
        current.append(sentence);
      }
    }
    flush(current, result);

    return result;
  }

  static List<String> sliceByLength(String text, int maxChunkSize) {
    List<String> slices = new ArrayList<>();
    for (int start = 0; start < text.length(); start += maxChunkSize) {
      slices.add(text.substring(start, Math.min(start + maxChunkSize, text.length())));
    }
    return slices;
  }

  private static void flush(StringBuilder current, List<String> result) {
    if (!current.isEmpty()) {
      result.add(current.toString());
      current.setLength(0);
    }
  }
}
