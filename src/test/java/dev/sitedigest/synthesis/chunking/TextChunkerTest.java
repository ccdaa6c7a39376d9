package dev.sitedigest.synthesis.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextChunkerTest {

  @Test
  void shortTextIsReturnedUnchangedAsSingleChunk() {
    String text = "  One paragraph.\n\n\nAnother one.  ";

    assertThat(TextChunker.chunk(text, 100)).containsExactly(text);
  }

  @Test
  void emptyAndNullTextYieldSingleEmptyChunk() {
    assertThat(TextChunker.chunk("", 10)).containsExactly("");
    assertThat(TextChunker.chunk(null, 10)).containsExactly("");
  }

  @Test
  void paragraphsAreGroupedUpToLimit() {
    String text = "aaaa\n\nbbbb\n\ncccc";

    List<String> chunks = TextChunker.chunk(text, 10);

    assertThat(chunks).containsExactly("aaaa\n\nbbbb", "cccc");
  }

  @Test
  void paragraphBreaksMayContainWhitespace() {
    String text = "first part\n   \t\nsecond part";

    assertThat(TextChunker.chunk(text, 15)).containsExactly("first part", "second part");
  }

  @Test
  void oversizedParagraphIsSplitBySentences() {
    String text = "Short intro.\n\nOne two. Three four! Five six? Seven.";

    List<String> chunks = TextChunker.chunk(text, 20);

    assertThat(chunks).containsExactly("Short intro.", "One two. Three four!", "Five six? Seven.");
  }

  @Test
  void oversizedParagraphIsNeverMergedWithNeighbours() {
    String text = "ab\n\nThis sentence is long. And another.\n\ncd";

    List<String> chunks = TextChunker.chunk(text, 25);

    assertThat(chunks).containsExactly("ab", "This sentence is long.", "And another.", "cd");
  }

  @Test
  void oversizedSentenceIsSlicedByLength() {
    String text = "x".repeat(25);

    List<String> chunks = TextChunker.chunk(text, 10);

    assertThat(chunks).containsExactly("x".repeat(10), "x".repeat(10), "x".repeat(5));
  }

  @Test
  void everyChunkRespectsLimit() {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < 200; i++) {
      text.append("Sentence number ").append(i).append(" is here. ");
      if (i % 7 == 0) {
        text.append("\n\n");
      }
    }

    List<String> chunks = TextChunker.chunk(text.toString(), 120);

    assertThat(chunks).hasSizeGreaterThan(1).allMatch(c -> c.length() <= 120);
  }

  @Test
  void whitespaceOnlyTextLongerThanLimitYieldsSingleEmptyChunk() {
    assertThat(TextChunker.chunk(" \n\n ".repeat(10), 5)).containsExactly("");
  }

  @Test
  void nonPositiveLimitIsRejected() {
    assertThatThrownBy(() -> TextChunker.chunk("text", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void tokenEstimateIsAboutFourCharactersPerToken() {
    assertThat(TextChunker.estimateTokens("abcd")).isEqualTo(1);
    assertThat(TextChunker.estimateTokens("abcde")).isEqualTo(2);
    assertThat(TextChunker.estimateTokens("")).isZero();
    assertThat(TextChunker.estimateTokens(null)).isZero();
  }
}
