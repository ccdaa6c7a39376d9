package dev.sitedigest.mcp;

import dev.sitedigest.crawl.PageRecord;
import dev.sitedigest.synthesis.chunking.TextChunker;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats crawled pages as readable text blocks within a token budget.
 *
 * <p>Pages are appended in crawl order until the next one would exceed the budget. If even the
 * first page exceeds it, that page is cut at the character level so at least one page is returned.
 * A trailing line reports how many pages were left out.
 */
@Component
public class PageDigestFormatter {

  private static final int CHARS_PER_TOKEN = 4;

  private final int tokenBudget;

  public PageDigestFormatter(@Value("${sitedigest.mcp.token-budget:8000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Format pages into a digest.
   *
   * @param pages page records in crawl order
   * @return formatted digest, empty for no pages
   */
  public String format(@Nullable List<PageRecord> pages) {
    if (pages == null || pages.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;
    int included = 0;

    for (int i = 0; i < pages.size(); i++) {
      String formatted = formatPage(i + 1, pages.get(i));
      int pageTokens = TextChunker.estimateTokens(formatted);

      if (i == 0 && pageTokens > tokenBudget) {
        output.append(formatted, 0, Math.min(tokenBudget * CHARS_PER_TOKEN, formatted.length()));
        included = 1;
        break;
      }
      if (estimatedTokens + pageTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += pageTokens;
      included++;
    }

    int omitted = pages.size() - included;
    if (omitted > 0) {
      output.append("\n(").append(omitted).append(" more page(s) omitted to fit the token budget)\n");
    }
    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  private String formatPage(int index, PageRecord page) {
    return "## [%d] %s\nURL: %s\n%s\n%s\n\n---\n"
        .formatted(
            index,
            page.title().isEmpty() ? "(untitled)" : page.title(),
            page.url(),
            page.description().isEmpty() ? "" : "Description: " + page.description() + "\n",
            page.content());
  }
}
