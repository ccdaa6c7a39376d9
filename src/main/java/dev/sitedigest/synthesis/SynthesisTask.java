package dev.sitedigest.synthesis;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Known synthesis tasks. Any other task name falls back to {@link #CUSTOM}, where the name itself is
 * used as the instruction verb.
 */
public enum SynthesisTask {
  SUMMARIZE("summarize"),
  EXTRACT("extract"),
  ANALYZE("analyze"),
  QUESTIONS("questions"),
  CUSTOM(null);

  public static final String DEFAULT_TASK = "summarize";

  /** Selector that picks this task; null for {@link #CUSTOM}, which is never selected by name. */
  private final @Nullable String selector;

  SynthesisTask(@Nullable String selector) {
    this.selector = selector;
  }

  /**
   * Resolve a task selector case-insensitively.
   *
   * @param name task name from the caller
   * @return the matching task, or {@link #CUSTOM} for unknown names
   */
  public static SynthesisTask fromName(@Nullable String name) {
    if (name == null) {
      return CUSTOM;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (SynthesisTask task : values()) {
      if (normalized.equals(task.selector)) {
        return task;
      }
    }
    return CUSTOM;
  }
}
