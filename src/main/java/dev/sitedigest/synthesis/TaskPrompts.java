package dev.sitedigest.synthesis;

/** Prompt templates for per-chunk generation and the final combining pass. */
public final class TaskPrompts {

  private TaskPrompts() {
    // utility class
  }

  /**
   * Build the prompt for one chunk.
   *
   * @param task task selector; unknown names become the instruction verb
   * @param chunk chunk of the combined crawl document
   * @return prompt text
   */
  public static String forChunk(String task, String chunk) {
    return switch (SynthesisTask.fromName(task)) {
      case SUMMARIZE ->
          """
          Please provide a comprehensive summary of the following web content. \
          Focus on the main points, key information, and overall themes:

          %s

          Provide a well-structured summary with key points, important details, and main conclusions.\
          """
              .formatted(chunk);
      case EXTRACT ->
          """
          Please extract all factual information from the following web content:

          %s

          Format the information as a list of verified facts found in the content.\
          """
              .formatted(chunk);
      case ANALYZE ->
          """
          Please analyze the following web content:

          %s

          Provide:
          1. Main topic overview
          2. Key arguments or claims made
          3. Evidence presented
          4. Logical fallacies or biases (if any)
          5. Quality assessment of the information
          6. Connections between concepts
          7. Areas where information might be missing\
          """
              .formatted(chunk);
      case QUESTIONS ->
          """
          Based on the following web content:

          %s

          Generate 10 important questions that someone might have after reading this content, \
          along with detailed answers based solely on the information provided.\
          """
              .formatted(chunk);
      case CUSTOM ->
          """
          Please %s the following web content:

          %s\
          """
              .formatted(task == null ? "" : task.trim(), chunk);
    };
  }

  /**
   * Build the prompt that merges ordered per-chunk outputs into one response.
   *
   * @param joinedChunkOutputs per-chunk outputs in chunk order, separated by blank lines
   * @return prompt text
   */
  public static String forCombine(String joinedChunkOutputs) {
    return """
        You've analyzed multiple chunks of web content and provided separate analyses. \
        Please combine and synthesize these separate analyses into a single coherent response:

        %s

        Provide a unified, well-structured response that combines all the information without repetition.\
        """
        .formatted(joinedChunkOutputs);
  }
}
