package dev.sitedigest.synthesis;

import java.time.Instant;

/**
 * Metadata of a completed synthesis run.
 *
 * @param model model identifier used for every call
 * @param processedAt completion time
 * @param pagesProcessed number of page records in the combined document
 * @param chunksProcessed number of chunks sent to generation, including ones whose call failed
 */
public record SynthesisMeta(
    String model, Instant processedAt, int pagesProcessed, int chunksProcessed) {}
