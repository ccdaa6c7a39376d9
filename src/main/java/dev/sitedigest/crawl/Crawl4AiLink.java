package dev.sitedigest.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** A hyperlink found on a rendered page, as returned by the Crawl4AI sidecar. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Crawl4AiLink(@Nullable String href, @Nullable String text) {}
