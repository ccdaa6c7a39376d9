package dev.sitedigest.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Per-page result within a {@link Crawl4AiResponse}: rendered HTML, Markdown, page metadata and
 * discovered links.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Crawl4AiPageResult(
    String url,
    boolean success,
    @Nullable String html,
    @Nullable Crawl4AiMarkdown markdown,
    @Nullable Map<String, Object> metadata,
    @Nullable Map<String, List<Crawl4AiLink>> links,
    @Nullable String error_message) {
  public Crawl4AiPageResult {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
    links = links == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(links));
  }

  /** Hrefs of internal and external links, internal first. Scope is decided by the caller. */
  public List<String> linkHrefs() {
    List<String> hrefs = new ArrayList<>();
    for (String kind : List.of("internal", "external")) {
      List<Crawl4AiLink> group = links == null ? null : links.get(kind);
      if (group == null) {
        continue;
      }
      group.stream().filter(Objects::nonNull).map(Crawl4AiLink::href).filter(Objects::nonNull)
          .forEach(hrefs::add);
    }
    return hrefs;
  }

  public @Nullable String metadataValue(String key) {
    Object value = metadata == null ? null : metadata.get(key);
    return value == null ? null : value.toString();
  }
}
