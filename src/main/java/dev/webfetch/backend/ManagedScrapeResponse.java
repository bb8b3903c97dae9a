package dev.webfetch.backend;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** Top-level JSON response from the managed scraper. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManagedScrapeResponse(
    boolean success, @Nullable Data data, @Nullable String error) {

  /** Page content in the formats that were requested. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Data(@Nullable String markdown, @Nullable String html) {}
}
