package dev.webfetch.api;

import dev.webfetch.backend.ContentFormat;
import dev.webfetch.retrieval.RetrievalRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /api/scrape}. Omitted flags default to a cached, saving retrieval.
 *
 * @param url absolute http(s) URL
 * @param format {@code markdown} (default), {@code html} or {@code text}
 * @param timeoutMs per-attempt timeout override
 * @param strategy strategy to try first
 * @param forceRefresh skip the cache lookup
 * @param saveResource store the result in the cache
 */
public record ScrapeRequestBody(
    @NotBlank String url,
    @Nullable String format,
    @Nullable @Positive Integer timeoutMs,
    @Nullable String strategy,
    @Nullable Boolean forceRefresh,
    @Nullable Boolean saveResource) {

  /**
   * Convert to a domain request.
   *
   * @throws IllegalArgumentException if the URL or format is invalid
   */
  RetrievalRequest toRetrievalRequest() {
    ContentFormat contentFormat = ContentFormat.MARKDOWN;
    if (format != null && !format.isBlank()) {
      contentFormat =
          ContentFormat.parse(format)
              .orElseThrow(() -> new IllegalArgumentException("Unknown format: " + format));
    }
    return new RetrievalRequest(
        url,
        contentFormat,
        timeoutMs,
        strategy,
        Boolean.TRUE.equals(forceRefresh),
        !Boolean.FALSE.equals(saveResource));
  }
}
