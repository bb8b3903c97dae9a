package dev.webfetch.retrieval;

import dev.webfetch.backend.ContentFormat;
import dev.webfetch.url.UrlNormalizer;
import org.jspecify.annotations.Nullable;

/**
 * A single retrieval. Construction validates the input, so an invalid URL is rejected before any
 * backend is invoked.
 *
 * @param url absolute http(s) URL
 * @param format requested output format
 * @param timeoutMs per-attempt timeout override, must be positive when set
 * @param explicitStrategy strategy name the caller wants tried first; validated by the
 *     orchestrator so unknown names become an error result rather than an exception
 * @param forceRefresh skip the cache lookup and always hit a backend
 * @param saveResource store successful content in the resource cache
 * @throws IllegalArgumentException if the URL is invalid or the timeout is not positive
 */
public record RetrievalRequest(
    String url,
    ContentFormat format,
    @Nullable Integer timeoutMs,
    @Nullable String explicitStrategy,
    boolean forceRefresh,
    boolean saveResource) {

  public RetrievalRequest {
    UrlNormalizer.requireHttpUrl(url);
    url = url.trim();
    format = format == null ? ContentFormat.MARKDOWN : format;
    if (timeoutMs != null && timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be positive, got: " + timeoutMs);
    }
    explicitStrategy =
        explicitStrategy == null || explicitStrategy.isBlank() ? null : explicitStrategy.trim();
  }

  /** Request with default format, no timeout override, no explicit strategy, cache enabled. */
  public static RetrievalRequest of(String url) {
    return new RetrievalRequest(url, ContentFormat.MARKDOWN, null, null, false, true);
  }

  public RetrievalRequest withExplicitStrategy(@Nullable String strategy) {
    return new RetrievalRequest(url, format, timeoutMs, strategy, forceRefresh, saveResource);
  }

  public RetrievalRequest withForceRefresh(boolean refresh) {
    return new RetrievalRequest(url, format, timeoutMs, explicitStrategy, refresh, saveResource);
  }

  public RetrievalRequest withTimeoutMs(@Nullable Integer timeout) {
    return new RetrievalRequest(url, format, timeout, explicitStrategy, forceRefresh, saveResource);
  }
}
