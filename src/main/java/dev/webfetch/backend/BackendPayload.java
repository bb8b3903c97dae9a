package dev.webfetch.backend;

import org.jspecify.annotations.Nullable;

/**
 * Backend-specific shape of scraped content. The retrieval layer flattens it into a single string
 * using a fixed rule per backend.
 */
public sealed interface BackendPayload permits BackendPayload.Plain, BackendPayload.Markup {

  /** A single body, as returned by the native fetch and the proxy scraper. */
  record Plain(String body) implements BackendPayload {}

  /** A markdown/html pair, as returned by the managed scraper. */
  record Markup(@Nullable String markdown, @Nullable String html) implements BackendPayload {}
}
