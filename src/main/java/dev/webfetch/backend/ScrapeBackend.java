package dev.webfetch.backend;

import dev.webfetch.strategy.StrategyName;

/**
 * Uniform capability implemented once per scraping backend.
 *
 * <p>Implementations must not throw for ordinary failures; they return {@link
 * BackendResult#failed(String)} instead. Anything that still escapes is caught by the caller and
 * recorded as a failed attempt.
 */
public interface ScrapeBackend {

  /** The strategy this backend implements. */
  StrategyName strategy();

  BackendResult scrape(String url, ScrapeOptions options);
}
