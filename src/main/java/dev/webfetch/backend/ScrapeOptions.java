package dev.webfetch.backend;

import java.time.Duration;

/**
 * Per-attempt options handed to a {@link ScrapeBackend}.
 *
 * @param timeout the budget for this single attempt
 * @param format the output format the caller asked for
 */
public record ScrapeOptions(Duration timeout, ContentFormat format) {

  public ScrapeOptions {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    format = format == null ? ContentFormat.MARKDOWN : format;
  }
}
