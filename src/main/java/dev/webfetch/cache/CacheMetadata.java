package dev.webfetch.cache;

import dev.webfetch.backend.ContentFormat;
import dev.webfetch.strategy.StrategyName;

/**
 * Descriptive fields stored alongside cached content.
 *
 * @param mimeType content type of the stored content
 * @param format the output format requested when the content was retrieved; lookups only return
 *     versions in the format asked for
 * @param strategyUsed the strategy that produced the content
 */
public record CacheMetadata(String mimeType, ContentFormat format, StrategyName strategyUsed) {

  public CacheMetadata {
    mimeType = mimeType == null || mimeType.isBlank() ? "text/plain" : mimeType;
    format = format == null ? ContentFormat.MARKDOWN : format;
    if (strategyUsed == null) {
      throw new IllegalArgumentException("strategyUsed must not be null");
    }
  }
}
