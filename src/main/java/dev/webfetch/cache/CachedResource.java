package dev.webfetch.cache;

import dev.webfetch.backend.ContentFormat;
import dev.webfetch.strategy.StrategyName;
import java.time.Instant;

/**
 * One immutable version of retrieved content. A newer version for the same URL supersedes it by
 * having a higher {@code sequence}.
 *
 * @param versionId storage-specific identifier, e.g. {@code memory://example.com_page/42}
 * @param url the normalized URL this content was retrieved from
 * @param content the retrieved content
 * @param mimeType content type of {@code content}
 * @param format the output format the content was retrieved in
 * @param strategyUsed the strategy that produced the content
 * @param scrapedAt when the content was retrieved
 * @param sequence cache-wide monotonic version number
 */
public record CachedResource(
    String versionId,
    String url,
    String content,
    String mimeType,
    ContentFormat format,
    StrategyName strategyUsed,
    Instant scrapedAt,
    long sequence) {

  public CachedResource {
    format = format == null ? ContentFormat.MARKDOWN : format;
  }
}
