package dev.webfetch.strategy;

import java.time.Instant;

/**
 * A learned or hand-written rule: URLs starting with {@code prefix} (scheme stripped) should be
 * scraped with {@code strategy} first.
 *
 * @param prefix scheme-stripped host or host+path prefix, e.g. {@code yelp.com/biz/}
 * @param strategy the strategy that previously succeeded for this prefix
 * @param notes free-form provenance, e.g. {@code "Auto-discovered via universal fallback"}
 * @param createdAt when the entry was written
 */
public record StrategyConfigEntry(String prefix, StrategyName strategy, String notes, Instant createdAt) {

  public StrategyConfigEntry {
    if (prefix == null || prefix.isBlank()) {
      throw new IllegalArgumentException("prefix must not be blank");
    }
    if (strategy == null) {
      throw new IllegalArgumentException("strategy must not be null");
    }
    prefix = prefix.strip();
    notes = notes == null ? "" : notes;
    createdAt = createdAt == null ? Instant.EPOCH : createdAt;
  }
}
