package dev.webfetch.strategy;

import java.util.List;
import java.util.Optional;

/**
 * Persisted mapping from URL prefix to the strategy that previously worked for it.
 *
 * <p>Storage failures surface as {@link java.io.UncheckedIOException}. Callers on the retrieval
 * path treat a failed lookup as "no configured strategy".
 */
public interface StrategyConfigStore {

  /** All entries, longest prefix first. A missing backing file is an empty config. */
  List<StrategyConfigEntry> loadConfig();

  /** Replace the whole config with {@code entries}. */
  void saveConfig(List<StrategyConfigEntry> entries);

  /** Insert {@code entry}, or overwrite the entry with the identical prefix in place. */
  void upsertEntry(StrategyConfigEntry entry);

  /**
   * Strategy of the entry whose prefix is the longest match for {@code url}.
   *
   * @param url an absolute URL
   * @return the configured strategy, or empty if no prefix matches
   */
  Optional<StrategyName> getStrategyForUrl(String url);
}
