package dev.webfetch.backend;

import dev.webfetch.strategy.StrategyName;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed lookup table from {@link StrategyName} to the configured backend, built once at startup.
 * Strategies without an entry are not configured for this deployment.
 */
public final class ScrapeBackends {

  private final Map<StrategyName, ScrapeBackend> backends;

  private ScrapeBackends(Map<StrategyName, ScrapeBackend> backends) {
    this.backends = Collections.unmodifiableMap(backends);
  }

  /**
   * Build a table from the given backends, keyed by {@link ScrapeBackend#strategy()}.
   *
   * @throws IllegalArgumentException if two backends claim the same strategy
   */
  public static ScrapeBackends of(List<? extends ScrapeBackend> available) {
    EnumMap<StrategyName, ScrapeBackend> table = new EnumMap<>(StrategyName.class);
    for (ScrapeBackend backend : available) {
      if (table.putIfAbsent(backend.strategy(), backend) != null) {
        throw new IllegalArgumentException("Duplicate backend for strategy " + backend.strategy());
      }
    }
    return new ScrapeBackends(table);
  }

  public static ScrapeBackends of(ScrapeBackend... available) {
    return of(List.of(available));
  }

  public Optional<ScrapeBackend> get(StrategyName strategy) {
    return Optional.ofNullable(backends.get(strategy));
  }

  public boolean isAvailable(StrategyName strategy) {
    return backends.containsKey(strategy);
  }

  public Set<StrategyName> available() {
    return backends.keySet();
  }
}
