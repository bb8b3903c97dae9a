package dev.webfetch.retrieval;

import dev.webfetch.strategy.StrategyName;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What happened during one retrieval, so callers can tell a fast success from one that needed two
 * failed attempts first.
 *
 * @param strategiesAttempted strategies whose backend was actually invoked, in order
 * @param strategyErrors failure reason per strategy, including unavailable backends
 * @param timing wall time per invoked strategy
 */
public record Diagnostics(
    List<StrategyName> strategiesAttempted,
    Map<StrategyName, String> strategyErrors,
    Map<StrategyName, Duration> timing) {

  public Diagnostics {
    strategiesAttempted = List.copyOf(strategiesAttempted);
    strategyErrors = Collections.unmodifiableMap(new LinkedHashMap<>(strategyErrors));
    timing = Collections.unmodifiableMap(new LinkedHashMap<>(timing));
  }

  public static Diagnostics empty() {
    return new Diagnostics(List.of(), Map.of(), Map.of());
  }

  /** {@code "native: HTTP 500; managed: timeout"}, in the order errors were recorded. */
  public String describeErrors() {
    List<String> parts = new ArrayList<>();
    strategyErrors.forEach((strategy, error) -> parts.add(strategy.wireName() + ": " + error));
    return String.join("; ", parts);
  }

  /** Mutable accumulator used while a single request is in flight. Not thread-safe. */
  static final class Recorder {

    private final List<StrategyName> attempted = new ArrayList<>();
    private final Map<StrategyName, String> errors = new LinkedHashMap<>();
    private final Map<StrategyName, Duration> timing = new EnumMap<>(StrategyName.class);

    void attempted(StrategyName strategy) {
      attempted.add(strategy);
    }

    void error(StrategyName strategy, String error) {
      errors.put(strategy, error);
    }

    void timing(StrategyName strategy, Duration elapsed) {
      timing.put(strategy, elapsed);
    }

    Diagnostics snapshot() {
      return new Diagnostics(attempted, errors, timing);
    }
  }
}
