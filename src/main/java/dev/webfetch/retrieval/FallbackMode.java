package dev.webfetch.retrieval;

import dev.webfetch.strategy.StrategyName;
import java.util.List;

/** Ordering of the universal fallback sequence. */
public enum FallbackMode {

  /** Cheapest first: {@code native -> managed -> proxy}. */
  COST(List.of(StrategyName.NATIVE, StrategyName.MANAGED, StrategyName.PROXY)),

  /** Skips the native fetch entirely: {@code managed -> proxy}. */
  SPEED(List.of(StrategyName.MANAGED, StrategyName.PROXY));

  private final List<StrategyName> sequence;

  FallbackMode(List<StrategyName> sequence) {
    this.sequence = sequence;
  }

  public List<StrategyName> sequence() {
    return sequence;
  }
}
