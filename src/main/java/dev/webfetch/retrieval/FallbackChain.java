package dev.webfetch.retrieval;

import dev.webfetch.strategy.StrategyName;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Ordered candidate strategies reduced by "first success wins". Holds no I/O; the attempt
 * function supplied by the caller does the work.
 */
public record FallbackChain(List<StrategyName> candidates) {

  public FallbackChain {
    candidates = candidates == null ? List.of() : List.copyOf(candidates);
  }

  /** The universal sequence for {@code mode}. */
  public static FallbackChain universal(FallbackMode mode) {
    return new FallbackChain(mode.sequence());
  }

  /** This chain without {@code failed}, preserving order. */
  public FallbackChain excluding(Collection<StrategyName> failed) {
    return new FallbackChain(candidates.stream().filter(s -> !failed.contains(s)).toList());
  }

  /**
   * Try each candidate in order until one yields a value.
   *
   * @param attempt runs one candidate; empty means it failed
   * @param stop checked before each candidate; when true no further candidates are tried
   * @return the first successful value, or empty if every candidate failed or the chain stopped
   */
  public <T> Optional<T> firstSuccess(
      Function<StrategyName, Optional<T>> attempt, BooleanSupplier stop) {
    for (StrategyName candidate : candidates) {
      if (stop.getAsBoolean()) {
        return Optional.empty();
      }
      Optional<T> result = attempt.apply(candidate);
      if (result.isPresent()) {
        return result;
      }
    }
    return Optional.empty();
  }

  public <T> Optional<T> firstSuccess(Function<StrategyName, Optional<T>> attempt) {
    return firstSuccess(attempt, () -> false);
  }
}
