package dev.webfetch.retrieval;

import dev.webfetch.cache.CachedResource;
import dev.webfetch.strategy.StrategyName;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a retrieval. {@code success} is false exactly when {@code content} is null.
 *
 * @param success whether content was retrieved
 * @param content the retrieved content, or null on failure
 * @param source winning strategy name, {@code "none"} when every attempted backend failed, or the
 *     rejected name for an unknown strategy
 * @param error human-readable failure reason
 * @param diagnostics attempts, per-strategy errors and timings
 * @param cached whether the content came from the resource cache
 */
public record RetrievalResult(
    boolean success,
    @Nullable String content,
    String source,
    @Nullable String error,
    Diagnostics diagnostics,
    boolean cached) {

  public static final String SOURCE_NONE = "none";

  public RetrievalResult {
    if (success != (content != null)) {
      throw new IllegalArgumentException("success must be true exactly when content is present");
    }
    diagnostics = diagnostics == null ? Diagnostics.empty() : diagnostics;
  }

  static RetrievalResult succeeded(String content, StrategyName source, Diagnostics diagnostics) {
    return new RetrievalResult(true, content, source.wireName(), null, diagnostics, false);
  }

  static RetrievalResult failed(String source, String error, Diagnostics diagnostics) {
    return new RetrievalResult(false, null, source, error, diagnostics, false);
  }

  static RetrievalResult unknownStrategy(String name) {
    return failed(name, "Unknown strategy: " + name, Diagnostics.empty());
  }

  static RetrievalResult allFailed(Diagnostics diagnostics) {
    String attempted =
        diagnostics.strategiesAttempted().isEmpty()
            ? SOURCE_NONE
            : String.join(
                ", ",
                diagnostics.strategiesAttempted().stream().map(StrategyName::wireName).toList());
    String errors = diagnostics.describeErrors();
    return failed(
        SOURCE_NONE,
        "All strategies failed. Attempted: " + attempted + "."
            + (errors.isEmpty() ? "" : " Errors: " + errors),
        diagnostics);
  }

  static RetrievalResult fromCache(CachedResource resource) {
    return new RetrievalResult(
        true,
        resource.content(),
        resource.strategyUsed().wireName(),
        null,
        Diagnostics.empty(),
        true);
  }

  /** The winning strategy, if {@link #source()} names one. */
  public Optional<StrategyName> sourceStrategy() {
    return success ? StrategyName.parse(source) : Optional.empty();
  }
}
