package dev.webfetch.retrieval;

import dev.webfetch.backend.BackendResult;
import dev.webfetch.backend.ScrapeBackend;
import dev.webfetch.backend.ScrapeBackends;
import dev.webfetch.backend.ScrapeOptions;
import dev.webfetch.strategy.StrategyConfigEntry;
import dev.webfetch.strategy.StrategyConfigStore;
import dev.webfetch.strategy.StrategyName;
import dev.webfetch.strategy.UrlPatternLearner;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves which scraping strategy to use for a URL, runs it, falls back on failure and feeds
 * fallback successes back into the {@link StrategyConfigStore}.
 *
 * <p>Resolution order for {@link #scrapeWithStrategy}:
 *
 * <ol>
 *   <li>An explicit strategy is tried alone. Success returns immediately without learning.
 *   <li>Otherwise the configured strategy for the URL (longest prefix) is tried alone, with the
 *       same success branch. Lookup failures count as "not configured", and so does a configured
 *       strategy that the fallback mode leaves out.
 *   <li>The universal fallback sequence from {@link OrchestratorConfig#fallbackMode()} runs next,
 *       skipping any strategy already tried in this request. A success here is learned under
 *       {@link UrlPatternLearner#derivePrefix(String)}.
 * </ol>
 *
 * <p>Attempts are strictly sequential: a paid backend is never called while a cheaper one might
 * still succeed. Each attempt has its own timeout and there is no retry of the same backend. If
 * the calling thread is interrupted, the in-flight attempt is cancelled and no further candidates
 * are tried. Apart from malformed input rejected by {@link RetrievalRequest}, nothing here throws:
 * every failure ends up in a {@link RetrievalResult}.
 */
public class RetrievalOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(RetrievalOrchestrator.class);

  static final String NOTES_UNIVERSAL = "Auto-discovered via universal fallback";
  static final String CANCELLED = "Retrieval cancelled";

  private final OrchestratorConfig config;
  private final AttemptRunner attemptRunner;
  private final Clock clock;

  public RetrievalOrchestrator(OrchestratorConfig config, ExecutorService executor, Clock clock) {
    this.config = config;
    this.attemptRunner = new AttemptRunner(executor);
    this.clock = clock;
  }

  public OrchestratorConfig getConfig() {
    return config;
  }

  /**
   * Try exactly one strategy, with no fallback and no learning.
   *
   * @param strategyName strategy name as supplied by the caller
   * @return the result; an unknown name yields {@code "Unknown strategy: <name>"} without invoking
   *     any backend
   */
  public RetrievalResult scrapeWithSingleStrategy(
      ScrapeBackends backends, String strategyName, RetrievalRequest request) {
    Optional<StrategyName> strategy = StrategyName.parse(strategyName);
    if (strategy.isEmpty()) {
      return RetrievalResult.unknownStrategy(strategyName);
    }
    return scrapeWithSingleStrategy(backends, strategy.get(), request);
  }

  public RetrievalResult scrapeWithSingleStrategy(
      ScrapeBackends backends, StrategyName strategy, RetrievalRequest request) {
    var recorder = new Diagnostics.Recorder();
    Attempt attempt = attempt(backends, strategy, request, recorder);
    return toSingleResult(attempt, recorder);
  }

  /** Run the universal fallback sequence only, without consulting any config. */
  public RetrievalResult scrapeUniversal(ScrapeBackends backends, RetrievalRequest request) {
    return runUniversal(backends, request, new Diagnostics.Recorder(), Set.of());
  }

  /** Full resolution using the request's own explicit strategy, if any. */
  public RetrievalResult scrapeWithStrategy(
      ScrapeBackends backends, StrategyConfigStore configStore, RetrievalRequest request) {
    return scrapeWithStrategy(backends, configStore, request, request.explicitStrategy());
  }

  /**
   * Full resolution: explicit strategy, then configured strategy, then universal fallback with
   * learning.
   *
   * @param explicitStrategy strategy name to try first; null or blank means none
   */
  public RetrievalResult scrapeWithStrategy(
      ScrapeBackends backends,
      StrategyConfigStore configStore,
      RetrievalRequest request,
      @Nullable String explicitStrategy) {
    var recorder = new Diagnostics.Recorder();
    String notes = NOTES_UNIVERSAL;
    @Nullable StrategyName firstChoice = null;

    if (explicitStrategy != null && !explicitStrategy.isBlank()) {
      Optional<StrategyName> parsed = StrategyName.parse(explicitStrategy);
      if (parsed.isEmpty()) {
        return RetrievalResult.unknownStrategy(explicitStrategy.trim());
      }
      firstChoice = parsed.get();
      notes = "Auto-discovered after explicit strategy " + firstChoice.wireName() + " failed";
    } else {
      Optional<StrategyName> configured =
          lookupConfigured(configStore, request.url()).filter(this::usedByFallbackMode);
      if (configured.isPresent()) {
        firstChoice = configured.get();
        notes = "Auto-discovered after configured strategy " + firstChoice.wireName() + " failed";
      }
    }

    Set<StrategyName> alreadyTried = EnumSet.noneOf(StrategyName.class);
    if (firstChoice != null) {
      Attempt first = attempt(backends, firstChoice, request, recorder);
      if (first.succeeded()) {
        return RetrievalResult.succeeded(first.content(), firstChoice, recorder.snapshot());
      }
      if (first.cancelled()) {
        return RetrievalResult.failed(firstChoice.wireName(), CANCELLED, recorder.snapshot());
      }
      log.debug(
          "Strategy '{}' failed for {}, falling back to universal sequence",
          firstChoice,
          request.url());
      alreadyTried.add(firstChoice);
    }

    RetrievalResult universal = runUniversal(backends, request, recorder, alreadyTried);
    String learnedNotes = notes;
    universal
        .sourceStrategy()
        .ifPresent(winner -> learn(configStore, request.url(), winner, learnedNotes));
    return universal;
  }

  private RetrievalResult runUniversal(
      ScrapeBackends backends,
      RetrievalRequest request,
      Diagnostics.Recorder recorder,
      Set<StrategyName> alreadyTried) {
    FallbackChain chain = FallbackChain.universal(config.fallbackMode()).excluding(alreadyTried);
    boolean[] cancelled = {false};

    Optional<Attempt> winner =
        chain.firstSuccess(
            strategy -> {
              Attempt attempt = attempt(backends, strategy, request, recorder);
              cancelled[0] = attempt.cancelled();
              return attempt.succeeded() ? Optional.of(attempt) : Optional.empty();
            },
            () -> cancelled[0]);

    if (winner.isPresent()) {
      Attempt success = winner.get();
      return RetrievalResult.succeeded(success.content(), success.strategy(), recorder.snapshot());
    }
    if (cancelled[0]) {
      return RetrievalResult.failed(RetrievalResult.SOURCE_NONE, CANCELLED, recorder.snapshot());
    }
    Diagnostics diagnostics = recorder.snapshot();
    log.info("All strategies failed for {}: {}", request.url(), diagnostics.describeErrors());
    return RetrievalResult.allFailed(diagnostics);
  }

  private Attempt attempt(
      ScrapeBackends backends,
      StrategyName strategy,
      RetrievalRequest request,
      Diagnostics.Recorder recorder) {
    Optional<ScrapeBackend> backend = backends.get(strategy);
    if (backend.isEmpty()) {
      String error = strategy.displayName() + " client not available";
      recorder.error(strategy, error);
      return Attempt.failed(strategy, error);
    }

    recorder.attempted(strategy);
    long started = System.nanoTime();
    BackendResult result;
    try {
      result = attemptRunner.run(backend.get(), request.url(), optionsFor(request));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      recorder.timing(strategy, Duration.ofNanos(System.nanoTime() - started));
      recorder.error(strategy, CANCELLED);
      return Attempt.cancelled(strategy);
    }
    recorder.timing(strategy, Duration.ofNanos(System.nanoTime() - started));

    if (result.success()) {
      String content = ContentNormalizer.extract(result.payload(), request.format());
      if (content != null) {
        log.debug("Strategy '{}' succeeded for {}", strategy, request.url());
        return Attempt.succeeded(strategy, content);
      }
      String error = strategy.displayName() + " returned empty content";
      recorder.error(strategy, error);
      return Attempt.failed(strategy, error);
    }

    String error = result.error() != null ? result.error() : "Strategy " + strategy + " failed";
    recorder.error(strategy, error);
    log.debug("Strategy '{}' failed for {}: {}", strategy, request.url(), error);
    return Attempt.failed(strategy, error);
  }

  private Optional<StrategyName> lookupConfigured(StrategyConfigStore configStore, String url) {
    try {
      return configStore.getStrategyForUrl(url);
    } catch (RuntimeException e) {
      log.warn("Failed to load strategy config, continuing without it: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /** A configured rule never brings in a strategy the active mode leaves out (native in SPEED). */
  private boolean usedByFallbackMode(StrategyName strategy) {
    if (config.fallbackMode().sequence().contains(strategy)) {
      return true;
    }
    log.debug(
        "Ignoring configured strategy '{}', not used in {} mode", strategy, config.fallbackMode());
    return false;
  }

  private void learn(
      StrategyConfigStore configStore, String url, StrategyName winner, String notes) {
    String prefix = UrlPatternLearner.derivePrefix(url);
    try {
      configStore.upsertEntry(new StrategyConfigEntry(prefix, winner, notes, clock.instant()));
    } catch (RuntimeException e) {
      log.warn("Failed to update strategy config for prefix {}: {}", prefix, e.getMessage());
    }
  }

  private ScrapeOptions optionsFor(RetrievalRequest request) {
    Duration timeout =
        request.timeoutMs() != null
            ? Duration.ofMillis(request.timeoutMs())
            : config.defaultTimeout();
    return new ScrapeOptions(timeout, request.format());
  }

  private static RetrievalResult toSingleResult(Attempt attempt, Diagnostics.Recorder recorder) {
    if (attempt.succeeded()) {
      return RetrievalResult.succeeded(attempt.content(), attempt.strategy(), recorder.snapshot());
    }
    return RetrievalResult.failed(
        attempt.strategy().wireName(),
        attempt.error() != null ? attempt.error() : CANCELLED,
        recorder.snapshot());
  }

  /** Outcome of trying one strategy within a request. */
  private record Attempt(
      StrategyName strategy,
      @Nullable String content,
      @Nullable String error,
      boolean cancelled) {

    static Attempt succeeded(StrategyName strategy, String content) {
      return new Attempt(strategy, content, null, false);
    }

    static Attempt failed(StrategyName strategy, String error) {
      return new Attempt(strategy, null, error, false);
    }

    static Attempt cancelled(StrategyName strategy) {
      return new Attempt(strategy, null, CANCELLED, true);
    }

    boolean succeeded() {
      return content != null;
    }
  }
}
