package dev.webfetch.retrieval;

import static dev.webfetch.strategy.StrategyName.MANAGED;
import static dev.webfetch.strategy.StrategyName.NATIVE;
import static dev.webfetch.strategy.StrategyName.PROXY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;

import dev.webfetch.backend.BackendPayload;
import dev.webfetch.backend.BackendResult;
import dev.webfetch.backend.ContentFormat;
import dev.webfetch.backend.ScrapeBackends;
import dev.webfetch.backend.ScrapeOptions;
import dev.webfetch.fixture.InMemoryStrategyConfigStore;
import dev.webfetch.fixture.StubBackend;
import dev.webfetch.strategy.StrategyConfigEntry;
import dev.webfetch.strategy.StrategyConfigStore;
import dev.webfetch.strategy.StrategyName;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RetrievalOrchestratorTest {

  private static final String URL = "https://example.com/page";
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private ExecutorService executor;
  private RetrievalOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
    orchestrator = orchestrator(FallbackMode.COST);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private RetrievalOrchestrator orchestrator(FallbackMode mode) {
    return new RetrievalOrchestrator(
        new OrchestratorConfig(mode, Duration.ofSeconds(5)),
        executor,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Nested
  class Universal {

    @Test
    void allBackendsFailingYieldsAggregateError() {
      var backends =
          ScrapeBackends.of(
              StubBackend.failing(NATIVE, "HTTP 403"),
              StubBackend.failing(MANAGED, "blocked"),
              StubBackend.failing(PROXY, "zone exhausted"));

      RetrievalResult result = orchestrator.scrapeUniversal(backends, RetrievalRequest.of(URL));

      assertThat(result.success()).isFalse();
      assertThat(result.content()).isNull();
      assertThat(result.source()).isEqualTo("none");
      assertThat(result.error())
          .startsWith("All strategies failed")
          .contains("Attempted: native, managed, proxy")
          .contains("native: HTTP 403; managed: blocked; proxy: zone exhausted");
      assertThat(result.diagnostics().strategiesAttempted()).containsExactly(NATIVE, MANAGED, PROXY);
      assertThat(result.diagnostics().timing()).containsOnlyKeys(NATIVE, MANAGED, PROXY);
    }

    @Test
    void nativeSuccessShortCircuitsInCostMode() {
      var nativeBackend = StubBackend.succeeding(NATIVE, "X");
      var managed = StubBackend.succeeding(MANAGED, "Y");
      var proxy = StubBackend.succeeding(PROXY, "Z");

      RetrievalResult result =
          orchestrator.scrapeUniversal(
              ScrapeBackends.of(nativeBackend, managed, proxy), RetrievalRequest.of(URL));

      assertThat(result.success()).isTrue();
      assertThat(result.content()).isEqualTo("X");
      assertThat(result.source()).isEqualTo("native");
      assertThat(result.diagnostics().strategiesAttempted()).containsExactly(NATIVE);
      assertThat(managed.callCount()).isZero();
      assertThat(proxy.callCount()).isZero();
    }

    @Test
    void laterStrategyIsNotAttemptedAfterSuccess() {
      var nativeBackend = StubBackend.failing(NATIVE, "HTTP 500");
      var managed = StubBackend.succeeding(MANAGED, "rendered");
      var proxy = StubBackend.succeeding(PROXY, "Z");

      RetrievalResult result =
          orchestrator.scrapeUniversal(
              ScrapeBackends.of(nativeBackend, managed, proxy), RetrievalRequest.of(URL));

      assertThat(result.source()).isEqualTo("managed");
      assertThat(result.diagnostics().strategyErrors()).containsOnlyKeys(NATIVE);
      assertThat(proxy.callCount()).isZero();
    }

    @Test
    void speedModeNeverAttemptsNative() {
      var nativeBackend = StubBackend.succeeding(NATIVE, "X");
      var managed = StubBackend.failing(MANAGED, "blocked");
      var proxy = StubBackend.failing(PROXY, "blocked");

      RetrievalResult result =
          orchestrator(FallbackMode.SPEED)
              .scrapeUniversal(
                  ScrapeBackends.of(nativeBackend, managed, proxy), RetrievalRequest.of(URL));

      assertThat(result.success()).isFalse();
      assertThat(result.error()).contains("Attempted: managed, proxy");
      assertThat(nativeBackend.callCount()).isZero();
    }

    @Test
    void unavailableBackendIsReportedButNotAttempted() {
      var nativeBackend = StubBackend.failing(NATIVE, "HTTP 403");

      RetrievalResult result =
          orchestrator.scrapeUniversal(ScrapeBackends.of(nativeBackend), RetrievalRequest.of(URL));

      assertThat(result.success()).isFalse();
      assertThat(result.diagnostics().strategiesAttempted()).containsExactly(NATIVE);
      assertThat(result.diagnostics().strategyErrors())
          .containsEntry(MANAGED, "Managed client not available")
          .containsEntry(PROXY, "Proxy client not available");
    }

    @Test
    void backendExceptionIsCapturedAsFailure() {
      var backends =
          ScrapeBackends.of(
              StubBackend.throwing(NATIVE, new IllegalStateException("boom")),
              StubBackend.succeeding(MANAGED, "ok"));

      RetrievalResult result = orchestrator.scrapeUniversal(backends, RetrievalRequest.of(URL));

      assertThat(result.source()).isEqualTo("managed");
      assertThat(result.diagnostics().strategyErrors()).containsEntry(NATIVE, "boom");
    }

    @Test
    void blankContentCountsAsFailure() {
      var backends =
          ScrapeBackends.of(
              StubBackend.succeeding(NATIVE, "   "), StubBackend.succeeding(MANAGED, "real"));

      RetrievalResult result = orchestrator.scrapeUniversal(backends, RetrievalRequest.of(URL));

      assertThat(result.source()).isEqualTo("managed");
      assertThat(result.diagnostics().strategyErrors())
          .containsEntry(NATIVE, "Native returned empty content");
    }

    @Test
    void managedMarkupFollowsRequestedFormat() {
      var managed =
          StubBackend.returning(
              MANAGED, BackendResult.ok(new BackendPayload.Markup("# md", "<p>html</p>")));
      var backends = ScrapeBackends.of(managed);

      RetrievalResult markdown = orchestrator.scrapeUniversal(backends, RetrievalRequest.of(URL));
      RetrievalResult html =
          orchestrator.scrapeUniversal(
              backends,
              new RetrievalRequest(URL, ContentFormat.HTML, null, null, false, true));

      assertThat(markdown.content()).isEqualTo("# md");
      assertThat(html.content()).isEqualTo("<p>html</p>");
      assertThat(managed.options())
          .extracting(ScrapeOptions::format)
          .containsExactly(ContentFormat.MARKDOWN, ContentFormat.HTML);
    }

    @Test
    void slowAttemptTimesOutAndFallsThrough() {
      var release = new CountDownLatch(1);
      var backends =
          ScrapeBackends.of(
              StubBackend.hanging(NATIVE, release), StubBackend.succeeding(MANAGED, "fast"));

      RetrievalResult result =
          orchestrator.scrapeUniversal(backends, RetrievalRequest.of(URL).withTimeoutMs(50));
      release.countDown();

      assertThat(result.source()).isEqualTo("managed");
      assertThat(result.diagnostics().strategyErrors())
          .containsEntry(NATIVE, "Request timed out after 50 ms");
    }

    @Test
    void requestTimeoutOverridesDefault() {
      var nativeBackend = StubBackend.succeeding(NATIVE, "X");

      orchestrator.scrapeUniversal(
          ScrapeBackends.of(nativeBackend), RetrievalRequest.of(URL).withTimeoutMs(1234));
      orchestrator.scrapeUniversal(ScrapeBackends.of(nativeBackend), RetrievalRequest.of(URL));

      assertThat(nativeBackend.options())
          .extracting(ScrapeOptions::timeout)
          .containsExactly(Duration.ofMillis(1234), Duration.ofSeconds(5));
    }

    @Test
    void interruptedCallerStopsTheChain() {
      var managed = StubBackend.succeeding(MANAGED, "Y");
      var backends =
          ScrapeBackends.of(StubBackend.hanging(NATIVE, new CountDownLatch(1)), managed);

      Thread.currentThread().interrupt();
      RetrievalResult result = orchestrator.scrapeUniversal(backends, RetrievalRequest.of(URL));

      assertThat(Thread.interrupted()).isTrue();
      assertThat(result.success()).isFalse();
      assertThat(result.error()).isEqualTo("Retrieval cancelled");
      assertThat(managed.callCount()).isZero();
    }
  }

  @Nested
  class SingleStrategy {

    @Test
    void missingAdapterReturnsNotAvailable() {
      var backends = ScrapeBackends.of(StubBackend.succeeding(NATIVE, "X"));

      RetrievalResult result =
          orchestrator.scrapeWithSingleStrategy(backends, "managed", RetrievalRequest.of(URL));

      assertThat(result.success()).isFalse();
      assertThat(result.source()).isEqualTo("managed");
      assertThat(result.error()).isEqualTo("Managed client not available");
      assertThat(result.diagnostics().strategiesAttempted()).isEmpty();
    }

    @Test
    void unknownNameIsRejectedWithoutCallingBackends() {
      var nativeBackend = StubBackend.succeeding(NATIVE, "X");

      RetrievalResult result =
          orchestrator.scrapeWithSingleStrategy(
              ScrapeBackends.of(nativeBackend), "carrier-pigeon", RetrievalRequest.of(URL));

      assertThat(result.success()).isFalse();
      assertThat(result.source()).isEqualTo("carrier-pigeon");
      assertThat(result.error()).isEqualTo("Unknown strategy: carrier-pigeon");
      assertThat(nativeBackend.callCount()).isZero();
    }

    @Test
    void failureDoesNotFallBack() {
      var managed = StubBackend.succeeding(MANAGED, "Y");
      var backends = ScrapeBackends.of(StubBackend.failing(NATIVE, "HTTP 404"), managed);

      RetrievalResult result =
          orchestrator.scrapeWithSingleStrategy(backends, NATIVE, RetrievalRequest.of(URL));

      assertThat(result.source()).isEqualTo("native");
      assertThat(result.error()).isEqualTo("HTTP 404");
      assertThat(managed.callCount()).isZero();
    }
  }

  @Nested
  class FullResolution {

    @Test
    void universalSuccessIsLearnedUnderDerivedPrefix() {
      var store = new InMemoryStrategyConfigStore();
      var backends =
          ScrapeBackends.of(
              StubBackend.failing(NATIVE, "HTTP 403"),
              StubBackend.failing(MANAGED, "blocked"),
              StubBackend.succeeding(PROXY, "reviews"));

      RetrievalResult result =
          orchestrator.scrapeWithStrategy(
              backends, store, RetrievalRequest.of("https://yelp.com/biz/dolly-sf"));

      assertThat(result.source()).isEqualTo("proxy");
      assertThat(store.upserts())
          .containsExactly(
              new StrategyConfigEntry(
                  "yelp.com/biz/", PROXY, "Auto-discovered via universal fallback", NOW));
    }

    @Test
    void learnedPrefixIsUsedForSiblingUrl() {
      var store = new InMemoryStrategyConfigStore();
      var nativeBackend = StubBackend.failing(NATIVE, "HTTP 403");
      var managed = StubBackend.failing(MANAGED, "blocked");
      var proxy = StubBackend.succeeding(PROXY, "reviews");
      var backends = ScrapeBackends.of(nativeBackend, managed, proxy);

      orchestrator.scrapeWithStrategy(
          backends, store, RetrievalRequest.of("https://yelp.com/biz/dolly-sf"));
      RetrievalResult second =
          orchestrator.scrapeWithStrategy(
              backends, store, RetrievalRequest.of("https://yelp.com/biz/tartine"));

      assertThat(store.getStrategyForUrl("https://yelp.com/biz/tartine")).contains(PROXY);
      assertThat(second.diagnostics().strategiesAttempted()).containsExactly(PROXY);
      assertThat(nativeBackend.callCount()).isEqualTo(1);
      assertThat(store.upserts()).hasSize(1);
    }

    @Test
    void explicitSuccessReturnsWithoutLearning() {
      var store = new InMemoryStrategyConfigStore();
      var nativeBackend = StubBackend.succeeding(NATIVE, "X");
      var managed = StubBackend.succeeding(MANAGED, "Y");

      RetrievalResult result =
          orchestrator.scrapeWithStrategy(
              ScrapeBackends.of(nativeBackend, managed), store, RetrievalRequest.of(URL), "managed");

      assertThat(result.source()).isEqualTo("managed");
      assertThat(nativeBackend.callCount()).isZero();
      assertThat(store.upserts()).isEmpty();
    }

    @Test
    void explicitFailureFallsBackWithoutRetryingIt() {
      var store = new InMemoryStrategyConfigStore();
      var nativeBackend = StubBackend.failing(NATIVE, "HTTP 403");
      var managed = StubBackend.failing(MANAGED, "blocked");
      var proxy = StubBackend.succeeding(PROXY, "Z");

      RetrievalResult result =
          orchestrator.scrapeWithStrategy(
              ScrapeBackends.of(nativeBackend, managed, proxy),
              store,
              RetrievalRequest.of(URL),
              "managed");

      assertThat(result.source()).isEqualTo("proxy");
      assertThat(result.diagnostics().strategiesAttempted()).containsExactly(MANAGED, NATIVE, PROXY);
      assertThat(managed.callCount()).isEqualTo(1);
      assertThat(store.upserts())
          .singleElement()
          .satisfies(
              entry -> {
                assertThat(entry.prefix()).isEqualTo("example.com");
                assertThat(entry.notes())
                    .isEqualTo("Auto-discovered after explicit strategy managed failed");
              });
    }

    @Test
    void requestExplicitStrategyIsUsedByDefault() {
      var nativeBackend = StubBackend.succeeding(NATIVE, "X");
      var proxy = StubBackend.succeeding(PROXY, "Z");

      RetrievalResult result =
          orchestrator.scrapeWithStrategy(
              ScrapeBackends.of(nativeBackend, proxy),
              new InMemoryStrategyConfigStore(),
              RetrievalRequest.of(URL).withExplicitStrategy("PROXY"));

      assertThat(result.source()).isEqualTo("proxy");
      assertThat(nativeBackend.callCount()).isZero();
    }

    @Test
    void configuredStrategyIsTriedFirst() {
      var store =
          InMemoryStrategyConfigStore.with(
              new StrategyConfigEntry("example.com", MANAGED, "", Instant.EPOCH));
      var nativeBackend = StubBackend.succeeding(NATIVE, "X");
      var managed = StubBackend.succeeding(MANAGED, "Y");

      RetrievalResult result =
          orchestrator.scrapeWithStrategy(
              ScrapeBackends.of(nativeBackend, managed), store, RetrievalRequest.of(URL));

      assertThat(result.source()).isEqualTo("managed");
      assertThat(nativeBackend.callCount()).isZero();
      assertThat(store.upserts()).isEmpty();
    }

    @Test
    void speedModeIgnoresConfiguredNative() {
      var store =
          InMemoryStrategyConfigStore.with(
              new StrategyConfigEntry("example.com", NATIVE, "", Instant.EPOCH));
      var nativeBackend = StubBackend.succeeding(NATIVE, "X");
      var managed = StubBackend.succeeding(MANAGED, "Y");

      RetrievalResult result =
          orchestrator(FallbackMode.SPEED)
              .scrapeWithStrategy(
                  ScrapeBackends.of(nativeBackend, managed), store, RetrievalRequest.of(URL));

      assertThat(result.source()).isEqualTo("managed");
      assertThat(result.diagnostics().strategiesAttempted()).containsExactly(MANAGED);
      assertThat(nativeBackend.callCount()).isZero();
      assertThat(store.upserts())
          .singleElement()
          .satisfies(
              entry -> assertThat(entry.notes()).isEqualTo(RetrievalOrchestrator.NOTES_UNIVERSAL));
    }

    @Test
    void configuredFailureIsNotedWhenLearning() {
      var store =
          InMemoryStrategyConfigStore.with(
              new StrategyConfigEntry("example.com", PROXY, "", Instant.EPOCH));
      var backends =
          ScrapeBackends.of(
              StubBackend.succeeding(NATIVE, "X"), StubBackend.failing(PROXY, "HTTP 502"));

      RetrievalResult result =
          orchestrator.scrapeWithStrategy(backends, store, RetrievalRequest.of(URL));

      assertThat(result.source()).isEqualTo("native");
      assertThat(store.upserts())
          .singleElement()
          .satisfies(
              entry -> {
                assertThat(entry.strategy()).isEqualTo(NATIVE);
                assertThat(entry.notes())
                    .isEqualTo("Auto-discovered after configured strategy proxy failed");
              });
    }

    @Test
    void unknownExplicitStrategyHasNoSideEffects() {
      var store = new InMemoryStrategyConfigStore();
      var nativeBackend = StubBackend.succeeding(NATIVE, "X");

      RetrievalResult result =
          orchestrator.scrapeWithStrategy(
              ScrapeBackends.of(nativeBackend), store, RetrievalRequest.of(URL), "scraperx");

      assertThat(result.success()).isFalse();
      assertThat(result.source()).isEqualTo("scraperx");
      assertThat(result.error()).isEqualTo("Unknown strategy: scraperx");
      assertThat(nativeBackend.callCount()).isZero();
      assertThat(store.upserts()).isEmpty();
    }

    @Test
    void configLookupFailureFallsBackToUniversal() {
      StrategyConfigStore store = mock(StrategyConfigStore.class);
      given(store.getStrategyForUrl(anyString()))
          .willThrow(new UncheckedIOException(new IOException("disk gone")));

      RetrievalResult result =
          orchestrator.scrapeWithStrategy(
              ScrapeBackends.of(StubBackend.succeeding(NATIVE, "X")),
              store,
              RetrievalRequest.of(URL));

      assertThat(result.success()).isTrue();
      assertThat(result.source()).isEqualTo("native");
    }

    @Test
    void upsertFailureDoesNotFailRetrieval() {
      StrategyConfigStore store = mock(StrategyConfigStore.class);
      given(store.getStrategyForUrl(anyString())).willReturn(Optional.empty());
      willThrow(new UncheckedIOException(new IOException("read-only")))
          .given(store)
          .upsertEntry(any(StrategyConfigEntry.class));

      RetrievalResult result =
          orchestrator.scrapeWithStrategy(
              ScrapeBackends.of(StubBackend.succeeding(NATIVE, "X")),
              store,
              RetrievalRequest.of(URL));

      assertThat(result.success()).isTrue();
      assertThat(result.content()).isEqualTo("X");
    }

    @Test
    void everyStrategyFailingLearnsNothing() {
      var store = new InMemoryStrategyConfigStore();
      var backends =
          ScrapeBackends.of(
              StubBackend.failing(NATIVE, "a"),
              StubBackend.failing(MANAGED, "b"),
              StubBackend.failing(PROXY, "c"));

      RetrievalResult result =
          orchestrator.scrapeWithStrategy(backends, store, RetrievalRequest.of(URL));

      assertThat(result.source()).isEqualTo(RetrievalResult.SOURCE_NONE);
      assertThat(store.upserts()).isEmpty();
    }
  }

  @Test
  void sourceStrategyParsesWinningName() {
    RetrievalResult result =
        orchestrator.scrapeUniversal(
            ScrapeBackends.of(StubBackend.succeeding(NATIVE, "X")), RetrievalRequest.of(URL));

    assertThat(result.sourceStrategy()).contains(StrategyName.NATIVE);
  }
}
