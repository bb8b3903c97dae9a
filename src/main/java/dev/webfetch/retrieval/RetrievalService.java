package dev.webfetch.retrieval;

import dev.webfetch.backend.ScrapeBackends;
import dev.webfetch.cache.CacheMetadata;
import dev.webfetch.cache.CachedResource;
import dev.webfetch.cache.ResourceCache;
import dev.webfetch.strategy.StrategyConfigStore;
import dev.webfetch.strategy.StrategyName;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point used by the MCP and REST adapters. Wraps {@link RetrievalOrchestrator} with the
 * resource cache: a cached version in the requested format is served unless the request forces a
 * refresh, and fresh content is stored when the request asks for it.
 *
 * <p>An explicit strategy name is checked before the cache so that an unknown name is rejected
 * with no side effects, even for a URL that is already cached.
 */
@Service
public class RetrievalService {

  private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

  private final RetrievalOrchestrator orchestrator;
  private final ScrapeBackends backends;
  private final StrategyConfigStore configStore;
  private final ResourceCache cache;

  public RetrievalService(
      RetrievalOrchestrator orchestrator,
      ScrapeBackends backends,
      StrategyConfigStore configStore,
      ResourceCache cache) {
    this.orchestrator = orchestrator;
    this.backends = backends;
    this.configStore = configStore;
    this.cache = cache;
  }

  /** Retrieve content for {@code request}, from the cache when allowed. */
  public RetrievalResult retrieve(RetrievalRequest request) {
    String explicit = request.explicitStrategy();
    if (explicit != null && StrategyName.parse(explicit).isEmpty()) {
      return RetrievalResult.unknownStrategy(explicit);
    }

    if (!request.forceRefresh()) {
      Optional<CachedResource> cached = findCached(request);
      if (cached.isPresent()) {
        log.debug("Serving {} from cache ({})", request.url(), cached.get().versionId());
        return RetrievalResult.fromCache(cached.get());
      }
    }

    RetrievalResult result = orchestrator.scrapeWithStrategy(backends, configStore, request);

    if (result.success() && request.saveResource()) {
      store(request, result);
    }
    return result;
  }

  private Optional<CachedResource> findCached(RetrievalRequest request) {
    try {
      return cache.findLatest(request.url(), request.format());
    } catch (RuntimeException e) {
      log.warn("Cache lookup failed for {}, fetching fresh: {}", request.url(), e.getMessage());
      return Optional.empty();
    }
  }

  private void store(RetrievalRequest request, RetrievalResult result) {
    Optional<StrategyName> strategy = result.sourceStrategy();
    String content = result.content();
    if (strategy.isEmpty() || content == null) {
      return;
    }
    try {
      String versionId =
          cache.write(
              request.url(),
              content,
              new CacheMetadata(
                  ContentNormalizer.mimeTypeOf(content, request.format()),
                  request.format(),
                  strategy.get()));
      log.debug("Cached {} as {}", request.url(), versionId);
    } catch (RuntimeException e) {
      log.warn("Failed to cache content for {}: {}", request.url(), e.getMessage());
    }
  }
}
