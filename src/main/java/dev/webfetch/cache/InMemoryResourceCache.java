package dev.webfetch.cache;

import dev.webfetch.url.UrlNormalizer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link ResourceCache}. Content is lost on restart.
 *
 * <p>Versions for one URL are updated atomically through {@link ConcurrentHashMap#compute}, so
 * concurrent writes for the same URL both land as separate versions and the higher sequence wins.
 */
public class InMemoryResourceCache implements ResourceCache {

  private final ConcurrentHashMap<String, List<CachedResource>> versionsByUrl =
      new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;
  private final int maxVersionsPerUrl;

  public InMemoryResourceCache(Clock clock, int maxVersionsPerUrl) {
    if (maxVersionsPerUrl < 1) {
      throw new IllegalArgumentException("maxVersionsPerUrl must be at least 1");
    }
    this.clock = clock;
    this.maxVersionsPerUrl = maxVersionsPerUrl;
  }

  @Override
  public String write(String url, String content, CacheMetadata metadata) {
    String key = UrlNormalizer.normalize(url);
    long seq = sequence.incrementAndGet();
    String versionId = "memory://" + sanitize(key) + "/" + seq;
    CachedResource resource =
        new CachedResource(
            versionId,
            key,
            content,
            metadata.mimeType(),
            metadata.format(),
            metadata.strategyUsed(),
            clock.instant(),
            seq);

    versionsByUrl.compute(
        key,
        (k, existing) -> {
          List<CachedResource> versions =
              existing == null ? new ArrayList<>() : new ArrayList<>(existing);
          versions.add(resource);
          versions.sort(Comparator.comparingLong(CachedResource::sequence).reversed());
          while (versions.size() > maxVersionsPerUrl) {
            versions.remove(versions.size() - 1);
          }
          return List.copyOf(versions);
        });
    return versionId;
  }

  @Override
  public List<CachedResource> findAll(String url) {
    return versionsByUrl.getOrDefault(UrlNormalizer.normalize(url), List.of());
  }

  static String sanitize(String url) {
    return url.replaceFirst("^https?://", "").replaceAll("[^a-zA-Z0-9.-]", "_");
  }
}
