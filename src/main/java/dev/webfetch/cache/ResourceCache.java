package dev.webfetch.cache;

import dev.webfetch.backend.ContentFormat;
import java.util.List;
import java.util.Optional;

/**
 * Versioned store of previously retrieved content, keyed by normalized URL.
 *
 * <p>Versions are never mutated. Each write gets a sequence number higher than any before it, and
 * {@link #findLatest(String, ContentFormat)} returns the version with the highest sequence for the
 * URL in the requested format. Older versions beyond the configured per-URL history are evicted on
 * write, whatever their format.
 */
public interface ResourceCache {

  /**
   * Store a new version of the content for {@code url}.
   *
   * @return the version id of the stored entry
   */
  String write(String url, String content, CacheMetadata metadata);

  /** Newest retained version of {@code url} that was retrieved in {@code format}. */
  default Optional<CachedResource> findLatest(String url, ContentFormat format) {
    return findAll(url).stream().filter(version -> version.format() == format).findFirst();
  }

  /** All retained versions for {@code url}, highest sequence first. */
  List<CachedResource> findAll(String url);
}
