package dev.webfetch.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.webfetch.backend.ContentFormat;
import dev.webfetch.strategy.StrategyName;
import dev.webfetch.url.UrlNormalizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ResourceCache} that keeps one JSON document per version in a directory, so cached content
 * survives restarts.
 *
 * <p>File names are {@code <url-hash>-<sequence>.json}, where the hash is the first 16 hex chars
 * of the SHA-256 of the normalized URL. The sequence counter resumes from the highest sequence
 * found on disk.
 */
public class FilesystemResourceCache implements ResourceCache {

  private static final Logger log = LoggerFactory.getLogger(FilesystemResourceCache.class);

  private static final Pattern FILE_NAME = Pattern.compile("([0-9a-f]{16})-(\\d+)\\.json");
  private static final int HASH_CHARS = 16;

  private final Path directory;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final int maxVersionsPerUrl;
  private final AtomicLong sequence;
  private final Object writeMonitor = new Object();

  /** On-disk shape of a version; the version id is derived from the file path instead. */
  record StoredResource(
      String url,
      String content,
      String mimeType,
      @Nullable ContentFormat format,
      StrategyName strategyUsed,
      Instant scrapedAt,
      long sequence) {}

  public FilesystemResourceCache(
      Path directory, ObjectMapper objectMapper, Clock clock, int maxVersionsPerUrl) {
    if (maxVersionsPerUrl < 1) {
      throw new IllegalArgumentException("maxVersionsPerUrl must be at least 1");
    }
    this.directory = directory.toAbsolutePath().normalize();
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.maxVersionsPerUrl = maxVersionsPerUrl;
    try {
      Files.createDirectories(this.directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create cache directory " + this.directory, e);
    }
    this.sequence = new AtomicLong(highestSequenceOnDisk());
  }

  @Override
  public String write(String url, String content, CacheMetadata metadata) {
    String key = UrlNormalizer.normalize(url);
    String hash = hashOf(key);
    synchronized (writeMonitor) {
      long seq = sequence.incrementAndGet();
      Path file = directory.resolve(hash + "-" + seq + ".json");
      var stored =
          new StoredResource(
              key,
              content,
              metadata.mimeType(),
              metadata.format(),
              metadata.strategyUsed(),
              clock.instant(),
              seq);
      try {
        objectMapper.writeValue(file.toFile(), stored);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to write cache entry " + file, e);
      }
      evictOldVersions(key, hash);
      return versionIdOf(file);
    }
  }

  @Override
  public List<CachedResource> findAll(String url) {
    String key = UrlNormalizer.normalize(url);
    return readAll(hashOf(key)).stream().filter(r -> r.url().equals(key)).toList();
  }

  private void evictOldVersions(String key, String hash) {
    List<CachedResource> versions = readAll(hash).stream().filter(r -> r.url().equals(key)).toList();
    for (int i = maxVersionsPerUrl; i < versions.size(); i++) {
      Path evicted = Path.of(URI.create(versions.get(i).versionId()));
      try {
        Files.deleteIfExists(evicted);
      } catch (IOException e) {
        log.warn("Failed to evict cache entry {}: {}", evicted, e.getMessage());
      }
    }
  }

  private List<CachedResource> readAll(String hash) {
    List<CachedResource> resources = new ArrayList<>();
    for (Path file : listFiles()) {
      String name = file.getFileName().toString();
      Matcher matcher = FILE_NAME.matcher(name);
      if (!matcher.matches() || !hash.equals(matcher.group(1))) {
        continue;
      }
      readFile(file).ifPresent(resources::add);
    }
    resources.sort(Comparator.comparingLong(CachedResource::sequence).reversed());
    return resources;
  }

  private Optional<CachedResource> readFile(Path file) {
    try {
      StoredResource stored = objectMapper.readValue(file.toFile(), StoredResource.class);
      return Optional.of(
          new CachedResource(
              versionIdOf(file),
              stored.url(),
              stored.content(),
              stored.mimeType(),
              stored.format(),
              stored.strategyUsed(),
              stored.scrapedAt(),
              stored.sequence()));
    } catch (NoSuchFileException e) {
      return Optional.empty(); // evicted between listing and reading
    } catch (IOException e) {
      log.warn("Skipping unreadable cache entry {}: {}", file, e.getMessage());
      return Optional.empty();
    }
  }

  private List<Path> listFiles() {
    try (Stream<Path> files = Files.list(directory)) {
      return files.filter(Files::isRegularFile).toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list cache directory " + directory, e);
    }
  }

  private long highestSequenceOnDisk() {
    long highest = 0;
    for (Path file : listFiles()) {
      Matcher matcher = FILE_NAME.matcher(file.getFileName().toString());
      if (matcher.matches()) {
        highest = Math.max(highest, Long.parseLong(matcher.group(2)));
      }
    }
    return highest;
  }

  /** First {@value #HASH_CHARS} hex chars of the SHA-256 of the normalized URL. */
  static String hashOf(String key) {
    try {
      byte[] digest =
          MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest).substring(0, HASH_CHARS);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  private static String versionIdOf(Path file) {
    return file.toUri().toString();
  }
}
