package dev.webfetch.cache;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the resource cache.
 *
 * <p>Properties are bound from {@code webfetch.cache.*} in application.yml.
 *
 * <ul>
 *   <li>{@code type} - {@code memory} (default) or {@code filesystem}
 *   <li>{@code directory} - where the filesystem cache keeps its files (default {@code
 *       ${java.io.tmpdir}/webfetch/resources})
 *   <li>{@code max-versions-per-url} - retained history per URL (default 5, bounded [1, 100])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "webfetch.cache")
public class CacheProperties {

  /** Backing store for cached resources. */
  public enum Type {
    MEMORY,
    FILESYSTEM
  }

  private Type type = Type.MEMORY;
  private Path directory = Path.of(System.getProperty("java.io.tmpdir"), "webfetch", "resources");
  private int maxVersionsPerUrl = 5;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxVersionsPerUrl < 1 || maxVersionsPerUrl > 100) {
      throw new IllegalStateException(
          "webfetch.cache.max-versions-per-url must be in [1, 100], got: " + maxVersionsPerUrl);
    }
    if (type == Type.FILESYSTEM && directory == null) {
      throw new IllegalStateException("webfetch.cache.directory is required for filesystem cache");
    }
  }

  public Type getType() {
    return type;
  }

  public void setType(Type type) {
    this.type = type;
  }

  public Path getDirectory() {
    return directory;
  }

  public void setDirectory(Path directory) {
    this.directory = directory;
  }

  public int getMaxVersionsPerUrl() {
    return maxVersionsPerUrl;
  }

  public void setMaxVersionsPerUrl(int maxVersionsPerUrl) {
    this.maxVersionsPerUrl = maxVersionsPerUrl;
  }
}
