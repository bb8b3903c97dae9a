package dev.webfetch.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the {@link ResourceCache} implementation from {@link CacheProperties#getType()}. */
@Configuration
public class CacheConfig {

  private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

  @Bean
  public ResourceCache resourceCache(
      CacheProperties properties, ObjectMapper objectMapper, Clock clock) {
    if (properties.getType() == CacheProperties.Type.FILESYSTEM) {
      log.info("Caching resources on disk under {}", properties.getDirectory().toAbsolutePath());
      return new FilesystemResourceCache(
          properties.getDirectory(), objectMapper, clock, properties.getMaxVersionsPerUrl());
    }
    log.info("Caching resources in memory");
    return new InMemoryResourceCache(clock, properties.getMaxVersionsPerUrl());
  }
}
