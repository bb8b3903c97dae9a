package dev.webfetch.retrieval;

import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retrieval settings bound from {@code webfetch.retrieval.*}.
 *
 * @param fallbackMode {@code cost} (default) or {@code speed}
 * @param defaultTimeout per-attempt timeout, e.g. {@code 30s}
 */
@ConfigurationProperties(prefix = "webfetch.retrieval")
public record RetrievalProperties(
    @Nullable FallbackMode fallbackMode, @Nullable Duration defaultTimeout) {

  public OrchestratorConfig toOrchestratorConfig() {
    return new OrchestratorConfig(fallbackMode, defaultTimeout);
  }
}
