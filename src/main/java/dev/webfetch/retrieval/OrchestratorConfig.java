package dev.webfetch.retrieval;

import java.time.Duration;

/**
 * Settings fixed at orchestrator construction.
 *
 * @param fallbackMode ordering of the universal fallback sequence
 * @param defaultTimeout per-attempt timeout when the request does not set one
 */
public record OrchestratorConfig(FallbackMode fallbackMode, Duration defaultTimeout) {

  public OrchestratorConfig {
    fallbackMode = fallbackMode == null ? FallbackMode.COST : fallbackMode;
    if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
      defaultTimeout = Duration.ofSeconds(30);
    }
  }

  public static OrchestratorConfig defaults() {
    return new OrchestratorConfig(FallbackMode.COST, Duration.ofSeconds(30));
  }
}
