package dev.webfetch.backend;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the three scraping backends, bound from {@code webfetch.backends.*}.
 *
 * <p>The managed and proxy backends are only registered when their API key is set.
 */
@ConfigurationProperties(prefix = "webfetch.backends")
public record BackendProperties(Native nativeFetch, Managed managed, Proxy proxy) {

  public BackendProperties {
    nativeFetch = nativeFetch == null ? new Native(null, 0, 0) : nativeFetch;
    managed = managed == null ? new Managed(null, null, 0, 0) : managed;
    proxy = proxy == null ? new Proxy(null, null, null, 0, 0) : proxy;
  }

  public record Native(@Nullable String userAgent, int connectTimeoutMs, int readTimeoutMs) {
    public Native {
      userAgent = userAgent == null || userAgent.isBlank() ? "webfetch/0.1" : userAgent;
      connectTimeoutMs = connectTimeoutMs <= 0 ? 10_000 : connectTimeoutMs;
      readTimeoutMs = readTimeoutMs <= 0 ? 30_000 : readTimeoutMs;
    }
  }

  public record Managed(
      @Nullable String baseUrl, @Nullable String apiKey, int connectTimeoutMs, int readTimeoutMs) {
    public Managed {
      baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.firecrawl.dev" : baseUrl;
      connectTimeoutMs = connectTimeoutMs <= 0 ? 10_000 : connectTimeoutMs;
      readTimeoutMs = readTimeoutMs <= 0 ? 60_000 : readTimeoutMs;
    }

    public boolean isConfigured() {
      return apiKey != null && !apiKey.isBlank();
    }
  }

  public record Proxy(
      @Nullable String baseUrl,
      @Nullable String apiKey,
      @Nullable String zone,
      int connectTimeoutMs,
      int readTimeoutMs) {
    public Proxy {
      baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.brightdata.com" : baseUrl;
      zone = zone == null || zone.isBlank() ? "web_unlocker1" : zone;
      connectTimeoutMs = connectTimeoutMs <= 0 ? 10_000 : connectTimeoutMs;
      readTimeoutMs = readTimeoutMs <= 0 ? 90_000 : readTimeoutMs;
    }

    public boolean isConfigured() {
      return apiKey != null && !apiKey.isBlank();
    }
  }
}
