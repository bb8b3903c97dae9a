package dev.webfetch.backend;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Builds one {@link RestClient} per backend and the {@link ScrapeBackends} lookup table.
 *
 * <p>Timeouts are externalized via {@code webfetch.backends.*} properties and act as an upper
 * bound; the per-attempt timeout is enforced by the retrieval layer, which interrupts the worker.
 * Clients sit on the JDK {@link HttpClient} because its blocking send aborts on interrupt, so a
 * timed-out attempt frees its thread at once. A backend whose API key is missing is left out of
 * the table, which the orchestrator reports as "client not available".
 */
@Configuration
@EnableConfigurationProperties(BackendProperties.class)
public class BackendConfig {

  private static final Logger log = LoggerFactory.getLogger(BackendConfig.class);

  /**
   * Creates the lookup table of configured backends.
   *
   * @param builder Spring-provided builder with common defaults (Jackson converters)
   * @param properties bound backend settings
   * @return the table consumed by the retrieval orchestrator
   */
  @Bean
  public ScrapeBackends scrapeBackends(RestClient.Builder builder, BackendProperties properties) {
    List<ScrapeBackend> available = new ArrayList<>();

    BackendProperties.Native nativeFetch = properties.nativeFetch();
    RestClient nativeClient =
        builder
            .clone()
            .requestFactory(
                requestFactory(nativeFetch.connectTimeoutMs(), nativeFetch.readTimeoutMs()))
            .build();
    available.add(new NativeFetchBackend(nativeClient, nativeFetch.userAgent()));

    BackendProperties.Managed managed = properties.managed();
    if (managed.isConfigured()) {
      RestClient managedClient =
          jsonClient(
              builder,
              Objects.requireNonNull(managed.baseUrl()),
              Objects.requireNonNull(managed.apiKey()),
              managed.connectTimeoutMs(),
              managed.readTimeoutMs());
      available.add(new ManagedScraperBackend(managedClient));
    }

    BackendProperties.Proxy proxy = properties.proxy();
    if (proxy.isConfigured()) {
      RestClient proxyClient =
          jsonClient(
              builder,
              Objects.requireNonNull(proxy.baseUrl()),
              Objects.requireNonNull(proxy.apiKey()),
              proxy.connectTimeoutMs(),
              proxy.readTimeoutMs());
      available.add(new ProxyScraperBackend(proxyClient, Objects.requireNonNull(proxy.zone())));
    }

    ScrapeBackends backends = ScrapeBackends.of(available);
    log.info("Scraping backends available: {}", backends.available());
    return backends;
  }

  private static RestClient jsonClient(
      RestClient.Builder builder,
      String baseUrl,
      String apiKey,
      int connectTimeoutMs,
      int readTimeoutMs) {
    return builder
        .clone()
        .baseUrl(baseUrl)
        .requestFactory(requestFactory(connectTimeoutMs, readTimeoutMs))
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
        .build();
  }

  static JdkClientHttpRequestFactory requestFactory(int connectTimeoutMs, int readTimeoutMs) {
    HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(connectTimeoutMs))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    var requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
    return requestFactory;
  }
}
