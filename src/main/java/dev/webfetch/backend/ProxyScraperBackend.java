package dev.webfetch.backend;

import dev.webfetch.strategy.StrategyName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Scrapes through a residential-proxy unlocker service. Most expensive strategy, used last for
 * pages that block datacenter traffic.
 */
public class ProxyScraperBackend implements ScrapeBackend {

  private static final Logger log = LoggerFactory.getLogger(ProxyScraperBackend.class);

  private final RestClient restClient;
  private final String zone;

  public ProxyScraperBackend(RestClient restClient, String zone) {
    this.restClient = restClient;
    this.zone = zone;
  }

  @Override
  public StrategyName strategy() {
    return StrategyName.PROXY;
  }

  @Override
  public BackendResult scrape(String url, ScrapeOptions options) {
    try {
      String body =
          restClient
              .post()
              .uri("/request")
              .body(ProxyScrapeRequest.raw(zone, url))
              .retrieve()
              .body(String.class);

      if (body == null || body.isBlank()) {
        return BackendResult.failed("Proxy scraper returned an empty body");
      }
      return BackendResult.ok(new BackendPayload.Plain(body));
    } catch (RestClientException e) {
      log.debug("Proxy scrape failed for {}: {}", url, e.getMessage());
      return BackendErrors.toResult(e);
    }
  }
}
