package dev.webfetch.backend;

import dev.webfetch.strategy.StrategyName;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches a page directly over HTTP. Cheapest strategy, but fails on pages that need JavaScript
 * rendering or block non-browser clients.
 */
public class NativeFetchBackend implements ScrapeBackend {

  private static final Logger log = LoggerFactory.getLogger(NativeFetchBackend.class);

  private static final String ACCEPT_HTML = "text/html,application/xhtml+xml,*/*;q=0.8";

  private final RestClient restClient;
  private final String userAgent;

  public NativeFetchBackend(RestClient restClient, String userAgent) {
    this.restClient = restClient;
    this.userAgent = userAgent;
  }

  @Override
  public StrategyName strategy() {
    return StrategyName.NATIVE;
  }

  @Override
  public BackendResult scrape(String url, ScrapeOptions options) {
    try {
      ResponseEntity<String> response =
          restClient
              .get()
              .uri(URI.create(url))
              .header(HttpHeaders.USER_AGENT, userAgent)
              .header(HttpHeaders.ACCEPT, ACCEPT_HTML)
              .retrieve()
              .toEntity(String.class);

      int status = response.getStatusCode().value();
      String body = response.getBody();
      if (!response.getStatusCode().is2xxSuccessful()) {
        return BackendResult.failed("HTTP " + status, status);
      }
      if (body == null || body.isEmpty()) {
        return BackendResult.failed("Empty response body (HTTP " + status + ")", status);
      }
      return BackendResult.ok(new BackendPayload.Plain(body), status);
    } catch (RestClientException e) {
      log.debug("Native fetch failed for {}: {}", url, e.getMessage());
      return BackendErrors.toResult(e);
    }
  }
}
