package dev.webfetch.backend;

import dev.webfetch.strategy.StrategyName;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Scrapes through a hosted scraping API that renders JavaScript and strips boilerplate. The
 * {@link RestClient} carries the base URL and bearer key.
 */
public class ManagedScraperBackend implements ScrapeBackend {

  private static final Logger log = LoggerFactory.getLogger(ManagedScraperBackend.class);

  private final RestClient restClient;

  public ManagedScraperBackend(RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public StrategyName strategy() {
    return StrategyName.MANAGED;
  }

  @Override
  public BackendResult scrape(String url, ScrapeOptions options) {
    var request =
        new ManagedScrapeRequest(
            url, List.of(requestedFormat(options.format())), true, options.timeout().toMillis());
    try {
      ManagedScrapeResponse response =
          restClient.post().uri("/v1/scrape").body(request).retrieve().body(ManagedScrapeResponse.class);

      if (response == null) {
        return BackendResult.failed("Managed scraper returned no response body");
      }
      if (!response.success() || response.data() == null) {
        return BackendResult.failed(
            response.error() != null ? response.error() : "Request failed without error details");
      }
      return BackendResult.ok(
          new BackendPayload.Markup(response.data().markdown(), response.data().html()));
    } catch (RestClientException e) {
      log.debug("Managed scrape failed for {}: {}", url, e.getMessage());
      return BackendErrors.toResult(e);
    }
  }

  /** The service renders markdown or html; html is the closest it offers to plain text. */
  static String requestedFormat(ContentFormat format) {
    return format == ContentFormat.MARKDOWN ? "markdown" : "html";
  }
}
