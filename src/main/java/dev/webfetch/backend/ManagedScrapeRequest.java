package dev.webfetch.backend;

import java.util.List;

/** JSON request body for the managed scraper's {@code /v1/scrape} endpoint. */
public record ManagedScrapeRequest(
    String url, List<String> formats, boolean onlyMainContent, long timeout) {
  public ManagedScrapeRequest {
    formats = formats == null ? List.of() : List.copyOf(formats);
  }
}
