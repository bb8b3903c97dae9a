package dev.webfetch.backend;

/** JSON request body for the proxy scraper's {@code /request} endpoint. */
public record ProxyScrapeRequest(String zone, String url, String format) {

  static ProxyScrapeRequest raw(String zone, String url) {
    return new ProxyScrapeRequest(zone, url, "raw");
  }
}
