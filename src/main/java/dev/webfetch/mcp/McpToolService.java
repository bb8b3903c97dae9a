package dev.webfetch.mcp;

import dev.webfetch.backend.ContentFormat;
import dev.webfetch.cache.CachedResource;
import dev.webfetch.cache.ResourceCache;
import dev.webfetch.retrieval.RetrievalRequest;
import dev.webfetch.retrieval.RetrievalResult;
import dev.webfetch.retrieval.RetrievalService;
import dev.webfetch.strategy.StrategyConfigEntry;
import dev.webfetch.strategy.StrategyConfigStore;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing retrieval as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods never throw: invalid input and unexpected failures come back as {@code "Error: ..."}
 * strings so the calling agent can read and act on them.
 *
 * <p>Tools: {@code scrape}, {@code strategy_config}, {@code cache_history}.
 *
 * @see ScrapeResponseFormatter
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final RetrievalService retrievalService;
  private final StrategyConfigStore configStore;
  private final ResourceCache cache;
  private final ScrapeResponseFormatter formatter;

  public McpToolService(
      RetrievalService retrievalService,
      StrategyConfigStore configStore,
      ResourceCache cache,
      ScrapeResponseFormatter formatter) {
    this.retrievalService = retrievalService;
    this.configStore = configStore;
    this.cache = cache;
    this.formatter = formatter;
  }

  /** Fetches a URL through the adaptive strategy chain and returns one page of its content. */
  @Tool(
      name = "scrape",
      description =
          "Fetch the content of a web page. Picks the cheapest scraping strategy known to work for "
              + "the URL, falls back to more capable ones on failure and remembers what worked. "
              + "Long content is paginated: pass startIndex to continue.")
  public String scrape(
      @ToolParam(description = "Absolute http or https URL to fetch") @Nullable String url,
      @ToolParam(description = "Output format: markdown (default), html or text", required = false)
          @Nullable String format,
      @ToolParam(description = "Per-attempt timeout in milliseconds", required = false)
          @Nullable Integer timeout,
      @ToolParam(
              description =
                  "Strategy to try first: native, managed or proxy. Falls back automatically if it fails.",
              required = false)
          @Nullable String strategy,
      @ToolParam(description = "Ignore cached content and fetch again", required = false)
          @Nullable Boolean forceRefresh,
      @ToolParam(description = "Store the fetched content in the cache (default true)", required = false)
          @Nullable Boolean saveResource,
      @ToolParam(description = "Character offset to start from (default 0)", required = false)
          @Nullable Integer startIndex,
      @ToolParam(description = "Maximum characters to return", required = false)
          @Nullable Integer maxChars) {
    try {
      if (url == null || url.isBlank()) {
        return "Error: URL must not be empty. Provide an absolute http(s) URL.";
      }
      Optional<ContentFormat> contentFormat = ContentFormat.parse(format);
      if (format != null && !format.isBlank() && contentFormat.isEmpty()) {
        return "Error: Unknown format '%s'. Use markdown, html or text.".formatted(format);
      }
      if (startIndex != null && startIndex < 0) {
        return "Error: startIndex must not be negative.";
      }
      if (maxChars != null && maxChars < 1) {
        return "Error: maxChars must be positive.";
      }

      RetrievalRequest request =
          new RetrievalRequest(
              url,
              contentFormat.orElse(ContentFormat.MARKDOWN),
              timeout,
              strategy,
              Boolean.TRUE.equals(forceRefresh),
              !Boolean.FALSE.equals(saveResource));
      RetrievalResult result = retrievalService.retrieve(request);

      if (!result.success()) {
        return "Error: " + result.error();
      }
      return formatter.format(result, startIndex, maxChars);
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.warn("scrape failed for {}: {}", url, e.getMessage(), e);
      return "Error scraping URL: " + e.getMessage();
    }
  }

  /** Lists learned and hand-written prefix rules. */
  @Tool(
      name = "strategy_config",
      description =
          "List the URL prefix rules that decide which scraping strategy is tried first, "
              + "longest prefix first.")
  public String strategyConfig() {
    try {
      List<StrategyConfigEntry> entries = configStore.loadConfig();
      if (entries.isEmpty()) {
        return "No strategy rules yet. Rules are learned automatically when a fallback succeeds.";
      }
      StringBuilder sb = new StringBuilder();
      for (StrategyConfigEntry entry : entries) {
        sb.append(
            String.format(
                "- %s -> %s%s (%s)%n",
                entry.prefix(),
                entry.strategy().wireName(),
                entry.notes().isBlank() ? "" : " | " + entry.notes(),
                entry.createdAt()));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error reading strategy config: " + e.getMessage();
    }
  }

  /** Lists retained cached versions of a URL, newest first. */
  @Tool(
      name = "cache_history",
      description = "List the cached versions of a URL, newest first.")
  public String cacheHistory(
      @ToolParam(description = "URL whose cached versions to list") @Nullable String url) {
    try {
      if (url == null || url.isBlank()) {
        return "Error: URL must not be empty.";
      }
      List<CachedResource> versions = cache.findAll(url);
      if (versions.isEmpty()) {
        return "No cached versions of %s.".formatted(url);
      }
      StringBuilder sb = new StringBuilder();
      for (CachedResource version : versions) {
        sb.append(
            String.format(
                "- #%d %s | %s | %s (%s) | %,d chars | %s%n",
                version.sequence(),
                version.scrapedAt(),
                version.strategyUsed().wireName(),
                version.format().wireName(),
                version.mimeType(),
                version.content().length(),
                version.versionId()));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error reading cache history: " + e.getMessage();
    }
  }
}
