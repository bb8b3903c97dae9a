package dev.webfetch.mcp;

import dev.webfetch.cache.ContentPage;
import dev.webfetch.cache.ContentPaginator;
import dev.webfetch.retrieval.RetrievalResult;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders a successful {@link RetrievalResult} as tool output: one page of content followed by a
 * footer naming the source, and a continuation hint when the page was cut short.
 *
 * <p>Page size defaults to {@code webfetch.mcp.max-chars} and can be lowered (never raised) per
 * call, so a single tool response cannot exceed the configured budget.
 */
@Component
public class ScrapeResponseFormatter {

  private final int maxChars;

  public ScrapeResponseFormatter(@Value("${webfetch.mcp.max-chars:100000}") int maxChars) {
    if (maxChars < 1) {
      throw new IllegalStateException("webfetch.mcp.max-chars must be positive, got " + maxChars);
    }
    this.maxChars = maxChars;
  }

  public int getMaxChars() {
    return maxChars;
  }

  /**
   * Format one page of the result's content.
   *
   * @param result a successful result
   * @param startIndex first character to return, null for 0
   * @param requestedMaxChars page size override, null or larger than the budget for the budget
   */
  public String format(
      RetrievalResult result, @Nullable Integer startIndex, @Nullable Integer requestedMaxChars) {
    String content = result.content();
    if (content == null) {
      throw new IllegalArgumentException("Cannot format a failed result");
    }
    int start = startIndex != null ? startIndex : 0;
    int size = requestedMaxChars != null ? Math.min(requestedMaxChars, maxChars) : maxChars;
    ContentPage page = ContentPaginator.page(content, start, size);

    StringBuilder out = new StringBuilder(page.text().length() + 200);
    out.append(page.text());
    if (page.text().isEmpty() && page.totalLength() > 0) {
      out.append("(no content at startIndex ").append(start).append(')');
    }
    out.append("\n\n---\n");
    out.append("Source: ").append(result.source());
    if (result.cached()) {
      out.append(" (cached)");
    }
    out.append(" | characters ")
        .append(page.startIndex())
        .append('-')
        .append(page.endIndex())
        .append(" of ")
        .append(page.totalLength());
    if (page.truncated()) {
      out.append("\nContent truncated. Call scrape again with startIndex=")
          .append(page.endIndex())
          .append(" to continue.");
    }
    return out.toString();
  }
}
