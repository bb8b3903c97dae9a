package dev.webfetch.cache;

/**
 * Read-side pagination of one cached entry's content, independent of versioning. Callers page
 * through long documents by passing the previous page's {@code endIndex} as the next {@code
 * startIndex}.
 */
public final class ContentPaginator {

  private ContentPaginator() {
    // utility class
  }

  /**
   * Slice {@code content} starting at {@code startIndex}, returning at most {@code maxChars}
   * characters.
   *
   * @param content the full content
   * @param startIndex zero-based start; values past the end yield an empty page
   * @param maxChars maximum characters to return, must be positive
   * @return the requested page
   */
  public static ContentPage page(String content, int startIndex, int maxChars) {
    if (startIndex < 0) {
      throw new IllegalArgumentException("startIndex must not be negative");
    }
    if (maxChars < 1) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    int total = content.length();
    int start = Math.min(startIndex, total);
    int end = (int) Math.min((long) start + maxChars, total);
    return new ContentPage(content.substring(start, end), start, end, total);
  }
}
