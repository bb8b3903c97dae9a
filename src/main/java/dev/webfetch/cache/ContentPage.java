package dev.webfetch.cache;

/**
 * A window over a single piece of content.
 *
 * @param text the characters in {@code [startIndex, endIndex)}
 * @param startIndex first character included, clamped to the content length
 * @param endIndex one past the last character included
 * @param totalLength length of the whole content
 */
public record ContentPage(String text, int startIndex, int endIndex, int totalLength) {

  /** Whether more content follows this page. */
  public boolean truncated() {
    return endIndex < totalLength;
  }
}
