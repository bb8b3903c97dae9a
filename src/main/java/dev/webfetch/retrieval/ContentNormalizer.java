package dev.webfetch.retrieval;

import dev.webfetch.backend.BackendPayload;
import dev.webfetch.backend.ContentFormat;
import org.jspecify.annotations.Nullable;

/** Flattens backend-specific payloads into the single content string callers receive. */
final class ContentNormalizer {

  private ContentNormalizer() {
    // utility class
  }

  /**
   * Extract content from a payload. A markdown/html pair yields the field matching the requested
   * format, falling back to the other one; {@code text} reads the html field, as that is what the
   * managed scraper is asked for in that case.
   *
   * @return the content, or null if the payload carries none
   */
  static @Nullable String extract(@Nullable BackendPayload payload, ContentFormat format) {
    if (payload instanceof BackendPayload.Plain plain) {
      return blankToNull(plain.body());
    }
    if (payload instanceof BackendPayload.Markup markup) {
      if (format == ContentFormat.MARKDOWN) {
        return firstNonBlank(markup.markdown(), markup.html());
      }
      return firstNonBlank(markup.html(), markup.markdown());
    }
    return null;
  }

  /** Best-effort content type for storing retrieved content. */
  static String mimeTypeOf(String content, ContentFormat requested) {
    String head = content.stripLeading();
    if (head.startsWith("<!") || head.startsWith("<html") || head.startsWith("<HTML")) {
      return ContentFormat.HTML.mimeType();
    }
    return requested.mimeType();
  }

  private static @Nullable String firstNonBlank(@Nullable String first, @Nullable String second) {
    String value = blankToNull(first);
    return value != null ? value : blankToNull(second);
  }

  private static @Nullable String blankToNull(@Nullable String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
