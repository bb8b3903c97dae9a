package dev.webfetch.backend;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** Output format a caller asks a backend for. */
public enum ContentFormat {
  MARKDOWN("text/markdown"),
  HTML("text/html"),
  TEXT("text/plain");

  private final String mimeType;

  ContentFormat(String mimeType) {
    this.mimeType = mimeType;
  }

  public String mimeType() {
    return mimeType;
  }

  /** Lowercase name used in tool arguments and JSON payloads. */
  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parse a format name case-insensitively.
   *
   * @param value the format name, e.g. {@code "markdown"}
   * @return the matching format, or empty if the name is unknown or null
   */
  public static Optional<ContentFormat> parse(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    for (ContentFormat format : values()) {
      if (format.name().equalsIgnoreCase(value.trim())) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }
}
