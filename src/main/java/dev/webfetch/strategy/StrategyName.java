package dev.webfetch.strategy;

import com.fasterxml.jackson.annotation.JsonKey;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Closed set of scraping strategies. Each maps to exactly one backend.
 *
 * <ul>
 *   <li>{@link #NATIVE} - plain HTTP fetch from this process
 *   <li>{@link #MANAGED} - hosted scraping service with JS rendering
 *   <li>{@link #PROXY} - residential-proxy scraping service for protected pages
 * </ul>
 */
public enum StrategyName {
  NATIVE("Native"),
  MANAGED("Managed"),
  PROXY("Proxy");

  private final String displayName;

  StrategyName(String displayName) {
    this.displayName = displayName;
  }

  /** Capitalized name used in user-facing messages, e.g. {@code "Managed client not available"}. */
  public String displayName() {
    return displayName;
  }

  /** Lowercase name used in tool arguments, diagnostics and the persisted config table. */
  @JsonKey
  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return wireName();
  }

  /**
   * Parse a strategy name case-insensitively.
   *
   * @param value the strategy name, e.g. {@code "proxy"}
   * @return the strategy, or empty if the name is not part of the closed set
   */
  public static Optional<StrategyName> parse(@Nullable String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    for (StrategyName name : values()) {
      if (name.name().equalsIgnoreCase(trimmed)) {
        return Optional.of(name);
      }
    }
    return Optional.empty();
  }
}
