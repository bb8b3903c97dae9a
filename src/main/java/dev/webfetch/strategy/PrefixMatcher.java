package dev.webfetch.strategy;

import dev.webfetch.url.UrlNormalizer;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Longest-prefix lookup over strategy config entries.
 *
 * <p>A prefix containing {@code /} matches when the scheme-stripped URL (host + path) starts with
 * it, with or without a leading {@code www.}. A host-only prefix matches that host, its {@code
 * www.} form, or any subdomain. Among matching entries the longest prefix wins; ties keep list
 * order.
 */
public final class PrefixMatcher {

  private static final String WWW = "www.";

  private PrefixMatcher() {
    // utility class
  }

  public static Optional<StrategyConfigEntry> longestMatch(
      List<StrategyConfigEntry> entries, String url) {
    Optional<String> stripped = UrlNormalizer.stripScheme(url);
    if (stripped.isEmpty()) {
      return Optional.empty();
    }
    String hostPath = stripped.get();
    StrategyConfigEntry best = null;
    for (StrategyConfigEntry entry : entries) {
      if (matches(hostPath, entry.prefix())
          && (best == null || entry.prefix().length() > best.prefix().length())) {
        best = entry;
      }
    }
    return Optional.ofNullable(best);
  }

  /**
   * Whether {@code prefix} matches a scheme-stripped URL.
   *
   * @param hostPath host (lowercase, with non-default port) followed by the path
   * @param prefix a config prefix
   */
  static boolean matches(String hostPath, String prefix) {
    if (prefix.contains("/")) {
      String withoutWww = hostPath.startsWith(WWW) ? hostPath.substring(WWW.length()) : hostPath;
      return hostPath.startsWith(prefix) || withoutWww.startsWith(prefix);
    }
    int slash = hostPath.indexOf('/');
    String host = slash < 0 ? hostPath : hostPath.substring(0, slash);
    String hostPrefix = prefix.toLowerCase(Locale.ROOT);
    return host.equals(hostPrefix)
        || host.equals(WWW + hostPrefix)
        || host.endsWith("." + hostPrefix);
  }
}
