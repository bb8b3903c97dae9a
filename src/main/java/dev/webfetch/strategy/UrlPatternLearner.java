package dev.webfetch.strategy;

import dev.webfetch.url.UrlNormalizer;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Generalizes a concrete URL into a reusable prefix key for strategy learning.
 *
 * <p>Rules are tried in order and the first match wins. Query string and fragment are always
 * ignored; the host is lowercased and keeps a non-default port.
 *
 * <ol>
 *   <li>Entity detail, {@code /biz/<slug>}: {@code host/biz/}
 *   <li>Threaded discussion, {@code /r/<community>/comments/<id>/<title>}: {@code
 *       host/r/<community>/comments/<id>/} (the id is only kept when more segments follow it)
 *   <li>Dated content, {@code /blog/<year>/<slug>}: {@code host/blog/<year>/}
 *   <li>Anything else: {@code host}
 * </ol>
 *
 * <p>The derived prefix is always a literal prefix of the scheme-stripped URL it came from: it is
 * cut from the raw path text, so doubled slashes and percent-escapes are kept as written.
 */
public final class UrlPatternLearner {

  static final Set<String> ENTITY_KEYWORDS =
      Set.of(
          "biz", "p", "product", "products", "item", "items", "dp", "company", "companies",
          "profile", "user", "users", "listing", "place", "restaurant", "hotel");

  static final Set<String> DATED_SECTIONS = Set.of("blog", "news", "posts", "articles", "archive");

  private static final Pattern YEAR = Pattern.compile("(19|20)\\d{2}");

  private UrlPatternLearner() {
    // utility class
  }

  /**
   * Derive the learning prefix for a URL.
   *
   * @param url an absolute URL
   * @return the prefix, or the input unchanged if it cannot be parsed
   */
  public static String derivePrefix(String url) {
    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException | NullPointerException e) {
      return url;
    }
    if (uri.getHost() == null) {
      return url;
    }
    String host = UrlNormalizer.hostWithPort(uri);
    String rawPath = uri.getRawPath() == null ? "" : uri.getRawPath();
    List<Segment> segments = segments(rawPath);

    return entityDetail(segments)
        .or(() -> threadedDiscussion(segments))
        .or(() -> datedContent(segments))
        .map(last -> host + rawPath.substring(0, last.end()) + "/")
        .orElse(host);
  }

  /** Returns the last segment kept in the prefix; the prefix runs through the slash after it. */
  private static Optional<Segment> entityDetail(List<Segment> segments) {
    if (segments.size() >= 2 && ENTITY_KEYWORDS.contains(segments.get(0).lower())) {
      return Optional.of(segments.get(0));
    }
    return Optional.empty();
  }

  private static Optional<Segment> threadedDiscussion(List<Segment> segments) {
    if (segments.size() >= 4
        && "r".equals(segments.get(0).lower())
        && "comments".equals(segments.get(2).lower())) {
      return Optional.of(segments.size() >= 5 ? segments.get(3) : segments.get(2));
    }
    return Optional.empty();
  }

  private static Optional<Segment> datedContent(List<Segment> segments) {
    if (segments.size() >= 3
        && DATED_SECTIONS.contains(segments.get(0).lower())
        && YEAR.matcher(segments.get(1).text()).matches()) {
      return Optional.of(segments.get(1));
    }
    return Optional.empty();
  }

  /** Non-empty path segments with the offset just past each one in the raw path. */
  private static List<Segment> segments(String rawPath) {
    List<Segment> segments = new ArrayList<>();
    int start = 0;
    while (start <= rawPath.length()) {
      int slash = rawPath.indexOf('/', start);
      int end = slash < 0 ? rawPath.length() : slash;
      if (end > start) {
        segments.add(new Segment(rawPath.substring(start, end), end));
      }
      if (slash < 0) {
        break;
      }
      start = slash + 1;
    }
    return segments;
  }

  private record Segment(String text, int end) {
    String lower() {
      return text.toLowerCase(Locale.ROOT);
    }
  }
}
