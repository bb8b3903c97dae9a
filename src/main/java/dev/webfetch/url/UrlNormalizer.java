package dev.webfetch.url;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for the URL forms used across retrieval: validated request URLs, normalized cache
 * keys, and the scheme-stripped {@code host/path} form that strategy prefixes are matched against.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    // Only parameters that never select content; "ref" and "source" often do.
    private static final Set<String> CLICK_ID_PARAMS = Set.of("fbclid", "gclid");
    private static final String UTM_PREFIX = "utm_";

    private static final Set<String> SUPPORTED_SCHEMES = Set.of("http", "https");

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Validate that a URL is absolute, uses http or https, and names a host.
     *
     * @param url the URL supplied by the caller
     * @return the parsed URI
     * @throws IllegalArgumentException if the URL is blank, malformed, relative or not http(s)
     */
    public static URI requireHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL must not be empty");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
        if (uri.getScheme() == null || !SUPPORTED_SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("URL must be absolute with an http or https scheme: " + url);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("URL must include a host: " + url);
        }
        return uri;
    }

    /**
     * Normalize a URL for use as a cache key:
     * - Remove fragments (#section)
     * - Remove campaign and click-id query params (utm_*, fbclid, gclid)
     * - Lowercase scheme and host, drop the scheme's default port
     * - Keep path, trailing slash and the order of remaining params as given
     *
     * @param url the URL to normalize
     * @return normalized URL string, or the input unchanged if malformed
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            log.warn("Malformed URL, returning unchanged: {}", url);
            return url;
        }

        if (uri.getScheme() == null || uri.getHost() == null) {
            log.warn("URL missing scheme or host, returning unchanged: {}", url);
            return url;
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }

        String filteredQuery = filterQueryParams(uri.getRawQuery());

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(hostWithPort(uri)).append(path);
        if (filteredQuery != null) {
            sb.append('?').append(filteredQuery);
        }
        return sb.toString();
    }

    /**
     * Lowercased host, with the port appended when it is not the scheme's default.
     *
     * @param uri an absolute URI with a host
     * @return e.g. {@code example.com} or {@code example.com:8080}
     */
    public static String hostWithPort(URI uri) {
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port == -1 || isDefaultPort(uri.getScheme(), port)) {
            return host;
        }
        return host + ":" + port;
    }

    /**
     * Scheme-stripped form used for prefix matching: host (with non-default port) followed by the
     * raw path. Query and fragment are dropped.
     *
     * @param url an absolute URL
     * @return e.g. {@code yelp.com/biz/dolly-sf}, or empty if the URL cannot be parsed
     */
    public static Optional<String> stripScheme(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(url.trim());
            if (uri.getHost() == null) {
                return Optional.empty();
            }
            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            return Optional.of(hostWithPort(uri) + path);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    private static String filterQueryParams(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
                .filter(param -> !param.isEmpty())
                .filter(param -> {
                    String key = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
                    String lower = key.toLowerCase(Locale.ROOT);
                    return !lower.startsWith(UTM_PREFIX) && !CLICK_ID_PARAMS.contains(lower);
                })
                .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        String lower = scheme == null ? "" : scheme.toLowerCase(Locale.ROOT);
        return ("http".equals(lower) && port == 80)
                || ("https".equals(lower) && port == 443);
    }
}
