package dev.sitedigest.crawl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class that normalizes URLs for visited-set deduplication and resolves links found on
 * rendered pages. Removes fragments, tracking query params, normalizes trailing slashes and host
 * casing.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "ref", "source"
    );

    private static final Set<String> FETCHABLE_SCHEMES = Set.of("http", "https");

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Normalize a URL for deduplication:
     * - Remove fragments (#section)
     * - Remove common tracking query params (utm_*, ref, source)
     * - Remove trailing slash unless URL is just the domain root
     * - Lowercase scheme and host (path is case-sensitive)
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
            log.debug("Malformed URL, returning unchanged: {}", url);
            return url;
        }

        if (uri.getScheme() == null || uri.getHost() == null) {
            log.debug("URL missing scheme or host, returning unchanged: {}", url);
            return url;
        }

        String scheme = uri.getScheme().toLowerCase();
        String host = uri.getHost().toLowerCase();
        int port = uri.getPort();
        String path = uri.getRawPath();
        String query = uri.getRawQuery();

        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        String filteredQuery = filterQueryParams(query);

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (filteredQuery != null && !filteredQuery.isEmpty()) {
            sb.append('?').append(filteredQuery);
        }

        return sb.toString();
    }

    /**
     * Extract the origin (scheme://host[:port]) from a full URL.
     * Non-default ports are preserved; default ports (80 for HTTP, 443 for HTTPS) are omitted.
     *
     * @param url the URL to extract the origin from
     * @return the origin, or {@code null} if the URL is malformed or not absolute
     */
    public static @Nullable String originOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                return null;
            }
            String scheme = uri.getScheme().toLowerCase();
            String host = uri.getHost().toLowerCase();
            int port = uri.getPort();
            if (port == -1 || isDefaultPort(scheme, port)) {
                return scheme + "://" + host;
            }
            return scheme + "://" + host + ":" + port;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Check if a candidate URL has the same scheme+host+port as the given origin.
     *
     * @param baseOrigin the origin defining the site boundary, e.g. {@code https://docs.example.com}
     * @param candidateUrl the URL to check
     * @return true if the candidate is on the same origin
     */
    public static boolean isSameOrigin(String baseOrigin, String candidateUrl) {
        String base = originOf(baseOrigin);
        String candidate = originOf(candidateUrl);
        return base != null && base.equals(candidate);
    }

    /**
     * Resolve a link href against the URL of the page it was found on, then normalize it.
     * Only http(s) targets are kept; mailto:, javascript: and unparseable hrefs are dropped.
     *
     * @param pageUrl absolute URL of the page the link appeared on
     * @param href raw href, absolute or relative
     * @return the normalized absolute URL, or {@code null} if the link cannot be resolved
     */
    public static @Nullable String resolve(String pageUrl, @Nullable String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        try {
            URI base = new URI(normalize(pageUrl));
            URI resolved = base.resolve(href.trim());
            if (resolved.getScheme() == null || resolved.getHost() == null
                    || !FETCHABLE_SCHEMES.contains(resolved.getScheme().toLowerCase())) {
                return null;
            }
            return normalize(resolved.toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Dropping unresolvable link {} on {}: {}", href, pageUrl, e.getMessage());
            return null;
        }
    }

    private static String filterQueryParams(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
                .filter(param -> {
                    String key = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
                    return !TRACKING_PARAMS.contains(key.toLowerCase());
                })
                .sorted()
                .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
