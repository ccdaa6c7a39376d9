package dev.sitedigest.crawl;

import java.net.URI;
import java.util.List;

/**
 * Static utility deciding whether a candidate URL may be fetched during a crawl run.
 * A URL must share the seed's origin and must not be disallowed by the site's robots rules.
 */
public final class UrlScopeFilter {

    private UrlScopeFilter() {
        // utility class
    }

    /**
     * Check whether a URL belongs to the crawled site.
     *
     * @param url the candidate URL
     * @param baseOrigin scheme://host[:port] of the seed URL
     * @return true iff the URL's origin equals {@code baseOrigin}; malformed URLs are out of scope
     */
    public static boolean isInScope(String url, String baseOrigin) {
        return UrlNormalizer.isSameOrigin(baseOrigin, url);
    }

    /**
     * Check a URL against robots rules under the wildcard user agent.
     * Prefixes are matched against the path plus query, both as written and percent-decoded,
     * so {@code Disallow: /search?q} and {@code Disallow: /café} apply to the URLs they name.
     * Malformed URLs fail open.
     *
     * @param url the candidate URL
     * @param robotsRuleSet rules loaded for the crawled site
     * @return false only if a disallow prefix matches and no allow prefix does
     */
    public static boolean isAllowed(String url, RobotsRuleSet robotsRuleSet) {
        if (url == null) {
            return true;
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return true;
        }
        String raw = pathAndQuery(uri.getRawPath(), uri.getRawQuery());
        String decoded = pathAndQuery(uri.getPath(), uri.getQuery());
        return robotsRuleSet.isAnyFormAllowed(raw.equals(decoded) ? List.of(raw) : List.of(raw, decoded));
    }

    private static String pathAndQuery(String path, String query) {
        String base = path == null || path.isEmpty() ? "/" : path;
        return query == null ? base : base + "?" + query;
    }
}
