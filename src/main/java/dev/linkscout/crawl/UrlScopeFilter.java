package dev.linkscout.crawl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Static utility deciding which normalized URLs may enter the crawl frontier.
 * A URL qualifies when it uses http(s) and shares the base URL's network location.
 */
public final class UrlScopeFilter {

    private UrlScopeFilter() {
        // utility class
    }

    /**
     * Check whether the candidate lives on the same network location as the base URL.
     * Only the authority (host and port as written) is compared; the scheme may differ,
     * so {@code http://example.com/a} is internal to {@code https://example.com}.
     *
     * @param baseUrl the crawl's base URL
     * @param candidateUrl the URL to check
     * @return true if both URLs have the same, non-empty authority
     */
    public static boolean isInternal(String baseUrl, String candidateUrl) {
        String baseAuthority = authorityOf(baseUrl);
        String candidateAuthority = authorityOf(candidateUrl);
        return baseAuthority != null && baseAuthority.equals(candidateAuthority);
    }

    /**
     * Check whether the URL uses a scheme the crawler can fetch.
     * Rejects {@code mailto:}, {@code tel:}, {@code javascript:} and any other non-http(s) link.
     *
     * @param url a normalized URL
     * @return true for http and https URLs
     */
    public static boolean isCrawlableScheme(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("mailto:") || lower.startsWith("tel:")) {
            return false;
        }
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    /**
     * Check whether a URL passes both scope rules relative to the base URL.
     *
     * @param baseUrl the crawl's base URL
     * @param candidateUrl the normalized candidate
     * @return true if the candidate may be enqueued
     */
    public static boolean isAllowed(String baseUrl, String candidateUrl) {
        return isCrawlableScheme(candidateUrl) && isInternal(baseUrl, candidateUrl);
    }

    private static String authorityOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String authority = new URI(url).getRawAuthority();
            return authority == null ? null : authority.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
