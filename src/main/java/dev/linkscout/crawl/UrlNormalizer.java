package dev.linkscout.crawl;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class that turns hyperlinks into canonical URL strings for deduplication.
 * Resolves relative references, drops fragments, trims whitespace and trailing slashes.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Normalize a link found on a page:
     * - Resolve it against {@code base} (RFC 3986 reference resolution)
     * - Remove the fragment (#section)
     * - Trim surrounding whitespace
     * - Remove trailing slashes, so {@code /docs/} and {@code /docs} collapse to one entry
     *
     * <p>Scheme and host casing are kept as written. Malformed input never fails: the best-effort
     * string is returned and the fetch classifies it later.
     *
     * @param base the URL of the page the link was found on; blank for a standalone URL
     * @param link the raw link, absolute or relative; blank to normalize {@code base} itself
     * @return normalized URL string
     */
    public static String normalize(String base, String link) {
        String trimmedBase = base == null ? "" : base.strip();
        String trimmedLink = link == null ? "" : link.strip();

        String joined;
        if (trimmedLink.isEmpty()) {
            joined = trimmedBase;
        } else if (trimmedBase.isEmpty()) {
            joined = trimmedLink;
        } else {
            joined = resolve(trimmedBase, trimmedLink);
        }
        return clean(stripFragment(joined));
    }

    private static String resolve(String base, String link) {
        if (link.startsWith("?")) {
            // query-only reference keeps the base path (RFC 3986 5.2.2); URI.resolve drops the last segment
            return stripQuery(stripFragment(base)) + link;
        }
        try {
            URI baseUri = new URI(base);
            // URI.resolve mishandles an authority with an empty path ("https://host" + "a")
            if (baseUri.getRawAuthority() != null
                    && (baseUri.getRawPath() == null || baseUri.getRawPath().isEmpty())) {
                baseUri = new URI(base + "/");
            }
            return baseUri.resolve(new URI(link)).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.trace("Strict resolution failed for {} against {}: {}", link, base, e.getMessage());
        }
        try {
            // java.net.URL tolerates characters URI rejects (spaces, unescaped brackets)
            return new URL(new URL(base), link).toString();
        } catch (MalformedURLException e) {
            log.debug("Malformed link {} on {}, keeping it unresolved", link, base);
            return link;
        }
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    private static String stripQuery(String url) {
        int question = url.indexOf('?');
        return question >= 0 ? url.substring(0, question) : url;
    }

    private static String clean(String url) {
        String current = url;
        String previous;
        do {
            previous = current;
            current = current.strip();
            while (current.endsWith("/")) {
                current = current.substring(0, current.length() - 1);
            }
        } while (!current.equals(previous));
        return current;
    }
}
