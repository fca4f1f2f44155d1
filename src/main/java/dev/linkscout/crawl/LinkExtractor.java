package dev.linkscout.crawl;

import java.util.Set;

/** Extracts candidate hyperlink targets from a page body. */
public interface LinkExtractor {

  /**
   * @param html page body, possibly malformed
   * @param pageUrl URL the body was fetched from
   * @return raw {@code href} values in document order, unresolved; empty if nothing can be parsed
   */
  Set<String> extractLinks(String html, String pageUrl);
}
