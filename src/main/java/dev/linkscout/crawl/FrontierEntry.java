package dev.linkscout.crawl;

/**
 * A URL waiting to be checked, the depth at which it was found, and the page that linked to it.
 *
 * @param url normalized target URL
 * @param depth number of hops from the base URL
 * @param sourceUrl normalized page that linked to {@code url}, or {@link #ROOT_SOURCE} for the seed
 */
public record FrontierEntry(String url, int depth, String sourceUrl) {

  public static final String ROOT_SOURCE = "root";

  public FrontierEntry {
    if (depth < 0) {
      throw new IllegalArgumentException("depth must be >= 0, got: " + depth);
    }
  }

  public static FrontierEntry seed(String baseUrl) {
    return new FrontierEntry(baseUrl, 0, ROOT_SOURCE);
  }
}
