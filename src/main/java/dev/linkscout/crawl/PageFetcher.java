package dev.linkscout.crawl;

/** Performs the HTTP fetch for one URL. Implementations must not throw for network failures. */
public interface PageFetcher {

  /**
   * Fetch a URL and classify the result.
   *
   * @param url absolute http(s) URL
   * @return the outcome, with the body attached only for successful HTML responses
   */
  FetchedPage fetch(String url);
}
