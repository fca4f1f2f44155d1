package dev.linkscout.crawl;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks one frontier entry: fetches it, classifies the outcome, records it in the shared {@link
 * CrawlState} and, for a working page, returns the internal links that nobody has queued yet.
 *
 * <p>Never throws. A failure of the fetch or the extraction is recorded as a broken link or an
 * empty result.
 */
public class LinkCheckTask implements Callable<List<FrontierEntry>> {

  private static final Logger log = LoggerFactory.getLogger(LinkCheckTask.class);

  private final FrontierEntry entry;
  private final String baseUrl;
  private final int maxDepth;
  private final CrawlState state;
  private final PageFetcher fetcher;
  private final LinkExtractor extractor;

  public LinkCheckTask(
      FrontierEntry entry,
      String baseUrl,
      int maxDepth,
      CrawlState state,
      PageFetcher fetcher,
      LinkExtractor extractor) {
    this.entry = entry;
    this.baseUrl = baseUrl;
    this.maxDepth = maxDepth;
    this.state = state;
    this.fetcher = fetcher;
    this.extractor = extractor;
  }

  @Override
  public List<FrontierEntry> call() {
    String url = entry.url();

    // Beyond the limit the URL stays discovered-only; it does not take a visited slot.
    if (entry.depth() > maxDepth) {
      log.trace("Skipping {} at depth {} (max {})", url, entry.depth(), maxDepth);
      return List.of();
    }
    if (!state.tryMarkVisited(url)) {
      return List.of();
    }

    FetchedPage page = fetchSafely(url);
    FetchOutcome outcome = page.outcome();
    state.recordStatus(outcome);

    if (outcome.isBroken()) {
      logBroken(url, outcome);
      state.recordBroken(new BrokenLink(url, outcome, entry.sourceUrl()));
      return List.of();
    }

    log.debug("[depth={}] {} -> {}", entry.depth(), url, outcome.errorToken());
    if (page.body() == null) {
      return List.of();
    }
    return discoverLinks(url, page.body());
  }

  private FetchedPage fetchSafely(String url) {
    try {
      return fetcher.fetch(url);
    } catch (RuntimeException e) {
      log.warn("Unexpected failure fetching {}", url, e);
      return FetchedPage.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }

  private List<FrontierEntry> discoverLinks(String url, String body) {
    Set<String> hrefs;
    try {
      hrefs = extractor.extractLinks(body, url);
    } catch (RuntimeException e) {
      log.debug("Link extraction failed on {}: {}", url, e.getMessage());
      return List.of();
    }

    List<FrontierEntry> next = new ArrayList<>();
    int nextDepth = entry.depth() + 1;
    for (String href : hrefs) {
      String normalized = UrlNormalizer.normalize(url, href);
      if (!UrlScopeFilter.isAllowed(baseUrl, normalized)) {
        continue;
      }
      if (!state.tryMarkDiscovered(normalized)) {
        continue;
      }
      next.add(new FrontierEntry(normalized, nextDepth, url));
    }
    return next;
  }

  private void logBroken(String url, FetchOutcome outcome) {
    if (outcome instanceof FetchOutcome.TransportError error) {
      log.warn("Broken link {} (from {}): {}", url, entry.sourceUrl(), error.description());
    } else {
      log.warn("Broken link {} (from {}): HTTP {}", url, entry.sourceUrl(), outcome.errorToken());
    }
  }
}
