package dev.linkscout.crawl;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/** Final state of one crawl run, read by reporting and export once the scheduler is done. */
public record CrawlReport(
    String baseUrl,
    int maxDepth,
    CrawlStatistics statistics,
    List<BrokenLink> brokenLinks,
    Set<String> visitedUrls,
    Instant startedAt,
    Instant finishedAt) {

  public CrawlReport {
    brokenLinks = brokenLinks == null ? List.of() : List.copyOf(brokenLinks);
    visitedUrls = visitedUrls == null ? Set.of() : Set.copyOf(visitedUrls);
  }

  public Duration elapsed() {
    return Duration.between(startedAt, finishedAt);
  }
}
