package dev.linkscout.crawl;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable snapshot of crawl counters taken from {@link CrawlState}.
 *
 * @param discovered URLs ever enqueued
 * @param visited URLs dispatched for fetching
 * @param statusCounts responses received, keyed by HTTP status code
 * @param transportErrors fetches that produced no response
 */
public record CrawlStatistics(
    int discovered, int visited, SortedMap<Integer, Integer> statusCounts, int transportErrors) {

  public CrawlStatistics {
    statusCounts = statusCounts == null
        ? new TreeMap<>()
        : new TreeMap<>(statusCounts);
  }

  /** Discovered but not (yet) visited, including URLs dropped beyond the depth limit. */
  public int inQueue() {
    return Math.max(0, discovered - visited);
  }

  public int count(int status) {
    return statusCounts.getOrDefault(status, 0);
  }

  /** Status counts outside the ones highlighted in progress output (200, 400, 404, 500). */
  public int otherStatuses() {
    int other = 0;
    for (Map.Entry<Integer, Integer> entry : statusCounts.entrySet()) {
      int status = entry.getKey();
      if (status != 200 && status != 400 && status != 404 && status != 500) {
        other += entry.getValue();
      }
    }
    return other;
  }

  @Override
  public SortedMap<Integer, Integer> statusCounts() {
    return new TreeMap<>(statusCounts);
  }
}
