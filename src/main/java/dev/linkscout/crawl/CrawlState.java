package dev.linkscout.crawl;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable state shared by every worker of one crawl run.
 *
 * <p>Holds the visited set, the discovered set, the status histogram and the broken-link list. All
 * of them are guarded by one {@link ReentrantLock}, so every operation is linearizable with respect
 * to every other one: a URL is admitted by {@link #tryMarkVisited} exactly once however many
 * workers race for it, and a snapshot never mixes counts from before and after an update.
 *
 * <p>Containers are never handed out; readers get copies.
 */
public final class CrawlState {

  private static final Logger log = LoggerFactory.getLogger(CrawlState.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Set<String> visited = new LinkedHashSet<>();
  private final Set<String> discovered = new HashSet<>();
  private final SortedMap<Integer, Integer> statusCounts = new TreeMap<>();
  private final List<BrokenLink> brokenLinks = new ArrayList<>();
  private final BrokenLinkListener listener;
  private int transportErrors;

  public CrawlState() {
    this(BrokenLinkListener.NONE);
  }

  /**
   * @param listener notified of each broken link while the state lock is held, so notifications
   *     arrive in the same order as {@link #brokenLinks()}
   */
  public CrawlState(BrokenLinkListener listener) {
    this.listener = listener;
  }

  /**
   * Admit a URL for fetching.
   *
   * @return true if the caller now owns the URL and must fetch it; false if it was admitted before
   */
  public boolean tryMarkVisited(String url) {
    lock.lock();
    try {
      return visited.add(url);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Record that a URL has been queued.
   *
   * @return true if the URL had never been discovered, meaning the caller should enqueue it
   */
  public boolean tryMarkDiscovered(String url) {
    lock.lock();
    try {
      return discovered.add(url);
    } finally {
      lock.unlock();
    }
  }

  /** Count one fetch outcome: its status code, or the transport error bucket. */
  public void recordStatus(FetchOutcome outcome) {
    lock.lock();
    try {
      if (outcome instanceof FetchOutcome.Success success) {
        statusCounts.merge(success.status(), 1, Integer::sum);
      } else if (outcome instanceof FetchOutcome.HttpError error) {
        statusCounts.merge(error.status(), 1, Integer::sum);
      } else {
        transportErrors++;
      }
    } finally {
      lock.unlock();
    }
  }

  /** Append a broken link and hand it to the listener. */
  public void recordBroken(BrokenLink brokenLink) {
    lock.lock();
    try {
      brokenLinks.add(brokenLink);
      try {
        listener.onBrokenLink(brokenLink);
      } catch (RuntimeException e) {
        log.error("Broken-link listener failed for {}: {}", brokenLink.url(), e.getMessage(), e);
      }
    } finally {
      lock.unlock();
    }
  }

  public CrawlStatistics snapshot() {
    lock.lock();
    try {
      return new CrawlStatistics(discovered.size(), visited.size(), statusCounts, transportErrors);
    } finally {
      lock.unlock();
    }
  }

  /** Broken links in the order workers recorded them. */
  public List<BrokenLink> brokenLinks() {
    lock.lock();
    try {
      return List.copyOf(brokenLinks);
    } finally {
      lock.unlock();
    }
  }

  public Set<String> visitedUrls() {
    lock.lock();
    try {
      return new LinkedHashSet<>(visited);
    } finally {
      lock.unlock();
    }
  }

  boolean isDiscovered(String url) {
    lock.lock();
    try {
      return discovered.contains(url);
    } finally {
      lock.unlock();
    }
  }
}
