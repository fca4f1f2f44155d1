package dev.linkscout.crawl;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Breadth-first crawl engine that checks a site in waves over a fixed pool of workers.
 *
 * <p>Each wave drains the whole frontier into a batch before anything is merged back, submits the
 * batch as {@link LinkCheckTask}s to a pool of {@link CrawlProperties#concurrency()} threads, and
 * appends the entries returned by each task as it completes. The crawl is done when a wave
 * finishes with an empty frontier.
 *
 * <p>Duplicate fetches are prevented by {@link CrawlState#tryMarkVisited}, not by wave
 * boundaries. Each call to {@link #crawl} gets its own state and pool, so one scheduler can run
 * crawls concurrently.
 */
@Service
public class CrawlScheduler {

  private static final Logger log = LoggerFactory.getLogger(CrawlScheduler.class);

  private static final long SHUTDOWN_GRACE_SECONDS = 5;

  private final CrawlProperties properties;
  private final PageFetcher fetcher;
  private final LinkExtractor extractor;
  private final Clock clock;

  public CrawlScheduler(
      CrawlProperties properties, PageFetcher fetcher, LinkExtractor extractor, Clock clock) {
    this.properties = properties;
    this.fetcher = fetcher;
    this.extractor = extractor;
    this.clock = clock;
  }

  /**
   * Crawl a site without realtime notification of broken links.
   *
   * @param baseUrl normalized URL to start from
   * @return the final crawl state
   */
  public CrawlReport crawl(String baseUrl) {
    return crawl(baseUrl, BrokenLinkListener.NONE);
  }

  /**
   * Crawl a site from its base URL until no undiscovered internal link within the depth limit
   * remains.
   *
   * @param baseUrl normalized URL to start from; also defines which links are internal
   * @param listener receives each broken link as soon as it is found
   * @return the final crawl state
   */
  public CrawlReport crawl(String baseUrl, BrokenLinkListener listener) {
    Instant startedAt = clock.instant();
    CrawlState state = new CrawlState(listener);
    Deque<FrontierEntry> frontier = new ArrayDeque<>();
    frontier.add(FrontierEntry.seed(baseUrl));
    state.tryMarkDiscovered(baseUrl);

    log.info(
        "Starting crawl of {} (maxDepth={}, concurrency={}, timeout={})",
        baseUrl,
        properties.maxDepth(),
        properties.concurrency(),
        properties.fetchTimeout());

    ExecutorService pool =
        Executors.newFixedThreadPool(
            properties.concurrency(), new CustomizableThreadFactory("linkscout-worker-"));
    try {
      int wave = 0;
      while (!frontier.isEmpty()) {
        wave++;
        List<FrontierEntry> batch = new ArrayList<>(frontier);
        frontier.clear();
        runWave(batch, baseUrl, state, pool, frontier);
        logProgress(wave, batch.size(), state.snapshot());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Crawl of {} interrupted, reporting partial results", baseUrl);
    } finally {
      shutdown(pool);
    }

    CrawlReport report =
        new CrawlReport(
            baseUrl,
            properties.maxDepth(),
            state.snapshot(),
            state.brokenLinks(),
            state.visitedUrls(),
            startedAt,
            clock.instant());
    log.info(
        "Crawl complete: {} pages checked, {} broken links from {}",
        report.statistics().visited(),
        report.brokenLinks().size(),
        baseUrl);
    return report;
  }

  private void runWave(
      List<FrontierEntry> batch,
      String baseUrl,
      CrawlState state,
      ExecutorService pool,
      Deque<FrontierEntry> frontier)
      throws InterruptedException {
    CompletionService<List<FrontierEntry>> completion = new ExecutorCompletionService<>(pool);
    for (FrontierEntry entry : batch) {
      completion.submit(
          new LinkCheckTask(entry, baseUrl, properties.maxDepth(), state, fetcher, extractor));
    }
    for (int i = 0; i < batch.size(); i++) {
      frontier.addAll(resultOf(completion.take()));
    }
  }

  private List<FrontierEntry> resultOf(Future<List<FrontierEntry>> done)
      throws InterruptedException {
    try {
      return done.get();
    } catch (ExecutionException e) {
      // LinkCheckTask maps RuntimeExceptions to outcomes, so only Errors land here
      log.error("Link check task failed unexpectedly", e.getCause());
      return List.of();
    }
  }

  private void logProgress(int wave, int batchSize, CrawlStatistics stats) {
    log.info(
        "Wave {} ({} dispatched): discovered={}, checked={}, in queue={}, "
            + "200={}, 400={}, 404={}, 500={}, other statuses={}, errors={}",
        wave,
        batchSize,
        stats.discovered(),
        stats.visited(),
        stats.inQueue(),
        stats.count(200),
        stats.count(400),
        stats.count(404),
        stats.count(500),
        stats.otherStatuses(),
        stats.transportErrors());
  }

  private void shutdown(ExecutorService pool) {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
        pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
