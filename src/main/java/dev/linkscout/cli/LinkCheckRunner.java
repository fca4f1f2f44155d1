package dev.linkscout.cli;

import dev.linkscout.crawl.BrokenLinkListener;
import dev.linkscout.crawl.CrawlProperties;
import dev.linkscout.crawl.CrawlReport;
import dev.linkscout.crawl.CrawlScheduler;
import dev.linkscout.crawl.UrlNormalizer;
import dev.linkscout.crawl.UrlScopeFilter;
import dev.linkscout.export.CsvReportExporter;
import dev.linkscout.export.ExportProperties;
import dev.linkscout.export.RealtimeCsvExporter;
import dev.linkscout.report.ConsoleReporter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one crawl per application start: opens the realtime export if configured, crawls the base
 * URL, prints the summary and writes the final export.
 *
 * <p>Disabled with {@code linkscout.runner.enabled=false}, which tests use to load the context
 * without crawling.
 */
@Component
@ConditionalOnProperty(
    prefix = "linkscout.runner",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class LinkCheckRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(LinkCheckRunner.class);

  private final CrawlProperties crawlProperties;
  private final ExportProperties exportProperties;
  private final CrawlScheduler scheduler;
  private final ConsoleReporter consoleReporter;
  private final CsvReportExporter csvReportExporter;

  public LinkCheckRunner(
      CrawlProperties crawlProperties,
      ExportProperties exportProperties,
      CrawlScheduler scheduler,
      ConsoleReporter consoleReporter,
      CsvReportExporter csvReportExporter) {
    this.crawlProperties = crawlProperties;
    this.exportProperties = exportProperties;
    this.scheduler = scheduler;
    this.consoleReporter = consoleReporter;
    this.csvReportExporter = csvReportExporter;
  }

  @Override
  public void run(ApplicationArguments args) throws IOException {
    checkRun();
  }

  /**
   * Performs the crawl, reporting and exports.
   *
   * @return the final crawl state
   * @throws IllegalArgumentException if the base URL is not an http(s) URL
   * @throws java.io.UncheckedIOException if the realtime export file cannot be opened
   * @throws IOException if the realtime export cannot be closed cleanly
   */
  public CrawlReport checkRun() throws IOException {
    String baseUrl = UrlNormalizer.normalize(crawlProperties.baseUrl(), "");
    if (!UrlScopeFilter.isCrawlableScheme(baseUrl)) {
      throw new IllegalArgumentException(
          "Base URL must be an http(s) URL, got: " + crawlProperties.baseUrl());
    }
    log.info(
        "Scanning {} up to depth {} with {} threads",
        baseUrl,
        crawlProperties.maxDepth(),
        crawlProperties.concurrency());

    CrawlReport report;
    Optional<Path> realtimePath = exportProperties.realtimeExportPath();
    try (RealtimeCsvExporter realtime = realtimePath.map(RealtimeCsvExporter::open).orElse(null)) {
      BrokenLinkListener listener = realtime != null ? realtime : BrokenLinkListener.NONE;
      report = scheduler.crawl(baseUrl, listener);
    }

    consoleReporter.printSummary(report);
    exportProperties.finalExportPath().ifPresent(path -> exportFinal(report, path));
    return report;
  }

  private void exportFinal(CrawlReport report, Path path) {
    try {
      csvReportExporter.export(report.brokenLinks(), path);
    } catch (IOException e) {
      log.error("Could not write broken-link export {}: {}", path, e.getMessage(), e);
    }
  }
}
