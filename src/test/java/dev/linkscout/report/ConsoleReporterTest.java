package dev.linkscout.report;

import static org.assertj.core.api.Assertions.assertThat;

import dev.linkscout.crawl.BrokenLink;
import dev.linkscout.crawl.CrawlReport;
import dev.linkscout.crawl.CrawlStatistics;
import dev.linkscout.crawl.FetchOutcome;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConsoleReporterTest {

  private static final String BASE = "https://example.com";
  private static final Instant START = Instant.parse("2026-01-15T10:00:00Z");

  private ByteArrayOutputStream buffer;
  private ConsoleReporter reporter;

  @BeforeEach
  void setUp() {
    buffer = new ByteArrayOutputStream();
    reporter = new ConsoleReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8));
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  private static CrawlReport report(List<BrokenLink> brokenLinks) {
    TreeMap<Integer, Integer> counts = new TreeMap<>();
    counts.put(200, 3);
    counts.put(301, 1);
    counts.put(404, 1);
    return new CrawlReport(
        BASE,
        2,
        new CrawlStatistics(6, 5, counts, 1),
        brokenLinks,
        Set.of(BASE),
        START,
        START.plusMillis(2345));
  }

  @Test
  void printsStatisticsTable() {
    reporter.printSummary(report(List.of()));

    String out = output();
    assertThat(out).contains("Scan complete: https://example.com (max depth 2)");
    assertThat(out).contains("Link Checking Summary");
    assertThat(out).containsPattern("\\| Links Discovered +\\| 6 +\\|");
    assertThat(out).containsPattern("\\| Links Checked +\\| 5 +\\|");
    assertThat(out).containsPattern("\\| In Queue +\\| 1 +\\|");
    assertThat(out).containsPattern("\\| 200 OK +\\| 3 +\\|");
    assertThat(out).containsPattern("\\| 404 Not Found +\\| 1 +\\|");
    assertThat(out).containsPattern("\\| Other Statuses +\\| 1 +\\|");
    assertThat(out).containsPattern("\\| Other Errors +\\| 1 +\\|");
    assertThat(out).containsPattern("\\| Elapsed +\\| 2\\.345s +\\|");
  }

  @Test
  void printsSuccessLineWhenNothingIsBroken() {
    reporter.printSummary(report(List.of()));

    assertThat(output()).contains(ConsoleReporter.NO_BROKEN_LINKS).doesNotContain("Broken Links Summary");
  }

  @Test
  void printsBrokenLinksTable() {
    List<BrokenLink> broken =
        List.of(
            new BrokenLink(BASE + "/b", new FetchOutcome.HttpError(404), BASE),
            new BrokenLink(BASE + "/down", new FetchOutcome.TransportError("timeout"), BASE + "/a"));

    reporter.printSummary(report(broken));

    String out = output();
    assertThat(out).contains("Broken Links Summary (2)");
    assertThat(out).containsPattern("\\| Error +\\| URL +\\| Source +\\|");
    assertThat(out).containsPattern("\\| 404 +\\| https://example\\.com/b +\\| https://example\\.com +\\|");
    assertThat(out)
        .containsPattern("\\| ERROR +\\| https://example\\.com/down +\\| https://example\\.com/a +\\|");
    assertThat(out).doesNotContain(ConsoleReporter.NO_BROKEN_LINKS);
  }

  @Test
  void renderTableSizesColumnsToWidestCell() {
    String table =
        ConsoleReporter.renderTable(
            "T", List.of("A", "B"), List.of(List.of("short", "x"), List.of("much longer", "yy")));

    assertThat(table)
        .isEqualTo(
            "T\n"
                + "+-------------+----+\n"
                + "| A           | B  |\n"
                + "+-------------+----+\n"
                + "| short       | x  |\n"
                + "| much longer | yy |\n"
                + "+-------------+----+\n");
  }

  @Test
  void formatElapsedSwitchesToSecondsFromOneSecond() {
    assertThat(ConsoleReporter.formatElapsed(Duration.ofMillis(850))).isEqualTo("850ms");
    assertThat(ConsoleReporter.formatElapsed(Duration.ofMillis(1000))).isEqualTo("1.000s");
    assertThat(ConsoleReporter.formatElapsed(Duration.ofSeconds(75, 42_000_000))).isEqualTo("75.042s");
  }
}
