package dev.linkscout.report;

import dev.linkscout.crawl.BrokenLink;
import dev.linkscout.crawl.CrawlReport;
import dev.linkscout.crawl.CrawlStatistics;
import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Prints the end-of-run summary: crawl statistics and either a table of broken links or a
 * success line.
 *
 * <p>Tables are plain text with columns sized to their widest cell, so output stays readable when
 * redirected to a file.
 */
@Component
public class ConsoleReporter {

  static final String NO_BROKEN_LINKS = "No broken links found.";

  private final PrintStream out;

  public ConsoleReporter() {
    this(System.out);
  }

  public ConsoleReporter(PrintStream out) {
    this.out = out;
  }

  /**
   * Prints statistics and the broken links of a finished crawl.
   *
   * @param report the final crawl state
   */
  public void printSummary(CrawlReport report) {
    out.println();
    out.println("Scan complete: " + report.baseUrl() + " (max depth " + report.maxDepth() + ")");
    out.println();
    printStatistics(report.statistics(), report.elapsed());
    out.println();
    printBrokenLinks(report.brokenLinks());
  }

  void printStatistics(CrawlStatistics stats, Duration elapsed) {
    List<List<String>> rows = new ArrayList<>();
    rows.add(row("Links Discovered", stats.discovered()));
    rows.add(row("Links Checked", stats.visited()));
    rows.add(row("In Queue", stats.inQueue()));
    rows.add(row("200 OK", stats.count(200)));
    rows.add(row("400 Bad Request", stats.count(400)));
    rows.add(row("404 Not Found", stats.count(404)));
    rows.add(row("500 Server Error", stats.count(500)));
    rows.add(row("Other Statuses", stats.otherStatuses()));
    rows.add(row("Other Errors", stats.transportErrors()));
    rows.add(List.of("Elapsed", formatElapsed(elapsed)));
    out.print(renderTable("Link Checking Summary", List.of("Metric", "Count"), rows));
  }

  void printBrokenLinks(List<BrokenLink> brokenLinks) {
    if (brokenLinks.isEmpty()) {
      out.println(NO_BROKEN_LINKS);
      return;
    }
    List<List<String>> rows = new ArrayList<>();
    for (BrokenLink link : brokenLinks) {
      rows.add(List.of(link.errorToken(), link.url(), link.sourceUrl()));
    }
    out.print(
        renderTable(
            "Broken Links Summary (" + brokenLinks.size() + ")",
            List.of("Error", "URL", "Source"),
            rows));
  }

  static String renderTable(String title, List<String> header, List<List<String>> rows) {
    int[] widths = new int[header.size()];
    for (int i = 0; i < header.size(); i++) {
      widths[i] = header.get(i).length();
    }
    for (List<String> row : rows) {
      for (int i = 0; i < widths.length; i++) {
        widths[i] = Math.max(widths[i], row.get(i).length());
      }
    }

    String separator = separatorLine(widths);
    StringBuilder table = new StringBuilder();
    table.append(title).append('\n');
    table.append(separator);
    table.append(formatRow(header, widths));
    table.append(separator);
    for (List<String> row : rows) {
      table.append(formatRow(row, widths));
    }
    table.append(separator);
    return table.toString();
  }

  private static String separatorLine(int[] widths) {
    StringBuilder line = new StringBuilder("+");
    for (int width : widths) {
      line.append("-".repeat(width + 2)).append('+');
    }
    return line.append('\n').toString();
  }

  private static String formatRow(List<String> cells, int[] widths) {
    StringBuilder line = new StringBuilder("|");
    for (int i = 0; i < widths.length; i++) {
      line.append(' ').append(pad(cells.get(i), widths[i])).append(" |");
    }
    return line.append('\n').toString();
  }

  private static String pad(String value, int width) {
    return value + " ".repeat(width - value.length());
  }

  private static List<String> row(String metric, int count) {
    return List.of(metric, String.valueOf(count));
  }

  static String formatElapsed(Duration elapsed) {
    long millis = elapsed.toMillis();
    if (millis < 1000) {
      return millis + "ms";
    }
    return "%d.%03ds".formatted(millis / 1000, millis % 1000);
  }
}
