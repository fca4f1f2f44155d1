package dev.linkscout.export;

import dev.linkscout.crawl.BrokenLink;
import dev.linkscout.crawl.FetchOutcome;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes the end-of-run CSV of broken links in one pass, replacing any existing file.
 *
 * <p>When {@link ExportProperties#statuses()} is set, HTTP rows are limited to those statuses;
 * transport errors are always exported.
 */
@Service
public class CsvReportExporter {

  private static final Logger log = LoggerFactory.getLogger(CsvReportExporter.class);

  private final Set<Integer> statusFilter;

  public CsvReportExporter(ExportProperties properties) {
    this.statusFilter = Set.copyOf(properties.statuses());
  }

  /**
   * Export broken links to a CSV file.
   *
   * @param brokenLinks links to export, in report order
   * @param path target file, overwritten if it exists
   * @return number of rows written, excluding the header
   * @throws IOException if the file cannot be written
   */
  public int export(List<BrokenLink> brokenLinks, Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    int rows = 0;
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      writer.write(CsvFormat.HEADER);
      writer.newLine();
      for (BrokenLink link : brokenLinks) {
        if (!isExported(link)) {
          continue;
        }
        writer.write(CsvFormat.row(link));
        writer.newLine();
        rows++;
      }
    }
    log.info("Exported {} broken links to {}", rows, path);
    return rows;
  }

  boolean isExported(BrokenLink link) {
    if (statusFilter.isEmpty() || link.isTransportError()) {
      return true;
    }
    FetchOutcome.HttpError error = (FetchOutcome.HttpError) link.outcome();
    return statusFilter.contains(error.status());
  }
}
