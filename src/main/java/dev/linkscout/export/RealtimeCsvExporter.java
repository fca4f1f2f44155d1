package dev.linkscout.export;

import dev.linkscout.crawl.BrokenLink;
import dev.linkscout.crawl.BrokenLinkListener;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only CSV sink that records each broken link as soon as a worker finds it.
 *
 * <p>The header is written when the file is opened, before any record. Every {@link #write} is
 * flushed before it returns, so an interrupted crawl keeps every record written so far. Writes are
 * synchronized: concurrent workers never interleave partial rows.
 */
public class RealtimeCsvExporter implements BrokenLinkListener, Closeable {

  private static final Logger log = LoggerFactory.getLogger(RealtimeCsvExporter.class);

  private final Path path;
  private final BufferedWriter writer;
  private int rowsWritten;
  private boolean closed;

  private RealtimeCsvExporter(Path path, BufferedWriter writer) {
    this.path = path;
    this.writer = writer;
  }

  /**
   * Create or truncate the file and write the header.
   *
   * @param path target CSV file
   * @return an open exporter
   * @throws UncheckedIOException if the file cannot be opened; the crawl must not start
   */
  public static RealtimeCsvExporter open(Path path) {
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      BufferedWriter writer =
          Files.newBufferedWriter(
              path,
              StandardCharsets.UTF_8,
              StandardOpenOption.CREATE,
              StandardOpenOption.TRUNCATE_EXISTING,
              StandardOpenOption.WRITE);
      RealtimeCsvExporter exporter = new RealtimeCsvExporter(path, writer);
      exporter.writeLine(CsvFormat.HEADER);
      log.info("Streaming broken links to {}", path);
      return exporter;
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot open realtime export file " + path, e);
    }
  }

  @Override
  public void onBrokenLink(BrokenLink brokenLink) {
    write(brokenLink.errorToken(), brokenLink.url(), brokenLink.sourceUrl());
  }

  /**
   * Append one record and flush it.
   *
   * @param error HTTP status code or {@code ERROR}
   * @param url the broken target
   * @param source the page linking to it
   */
  public synchronized void write(String error, String url, String source) {
    if (closed) {
      log.warn("Realtime export {} already closed, dropping {}", path, url);
      return;
    }
    try {
      writeLine(CsvFormat.row(error, url, source));
      rowsWritten++;
    } catch (IOException e) {
      log.error("Failed to append {} to realtime export {}: {}", url, path, e.getMessage());
    }
  }

  synchronized int rowsWritten() {
    return rowsWritten;
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    writer.close();
    log.info("Realtime export {} closed ({} broken links)", path, rowsWritten);
  }

  private void writeLine(String line) throws IOException {
    writer.write(line);
    writer.newLine();
    writer.flush();
  }
}
