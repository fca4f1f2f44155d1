package dev.linkscout.export;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * CSV export settings bound from {@code linkscout.export.*} (aliases {@code --export}, {@code
 * --export-realtime} and {@code --export-statuses}).
 *
 * @param path file written once with all broken links after the crawl; blank to skip
 * @param realtimePath file each broken link is appended to as it is found; blank to skip
 * @param statuses HTTP statuses kept in the final export; empty keeps every status, transport
 *     errors are always kept
 */
@ConfigurationProperties(prefix = "linkscout.export")
public record ExportProperties(
    @Nullable String path, @Nullable String realtimePath, List<Integer> statuses) {

  public ExportProperties {
    statuses = statuses == null ? List.of() : List.copyOf(statuses);
  }

  public Optional<Path> finalExportPath() {
    return toPath(path);
  }

  public Optional<Path> realtimeExportPath() {
    return toPath(realtimePath);
  }

  private static Optional<Path> toPath(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Path.of(value.strip()));
  }
}
