package dev.linkscout.export;

import dev.linkscout.crawl.BrokenLink;

/** CSV layout shared by the realtime and final exports. */
final class CsvFormat {

  static final String HEADER = "Error,URL,Source";

  private CsvFormat() {
    // utility class
  }

  static String row(BrokenLink link) {
    return row(link.errorToken(), link.url(), link.sourceUrl());
  }

  static String row(String error, String url, String source) {
    return escapeCsv(error) + "," + escapeCsv(url) + "," + escapeCsv(source);
  }

  static String escapeCsv(String value) {
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
