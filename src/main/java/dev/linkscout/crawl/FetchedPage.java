package dev.linkscout.crawl;

import org.jspecify.annotations.Nullable;

/**
 * Result of fetching one URL: its classification and, for successful HTML responses, the body to
 * extract links from.
 */
public record FetchedPage(FetchOutcome outcome, @Nullable String body) {

  public static FetchedPage failed(String description) {
    return new FetchedPage(new FetchOutcome.TransportError(description), null);
  }

  public static FetchedPage of(int status, @Nullable String body) {
    FetchOutcome outcome = FetchOutcome.ofStatus(status);
    return new FetchedPage(outcome, outcome.isBroken() ? null : body);
  }
}
