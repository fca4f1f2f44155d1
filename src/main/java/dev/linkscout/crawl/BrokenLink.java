package dev.linkscout.crawl;

/**
 * A target that answered with an error status or could not be fetched, with the page linking to
 * it.
 */
public record BrokenLink(String url, FetchOutcome outcome, String sourceUrl) {

  public BrokenLink {
    if (!outcome.isBroken()) {
      throw new IllegalArgumentException("Not a broken outcome for " + url + ": " + outcome);
    }
  }

  public String errorToken() {
    return outcome.errorToken();
  }

  public boolean isTransportError() {
    return outcome instanceof FetchOutcome.TransportError;
  }
}
