package dev.linkscout.crawl;

/**
 * Classification of a single fetch attempt.
 *
 * <p>A response below 400 is a {@link Success}, a response of 400 or above is an {@link
 * HttpError}, and a request that produced no response at all (DNS failure, refused connection,
 * timeout, malformed URL) is a {@link TransportError}.
 */
public sealed interface FetchOutcome
    permits FetchOutcome.Success, FetchOutcome.HttpError, FetchOutcome.TransportError {

  /** Token written in the {@code Error} column for transport failures. */
  String TRANSPORT_ERROR_TOKEN = "ERROR";

  static FetchOutcome ofStatus(int status) {
    return status >= 400 ? new HttpError(status) : new Success(status);
  }

  /** Whether this outcome makes the target a broken link. */
  default boolean isBroken() {
    return !(this instanceof Success);
  }

  /**
   * Value of the {@code Error} column in console and CSV output: the status code for HTTP
   * outcomes, {@value #TRANSPORT_ERROR_TOKEN} for transport failures.
   */
  String errorToken();

  record Success(int status) implements FetchOutcome {
    @Override
    public String errorToken() {
      return String.valueOf(status);
    }
  }

  record HttpError(int status) implements FetchOutcome {
    public HttpError {
      if (status < 400) {
        throw new IllegalArgumentException("HTTP error status must be >= 400, got: " + status);
      }
    }

    @Override
    public String errorToken() {
      return String.valueOf(status);
    }
  }

  record TransportError(String description) implements FetchOutcome {
    @Override
    public String errorToken() {
      return TRANSPORT_ERROR_TOKEN;
    }
  }
}
