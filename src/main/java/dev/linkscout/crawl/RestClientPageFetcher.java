package dev.linkscout.crawl;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link PageFetcher} backed by Spring's {@link RestClient}.
 *
 * <p>Uses {@code exchange} rather than {@code retrieve} so that 4xx and 5xx responses come back
 * as statuses instead of exceptions. Only {@link RestClientException} (DNS, connection, timeout and
 * I/O failures) and unparseable URLs become {@link FetchOutcome.TransportError}.
 */
@Component
public class RestClientPageFetcher implements PageFetcher {

  private static final Logger log = LoggerFactory.getLogger(RestClientPageFetcher.class);

  private final RestClient restClient;

  public RestClientPageFetcher(@Qualifier("linkCheckRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public FetchedPage fetch(String url) {
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException e) {
      log.debug("Cannot request malformed URL {}: {}", url, e.getMessage());
      return FetchedPage.failed("Invalid URL: " + e.getMessage());
    }

    try {
      return restClient
          .get()
          .uri(uri)
          .exchange((request, response) -> toFetchedPage(response), true);
    } catch (RestClientException e) {
      log.debug("Request to {} failed: {}", url, e.getMessage());
      return FetchedPage.failed(describe(e));
    } catch (IllegalArgumentException e) {
      // e.g. a relative or scheme-less URL the request factory cannot open
      return FetchedPage.failed(describe(e));
    }
  }

  private FetchedPage toFetchedPage(ClientHttpResponse response) throws IOException {
    int status = response.getStatusCode().value();
    if (status >= 400) {
      return FetchedPage.of(status, null);
    }
    MediaType contentType = response.getHeaders().getContentType();
    if (!isHtml(contentType)) {
      log.trace("Skipping body with content type {}", contentType);
      return FetchedPage.of(status, null);
    }
    String body = StreamUtils.copyToString(response.getBody(), charsetOf(contentType));
    return FetchedPage.of(status, body);
  }

  /** A missing content type is treated as HTML, as browsers sniff it. */
  static boolean isHtml(@Nullable MediaType contentType) {
    if (contentType == null) {
      return true;
    }
    return MediaType.TEXT_HTML.includes(contentType)
        || MediaType.APPLICATION_XHTML_XML.includes(contentType);
  }

  private static Charset charsetOf(@Nullable MediaType contentType) {
    if (contentType != null && contentType.getCharset() != null) {
      return contentType.getCharset();
    }
    return StandardCharsets.UTF_8;
  }

  private static String describe(Exception e) {
    Throwable cause = e.getCause() != null ? e.getCause() : e;
    String message = cause.getMessage();
    return cause.getClass().getSimpleName() + (message == null ? "" : ": " + message);
  }
}
