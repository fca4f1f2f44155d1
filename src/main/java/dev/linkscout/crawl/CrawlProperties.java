package dev.linkscout.crawl;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Crawl settings bound from {@code linkscout.*}. The short command-line aliases ({@code --url},
 * {@code --depth}, {@code --threads}, {@code --timeout}) are mapped in application.yml.
 *
 * <p>Validated at startup; an invalid value stops the application before any request is sent.
 *
 * @param baseUrl URL the crawl starts from; its network location defines what is internal
 * @param maxDepth links found deeper than this many hops are discovered but never fetched
 * @param concurrency number of fetches allowed in flight at once
 * @param fetchTimeout connect and read timeout of each fetch
 * @param userAgent value of the User-Agent request header
 */
@Validated
@ConfigurationProperties(prefix = "linkscout")
public record CrawlProperties(
    @NotBlank(message = "a base URL is required (--url=https://example.com)") String baseUrl,
    @PositiveOrZero int maxDepth,
    @Positive int concurrency,
    @NotNull Duration fetchTimeout,
    @NotBlank String userAgent) {

  public static final int DEFAULT_MAX_DEPTH = 5;
  public static final int DEFAULT_CONCURRENCY = 10;
  public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(10);
  public static final String DEFAULT_USER_AGENT = "LinkScout/1.0";

  /** Defaults for everything but the base URL. */
  static CrawlProperties withDefaults(String baseUrl) {
    return new CrawlProperties(
        baseUrl, DEFAULT_MAX_DEPTH, DEFAULT_CONCURRENCY, DEFAULT_FETCH_TIMEOUT, DEFAULT_USER_AGENT);
  }

  CrawlProperties withMaxDepth(int depth) {
    return new CrawlProperties(baseUrl, depth, concurrency, fetchTimeout, userAgent);
  }

  CrawlProperties withConcurrency(int threads) {
    return new CrawlProperties(baseUrl, maxDepth, threads, fetchTimeout, userAgent);
  }
}
