package dev.linkscout.crawl;

import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to check pages.
 *
 * <p>The per-fetch timeout from {@link CrawlProperties#fetchTimeout()} applies to both connecting
 * and reading. Requests go through the JDK {@link HttpClient} with {@link
 * HttpClient.Redirect#NORMAL}: redirects are followed across hosts and from http to https, but
 * never from https down to http. The status checked is the one of the last response in the chain.
 * The client is qualified as {@code "linkCheckRestClient"}.
 */
@Configuration
public class FetchClientConfig {

  /**
   * Creates the REST client injected into {@link RestClientPageFetcher}.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties crawl settings supplying the timeout and User-Agent
   * @return a named REST client bean
   */
  @Bean
  public RestClient linkCheckRestClient(RestClient.Builder builder, CrawlProperties properties) {
    HttpClient httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(properties.fetchTimeout())
            .build();
    var requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.fetchTimeout());

    return builder
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
        .defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
        .build();
  }
}
