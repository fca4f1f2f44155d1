package dev.linkscout;

import static org.assertj.core.api.Assertions.assertThat;

import dev.linkscout.cli.LinkCheckRunner;
import dev.linkscout.crawl.CrawlProperties;
import dev.linkscout.crawl.CrawlScheduler;
import dev.linkscout.crawl.JsoupLinkExtractor;
import dev.linkscout.crawl.RestClientPageFetcher;
import dev.linkscout.export.ExportProperties;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(
    properties = {
      "url=https://example.com",
      "depth=3",
      "threads=4",
      "timeout=2s",
      "export=out/broken.csv",
      "export-statuses=400,404,500",
      "linkscout.runner.enabled=false"
    })
class LinkScoutApplicationTest {

  @Autowired private ApplicationContext context;

  @Autowired private CrawlProperties crawlProperties;

  @Autowired private ExportProperties exportProperties;

  @Test
  void commandLineAliasesBindToProperties() {
    assertThat(crawlProperties.baseUrl()).isEqualTo("https://example.com");
    assertThat(crawlProperties.maxDepth()).isEqualTo(3);
    assertThat(crawlProperties.concurrency()).isEqualTo(4);
    assertThat(crawlProperties.fetchTimeout()).isEqualTo(Duration.ofSeconds(2));
    assertThat(crawlProperties.userAgent()).isEqualTo(CrawlProperties.DEFAULT_USER_AGENT);
    assertThat(exportProperties.finalExportPath()).contains(Path.of("out/broken.csv"));
    assertThat(exportProperties.realtimeExportPath()).isEmpty();
    assertThat(exportProperties.statuses()).containsExactly(400, 404, 500);
  }

  @Test
  void crawlComponentsAreWired() {
    assertThat(context.getBean(CrawlScheduler.class)).isNotNull();
    assertThat(context.getBean(RestClientPageFetcher.class)).isNotNull();
    assertThat(context.getBean(JsoupLinkExtractor.class)).isNotNull();
    assertThat(context.getBeansOfType(LinkCheckRunner.class)).isEmpty();
  }
}
