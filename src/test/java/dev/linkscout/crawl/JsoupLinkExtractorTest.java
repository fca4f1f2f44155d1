package dev.linkscout.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class JsoupLinkExtractorTest {

  private static final String PAGE = "https://example.com/docs";

  private final JsoupLinkExtractor extractor = new JsoupLinkExtractor();

  @Test
  void returnsRawHrefsInDocumentOrder() {
    String html =
        """
        <html><body>
          <a href="/a">A</a>
          <p><a href="b/c">C</a></p>
          <a href="https://other.com/y">Y</a>
        </body></html>
        """;

    assertThat(extractor.extractLinks(html, PAGE))
        .containsExactly("/a", "b/c", "https://other.com/y");
  }

  @Test
  void ignoresAnchorsWithoutHrefAndOtherElements() {
    String html =
        """
        <a name="top">anchor</a>
        <a href="">empty</a>
        <link href="/style.css" rel="stylesheet">
        <img src="/logo.png">
        <a href="  /spaced  ">spaced</a>
        """;

    assertThat(extractor.extractLinks(html, PAGE)).containsExactly("/spaced");
  }

  @Test
  void deduplicatesIdenticalHrefs() {
    String html = "<a href=\"/a\">1</a><a href=\"/a\">2</a><a href=\"/a/\">3</a>";

    assertThat(extractor.extractLinks(html, PAGE)).containsExactly("/a", "/a/");
  }

  @Test
  void keepsNonHttpSchemesForTheScopeFilterToReject() {
    String html = "<a href=\"mailto:team@example.com\">m</a><a href=\"tel:+15551234\">t</a>";

    assertThat(extractor.extractLinks(html, PAGE))
        .containsExactly("mailto:team@example.com", "tel:+15551234");
  }

  @Test
  void toleratesMalformedHtml() {
    String html = "<div><a href=\"/a\">unclosed <b>bold <a href='/b'>next";

    assertThat(extractor.extractLinks(html, PAGE)).containsExactly("/a", "/b");
  }

  @Test
  void blankBodyYieldsNoLinks() {
    assertThat(extractor.extractLinks("   ", PAGE)).isEmpty();
    assertThat(extractor.extractLinks("", PAGE)).isEmpty();
  }
}
