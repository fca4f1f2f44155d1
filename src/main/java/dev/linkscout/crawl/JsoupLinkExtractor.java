package dev.linkscout.crawl;

import java.util.LinkedHashSet;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** {@link LinkExtractor} collecting the raw {@code href} of every {@code <a>} element via jsoup. */
@Component
public class JsoupLinkExtractor implements LinkExtractor {

  private static final Logger log = LoggerFactory.getLogger(JsoupLinkExtractor.class);

  private static final String LINK_QUERY = "a[href]";

  @Override
  public Set<String> extractLinks(String html, String pageUrl) {
    Set<String> links = new LinkedHashSet<>();
    if (html == null || html.isBlank()) {
      return links;
    }
    try {
      Document document = Jsoup.parse(html, pageUrl);
      for (Element anchor : document.select(LINK_QUERY)) {
        String href = anchor.attr("href").strip();
        if (!href.isEmpty()) {
          links.add(href);
        }
      }
    } catch (RuntimeException e) {
      log.debug("Could not parse {} for links: {}", pageUrl, e.getMessage());
      return new LinkedHashSet<>();
    }
    return links;
  }
}
