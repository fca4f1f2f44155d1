package dev.linkscout.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link UrlNormalizer}: normalization is idempotent and insensitive to
 * fragments and trailing slashes, whatever the link looks like.
 */
class UrlNormalizerPropertyTest {

  private static final String BASE = "https://example.com/docs/index";

  @Provide
  Arbitrary<String> links() {
    Arbitrary<String> segment = Arbitraries.strings().alpha().numeric().ofMinLength(1).ofMaxLength(8);
    Arbitrary<String> path = segment.list().ofMinSize(0).ofMaxSize(4).map(s -> String.join("/", s));
    Arbitrary<String> prefix = Arbitraries.of("", "/", "./", "../", "https://example.com/");
    Arbitrary<String> suffix = Arbitraries.of("", "/", "//", "#frag", "/#frag", "?q=1", " ");
    return Combinators.combine(prefix, path, suffix).as((p, s, x) -> p + s + x);
  }

  @Property
  void normalizing_a_normalized_url_changes_nothing(@ForAll("links") String link) {
    String once = UrlNormalizer.normalize(BASE, link);

    assertThat(UrlNormalizer.normalize(once, "")).isEqualTo(once);
    assertThat(UrlNormalizer.normalize("", once)).isEqualTo(once);
  }

  @Property
  void arbitrary_text_normalizes_idempotently(@ForAll String text) {
    String once = UrlNormalizer.normalize(text, "");

    assertThat(UrlNormalizer.normalize(once, "")).isEqualTo(once);
  }

  @Property
  void normalized_url_has_no_fragment_or_trailing_slash(@ForAll("links") String link) {
    String normalized = UrlNormalizer.normalize(BASE, link);

    assertThat(normalized).doesNotContain("#").doesNotEndWith("/");
  }

  @Property
  void fragment_and_trailing_slash_do_not_change_the_result(@ForAll("links") String link) {
    String stripped = UrlNormalizer.normalize(BASE, link);

    assertThat(UrlNormalizer.normalize(BASE, stripped + "/#section")).isEqualTo(stripped);
  }
}
