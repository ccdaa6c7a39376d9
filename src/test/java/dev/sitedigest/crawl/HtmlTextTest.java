package dev.sitedigest.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HtmlTextTest {

  @Test
  void stripsScriptsStylesAndTags() {
    String html =
        """
        <html><head><style>body { color: red; }</style>
        <script type="text/javascript">var x = "<b>";</script></head>
        <body><h1>Title</h1>   <p>First  paragraph.</p></body></html>
        """;

    assertThat(HtmlText.sanitize(html)).isEqualTo("Title First paragraph.");
  }

  @Test
  void attributeContainingAngleBracketDoesNotLeakMarkup() {
    assertThat(HtmlText.sanitize("<p><a title=\"a>b\" href=\"/x\">Link</a></p>"))
        .isEqualTo("Link");
  }

  @Test
  void commentsAreDropped() {
    assertThat(HtmlText.sanitize("<p>Hi<!-- a > b --> there</p>")).isEqualTo("Hi there");
  }

  @Test
  void decodesCommonEntities() {
    assertThat(HtmlText.sanitize("<p>a &lt;b&gt; &quot;c&quot; &#39;d&#39; e&nbsp;f &amp; g</p>"))
        .isEqualTo("a <b> \"c\" 'd' e f & g");
  }

  @Test
  void decodesNamedAndNumericEntities() {
    assertThat(HtmlText.sanitize("<p>Caf&eacute; &#8217;s &copy; &#x20AC;5</p>"))
        .isEqualTo("Café ’s © €5");
  }

  @Test
  void doubleEscapedEntityDecodesOnce() {
    assertThat(HtmlText.sanitize("&amp;lt;")).isEqualTo("&lt;");
  }

  @Test
  void nullOrBlankYieldsEmptyText() {
    assertThat(HtmlText.sanitize(null)).isEmpty();
    assertThat(HtmlText.sanitize("  ")).isEmpty();
  }
}
