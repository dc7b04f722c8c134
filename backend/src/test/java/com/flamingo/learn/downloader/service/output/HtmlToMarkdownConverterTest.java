package com.flamingo.learn.downloader.service.output;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HtmlToMarkdownConverter Tests")
class HtmlToMarkdownConverterTest {

  private final HtmlToMarkdownConverter converter = new HtmlToMarkdownConverter();

  @Test
  @DisplayName("Should convert headings, paragraphs, emphasis and links")
  void shouldConvertBasicMarkup() {
    String html =
        "<div><h2>Create a flow</h2><p>Use <strong>Power Automate</strong> to <em>automate</em>"
            + " work, see <a href=\"https://learn.example.com/docs\">the docs</a>.</p></div>";

    assertThat(converter.convert(html))
        .isEqualTo(
            "## Create a flow\n\nUse **Power Automate** to *automate* work, see"
                + " [the docs](https://learn.example.com/docs).\n");
  }

  @Test
  @DisplayName("Should render nested lists with indentation")
  void shouldConvertNestedLists() {
    String html = "<ul><li>One<ul><li>Inner</li></ul></li><li>Two</li></ul><ol><li>First</li></ol>";

    assertThat(converter.convert(html)).isEqualTo("- One\n  - Inner\n- Two\n\n1. First\n");
  }

  @Test
  @DisplayName("Should fence preformatted code and keep inline code")
  void shouldConvertCode() {
    String html = "<p>Run <code>az login</code></p><pre><code>line1\n  line2\n</code></pre>";

    assertThat(converter.convert(html))
        .isEqualTo("Run `az login`\n\n```\nline1\n  line2\n```\n");
  }

  @Test
  @DisplayName("Should render tables as pipe rows with a header separator")
  void shouldConvertTables() {
    String html =
        "<table><tr><th>Name</th><th>Value</th></tr><tr><td>a</td><td>1</td></tr></table>";

    assertThat(converter.convert(html))
        .isEqualTo("| Name | Value |\n| --- | --- |\n| a | 1 |\n");
  }

  @Test
  @DisplayName("Should keep image sources and drop in-page anchors")
  void shouldConvertImagesAndAnchors() {
    String html =
        "<p><img src=\"../media/flow.png\" alt=\"Flow\"> <a href=\"#next\">Next</a></p><hr>";

    assertThat(converter.convert(html)).isEqualTo("![Flow](../media/flow.png) Next\n\n---\n");
  }

  @Test
  @DisplayName("Should prefix block quotes and ignore scripts")
  void shouldConvertQuotes() {
    String html = "<blockquote><p>Note this.</p></blockquote><script>x()</script>";

    assertThat(converter.convert(html)).isEqualTo("> Note this.\n");
  }

  @Test
  @DisplayName("Should return empty text for blank input")
  void shouldHandleBlankInput() {
    assertThat(converter.convert("  ")).isEmpty();
    assertThat(converter.convert(null)).isEmpty();
  }
}
