package com.flamingo.learn.downloader.service.output;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

/**
 * Converts sanitized content markup to Markdown: ATX headings, paragraphs, nested lists, links,
 * images, emphasis, inline and fenced code, block quotes, pipe tables and rules. Unknown elements
 * contribute their children.
 */
@Component
public class HtmlToMarkdownConverter {

  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{3,}");
  private static final Pattern TRAILING_SPACES = Pattern.compile("[ \t]+\n");
  private static final Set<String> BLOCK_CONTAINERS =
      Set.of("div", "section", "article", "main", "aside", "figure", "figcaption", "details");
  private static final List<String> IMAGE_SOURCES = List.of("src", "data-src", "data-original");

  public String convert(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    Element body = Jsoup.parseBodyFragment(html).body();
    StringBuilder out = new StringBuilder();
    renderChildren(body, out, 0);
    String markdown = TRAILING_SPACES.matcher(out.toString()).replaceAll("\n");
    markdown = EXCESS_BLANK_LINES.matcher(markdown).replaceAll("\n\n").strip();
    return markdown.isEmpty() ? "" : markdown + "\n";
  }

  private void renderChildren(Element parent, StringBuilder out, int listDepth) {
    for (Node child : parent.childNodes()) {
      render(child, out, listDepth);
    }
  }

  private void render(Node node, StringBuilder out, int listDepth) {
    if (node instanceof TextNode textNode) {
      out.append(collapse(textNode.getWholeText()));
      return;
    }
    if (!(node instanceof Element element)) {
      return;
    }
    String tag = element.normalName();
    switch (tag) {
      case "h1", "h2", "h3", "h4", "h5", "h6" -> {
        int level = tag.charAt(1) - '0';
        block(out, "#".repeat(level) + " " + inline(element));
      }
      case "p" -> block(out, inline(element));
      case "br" -> out.append("  \n");
      case "hr" -> block(out, "---");
      case "ul", "ol" -> renderList(element, out, listDepth);
      case "pre" -> block(out, "```\n" + element.wholeText().stripTrailing() + "\n```");
      case "code" -> out.append('`').append(element.text()).append('`');
      case "strong", "b" -> wrap(out, "**", inline(element));
      case "em", "i" -> wrap(out, "*", inline(element));
      case "a" -> renderLink(element, out);
      case "img" -> renderImage(element, out);
      case "blockquote" -> renderQuote(element, out);
      case "table" -> renderTable(element, out);
      case "script", "style" -> {
        // never content
      }
      default -> {
        if (BLOCK_CONTAINERS.contains(tag)) {
          out.append("\n\n");
          renderChildren(element, out, listDepth);
          out.append("\n\n");
        } else {
          renderChildren(element, out, listDepth);
        }
      }
    }
  }

  private void renderList(Element list, StringBuilder out, int depth) {
    boolean ordered = list.normalName().equals("ol");
    String indent = "  ".repeat(depth);
    if (depth == 0) {
      out.append("\n\n");
    }
    int number = 1;
    for (Element item : list.children()) {
      if (!item.normalName().equals("li")) {
        continue;
      }
      StringBuilder text = new StringBuilder();
      StringBuilder nested = new StringBuilder();
      for (Node child : item.childNodes()) {
        if (child instanceof Element childElement
            && (childElement.normalName().equals("ul") || childElement.normalName().equals("ol"))) {
          renderList(childElement, nested, depth + 1);
        } else {
          render(child, text, depth + 1);
        }
      }
      String marker = ordered ? (number++) + ". " : "- ";
      out.append(indent)
          .append(marker)
          .append(singleLine(text.toString()))
          .append('\n')
          .append(nested);
    }
    if (depth == 0) {
      out.append('\n');
    }
  }

  private void renderLink(Element link, StringBuilder out) {
    String text = inline(link);
    String href = link.attr("href").trim();
    if (href.isEmpty() || href.startsWith("#")) {
      out.append(text);
      return;
    }
    String target = link.absUrl("href");
    out.append('[').append(text).append("](").append(target.isEmpty() ? href : target).append(')');
  }

  private void renderImage(Element img, StringBuilder out) {
    for (String attribute : IMAGE_SOURCES) {
      String src = img.attr(attribute).trim();
      if (!src.isEmpty()) {
        out.append("![").append(img.attr("alt").trim()).append("](").append(src).append(')');
        return;
      }
    }
  }

  private void renderQuote(Element quote, StringBuilder out) {
    StringBuilder inner = new StringBuilder();
    renderChildren(quote, inner, 0);
    String body = EXCESS_BLANK_LINES.matcher(inner.toString()).replaceAll("\n\n").strip();
    block(out, "> " + body.replace("\n", "\n> "));
  }

  private void renderTable(Element table, StringBuilder out) {
    StringBuilder rows = new StringBuilder();
    boolean header = true;
    for (Element row : table.select("tr")) {
      List<String> cells = row.select("th, td").eachText();
      if (cells.isEmpty()) {
        continue;
      }
      rows.append("| ").append(String.join(" | ", cells)).append(" |\n");
      if (header) {
        rows.append('|').append(" --- |".repeat(cells.size())).append('\n');
        header = false;
      }
    }
    block(out, rows.toString().stripTrailing());
  }

  private String inline(Element element) {
    StringBuilder inner = new StringBuilder();
    renderChildren(element, inner, 0);
    return singleLine(inner.toString());
  }

  private static String singleLine(String text) {
    return text.replaceAll("\\s*\n\\s*", " ").strip();
  }

  private static void wrap(StringBuilder out, String marker, String text) {
    if (!text.isEmpty()) {
      out.append(marker).append(text).append(marker);
    }
  }

  private static void block(StringBuilder out, String text) {
    if (!text.isBlank()) {
      out.append("\n\n").append(text).append("\n\n");
    }
  }

  private static String collapse(String text) {
    return text.replaceAll("\\s+", " ");
  }
}
