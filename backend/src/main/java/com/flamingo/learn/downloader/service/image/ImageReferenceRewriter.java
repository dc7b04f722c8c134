package com.flamingo.learn.downloader.service.image;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Points image references in HTML and Markdown at downloaded files. References without a match
 * are left as they are.
 */
@Component
public class ImageReferenceRewriter {

  private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\(([^)]+)\\)");
  private static final List<String> SOURCE_ATTRIBUTES = List.of("src", "data-src", "data-original");
  private static final List<String> LAZY_LOAD_ATTRIBUTES = List.of("data-src", "data-original");

  /**
   * Rewrites {@code img} sources.
   *
   * @param html content markup
   * @param mapping image URL to local file
   * @param imagesSubdir directory prefix for rewritten sources, empty for bare file names
   * @return the rewritten markup
   */
  public String rewriteHtmlReferences(
      String html, Map<String, Path> mapping, String imagesSubdir) {
    if (html == null || html.isBlank() || mapping.isEmpty()) {
      return html;
    }
    ImageReferenceMatcher matcher = new ImageReferenceMatcher(mapping);
    Document document = Jsoup.parseBodyFragment(html);
    document.outputSettings().prettyPrint(false);

    for (Element img : document.select("img")) {
      Optional<Path> local = matcher.match(source(img));
      if (local.isPresent()) {
        img.attr("src", localReference(local.get(), imagesSubdir));
        LAZY_LOAD_ATTRIBUTES.forEach(img::removeAttr);
      }
    }
    return document.body().html();
  }

  /**
   * Rewrites Markdown image targets ({@code ![alt](target)}).
   *
   * @param markdown Markdown text
   * @param mapping image URL to local file
   * @param imagesSubdir directory prefix for rewritten targets, empty for bare file names
   * @return the rewritten text
   */
  public String rewriteMarkdownReferences(
      String markdown, Map<String, Path> mapping, String imagesSubdir) {
    if (markdown == null || markdown.isBlank() || mapping.isEmpty()) {
      return markdown;
    }
    ImageReferenceMatcher matcher = new ImageReferenceMatcher(mapping);
    Matcher images = MARKDOWN_IMAGE.matcher(markdown);
    StringBuilder out = new StringBuilder();
    while (images.find()) {
      String alt = images.group(1);
      String replacement =
          matcher
              .match(images.group(2).trim())
              .map(path -> "![" + alt + "](" + localReference(path, imagesSubdir) + ")")
              .orElse(images.group(0));
      images.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    images.appendTail(out);
    return out.toString();
  }

  private static String source(Element img) {
    for (String attribute : SOURCE_ATTRIBUTES) {
      String value = img.attr(attribute).trim();
      if (!value.isEmpty()) {
        return value;
      }
    }
    return "";
  }

  private static String localReference(Path localPath, String imagesSubdir) {
    String fileName = localPath.getFileName().toString();
    if (imagesSubdir == null || imagesSubdir.isEmpty()) {
      return fileName;
    }
    return imagesSubdir + "/" + fileName;
  }
}
