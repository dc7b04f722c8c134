package com.flamingo.learn.downloader.domain.model;

import java.util.List;

/**
 * Normalized content of one scraped unit.
 *
 * @param unit unit metadata from the catalog
 * @param sourceUrl page the content was taken from (empty when the region was not found)
 * @param html sanitized main-content markup
 * @param text plain text of the content region
 * @param markdown Markdown rendition of {@code html}
 * @param images content images in document order
 */
public record ContentRecord(
    CatalogEntity unit,
    String sourceUrl,
    String html,
    String text,
    String markdown,
    List<ImageRef> images) {

  public ContentRecord {
    images = images != null ? List.copyOf(images) : List.of();
  }

  /** Returns a copy whose markup references local image files. */
  public ContentRecord withRewrittenReferences(String rewrittenHtml, String rewrittenMarkdown) {
    return new ContentRecord(unit, sourceUrl, rewrittenHtml, text, rewrittenMarkdown, images);
  }
}
