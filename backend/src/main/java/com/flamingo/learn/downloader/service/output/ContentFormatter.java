package com.flamingo.learn.downloader.service.output;

import com.flamingo.learn.downloader.domain.enums.OutputFormat;
import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import com.flamingo.learn.downloader.domain.model.ModuleContent;
import com.flamingo.learn.downloader.service.scrape.Slugs;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders acquired content into one document file. Implementations work from the given records
 * only and never touch the network.
 */
public interface ContentFormatter {

  OutputFormat format();

  /**
   * Writes the document.
   *
   * @param root the downloaded path, or a module wrapped as one
   * @param modules module content in path order, image references already local
   * @param outputDir directory receiving the file
   * @return the written file
   * @throws java.io.UncheckedIOException if the file cannot be written
   */
  Path write(CatalogEntity root, List<ModuleContent> modules, Path outputDir);

  /** Base file name for a document: the slugified title, or the UID when the title has none. */
  static String fileStem(CatalogEntity root) {
    String slug = Slugs.slugify(root.title());
    return slug.isEmpty() ? Slugs.slugify(root.uid()) : slug;
  }
}
