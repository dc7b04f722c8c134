package com.flamingo.learn.downloader.service.output;

import com.flamingo.learn.downloader.domain.enums.OutputFormat;
import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import com.flamingo.learn.downloader.domain.model.ContentRecord;
import com.flamingo.learn.downloader.domain.model.ModuleContent;
import com.flamingo.learn.downloader.service.scrape.Slugs;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Writes one Markdown document: title, table of contents, then every module and unit. */
@Component
@Slf4j
public class MarkdownFormatter implements ContentFormatter {

  @Override
  public OutputFormat format() {
    return OutputFormat.MARKDOWN;
  }

  @Override
  public Path write(CatalogEntity root, List<ModuleContent> modules, Path outputDir) {
    Path target = outputDir.resolve(ContentFormatter.fileStem(root) + ".md");
    try {
      Files.createDirectories(outputDir);
      Files.writeString(target, render(root, modules), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + target, e);
    }
    log.info("Markdown saved to: {}", target);
    return target;
  }

  String render(CatalogEntity root, List<ModuleContent> modules) {
    StringBuilder md = new StringBuilder();
    md.append("# ").append(root.title()).append("\n\n");
    if (!root.summary().isBlank()) {
      md.append(root.summary()).append("\n\n");
    }
    if (root.durationInMinutes() > 0) {
      md.append("**Duration:** ").append(root.durationInMinutes()).append(" minutes\n\n");
    }

    md.append("## Table of Contents\n\n");
    for (int m = 0; m < modules.size(); m++) {
      String title = modules.get(m).module().title();
      md.append(m + 1).append(". [").append(title).append("](#").append(Slugs.slugify(title));
      md.append(")\n");
    }
    md.append("\n---\n\n");

    for (ModuleContent module : modules) {
      md.append("## ").append(module.module().title()).append("\n\n");
      if (!module.module().summary().isBlank()) {
        md.append("*").append(module.module().summary()).append("*\n\n");
      }
      for (ContentRecord record : module.units()) {
        md.append("### ").append(record.unit().title()).append("\n\n");
        String body = record.markdown() == null ? "" : record.markdown().strip();
        if (!body.isEmpty()) {
          md.append(body).append("\n\n");
        }
        if (!record.sourceUrl().isEmpty()) {
          md.append("> Source: <").append(record.sourceUrl()).append(">\n\n");
        }
      }
      md.append("---\n\n");
    }
    return md.toString();
  }
}
