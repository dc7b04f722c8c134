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
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/** Writes a single self-contained HTML page with a table of contents. */
@Component
@Slf4j
public class HtmlFormatter implements ContentFormatter {

  private static final String STYLE =
      "body{font-family:sans-serif;max-width:960px;margin:0 auto;padding:2em;line-height:1.6}"
          + "img{max-width:100%;height:auto}"
          + "pre{background:#f4f4f4;padding:1em;overflow-x:auto}"
          + "table{border-collapse:collapse}td,th{border:1px solid #ccc;padding:.4em}"
          + ".module{page-break-before:always}.unit{margin-bottom:2em}"
          + ".source{font-size:.85em;color:#666}";

  @Override
  public OutputFormat format() {
    return OutputFormat.HTML;
  }

  @Override
  public Path write(CatalogEntity root, List<ModuleContent> modules, Path outputDir) {
    Document document = render(root, modules);
    Path target = outputDir.resolve(ContentFormatter.fileStem(root) + ".html");
    try {
      Files.createDirectories(outputDir);
      Files.writeString(target, document.outerHtml(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + target, e);
    }
    log.info("HTML saved to: {}", target);
    return target;
  }

  Document render(CatalogEntity root, List<ModuleContent> modules) {
    Document document = Document.createShell("");
    document.outputSettings().charset(StandardCharsets.UTF_8);
    document.title(root.title());
    document.head().appendElement("meta").attr("charset", "utf-8");
    document.head().appendElement("style").appendText(STYLE);

    Element body = document.body();
    body.appendElement("h1").text(root.title());
    if (!root.summary().isBlank()) {
      body.appendElement("p").addClass("summary").text(root.summary());
    }

    Element toc = body.appendElement("nav").addClass("toc");
    toc.appendElement("h2").text("Table of Contents");
    Element tocList = toc.appendElement("ol");

    for (int m = 0; m < modules.size(); m++) {
      ModuleContent module = modules.get(m);
      String moduleAnchor = "module-" + (m + 1);
      Element tocItem = tocList.appendElement("li");
      tocItem.appendElement("a").attr("href", "#" + moduleAnchor).text(module.module().title());
      Element unitToc = tocItem.appendElement("ol");

      Element section = body.appendElement("section").addClass("module").attr("id", moduleAnchor);
      section.appendElement("h2").text(module.module().title());
      if (!module.module().summary().isBlank()) {
        section.appendElement("p").addClass("summary").text(module.module().summary());
      }

      for (ContentRecord record : module.units()) {
        String unitAnchor = moduleAnchor + "-" + Slugs.slugify(record.unit().title());
        unitToc
            .appendElement("li")
            .appendElement("a")
            .attr("href", "#" + unitAnchor)
            .text(record.unit().title());

        Element unit = section.appendElement("article").addClass("unit").attr("id", unitAnchor);
        unit.appendElement("h3").text(record.unit().title());
        unit.appendElement("div").addClass("content").append(record.html());
        if (!record.sourceUrl().isEmpty()) {
          Element source = unit.appendElement("p").addClass("source");
          source.appendText("Source: ");
          source.appendElement("a").attr("href", record.sourceUrl()).text(record.sourceUrl());
        }
      }
    }
    return document;
  }
}
