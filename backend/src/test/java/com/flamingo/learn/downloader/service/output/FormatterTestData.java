package com.flamingo.learn.downloader.service.output;

import com.flamingo.learn.downloader.domain.enums.EntityType;
import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import com.flamingo.learn.downloader.domain.model.ContentRecord;
import com.flamingo.learn.downloader.domain.model.ModuleContent;
import java.util.List;

/** Shared fixture for formatter tests. */
final class FormatterTestData {

  static final CatalogEntity PATH =
      CatalogEntity.builder()
          .uid("learn.sample-path")
          .type(EntityType.LEARNING_PATH)
          .title("Sample Path: Basics")
          .summary("Learn the basics.")
          .durationInMinutes(45)
          .build();

  private FormatterTestData() {}

  static List<ModuleContent> modules() {
    return List.of(
        module("Getting started", record("Introduction", "<p>Hello</p>", "Hello\n")),
        module(
            "Next steps",
            record(
                "Images",
                "<p><img src=\"images/a_12345678.png\" alt=\"A\"></p>",
                "![A](images/a_12345678.png)\n")));
  }

  private static ModuleContent module(String title, ContentRecord record) {
    CatalogEntity module =
        CatalogEntity.builder().uid("learn." + title).type(EntityType.MODULE).title(title).build();
    return new ModuleContent(module, List.of(record));
  }

  private static ContentRecord record(String title, String html, String markdown) {
    CatalogEntity unit =
        CatalogEntity.builder().uid("learn.u." + title).type(EntityType.UNIT).title(title).build();
    return new ContentRecord(
        unit, "https://learn.example.com/u/" + title, html, title, markdown, List.of());
  }
}
