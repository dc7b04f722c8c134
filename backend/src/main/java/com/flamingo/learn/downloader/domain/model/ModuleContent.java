package com.flamingo.learn.downloader.domain.model;

import java.util.List;

/**
 * A module with the content of its successfully scraped units, in module order.
 *
 * @param module module metadata
 * @param units unit content, unresolved units omitted
 */
public record ModuleContent(CatalogEntity module, List<ContentRecord> units) {

  public ModuleContent {
    units = List.copyOf(units);
  }

  public List<ImageRef> images() {
    return units.stream().flatMap(unit -> unit.images().stream()).toList();
  }
}
