package com.flamingo.learn.downloader.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/** Kinds of catalog entities, keyed by the collection name the catalog API uses. */
public enum EntityType {
  LEARNING_PATH("learningPaths", "learningPath", "Learning path"),
  COURSE("courses", "course", "Course"),
  MODULE("modules", "module", "Module"),
  UNIT("units", "unit", "Unit");

  private final String collection;
  private final String itemType;
  private final String displayName;

  EntityType(String collection, String itemType, String displayName) {
    this.collection = collection;
    this.itemType = itemType;
    this.displayName = displayName;
  }

  /** Name of the top-level array in catalog responses and of the {@code type} query value. */
  public String getCollection() {
    return collection;
  }

  /** Singular name used in {@code type} fields of catalog items and download requests. */
  public String getItemType() {
    return itemType;
  }

  public String getDisplayName() {
    return displayName;
  }

  /** Accepts either the singular item type or the collection name. */
  public static Optional<EntityType> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(t -> t.itemType.equalsIgnoreCase(name) || t.collection.equalsIgnoreCase(name))
        .findFirst();
  }
}
