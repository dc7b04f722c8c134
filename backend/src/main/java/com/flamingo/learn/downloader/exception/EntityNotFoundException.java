package com.flamingo.learn.downloader.exception;

import com.flamingo.learn.downloader.domain.enums.EntityType;

/** Exception thrown when a required catalog entity does not exist. */
public class EntityNotFoundException extends RuntimeException {

  private final String uid;
  private final EntityType type;

  public EntityNotFoundException(EntityType type, String uid) {
    super(type.getDisplayName() + " not found: " + uid);
    this.uid = uid;
    this.type = type;
  }

  public String getUid() {
    return uid;
  }

  public EntityType getType() {
    return type;
  }
}
