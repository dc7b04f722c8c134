package com.flamingo.learn.downloader.domain.model;

import com.flamingo.learn.downloader.domain.enums.EntityType;

/**
 * One entry of a batch download request.
 *
 * @param uid catalog identifier, may be {@code null} when {@code url} is given
 * @param type entity kind, learning path when unspecified
 * @param title display title used for progress reporting
 * @param url learning path or course page URL, {@code null} to download by UID
 */
public record DownloadItem(String uid, EntityType type, String title, String url) {

  public DownloadItem {
    url = url != null && !url.isBlank() ? url.trim() : null;
    type = type != null ? type : EntityType.LEARNING_PATH;
    if (title == null || title.isBlank()) {
      title = uid != null && !uid.isBlank() ? uid : url;
    }
  }

  public DownloadItem(String uid, EntityType type, String title) {
    this(uid, type, title, null);
  }

  public boolean isByUrl() {
    return url != null;
  }
}
