package com.flamingo.learn.downloader.domain.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of one top-level download.
 *
 * @param success whether at least one artifact was produced
 * @param title entity title (or identifier when unresolved)
 * @param downloaded items completed: units for a path or module, paths for a course
 * @param requested items attempted
 * @param files documents written
 * @param message human-readable summary
 */
public record DownloadOutcome(
    boolean success,
    String title,
    int downloaded,
    int requested,
    List<Path> files,
    String message) {

  public DownloadOutcome {
    files = files != null ? List.copyOf(files) : List.of();
  }

  public static DownloadOutcome failure(String title, String message) {
    return new DownloadOutcome(false, title, 0, 0, List.of(), message);
  }
}
