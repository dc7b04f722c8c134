package com.flamingo.learn.downloader.service.job;

import com.flamingo.learn.downloader.domain.enums.JobStatus;
import java.time.Instant;

/**
 * Snapshot of a batch download job. Instances are immutable; the store replaces them on every
 * transition.
 *
 * @param id job identifier
 * @param status lifecycle state
 * @param progress percentage in {@code [0, 100]}
 * @param message latest human-readable status line
 * @param currentItem title of the item being processed, {@code null} before the first item
 * @param totalItems number of requested items
 * @param successCount items that produced output so far
 * @param createdAt submission time
 * @param updatedAt time of the latest transition
 */
public record DownloadJob(
    String id,
    JobStatus status,
    int progress,
    String message,
    String currentItem,
    int totalItems,
    int successCount,
    Instant createdAt,
    Instant updatedAt) {

  public static DownloadJob queued(String id, int totalItems) {
    Instant now = Instant.now();
    return new DownloadJob(
        id, JobStatus.QUEUED, 0, "Starting...", null, totalItems, 0, now, now);
  }

  public DownloadJob started() {
    return new DownloadJob(
        id,
        JobStatus.RUNNING,
        progress,
        message,
        currentItem,
        totalItems,
        successCount,
        createdAt,
        Instant.now());
  }

  public DownloadJob processing(String item, int percent, String status) {
    return new DownloadJob(
        id,
        JobStatus.RUNNING,
        clamp(percent),
        status,
        item,
        totalItems,
        successCount,
        createdAt,
        Instant.now());
  }

  public DownloadJob itemSucceeded() {
    return new DownloadJob(
        id,
        this.status,
        progress,
        message,
        currentItem,
        totalItems,
        successCount + 1,
        createdAt,
        Instant.now());
  }

  public DownloadJob completed(String summary) {
    return new DownloadJob(
        id,
        JobStatus.COMPLETED,
        100,
        summary,
        currentItem,
        totalItems,
        successCount,
        createdAt,
        Instant.now());
  }

  public DownloadJob failed(String reason) {
    return new DownloadJob(
        id,
        JobStatus.FAILED,
        progress,
        reason,
        currentItem,
        totalItems,
        successCount,
        createdAt,
        Instant.now());
  }

  public boolean isFinished() {
    return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
  }

  private static int clamp(int percent) {
    return Math.max(0, Math.min(100, percent));
  }
}
