package com.flamingo.learn.downloader.service.download;

/** Receives progress of a single download, reported once per module or course path. */
@FunctionalInterface
public interface DownloadProgressListener {

  DownloadProgressListener NONE = (completed, total, message) -> {};

  /**
   * Called before each step starts.
   *
   * @param completed steps already finished
   * @param total steps in this download
   * @param message what is being processed now
   */
  void onProgress(int completed, int total, String message);
}
