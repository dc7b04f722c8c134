package com.flamingo.learn.downloader.service.job;

import com.flamingo.learn.downloader.domain.model.DownloadItem;
import java.util.List;

/** Service interface for batch download jobs. */
public interface DownloadJobService {

  /**
   * Queues a batch and starts it in the background.
   *
   * @param items entities to download, at least one
   * @param folderName sub-folder of the configured output directory, {@code download} when blank
   * @param outputFormat comma-separated formats or {@code all}, all formats when blank
   * @param deleteImages whether to remove downloaded images after formatting, configured default
   *     when {@code null}
   * @return the queued job
   * @throws IllegalArgumentException if items are empty, the folder escapes the output directory,
   *     or no supported format is named
   */
  DownloadJob submit(
      List<DownloadItem> items, String folderName, String outputFormat, Boolean deleteImages);

  /**
   * Gets a job snapshot.
   *
   * @param jobId the job id
   * @return current snapshot
   * @throws com.flamingo.learn.downloader.exception.JobNotFoundException if not found
   */
  DownloadJob getJob(String jobId);
}
