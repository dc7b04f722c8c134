package com.flamingo.learn.downloader.service.job;

import com.flamingo.learn.downloader.domain.model.DownloadItem;
import com.flamingo.learn.downloader.domain.model.DownloadOutcome;
import com.flamingo.learn.downloader.exception.DownloadInterruptedException;
import com.flamingo.learn.downloader.service.download.DownloadOptions;
import com.flamingo.learn.downloader.service.download.DownloadProgressListener;
import com.flamingo.learn.downloader.service.download.DownloadService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Executes a batch job item by item, mirroring progress into the {@link JobStore}. An item that
 * fails or throws is logged and counted as unsuccessful; the batch carries on.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DownloadJobRunner {

  private final DownloadService downloadService;
  private final JobStore jobStore;
  private final MeterRegistry meterRegistry;

  @Async("downloadJobExecutor")
  public void runAsync(String jobId, List<DownloadItem> items, DownloadOptions options) {
    try {
      run(jobId, items, options);
    } catch (Exception e) {
      log.error("Job {} failed: {}", jobId, e.getMessage(), e);
      meterRegistry.counter("jobs.failed").increment();
      jobStore.update(jobId, job -> job.failed("Job failed: " + e.getMessage()));
    }
  }

  /** Runs the batch on the calling thread. */
  public DownloadJob run(String jobId, List<DownloadItem> items, DownloadOptions options) {
    jobStore.update(jobId, DownloadJob::started);
    int total = items.size();
    int succeeded = 0;

    for (int i = 0; i < total; i++) {
      DownloadItem item = items.get(i);
      int itemStart = i * 100 / total;
      String status = String.format("Processing %d/%d: %s", i + 1, total, item.title());
      jobStore.update(jobId, job -> job.processing(item.title(), itemStart, status));

      DownloadProgressListener listener =
          (completed, steps, message) -> {
            int percent = itemStart + (steps == 0 ? 0 : completed * 100 / steps / total);
            jobStore.update(jobId, job -> job.processing(item.title(), percent, status));
          };

      if (downloadItem(item, options, listener)) {
        succeeded++;
        jobStore.update(jobId, DownloadJob::itemSucceeded);
      }
    }

    String summary =
        String.format("Completed. Successfully downloaded %d/%d items.", succeeded, total);
    log.info("Job {}: {}", jobId, summary);
    meterRegistry.counter("jobs.completed").increment();
    return jobStore.update(jobId, job -> job.completed(summary));
  }

  private boolean downloadItem(
      DownloadItem item, DownloadOptions options, DownloadProgressListener listener) {
    try {
      DownloadOutcome outcome =
          item.isByUrl()
              ? downloadService.downloadLearningPathByUrl(item.url(), options, listener)
              : downloadByUid(item, options, listener);
      if (!outcome.success()) {
        log.warn("Item {} not downloaded: {}", item.title(), outcome.message());
      }
      return outcome.success();
    } catch (DownloadInterruptedException e) {
      throw e;
    } catch (RuntimeException e) {
      if (Thread.currentThread().isInterrupted()) {
        throw new DownloadInterruptedException("Download interrupted at " + item.title());
      }
      log.error("Error downloading {}: {}", item.title(), e.getMessage(), e);
      return false;
    }
  }

  private DownloadOutcome downloadByUid(
      DownloadItem item, DownloadOptions options, DownloadProgressListener listener) {
    return switch (item.type()) {
      case COURSE -> downloadService.downloadCourse(item.uid(), options, listener);
      case MODULE -> downloadService.downloadModule(item.uid(), options, listener);
      case LEARNING_PATH -> downloadService.downloadLearningPath(item.uid(), options, listener);
      case UNIT -> DownloadOutcome.failure(item.title(), "Units are not downloadable alone");
    };
  }
}
