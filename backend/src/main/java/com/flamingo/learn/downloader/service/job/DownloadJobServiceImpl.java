package com.flamingo.learn.downloader.service.job;

import com.flamingo.learn.downloader.config.DownloaderConfig;
import com.flamingo.learn.downloader.domain.enums.OutputFormat;
import com.flamingo.learn.downloader.domain.model.DownloadItem;
import com.flamingo.learn.downloader.exception.JobNotFoundException;
import com.flamingo.learn.downloader.service.download.DownloadOptions;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link DownloadJobService}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DownloadJobServiceImpl implements DownloadJobService {

  static final String DEFAULT_FOLDER = "download";

  private final JobStore jobStore;
  private final DownloadJobRunner jobRunner;
  private final DownloaderConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  public DownloadJob submit(
      List<DownloadItem> items, String folderName, String outputFormat, Boolean deleteImages) {
    if (items == null || items.isEmpty()) {
      throw new IllegalArgumentException("No items selected");
    }

    DownloadOptions defaults = DownloadOptions.defaults(config);
    DownloadOptions options =
        defaults
            .withOutputDir(resolveOutputDir(folderName))
            .withFormats(OutputFormat.parse(outputFormat))
            .withDeleteImages(deleteImages != null ? deleteImages : defaults.deleteImages());

    DownloadJob job = jobStore.create(items.size());
    meterRegistry.counter("jobs.submitted").increment();
    log.info(
        "Queued job {} with {} items into {} as {}",
        job.id(),
        items.size(),
        options.outputDir(),
        options.formats());

    jobRunner.runAsync(job.id(), List.copyOf(items), options);
    return job;
  }

  @Override
  public DownloadJob getJob(String jobId) {
    return jobStore.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  Path resolveOutputDir(String folderName) {
    Path base = Path.of(config.getStorage().getOutputDir()).toAbsolutePath().normalize();
    String folder = folderName == null || folderName.isBlank() ? DEFAULT_FOLDER : folderName.trim();
    Path resolved = base.resolve(folder).normalize();
    if (!resolved.startsWith(base) || resolved.equals(base)) {
      throw new IllegalArgumentException("Invalid folder name: " + folderName);
    }
    return resolved;
  }
}
