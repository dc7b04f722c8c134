package com.flamingo.learn.downloader.service.download;

import com.flamingo.learn.downloader.config.DownloaderConfig;
import com.flamingo.learn.downloader.domain.enums.OutputFormat;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-run download settings.
 *
 * @param formats documents to write, at least one
 * @param outputDir directory receiving documents and the {@code images} folder
 * @param downloadImages whether to fetch images and rewrite references to local copies
 * @param deleteImages whether to remove the {@code images} folder once documents are written
 */
public record DownloadOptions(
    Set<OutputFormat> formats, Path outputDir, boolean downloadImages, boolean deleteImages) {

  public DownloadOptions {
    if (formats == null || formats.isEmpty()) {
      throw new IllegalArgumentException("At least one output format is required");
    }
    formats = Set.copyOf(EnumSet.copyOf(formats));
  }

  /** Options taken from configuration, all formats selected. */
  public static DownloadOptions defaults(DownloaderConfig config) {
    return new DownloadOptions(
        EnumSet.allOf(OutputFormat.class),
        Paths.get(config.getStorage().getOutputDir()),
        config.getDownload().isImages(),
        config.getCleanup().isDeleteImages());
  }

  public DownloadOptions withOutputDir(Path dir) {
    return new DownloadOptions(formats, dir, downloadImages, deleteImages);
  }

  public DownloadOptions withFormats(Set<OutputFormat> selected) {
    return new DownloadOptions(selected, outputDir, downloadImages, deleteImages);
  }

  public DownloadOptions withDeleteImages(boolean delete) {
    return new DownloadOptions(formats, outputDir, downloadImages, delete);
  }
}
