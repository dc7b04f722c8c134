package com.flamingo.learn.downloader.service.image;

import com.flamingo.learn.downloader.config.DownloaderConfig;
import com.flamingo.learn.downloader.domain.model.ImageRef;
import com.flamingo.learn.downloader.exception.DownloadInterruptedException;
import com.flamingo.learn.downloader.service.http.PageFetcher;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Downloads the distinct images of a run into {@code <output>/images} on a bounded worker pool.
 * Files already present are reused without a request, so repeated runs only fetch what is
 * missing. A failed image is left out of the mapping and never affects the others.
 */
@Service
@Slf4j
public class ImageMaterializer {

  public static final String IMAGES_DIR = "images";

  private final PageFetcher pageFetcher;
  private final MeterRegistry meterRegistry;
  private final int maxConcurrentDownloads;

  public ImageMaterializer(
      PageFetcher pageFetcher, DownloaderConfig config, MeterRegistry meterRegistry) {
    this.pageFetcher = pageFetcher;
    this.meterRegistry = meterRegistry;
    this.maxConcurrentDownloads = Math.max(1, config.getDownload().getMaxConcurrentDownloads());
  }

  /**
   * Downloads images.
   *
   * @param images image references, duplicates by URL allowed
   * @param outputRoot run output directory
   * @return absolute image URL to local file, in first-reference order, failed images absent
   * @throws DownloadInterruptedException if the calling thread is interrupted while waiting
   */
  public Map<String, Path> materialize(List<ImageRef> images, Path outputRoot) {
    Map<String, ImageRef> distinct = new LinkedHashMap<>();
    for (ImageRef image : images) {
      distinct.putIfAbsent(image.url(), image);
    }
    if (distinct.isEmpty()) {
      return Map.of();
    }

    Path imagesDir = outputRoot.resolve(IMAGES_DIR);
    try {
      Files.createDirectories(imagesDir);
    } catch (IOException e) {
      log.error("Cannot create image directory {}: {}", imagesDir, e.getMessage());
      return Map.of();
    }
    log.info("Downloading {} images...", distinct.size());

    ExecutorService pool =
        Executors.newFixedThreadPool(
            Math.min(maxConcurrentDownloads, distinct.size()),
            new CustomizableThreadFactory("image-download-"));
    Map<String, Future<Optional<Path>>> pending = new LinkedHashMap<>();
    try {
      for (ImageRef image : distinct.values()) {
        pending.put(image.url(), pool.submit(() -> downloadOne(image, imagesDir)));
      }

      Map<String, Path> mapping = new LinkedHashMap<>();
      for (Map.Entry<String, Future<Optional<Path>>> entry : pending.entrySet()) {
        try {
          entry.getValue().get().ifPresent(path -> mapping.put(entry.getKey(), path));
        } catch (ExecutionException e) {
          meterRegistry.counter("images.failed").increment();
          log.warn("Error downloading {}: {}", entry.getKey(), e.getCause().getMessage());
        }
      }
      log.info("Downloaded {} images successfully", mapping.size());
      return Collections.unmodifiableMap(mapping);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DownloadInterruptedException("Interrupted while downloading images", e);
    } finally {
      pool.shutdownNow();
    }
  }

  /** Fetches one image unless its file already exists. */
  Optional<Path> downloadOne(ImageRef image, Path imagesDir) throws IOException {
    Path target = imagesDir.resolve(ImageFileNamer.fileName(image.url()));
    if (Files.exists(target)) {
      meterRegistry.counter("images.reused").increment();
      return Optional.of(target);
    }

    Optional<byte[]> data = pageFetcher.fetchImage(image.url(), image.referer());
    if (data.isEmpty()) {
      meterRegistry.counter("images.failed").increment();
      return Optional.empty();
    }

    // write beside the target and rename, so an interrupted write is never reused
    Path partial = imagesDir.resolve(target.getFileName() + ".part");
    Files.write(partial, data.get());
    Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
    meterRegistry.counter("images.downloaded").increment();
    return Optional.of(target);
  }
}
