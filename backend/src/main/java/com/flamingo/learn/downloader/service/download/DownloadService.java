package com.flamingo.learn.downloader.service.download;

import com.flamingo.learn.downloader.domain.enums.EntityType;
import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import com.flamingo.learn.downloader.domain.model.ContentRecord;
import com.flamingo.learn.downloader.domain.model.DownloadOutcome;
import com.flamingo.learn.downloader.domain.model.ImageRef;
import com.flamingo.learn.downloader.domain.model.ModuleContent;
import com.flamingo.learn.downloader.exception.DownloadInterruptedException;
import com.flamingo.learn.downloader.service.catalog.CatalogClient;
import com.flamingo.learn.downloader.service.http.PageFetcher;
import com.flamingo.learn.downloader.service.image.ImageMaterializer;
import com.flamingo.learn.downloader.service.image.ImageReferenceMatcher;
import com.flamingo.learn.downloader.service.image.ImageReferenceRewriter;
import com.flamingo.learn.downloader.service.output.ContentFormatter;
import com.flamingo.learn.downloader.service.scrape.ModulePageParser;
import com.flamingo.learn.downloader.service.scrape.ModuleScraper;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * Runs the acquisition pipeline for one top-level entity: resolve the catalog tree, scrape every
 * module's units in order, download the union of images once, rewrite references, and hand the
 * records to the selected formatters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DownloadService {

  private static final String COURSES_SEGMENT = "/courses/";

  private final CatalogClient catalogClient;
  private final ModuleScraper moduleScraper;
  private final PageFetcher pageFetcher;
  private final ModulePageParser modulePageParser;
  private final ImageMaterializer imageMaterializer;
  private final ImageReferenceRewriter referenceRewriter;
  private final List<ContentFormatter> formatters;
  private final MeterRegistry meterRegistry;

  @Timed(value = "download.learning_path", description = "Time to download a learning path")
  public DownloadOutcome downloadLearningPath(
      String uid, DownloadOptions options, DownloadProgressListener listener) {
    Optional<CatalogEntity> path = catalogClient.resolveByUid(uid, EntityType.LEARNING_PATH);
    if (path.isEmpty()) {
      return failed(uid, "Learning path not found: " + uid);
    }
    return downloadPath(path.get(), options, listener);
  }

  /**
   * Downloads from a page URL. Course pages ({@code /courses/}) are downloaded as courses,
   * anything else is resolved as a learning path.
   */
  @Timed(value = "download.url", description = "Time to download from a page URL")
  public DownloadOutcome downloadLearningPathByUrl(
      String url, DownloadOptions options, DownloadProgressListener listener) {
    if (url.contains(COURSES_SEGMENT)) {
      return downloadCourseByUrl(url, options, listener);
    }
    Optional<CatalogEntity> path = catalogClient.resolveByUrl(url);
    if (path.isEmpty()) {
      return failed(url, "No learning path found for URL: " + url);
    }
    return downloadPath(path.get(), options, listener);
  }

  /** Downloads a single module, presented to the formatters as a one-module path. */
  @Timed(value = "download.module", description = "Time to download a module")
  public DownloadOutcome downloadModule(
      String uid, DownloadOptions options, DownloadProgressListener listener) {
    Optional<CatalogEntity> found = catalogClient.resolveByUid(uid, EntityType.MODULE);
    if (found.isEmpty()) {
      return failed(uid, "Module not found: " + uid);
    }
    CatalogEntity module = found.get();
    log.info("Found module: {}", module.title());

    List<CatalogEntity> units =
        catalogClient.fetchUnitsForModules(List.of(module)).getOrDefault(module.uid(), List.of());
    if (units.isEmpty()) {
      return failed(module.title(), "No units found for this module");
    }

    listener.onProgress(0, 1, "Module: " + module.title());
    ModuleContent content = moduleScraper.scrapeModule(module, units);
    CatalogEntity wrapper =
        module.toBuilder().type(EntityType.LEARNING_PATH).childUids(List.of(module.uid())).build();
    return finish(wrapper, List.of(content), units.size(), options);
  }

  @Timed(value = "download.course", description = "Time to download a course")
  public DownloadOutcome downloadCourse(
      String uid, DownloadOptions options, DownloadProgressListener listener) {
    Optional<CatalogEntity> course = catalogClient.resolveByUid(uid, EntityType.COURSE);
    if (course.isEmpty()) {
      return failed(uid, "Course not found: " + uid);
    }
    CatalogEntity found = course.get();
    log.info("Found course: {}", found.title());
    return downloadCoursePaths(found.title(), found.childUids(), uid, options, listener);
  }

  /** Downloads every learning path listed on a course page. */
  public DownloadOutcome downloadCourseByUrl(
      String url, DownloadOptions options, DownloadProgressListener listener) {
    String courseId = lastSegment(url);
    Optional<String> html = pageFetcher.fetchPage(url, false);
    if (html.isEmpty()) {
      return failed(courseId, "Course page not found: " + url);
    }
    List<String> pathUids = modulePageParser.courseLearningPathUids(html.get());
    return downloadCoursePaths(courseId, pathUids, courseId, options, listener);
  }

  private DownloadOutcome downloadCoursePaths(
      String title,
      List<String> pathUids,
      String courseId,
      DownloadOptions options,
      DownloadProgressListener listener) {
    if (pathUids.isEmpty()) {
      return failed(title, "No learning paths found for course " + courseId);
    }
    log.info("Found {} learning paths in course {}", pathUids.size(), courseId);

    DownloadOptions courseOptions = options.withOutputDir(options.outputDir().resolve(courseId));
    // self-invocation skips the @Timed proxy
    Timer coursePathTimer =
        Timer.builder("download.course.learning_path")
            .description("Time to download one learning path of a course")
            .register(meterRegistry);
    List<Path> files = new ArrayList<>();
    int succeeded = 0;
    for (int i = 0; i < pathUids.size(); i++) {
      checkInterrupted();
      String pathUid = pathUids.get(i);
      listener.onProgress(i, pathUids.size(), "Learning path: " + pathUid);
      try {
        DownloadOutcome outcome =
            coursePathTimer.record(
                () -> downloadLearningPath(pathUid, courseOptions, DownloadProgressListener.NONE));
        if (outcome.success()) {
          succeeded++;
          files.addAll(outcome.files());
        }
      } catch (DownloadInterruptedException e) {
        throw e;
      } catch (RuntimeException e) {
        if (Thread.currentThread().isInterrupted()) {
          throw new DownloadInterruptedException("Download interrupted at " + pathUid);
        }
        log.error("Failed to download learning path {}: {}", pathUid, e.getMessage(), e);
      }
    }

    String message =
        String.format(
            "Downloaded %d/%d learning paths for course %s", succeeded, pathUids.size(), courseId);
    log.info(message);
    if (succeeded == 0) {
      meterRegistry.counter("download.failure").increment();
      return new DownloadOutcome(false, title, 0, pathUids.size(), List.of(), message);
    }
    meterRegistry.counter("download.success").increment();
    return new DownloadOutcome(true, title, succeeded, pathUids.size(), files, message);
  }

  private DownloadOutcome downloadPath(
      CatalogEntity path, DownloadOptions options, DownloadProgressListener listener) {
    log.info(
        "Found learning path: {} ({} modules, {} minutes)",
        path.title(),
        path.childUids().size(),
        path.durationInMinutes());

    List<CatalogEntity> modules = catalogClient.fetchModules(path);
    if (modules.isEmpty()) {
      return failed(path.title(), "No modules found for this learning path");
    }
    Map<String, List<CatalogEntity>> unitsByModule = catalogClient.fetchUnitsForModules(modules);

    List<ModuleContent> contents = new ArrayList<>();
    int requestedUnits = 0;
    for (int i = 0; i < modules.size(); i++) {
      checkInterrupted();
      CatalogEntity module = modules.get(i);
      listener.onProgress(i, modules.size(), "Module: " + module.title());

      List<CatalogEntity> units = unitsByModule.getOrDefault(module.uid(), List.of());
      if (units.isEmpty()) {
        log.warn("No units found for module {}", module.uid());
        continue;
      }
      requestedUnits += units.size();
      contents.add(moduleScraper.scrapeModule(module, units));
    }
    return finish(path, contents, requestedUnits, options);
  }

  /** Downloads images, rewrites references, writes every selected format. */
  private DownloadOutcome finish(
      CatalogEntity root,
      List<ModuleContent> contents,
      int requestedUnits,
      DownloadOptions options) {
    int downloadedUnits = contents.stream().mapToInt(module -> module.units().size()).sum();
    if (downloadedUnits == 0) {
      return failed(root.title(), "No unit content could be downloaded");
    }

    Map<String, Path> imageMapping = Map.of();
    List<ModuleContent> localized = contents;
    if (options.downloadImages()) {
      List<ImageRef> images = contents.stream().flatMap(m -> m.images().stream()).toList();
      imageMapping = imageMaterializer.materialize(images, options.outputDir());
      localized = rewriteReferences(contents, imageMapping);
    }

    List<Path> files = new ArrayList<>();
    for (ContentFormatter formatter : formatters) {
      if (options.formats().contains(formatter.format())) {
        files.add(formatter.write(root, localized, options.outputDir()));
      }
    }

    if (options.deleteImages() && !imageMapping.isEmpty()) {
      deleteImages(options.outputDir().resolve(ImageMaterializer.IMAGES_DIR));
    }

    meterRegistry.counter("download.success").increment();
    String message =
        String.format(
            "Downloaded %d/%d units of %s", downloadedUnits, requestedUnits, root.title());
    log.info(message);
    return new DownloadOutcome(true, root.title(), downloadedUnits, requestedUnits, files, message);
  }

  private List<ModuleContent> rewriteReferences(
      List<ModuleContent> contents, Map<String, Path> mapping) {
    if (mapping.isEmpty()) {
      return contents;
    }
    List<ModuleContent> rewritten = new ArrayList<>(contents.size());
    for (ModuleContent module : contents) {
      List<ContentRecord> units = new ArrayList<>(module.units().size());
      for (ContentRecord record : module.units()) {
        // a unit's own images win over same-named images of other units
        Map<String, Path> recordMapping =
            ImageReferenceMatcher.preferring(
                record.images().stream().map(ImageRef::url).toList(), mapping);
        units.add(
            record.withRewrittenReferences(
                referenceRewriter.rewriteHtmlReferences(
                    record.html(), recordMapping, ImageMaterializer.IMAGES_DIR),
                referenceRewriter.rewriteMarkdownReferences(
                    record.markdown(), recordMapping, ImageMaterializer.IMAGES_DIR)));
      }
      rewritten.add(new ModuleContent(module.module(), units));
    }
    return rewritten;
  }

  private void deleteImages(Path imagesDir) {
    log.info("Cleaning up images folder {}", imagesDir);
    try {
      FileSystemUtils.deleteRecursively(imagesDir);
    } catch (IOException e) {
      log.warn("Failed to delete images folder {}: {}", imagesDir, e.getMessage());
    }
  }

  private DownloadOutcome failed(String title, String message) {
    log.error(message);
    meterRegistry.counter("download.failure").increment();
    return DownloadOutcome.failure(title, message);
  }

  private static void checkInterrupted() {
    if (Thread.currentThread().isInterrupted()) {
      throw new DownloadInterruptedException("Download interrupted");
    }
  }

  private static String lastSegment(String url) {
    String trimmed = url.split("[?#]", 2)[0].replaceAll("/+$", "");
    return trimmed.substring(trimmed.lastIndexOf('/') + 1);
  }
}
