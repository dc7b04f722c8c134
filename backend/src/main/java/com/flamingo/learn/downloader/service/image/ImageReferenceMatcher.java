package com.flamingo.learn.downloader.service.image;

import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Correlates an image reference found in markup with a downloaded file. First tier: a mapped URL
 * that contains the reference or is contained in it. Second tier: the reference's base name
 * equals either a local file name or the base name of a mapped URL. Within each tier entries are
 * tried in mapping order.
 */
public final class ImageReferenceMatcher {

  private final Map<String, Path> byUrl;
  private final Map<String, Path> byBasename = new HashMap<>();

  public ImageReferenceMatcher(Map<String, Path> mapping) {
    this.byUrl = new LinkedHashMap<>(mapping);
    for (Map.Entry<String, Path> entry : byUrl.entrySet()) {
      Path localPath = entry.getValue();
      byBasename.putIfAbsent(localPath.getFileName().toString(), localPath);
      String urlName = ImageFileNamer.basename(entry.getKey());
      if (!urlName.isEmpty()) {
        byBasename.putIfAbsent(urlName, localPath);
      }
    }
  }

  /**
   * Reorders a mapping so that the given URLs are tried before all others, for example the images
   * a single unit itself references.
   *
   * @param preferredUrls URLs to try first, in order
   * @param mapping image URL to local file
   * @return a new ordered mapping with the same entries
   */
  public static Map<String, Path> preferring(
      Collection<String> preferredUrls, Map<String, Path> mapping) {
    Map<String, Path> ordered = new LinkedHashMap<>();
    for (String url : preferredUrls) {
      Path localPath = mapping.get(url);
      if (localPath != null) {
        ordered.put(url, localPath);
      }
    }
    mapping.forEach(ordered::putIfAbsent);
    return ordered;
  }

  public Optional<Path> match(String reference) {
    if (reference == null || reference.isBlank()) {
      return Optional.empty();
    }
    for (Map.Entry<String, Path> entry : byUrl.entrySet()) {
      String url = entry.getKey();
      if (url.contains(reference) || reference.contains(url)) {
        return Optional.of(entry.getValue());
      }
    }
    String name = ImageFileNamer.basename(reference);
    return name.isEmpty() ? Optional.empty() : Optional.ofNullable(byBasename.get(name));
  }
}
