package com.flamingo.learn.downloader.service.scrape;

import com.flamingo.learn.downloader.config.DownloaderConfig;
import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Generates the ordered list of URLs to try for a unit page when the module page did not
 * provide one. Order: {@code n-slug}, {@code n-title}, {@code slug}, {@code title}, {@code
 * n-cleaned}, {@code cleaned}, {@code n-introduction}; duplicates keep their first position.
 */
@Component
public class UnitUrlCandidates {

  private final Pattern productPrefix;

  public UnitUrlCandidates(DownloaderConfig config) {
    List<String> prefixes = config.getScrape().getSlugPrefixes();
    this.productPrefix =
        prefixes.isEmpty()
            ? null
            : Pattern.compile(
                prefixes.stream().map(Pattern::quote).collect(Collectors.joining("|", "^(", ")-")));
  }

  /**
   * Builds the candidate URLs.
   *
   * @param module the unit's module, its URL is the base
   * @param unit the unit
   * @param ordinal 1-based position of the unit in the module
   * @return candidate URLs in lookup order, empty when the module has no URL or the unit UID has
   *     no slug
   */
  public List<String> candidates(CatalogEntity module, CatalogEntity unit, int ordinal) {
    Optional<String> unitSlug = Slugs.unitSlug(unit.uid());
    if (unitSlug.isEmpty() || module.url().isBlank()) {
      return List.of();
    }
    String slug = unitSlug.get();
    String titleSlug = Slugs.slugify(unit.title());
    String cleaned = cleanSlug(slug);

    // LinkedHashSet keeps first-seen order while dropping repeats
    Set<String> segments = new LinkedHashSet<>();
    segments.add(ordinal + "-" + slug);
    if (!titleSlug.isEmpty()) {
      segments.add(ordinal + "-" + titleSlug);
    }
    segments.add(slug);
    if (!titleSlug.isEmpty()) {
      segments.add(titleSlug);
    }
    if (!cleaned.isEmpty()) {
      segments.add(ordinal + "-" + cleaned);
      segments.add(cleaned);
    }
    segments.add(ordinal + "-introduction");

    String base = Slugs.baseUrl(module.url());
    List<String> urls = new ArrayList<>(segments.size());
    for (String segment : segments) {
      urls.add(base + "/" + segment);
    }
    return urls;
  }

  String cleanSlug(String slug) {
    return productPrefix == null ? slug : productPrefix.matcher(slug).replaceFirst("");
  }
}
