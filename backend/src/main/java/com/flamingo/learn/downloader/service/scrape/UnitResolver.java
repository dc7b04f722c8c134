package com.flamingo.learn.downloader.service.scrape;

import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import com.flamingo.learn.downloader.service.http.PageFetcher;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds the page URL of a unit. The catalog does not publish unit URLs, so a link harvested from
 * the module page is tried first and then the slug candidates from {@link UnitUrlCandidates}, in
 * order, until one serves real content.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UnitResolver {

  private final PageFetcher pageFetcher;
  private final UnitUrlCandidates urlCandidates;
  private final NotFoundPageDetector notFoundDetector;

  /**
   * Resolves a unit page.
   *
   * @param module the unit's module
   * @param unit the unit
   * @param ordinal 1-based position of the unit in the module
   * @param knownUrl URL from the module page's unit table, {@code null} when not listed
   * @return the first page with real content, empty when every candidate failed
   */
  public Optional<ResolvedPage> resolve(
      CatalogEntity module, CatalogEntity unit, int ordinal, String knownUrl) {
    if (knownUrl != null && !knownUrl.isBlank()) {
      Optional<ResolvedPage> known = tryPage(knownUrl);
      if (known.isPresent()) {
        return known;
      }
      log.debug("Listed URL {} for unit {} did not serve content", knownUrl, unit.uid());
    }

    for (String candidate : urlCandidates.candidates(module, unit, ordinal)) {
      Optional<ResolvedPage> page = tryPage(candidate);
      if (page.isPresent()) {
        log.debug("Unit {} resolved to {}", unit.uid(), candidate);
        return page;
      }
    }

    log.warn("No valid HTML for unit: {} (tried known URL and guesses)", unit.uid());
    return Optional.empty();
  }

  private Optional<ResolvedPage> tryPage(String url) {
    return pageFetcher
        .fetchPage(url, true)
        .filter(notFoundDetector::isRealContent)
        .map(html -> new ResolvedPage(url, html));
  }
}
