package com.flamingo.learn.downloader.service.scrape;

import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import com.flamingo.learn.downloader.domain.model.ContentRecord;
import com.flamingo.learn.downloader.domain.model.ImageRef;
import com.flamingo.learn.downloader.domain.model.ModuleContent;
import com.flamingo.learn.downloader.service.http.PageFetcher;
import com.flamingo.learn.downloader.service.output.HtmlToMarkdownConverter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

/**
 * Scrapes the units of a module, one at a time in module order: resolve the page, extract the
 * content region and its images, and render Markdown alongside the HTML.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModuleScraper {

  private final PageFetcher pageFetcher;
  private final ModulePageParser modulePageParser;
  private final UnitResolver unitResolver;
  private final ContentExtractor contentExtractor;
  private final HtmlToMarkdownConverter markdownConverter;
  private final MeterRegistry meterRegistry;

  /**
   * Scrapes a module's units.
   *
   * @param module the module
   * @param units its units in module order
   * @return content of every unit that resolved, in module order
   */
  public ModuleContent scrapeModule(CatalogEntity module, List<CatalogEntity> units) {
    log.info("Scraping module: {}", module.title());

    Map<String, String> unitLinks = listedUnitLinks(module);
    List<ContentRecord> records = new ArrayList<>();
    for (int i = 0; i < units.size(); i++) {
      CatalogEntity unit = units.get(i);
      log.info("  Unit {}/{}: {}", i + 1, units.size(), unit.title());

      Optional<ContentRecord> record = scrapeUnit(module, unit, i + 1, unitLinks.get(unit.uid()));
      if (record.isPresent()) {
        records.add(record.get());
        meterRegistry.counter("scrape.unit.resolved").increment();
      } else {
        meterRegistry.counter("scrape.unit.unresolved").increment();
      }
    }
    return new ModuleContent(module, records);
  }

  /**
   * Scrapes one unit.
   *
   * @param module the unit's module
   * @param unit the unit
   * @param ordinal 1-based position in the module
   * @param knownUrl URL from the module page, may be {@code null}
   * @return the content record, empty when the page could not be resolved or had no content
   */
  public Optional<ContentRecord> scrapeUnit(
      CatalogEntity module, CatalogEntity unit, int ordinal, String knownUrl) {
    Optional<ResolvedPage> page = unitResolver.resolve(module, unit, ordinal, knownUrl);
    if (page.isEmpty()) {
      return Optional.empty();
    }
    String url = page.get().url();

    Optional<Element> content = contentExtractor.extractMainContent(page.get().html(), url);
    if (content.isEmpty()) {
      log.warn("Could not find main content for unit: {}", url);
      return Optional.empty();
    }

    Element region = content.get();
    List<ImageRef> images = contentExtractor.extractImages(region, url);
    String html = region.outerHtml();
    String text = region.wholeText();
    log.debug(
        "Extracted HTML chars: {}, text chars: {}, images: {}",
        html.length(),
        text.length(),
        images.size());

    return Optional.of(
        new ContentRecord(unit, url, html, text, markdownConverter.convert(html), images));
  }

  private Map<String, String> listedUnitLinks(CatalogEntity module) {
    if (module.url().isBlank()) {
      return Map.of();
    }
    return pageFetcher
        .fetchPage(module.url(), true)
        .map(html -> modulePageParser.unitLinks(html, module.url()))
        .orElse(Map.of());
  }
}
