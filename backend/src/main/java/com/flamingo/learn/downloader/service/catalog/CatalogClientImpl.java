package com.flamingo.learn.downloader.service.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.learn.downloader.config.DownloaderConfig;
import com.flamingo.learn.downloader.domain.enums.EntityType;
import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import com.flamingo.learn.downloader.exception.CatalogFetchException;
import com.flamingo.learn.downloader.exception.MalformedCatalogUrlException;
import com.flamingo.learn.downloader.exception.TransientHttpException;
import com.flamingo.learn.downloader.service.http.HttpResult;
import com.flamingo.learn.downloader.service.http.RetryingHttpExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/** Catalog client over the shared retrying HTTP layer. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogClientImpl implements CatalogClient {

  private static final String UID_PREFIX = "learn.";
  private static final Map<String, String> JSON_HEADERS =
      Map.of(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);

  private final RetryingHttpExecutor executor;
  private final CatalogEntityMapper entityMapper;
  private final ObjectMapper objectMapper;
  private final DownloaderConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  public JsonNode fetchCatalog(CatalogQuery query) {
    URI uri = buildUri(query);
    meterRegistry.counter("catalog.requests").increment();

    HttpResult result;
    try {
      result = executor.execute(uri, JSON_HEADERS, false);
    } catch (TransientHttpException e) {
      log.error("Failed to fetch {}: {}", uri, e.getMessage());
      throw new CatalogFetchException(uri.toString(), "Catalog request failed: " + uri, e);
    }

    if (!result.isSuccess()) {
      throw new CatalogFetchException(
          uri.toString(), "Catalog request returned HTTP " + result.status() + ": " + uri);
    }
    try {
      return objectMapper.readTree(result.body());
    } catch (IOException e) {
      throw new CatalogFetchException(uri.toString(), "Unreadable catalog response: " + uri, e);
    }
  }

  @Override
  public List<CatalogEntity> searchCatalog(String query, List<EntityType> types) {
    log.info("Searching catalog for '{}' (types: {})", query, types);

    CatalogSearchMatcher matcher = new CatalogSearchMatcher(query);
    List<CatalogEntity> results = new ArrayList<>();
    for (EntityType type : types) {
      JsonNode data = fetchCatalog(CatalogQuery.all(type));
      for (CatalogEntity entity : entityMapper.mapAll(data, type)) {
        if (matcher.matches(entity)) {
          results.add(entity);
        }
      }
    }
    log.debug("Search for '{}' matched {} items", query, results.size());
    return results;
  }

  @Override
  public Optional<CatalogEntity> resolveByUid(String uid) {
    return resolveByUid(uid, EntityType.LEARNING_PATH);
  }

  @Override
  public Optional<CatalogEntity> resolveByUid(String uid, EntityType type) {
    log.info("Fetching {}: {}", type.getItemType(), uid);

    JsonNode data = fetchCatalog(CatalogQuery.byUids(type, List.of(uid)));
    Optional<CatalogEntity> entity =
        entityMapper.mapAll(data, type).stream()
            .filter(candidate -> candidate.uid().equalsIgnoreCase(uid))
            .findFirst();
    if (entity.isEmpty()) {
      log.warn("{} not found: {}", type.getDisplayName(), uid);
    }
    return entity;
  }

  @Override
  public Optional<CatalogEntity> resolveByUrl(String url) {
    return resolveByUid(learningPathUidFromUrl(url), EntityType.LEARNING_PATH);
  }

  @Override
  public List<CatalogEntity> fetchModules(CatalogEntity path) {
    List<String> moduleUids = path.childUids();
    if (moduleUids.isEmpty()) {
      return List.of();
    }
    log.info("Fetching {} modules...", moduleUids.size());

    JsonNode data = fetchCatalog(CatalogQuery.byUids(EntityType.MODULE, moduleUids));
    return inChildOrder(moduleUids, indexByUid(entityMapper.mapAll(data, EntityType.MODULE)));
  }

  @Override
  public Map<String, List<CatalogEntity>> fetchUnitsForModules(List<CatalogEntity> modules) {
    List<String> allUnitUids =
        modules.stream().flatMap(module -> module.childUids().stream()).distinct().toList();
    if (allUnitUids.isEmpty()) {
      return Map.of();
    }
    log.info("Fetching {} units...", allUnitUids.size());

    int batchSize = Math.max(1, config.getApi().getUnitBatchSize());
    List<CatalogEntity> fetched = new ArrayList<>();
    for (int start = 0; start < allUnitUids.size(); start += batchSize) {
      List<String> batch =
          allUnitUids.subList(start, Math.min(start + batchSize, allUnitUids.size()));
      try {
        JsonNode data = fetchCatalog(CatalogQuery.byUids(EntityType.UNIT, batch));
        fetched.addAll(entityMapper.mapAll(data, EntityType.UNIT));
      } catch (CatalogFetchException e) {
        meterRegistry.counter("catalog.unit_batch.failure").increment();
        log.warn("Failed to fetch batch of {} units: {}", batch.size(), e.getMessage());
      }
    }

    Map<String, CatalogEntity> unitsByUid = indexByUid(fetched);
    Map<String, List<CatalogEntity>> result = new LinkedHashMap<>();
    for (CatalogEntity module : modules) {
      result.put(module.uid(), inChildOrder(module.childUids(), unitsByUid));
    }
    return result;
  }

  /**
   * Derives the conventional learning path UID ({@code learn.<slug>}) from a page URL.
   *
   * @throws MalformedCatalogUrlException when the URL has no slug after a {@code paths} segment
   */
  static String learningPathUidFromUrl(String url) {
    String path = url.split("[?#]", 2)[0].replaceAll("/+$", "");
    List<String> parts = Arrays.asList(path.split("/"));
    int index = parts.indexOf("paths");
    if (index < 0 || index + 1 >= parts.size() || parts.get(index + 1).isEmpty()) {
      throw new MalformedCatalogUrlException(url);
    }
    return UID_PREFIX + parts.get(index + 1);
  }

  private URI buildUri(CatalogQuery query) {
    UriComponentsBuilder builder =
        UriComponentsBuilder.fromUriString(config.getApi().getBaseUrl())
            .queryParam("locale", config.getApi().getLocale());
    if (query.type() != null) {
      builder.queryParam("type", query.type().getCollection());
    }
    if (!query.uids().isEmpty()) {
      builder.queryParam("uid", String.join(",", query.uids()));
    }
    return builder.encode().build().toUri();
  }

  private static Map<String, CatalogEntity> indexByUid(List<CatalogEntity> entities) {
    return entities.stream()
        .collect(
            Collectors.toMap(CatalogEntity::uid, Function.identity(), (a, b) -> a, HashMap::new));
  }

  /** Re-sorts an unordered batch response by the parent's child sequence, dropping absentees. */
  private static List<CatalogEntity> inChildOrder(
      List<String> childUids, Map<String, CatalogEntity> byUid) {
    return childUids.stream().map(byUid::get).filter(Objects::nonNull).toList();
  }
}
