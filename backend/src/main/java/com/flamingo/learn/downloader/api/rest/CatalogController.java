package com.flamingo.learn.downloader.api.rest;

import com.flamingo.learn.downloader.api.dto.response.CatalogItemResponse;
import com.flamingo.learn.downloader.domain.enums.EntityType;
import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import com.flamingo.learn.downloader.exception.EntityNotFoundException;
import com.flamingo.learn.downloader.service.catalog.CatalogClient;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for catalog search and lookup. */
@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
public class CatalogController {

  static final List<EntityType> DEFAULT_SEARCH_TYPES =
      List.of(EntityType.LEARNING_PATH, EntityType.COURSE, EntityType.MODULE);

  private final CatalogClient catalogClient;

  /**
   * Searches the catalog. A learning path page URL pasted as the query is resolved directly and
   * yields at most one result.
   */
  @GetMapping("/search")
  public ResponseEntity<List<CatalogItemResponse>> search(
      @RequestParam("q") String query,
      @RequestParam(value = "types", required = false) List<String> types) {
    String trimmed = query.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Query must not be blank");
    }

    List<CatalogEntity> results;
    if (isPathUrl(trimmed)) {
      Optional<CatalogEntity> path = catalogClient.resolveByUrl(trimmed);
      results = path.map(List::of).orElse(List.of());
    } else {
      results = catalogClient.searchCatalog(trimmed, parseTypes(types));
    }
    return ResponseEntity.ok(results.stream().map(CatalogItemResponse::fromEntity).toList());
  }

  /** Looks up one entity by type and UID. */
  @GetMapping("/{type}/{uid}")
  public ResponseEntity<CatalogItemResponse> getEntity(
      @PathVariable String type, @PathVariable String uid) {
    EntityType entityType =
        EntityType.fromName(type)
            .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + type));
    CatalogEntity entity =
        catalogClient
            .resolveByUid(uid, entityType)
            .orElseThrow(() -> new EntityNotFoundException(entityType, uid));
    return ResponseEntity.ok(CatalogItemResponse.fromEntity(entity));
  }

  private static boolean isPathUrl(String query) {
    return query.startsWith("http") && query.contains("/paths/");
  }

  private static List<EntityType> parseTypes(List<String> types) {
    if (types == null || types.isEmpty()) {
      return DEFAULT_SEARCH_TYPES;
    }
    return types.stream()
        .flatMap(value -> List.of(value.split(",")).stream())
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .map(
            value ->
                EntityType.fromName(value)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown type: " + value)))
        .distinct()
        .toList();
  }
}
