package com.flamingo.learn.downloader.service.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.learn.downloader.domain.enums.EntityType;
import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Client for the remote learning catalog API. */
public interface CatalogClient {

  /**
   * Issues one catalog request.
   *
   * @param query entity type and identifier filters
   * @return the JSON document, top-level arrays keyed by collection name
   * @throws com.flamingo.learn.downloader.exception.CatalogFetchException after retries are
   *     exhausted or on a non-retriable error status
   */
  JsonNode fetchCatalog(CatalogQuery query);

  /**
   * Searches the given collections for a query string.
   *
   * @param query free text, matched case-insensitively and then with punctuation ignored
   * @param types collections to search
   * @return matching entities in catalog order, each at most once
   */
  List<CatalogEntity> searchCatalog(String query, List<EntityType> types);

  /**
   * Looks up a learning path by UID.
   *
   * @param uid the identifier
   * @return the path, empty when the catalog has no such entity
   */
  Optional<CatalogEntity> resolveByUid(String uid);

  /**
   * Looks up an entity of the given kind by UID.
   *
   * @param uid the identifier
   * @param type entity kind
   * @return the entity, empty when the catalog has no such entity
   */
  Optional<CatalogEntity> resolveByUid(String uid, EntityType type);

  /**
   * Resolves a learning path page URL such as {@code .../training/paths/<slug>/}.
   *
   * @param url the page URL
   * @return the path, empty when the catalog has no such entity
   * @throws com.flamingo.learn.downloader.exception.MalformedCatalogUrlException when the URL has
   *     no {@code paths} segment
   */
  Optional<CatalogEntity> resolveByUrl(String url);

  /**
   * Fetches the modules of a learning path in path order. Modules missing from the response are
   * dropped.
   *
   * @param path the learning path
   * @return ordered modules
   */
  List<CatalogEntity> fetchModules(CatalogEntity path);

  /**
   * Fetches the units of several modules in bounded batches. A failed batch is logged and skipped.
   *
   * @param modules the modules
   * @return module UID to units, each list in the module's own order
   */
  Map<String, List<CatalogEntity>> fetchUnitsForModules(List<CatalogEntity> modules);
}
