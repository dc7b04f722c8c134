package com.flamingo.learn.downloader.service.catalog;

import com.flamingo.learn.downloader.domain.enums.EntityType;
import java.util.List;

/**
 * Filters for one catalog request.
 *
 * @param type entity collection to fetch, {@code null} for all
 * @param uids identifiers to restrict to, empty for the whole collection
 */
public record CatalogQuery(EntityType type, List<String> uids) {

  public CatalogQuery {
    uids = uids != null ? List.copyOf(uids) : List.of();
  }

  public static CatalogQuery all(EntityType type) {
    return new CatalogQuery(type, List.of());
  }

  public static CatalogQuery byUids(EntityType type, List<String> uids) {
    return new CatalogQuery(type, uids);
  }
}
