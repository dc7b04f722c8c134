package com.flamingo.learn.downloader.service.catalog;

import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Decides whether a catalog entity matches a search query. A direct case-insensitive substring
 * match on title, summary, UID or course number wins; otherwise both sides are reduced to
 * lowercase letters and digits and compared again, so {@code PL200} matches {@code PL-200}.
 */
public final class CatalogSearchMatcher {

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");

  private final String query;
  private final String normalizedQuery;

  public CatalogSearchMatcher(String query) {
    this.query = query.toLowerCase(Locale.ROOT);
    this.normalizedQuery = normalize(this.query);
  }

  public boolean matches(CatalogEntity entity) {
    if (fields(entity).anyMatch(field -> field.contains(query))) {
      return true;
    }
    return !normalizedQuery.isEmpty()
        && fields(entity)
            .map(CatalogSearchMatcher::normalize)
            .anyMatch(field -> field.contains(normalizedQuery));
  }

  static String normalize(String value) {
    return NON_ALPHANUMERIC.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
  }

  private static Stream<String> fields(CatalogEntity entity) {
    return Stream.of(entity.title(), entity.summary(), entity.uid(), entity.courseNumber())
        .map(field -> field.toLowerCase(Locale.ROOT));
  }
}
