package com.flamingo.learn.downloader.domain.model;

import com.flamingo.learn.downloader.domain.enums.EntityType;
import java.util.List;
import lombok.Builder;

/**
 * A learning path, course, module or unit as described by the catalog.
 *
 * @param uid globally unique identifier
 * @param type entity kind
 * @param title display title
 * @param summary short description (may be empty)
 * @param durationInMinutes estimated duration, 0 when unknown
 * @param url canonical page URL (may be empty, units have none)
 * @param courseNumber exam/course code such as {@code PL-200} (courses only, may be empty)
 * @param childUids ordered child identifiers: modules of a path, units of a module, paths of a
 *     course
 */
@Builder(toBuilder = true)
public record CatalogEntity(
    String uid,
    EntityType type,
    String title,
    String summary,
    int durationInMinutes,
    String url,
    String courseNumber,
    List<String> childUids) {

  public CatalogEntity {
    title = title != null ? title : "";
    summary = summary != null ? summary : "";
    url = url != null ? url : "";
    courseNumber = courseNumber != null ? courseNumber : "";
    childUids = childUids != null ? List.copyOf(childUids) : List.of();
  }
}
