package com.flamingo.learn.downloader.service.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.learn.downloader.config.DownloaderConfig;
import com.flamingo.learn.downloader.domain.enums.EntityType;
import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps catalog API items to {@link CatalogEntity}. Relative page URLs are resolved against the
 * configured content site.
 */
@Component
@Slf4j
public class CatalogEntityMapper {

  private final URI contentBase;

  public CatalogEntityMapper(DownloaderConfig config) {
    String base = config.getApi().getContentBaseUrl();
    this.contentBase = URI.create(base.endsWith("/") ? base : base + "/");
  }

  /**
   * Maps every item of the response array for {@code type}.
   *
   * @param document catalog response
   * @param type collection to read
   * @return entities in response order; items without a UID are skipped
   */
  public List<CatalogEntity> mapAll(JsonNode document, EntityType type) {
    List<CatalogEntity> entities = new ArrayList<>();
    for (JsonNode item : document.path(type.getCollection())) {
      String uid = item.path("uid").asText("");
      if (!uid.isEmpty()) {
        entities.add(map(item, type));
      }
    }
    return entities;
  }

  public CatalogEntity map(JsonNode item, EntityType type) {
    return CatalogEntity.builder()
        .uid(item.path("uid").asText(""))
        .type(type)
        .title(item.path("title").asText(""))
        .summary(item.path("summary").asText(""))
        .durationInMinutes(item.path("duration_in_minutes").asInt(0))
        .url(absoluteUrl(item.path("url").asText("")))
        .courseNumber(item.path("course_number").asText(""))
        .childUids(childUids(item, type))
        .build();
  }

  String absoluteUrl(String url) {
    if (url.isBlank()) {
      return "";
    }
    try {
      return contentBase.resolve(url.trim()).toString();
    } catch (IllegalArgumentException e) {
      log.debug("Keeping unparseable catalog URL as is: {}", url);
      return url;
    }
  }

  private List<String> childUids(JsonNode item, EntityType type) {
    return switch (type) {
      case LEARNING_PATH -> textValues(item.path("modules"));
      case MODULE -> textValues(item.path("units"));
      case COURSE -> studyGuidePaths(item.path("study_guide"));
      case UNIT -> List.of();
    };
  }

  private List<String> textValues(JsonNode array) {
    List<String> values = new ArrayList<>();
    for (JsonNode node : array) {
      if (node.isTextual() && !node.asText().isEmpty()) {
        values.add(node.asText());
      }
    }
    return values;
  }

  private List<String> studyGuidePaths(JsonNode studyGuide) {
    List<String> uids = new ArrayList<>();
    for (JsonNode entry : studyGuide) {
      if (EntityType.LEARNING_PATH.getItemType().equals(entry.path("type").asText())) {
        String uid = entry.path("uid").asText("");
        if (!uid.isEmpty()) {
          uids.add(uid);
        }
      }
    }
    return uids;
  }
}
