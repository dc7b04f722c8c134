package com.flamingo.learn.downloader.api.dto.response;

import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a catalog entity. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogItemResponse {

  private String uid;
  private String type;
  private String title;
  private String summary;
  private int durationInMinutes;
  private String url;
  private String courseNumber;
  private List<String> childUids;

  public static CatalogItemResponse fromEntity(CatalogEntity entity) {
    return CatalogItemResponse.builder()
        .uid(entity.uid())
        .type(entity.type().getItemType())
        .title(entity.title())
        .summary(entity.summary())
        .durationInMinutes(entity.durationInMinutes())
        .url(entity.url())
        .courseNumber(entity.courseNumber())
        .childUids(entity.childUids())
        .build();
  }
}
