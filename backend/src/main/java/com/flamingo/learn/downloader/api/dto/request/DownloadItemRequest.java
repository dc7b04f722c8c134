package com.flamingo.learn.downloader.api.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.learn.downloader.domain.enums.EntityType;
import com.flamingo.learn.downloader.domain.model.DownloadItem;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One selected catalog item in a download request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadItemRequest {

  private String uid;

  /** Item type or collection name ({@code learningPath}, {@code course}, {@code module}). */
  private String type;

  private String title;

  /** Learning path or course page URL, used instead of {@code uid}. */
  @Pattern(regexp = "https?://\\S+", message = "Item url must be an http(s) URL")
  private String url;

  @JsonIgnore
  @AssertTrue(message = "Item uid or url is required")
  public boolean isIdentified() {
    return (uid != null && !uid.isBlank()) || (url != null && !url.isBlank());
  }

  public DownloadItem toDomain() {
    EntityType entityType =
        type == null || type.isBlank()
            ? EntityType.LEARNING_PATH
            : EntityType.fromName(type)
                .orElseThrow(() -> new IllegalArgumentException("Unknown item type: " + type));
    return new DownloadItem(uid, entityType, title, url);
  }
}
