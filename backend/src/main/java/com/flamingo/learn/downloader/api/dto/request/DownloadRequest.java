package com.flamingo.learn.downloader.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting a batch download. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadRequest {

  @NotEmpty(message = "No items selected")
  @Valid
  private List<DownloadItemRequest> items;

  @Size(max = 255, message = "Folder name must be at most 255 characters")
  private String folderName;

  /** Comma-separated formats or {@code all}. */
  private String outputFormat;

  private Boolean deleteImages;
}
