package com.flamingo.learn.downloader.api.dto.response;

import com.flamingo.learn.downloader.domain.enums.JobStatus;
import com.flamingo.learn.downloader.service.job.DownloadJob;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for download job status. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadJobResponse {

  private String id;
  private JobStatus status;
  private int progress;
  private String message;
  private String currentItem;
  private int totalItems;
  private int successCount;
  private Instant createdAt;
  private Instant updatedAt;

  public static DownloadJobResponse fromJob(DownloadJob job) {
    return DownloadJobResponse.builder()
        .id(job.id())
        .status(job.status())
        .progress(job.progress())
        .message(job.message())
        .currentItem(job.currentItem())
        .totalItems(job.totalItems())
        .successCount(job.successCount())
        .createdAt(job.createdAt())
        .updatedAt(job.updatedAt())
        .build();
  }
}
