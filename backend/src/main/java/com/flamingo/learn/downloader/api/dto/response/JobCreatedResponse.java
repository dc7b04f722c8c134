package com.flamingo.learn.downloader.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO returned when a download job is queued. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCreatedResponse {

  private String jobId;
}
