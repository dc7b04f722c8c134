package com.flamingo.learn.downloader.api.rest;

import com.flamingo.learn.downloader.api.dto.request.DownloadItemRequest;
import com.flamingo.learn.downloader.api.dto.request.DownloadRequest;
import com.flamingo.learn.downloader.api.dto.response.DownloadJobResponse;
import com.flamingo.learn.downloader.api.dto.response.JobCreatedResponse;
import com.flamingo.learn.downloader.domain.model.DownloadItem;
import com.flamingo.learn.downloader.service.job.DownloadJob;
import com.flamingo.learn.downloader.service.job.DownloadJobService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for batch download jobs. */
@RestController
@RequestMapping("/api/downloads")
@RequiredArgsConstructor
public class DownloadController {

  private final DownloadJobService downloadJobService;

  /** Queues a download job. */
  @PostMapping
  public ResponseEntity<JobCreatedResponse> startDownload(
      @Valid @RequestBody DownloadRequest request) {
    List<DownloadItem> items =
        request.getItems().stream().map(DownloadItemRequest::toDomain).toList();
    DownloadJob job =
        downloadJobService.submit(
            items, request.getFolderName(), request.getOutputFormat(), request.getDeleteImages());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(JobCreatedResponse.builder().jobId(job.id()).build());
  }

  /** Gets the status of a download job. */
  @GetMapping("/{jobId}")
  public ResponseEntity<DownloadJobResponse> getJob(@PathVariable String jobId) {
    return ResponseEntity.ok(DownloadJobResponse.fromJob(downloadJobService.getJob(jobId)));
  }
}
