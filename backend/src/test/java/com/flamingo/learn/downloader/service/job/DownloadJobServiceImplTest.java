package com.flamingo.learn.downloader.service.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.flamingo.learn.downloader.config.DownloaderConfig;
import com.flamingo.learn.downloader.domain.enums.EntityType;
import com.flamingo.learn.downloader.domain.enums.JobStatus;
import com.flamingo.learn.downloader.domain.enums.OutputFormat;
import com.flamingo.learn.downloader.domain.model.DownloadItem;
import com.flamingo.learn.downloader.exception.JobNotFoundException;
import com.flamingo.learn.downloader.service.download.DownloadOptions;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DownloadJobServiceImpl Tests")
class DownloadJobServiceImplTest {

  @Mock private DownloadJobRunner jobRunner;
  @TempDir Path storageDir;

  private InMemoryJobStore jobStore;
  private DownloadJobServiceImpl service;
  private final List<DownloadItem> items =
      List.of(new DownloadItem("learn.p1", EntityType.LEARNING_PATH, "Path"));

  @BeforeEach
  void setUp() {
    DownloaderConfig config = new DownloaderConfig();
    config.getStorage().setOutputDir(storageDir.toString());
    config.getCleanup().setDeleteImages(true);
    jobStore = new InMemoryJobStore();
    service = new DownloadJobServiceImpl(jobStore, jobRunner, config, new SimpleMeterRegistry());
  }

  @Test
  @DisplayName("Should queue the job and start it with resolved options")
  void shouldQueueJob() {
    DownloadJob job = service.submit(items, "az-400", "md", null);

    assertThat(job.status()).isEqualTo(JobStatus.QUEUED);
    assertThat(service.getJob(job.id())).isEqualTo(job);

    ArgumentCaptor<DownloadOptions> options = ArgumentCaptor.forClass(DownloadOptions.class);
    verify(jobRunner).runAsync(eq(job.id()), eq(items), options.capture());
    assertThat(options.getValue().outputDir())
        .isEqualTo(storageDir.toAbsolutePath().normalize().resolve("az-400"));
    assertThat(options.getValue().formats()).containsExactly(OutputFormat.MARKDOWN);
    assertThat(options.getValue().deleteImages()).isTrue();
  }

  @Test
  @DisplayName("Should default folder and formats")
  void shouldApplyDefaults() {
    DownloadJob job = service.submit(items, " ", null, false);

    ArgumentCaptor<DownloadOptions> options = ArgumentCaptor.forClass(DownloadOptions.class);
    verify(jobRunner).runAsync(eq(job.id()), anyList(), options.capture());
    assertThat(options.getValue().outputDir().getFileName().toString()).isEqualTo("download");
    assertThat(options.getValue().formats())
        .containsExactlyInAnyOrder(OutputFormat.HTML, OutputFormat.MARKDOWN);
    assertThat(options.getValue().deleteImages()).isFalse();
  }

  @Test
  @DisplayName("Should reject empty batches")
  void shouldRejectEmptyItems() {
    assertThatThrownBy(() -> service.submit(List.of(), "x", "html", null))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(jobRunner);
  }

  @Test
  @DisplayName("Should reject folders outside the output directory")
  void shouldRejectTraversal() {
    assertThatThrownBy(() -> service.submit(items, "../elsewhere", "html", null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.submit(items, ".", "html", null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(jobStore.findAll()).isEmpty();
  }

  @Test
  @DisplayName("Should reject format lists without a supported format")
  void shouldRejectUnsupportedFormat() {
    assertThatThrownBy(() -> service.submit(items, "x", "pdf", null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should throw for unknown job ids")
  void shouldThrowForUnknownJob() {
    assertThatThrownBy(() -> service.getJob("missing")).isInstanceOf(JobNotFoundException.class);
  }
}
