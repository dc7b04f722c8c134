package com.flamingo.learn.downloader.service.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.learn.downloader.config.DownloaderConfig;
import com.flamingo.learn.downloader.exception.DownloadInterruptedException;
import com.flamingo.learn.downloader.exception.TransientHttpException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetryingHttpExecutor Tests")
class RetryingHttpExecutorTest {

  private static final URI URI_UNDER_TEST = URI.create("https://learn.example.com/page");

  @Mock private LearnHttpClient httpClient;

  private DownloaderConfig config;
  private RetryingHttpExecutor executor;

  @BeforeEach
  void setUp() {
    config = new DownloaderConfig();
    config.getApi().setRetryAttempts(3);
    config.getApi().setRetryDelay(Duration.ofMillis(1));
    executor = new RetryingHttpExecutor(httpClient, config);
  }

  @Test
  @DisplayName("Should return 404 without retrying")
  void shouldNotRetryNotFound() {
    when(httpClient.get(any(URI.class), anyMap())).thenReturn(result(404));

    HttpResult result = executor.execute(URI_UNDER_TEST, Map.of(), true);

    assertThat(result.isNotFound()).isTrue();
    verify(httpClient, times(1)).get(any(URI.class), anyMap());
  }

  @Test
  @DisplayName("Should retry server errors until success")
  void shouldRetryServerErrorThenSucceed() {
    when(httpClient.get(any(URI.class), anyMap())).thenReturn(result(503), result(200));

    HttpResult result = executor.execute(URI_UNDER_TEST, Map.of(), false);

    assertThat(result.isSuccess()).isTrue();
    verify(httpClient, times(2)).get(any(URI.class), anyMap());
  }

  @Test
  @DisplayName("Should retry connection failures")
  void shouldRetryConnectionFailures() {
    when(httpClient.get(any(URI.class), anyMap()))
        .thenThrow(new TransientHttpException(URI_UNDER_TEST.toString(), new RuntimeException()))
        .thenReturn(result(200));

    assertThat(executor.execute(URI_UNDER_TEST, Map.of(), true).isSuccess()).isTrue();
  }

  @Test
  @DisplayName("Should throw after all attempts fail")
  void shouldThrowWhenAttemptsExhausted() {
    when(httpClient.get(any(URI.class), anyMap())).thenReturn(result(500));

    assertThatThrownBy(() -> executor.execute(URI_UNDER_TEST, Map.of(), false))
        .isInstanceOf(TransientHttpException.class)
        .hasFieldOrPropertyWithValue("status", 500);
    verify(httpClient, times(3)).get(any(URI.class), anyMap());
  }

  @Test
  @DisplayName("Should hand back other client errors without retrying")
  void shouldNotRetryClientErrors() {
    when(httpClient.get(any(URI.class), anyMap())).thenReturn(result(403));

    assertThat(executor.execute(URI_UNDER_TEST, Map.of(), false).status()).isEqualTo(403);
    verify(httpClient, times(1)).get(any(URI.class), anyMap());
  }

  @Test
  @DisplayName("Should back off exponentially and double the wait after 429")
  void shouldComputeBackoff() {
    config.getApi().setRetryDelay(Duration.ofMillis(100));
    RetryingHttpExecutor slow = new RetryingHttpExecutor(httpClient, config);
    TransientHttpException serverError = new TransientHttpException("u", 503);
    TransientHttpException rateLimited = new TransientHttpException("u", 429);

    assertThat(slow.backoffMillis(1, serverError)).isEqualTo(100);
    assertThat(slow.backoffMillis(2, serverError)).isEqualTo(200);
    assertThat(slow.backoffMillis(3, serverError)).isEqualTo(400);
    assertThat(slow.backoffMillis(2, rateLimited)).isEqualTo(400);
  }

  @Test
  @DisplayName("Should stop retrying once the caller is interrupted")
  void shouldAbortOnInterrupt() {
    when(httpClient.get(any(URI.class), anyMap()))
        .thenAnswer(
            invocation -> {
              Thread.currentThread().interrupt();
              throw new TransientHttpException(URI_UNDER_TEST.toString(), 503);
            });

    try {
      assertThatThrownBy(() -> executor.execute(URI_UNDER_TEST, Map.of(), true))
          .isInstanceOf(DownloadInterruptedException.class);
    } finally {
      Thread.interrupted();
    }
  }

  private static HttpResult result(int status) {
    return new HttpResult(status, new byte[0], null);
  }
}
