package com.flamingo.learn.downloader.service.http;

import com.flamingo.learn.downloader.config.DownloaderConfig;
import com.flamingo.learn.downloader.exception.DownloadInterruptedException;
import com.flamingo.learn.downloader.exception.TransientHttpException;
import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.core.functions.Either;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs GET requests under the shared retry policy: up to {@code retry-attempts} attempts with
 * exponential backoff from {@code retry-delay}, the wait doubled again after a 429. Only
 * {@link TransientHttpException} is retried; a 404 or any other status is handed back as a result
 * without consuming an attempt.
 */
@Component
@Slf4j
public class RetryingHttpExecutor {

  private final LearnHttpClient httpClient;
  private final int maxAttempts;
  private final Duration baseDelay;

  public RetryingHttpExecutor(LearnHttpClient httpClient, DownloaderConfig config) {
    this.httpClient = httpClient;
    this.maxAttempts = Math.max(1, config.getApi().getRetryAttempts());
    this.baseDelay = config.getApi().getRetryDelay();
  }

  /**
   * Executes a GET with retries.
   *
   * @param uri target URI
   * @param headers extra request headers
   * @param silent log retries at debug instead of warn
   * @return the final response (2xx, 404 or a non-retriable status)
   * @throws TransientHttpException when every attempt failed
   * @throws DownloadInterruptedException when the calling thread is interrupted
   */
  public HttpResult execute(URI uri, Map<String, String> headers, boolean silent) {
    Retry retry = Retry.of("http", retryConfig());
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              String message = "Retry {}/{} for {} (waiting {} ms): {}";
              Object[] args = {
                event.getNumberOfRetryAttempts(),
                maxAttempts,
                uri,
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : ""
              };
              if (silent) {
                log.debug(message, args);
              } else {
                log.warn(message, args);
              }
            });
    try {
      return retry.executeSupplier(() -> attempt(uri, headers));
    } catch (TransientHttpException e) {
      // an interrupted backoff sleep rethrows the last failure with the flag set
      if (Thread.currentThread().isInterrupted()) {
        throw new DownloadInterruptedException("Retry interrupted: " + uri);
      }
      throw e;
    }
  }

  long backoffMillis(int attempt, Throwable failure) {
    long delay = baseDelay.toMillis() * (1L << Math.min(attempt - 1, 20));
    if (failure instanceof TransientHttpException transientFailure
        && transientFailure.isRateLimited()) {
      delay *= 2;
    }
    return delay;
  }

  private RetryConfig retryConfig() {
    IntervalBiFunction<Object> interval =
        (Integer attempt, Either<Throwable, Object> outcome) ->
            backoffMillis(attempt, outcome.isLeft() ? outcome.getLeft() : null);
    return RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalBiFunction(interval)
        .retryExceptions(TransientHttpException.class)
        .build();
  }

  private HttpResult attempt(URI uri, Map<String, String> headers) {
    HttpResult result = httpClient.get(uri, headers);
    if (result.isRetriable()) {
      throw new TransientHttpException(uri.toString(), result.status());
    }
    return result;
  }
}
