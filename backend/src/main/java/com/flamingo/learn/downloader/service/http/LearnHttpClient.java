package com.flamingo.learn.downloader.service.http;

import com.flamingo.learn.downloader.config.DownloaderConfig;
import com.flamingo.learn.downloader.exception.DownloadInterruptedException;
import com.flamingo.learn.downloader.exception.TransientHttpException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

/**
 * Single-shot HTTP GET over WebClient. Encapsulates all transport details; retry and status
 * interpretation live in {@link RetryingHttpExecutor}.
 */
@Component
@Slf4j
public class LearnHttpClient {

  private final WebClient webClient;
  private final Duration timeout;

  public LearnHttpClient(WebClient learnWebClient, DownloaderConfig config) {
    this.webClient = learnWebClient;
    this.timeout = config.getApi().getTimeout();
  }

  /**
   * Performs one GET request. Every status code is returned as a result.
   *
   * @param uri target URI
   * @param headers extra request headers
   * @return the response
   * @throws TransientHttpException on connection failure or timeout
   * @throws DownloadInterruptedException when the calling thread is interrupted while waiting
   */
  public HttpResult get(URI uri, Map<String, String> headers) {
    log.trace("GET {}", uri);
    try {
      return webClient
          .get()
          .uri(uri)
          .headers(h -> headers.forEach(h::set))
          .exchangeToMono(
              response ->
                  response
                      .bodyToMono(byte[].class)
                      .defaultIfEmpty(new byte[0])
                      .map(
                          body ->
                              new HttpResult(
                                  response.statusCode().value(),
                                  body,
                                  response
                                      .headers()
                                      .asHttpHeaders()
                                      .getFirst(HttpHeaders.CONTENT_TYPE))))
          .timeout(timeout)
          .onErrorMap(e -> new TransientHttpException(uri.toString(), e))
          .block();
    } catch (RuntimeException e) {
      if (Exceptions.unwrap(e) instanceof InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw new DownloadInterruptedException("Request interrupted: " + uri, interrupted);
      }
      if (Thread.currentThread().isInterrupted()) {
        throw new DownloadInterruptedException("Request interrupted: " + uri);
      }
      throw e;
    }
  }
}
