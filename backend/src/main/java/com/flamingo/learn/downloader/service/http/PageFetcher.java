package com.flamingo.learn.downloader.service.http;

import com.flamingo.learn.downloader.exception.PageFetchException;
import com.flamingo.learn.downloader.exception.TransientHttpException;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Fetches content pages and image payloads under the shared retry policy.
 *
 * <p>Silent mode is for speculative lookups: nothing is logged above debug and exhausted retries
 * yield an empty result. Non-silent requests are authoritative and fail with {@link
 * PageFetchException} once retries are exhausted. A 404 is an empty result in both modes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageFetcher {

  private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,*/*;q=0.8";
  private static final String IMAGE_ACCEPT = "image/avif,image/webp,image/apng,image/*,*/*;q=0.8";

  private final RetryingHttpExecutor executor;
  private final MeterRegistry meterRegistry;

  /**
   * Fetches a page body.
   *
   * @param url absolute page URL
   * @param silent true for probing requests
   * @return the page markup, empty on 404 or any non-success status
   * @throws PageFetchException in non-silent mode when all attempts failed
   */
  public Optional<String> fetchPage(String url, boolean silent) {
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException e) {
      if (silent) {
        log.debug("Skipping invalid page URL {}", url);
        return Optional.empty();
      }
      throw new PageFetchException(url, "Invalid page URL: " + url);
    }

    HttpResult result;
    try {
      result = executor.execute(uri, Map.of(HttpHeaders.ACCEPT, HTML_ACCEPT), silent);
    } catch (TransientHttpException e) {
      meterRegistry.counter("pages.failed").increment();
      if (silent) {
        log.debug("Giving up on {}: {}", url, e.getMessage());
        return Optional.empty();
      }
      log.error("Failed to fetch content from {}: {}", url, e.getMessage());
      throw new PageFetchException(url, e);
    }

    if (result.isNotFound()) {
      if (!silent) {
        log.warn("Failed to fetch content from {}: 404 Not Found", url);
      }
      return Optional.empty();
    }
    if (!result.isSuccess()) {
      if (silent) {
        log.debug("HTTP {} from {}", result.status(), url);
      } else {
        log.warn("Failed to fetch content from {}: HTTP {}", url, result.status());
      }
      return Optional.empty();
    }
    meterRegistry.counter("pages.fetched").increment();
    return Optional.of(result.bodyAsString());
  }

  /**
   * Fetches image bytes. Failures never propagate: the image is simply unavailable.
   *
   * @param url absolute image URL
   * @param referer referring page, sent for hosts that reject hot-linking; may be {@code null}
   * @return the image bytes, empty when unavailable
   */
  public Optional<byte[]> fetchImage(String url, String referer) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(HttpHeaders.ACCEPT, IMAGE_ACCEPT);
    if (referer != null && !referer.isBlank()) {
      headers.put(HttpHeaders.REFERER, referer);
    }
    try {
      HttpResult result = executor.execute(URI.create(url), headers, false);
      if (!result.isSuccess()) {
        log.warn("Failed to download image {}: HTTP {}", url, result.status());
        return Optional.empty();
      }
      return Optional.of(result.body());
    } catch (TransientHttpException | IllegalArgumentException e) {
      log.warn("Failed to download image {}: {}", url, e.getMessage());
      return Optional.empty();
    }
  }
}
