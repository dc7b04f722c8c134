package com.flamingo.learn.downloader.service.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.learn.downloader.exception.PageFetchException;
import com.flamingo.learn.downloader.exception.TransientHttpException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;

@ExtendWith(MockitoExtension.class)
@DisplayName("PageFetcher Tests")
class PageFetcherTest {

  private static final String PAGE_URL = "https://learn.example.com/training/modules/m/1-intro";

  @Mock private RetryingHttpExecutor executor;

  private SimpleMeterRegistry meterRegistry;
  private PageFetcher pageFetcher;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    pageFetcher = new PageFetcher(executor, meterRegistry);
  }

  @Test
  @DisplayName("Should return the page body decoded with the declared charset")
  void shouldReturnBody() {
    when(executor.execute(any(URI.class), anyMap(), anyBoolean()))
        .thenReturn(
            new HttpResult(
                200,
                "<p>café</p>".getBytes(StandardCharsets.ISO_8859_1),
                "text/html; charset=ISO-8859-1"));

    assertThat(pageFetcher.fetchPage(PAGE_URL, false)).contains("<p>café</p>");
    assertThat(meterRegistry.counter("pages.fetched").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should treat 404 as empty in both modes")
  void shouldReturnEmptyOnNotFound() {
    when(executor.execute(any(URI.class), anyMap(), anyBoolean()))
        .thenReturn(new HttpResult(404, new byte[0], null));

    assertThat(pageFetcher.fetchPage(PAGE_URL, true)).isEmpty();
    assertThat(pageFetcher.fetchPage(PAGE_URL, false)).isEmpty();
  }

  @Test
  @DisplayName("Should return empty when a silent fetch exhausts its retries")
  void shouldSwallowExhaustionWhenSilent() {
    when(executor.execute(any(URI.class), anyMap(), eq(true)))
        .thenThrow(new TransientHttpException(PAGE_URL, 503));

    assertThat(pageFetcher.fetchPage(PAGE_URL, true)).isEmpty();
    assertThat(meterRegistry.counter("pages.failed").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should raise PageFetchException when an authoritative fetch exhausts its retries")
  void shouldThrowWhenNotSilent() {
    when(executor.execute(any(URI.class), anyMap(), eq(false)))
        .thenThrow(new TransientHttpException(PAGE_URL, 503));

    assertThatThrownBy(() -> pageFetcher.fetchPage(PAGE_URL, false))
        .isInstanceOf(PageFetchException.class)
        .hasCauseInstanceOf(TransientHttpException.class);
  }

  @Test
  @DisplayName("Should skip invalid URLs in silent mode without a request")
  void shouldSkipInvalidUrlWhenSilent() {
    assertThat(pageFetcher.fetchPage("https://bad host/x y", true)).isEmpty();
    verifyNoInteractions(executor);
  }

  @Test
  @DisplayName("Should send the referer with image requests")
  @SuppressWarnings("unchecked")
  void shouldSendRefererForImages() {
    when(executor.execute(any(URI.class), anyMap(), anyBoolean()))
        .thenReturn(new HttpResult(200, new byte[] {1, 2, 3}, "image/png"));

    assertThat(pageFetcher.fetchImage("https://learn.example.com/a.png", PAGE_URL))
        .hasValueSatisfying(bytes -> assertThat(bytes).containsExactly(1, 2, 3));

    ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
    verify(executor).execute(any(URI.class), headers.capture(), eq(false));
    assertThat(headers.getValue()).containsEntry(HttpHeaders.REFERER, PAGE_URL);
  }

  @Test
  @DisplayName("Should report image as unavailable after failures")
  void shouldReturnEmptyImageOnFailure() {
    when(executor.execute(any(URI.class), anyMap(), anyBoolean()))
        .thenThrow(new TransientHttpException("https://learn.example.com/a.png", 500));

    assertThat(pageFetcher.fetchImage("https://learn.example.com/a.png", null)).isEmpty();
  }
}
