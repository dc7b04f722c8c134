package com.flamingo.learn.downloader.service.scrape;

import com.flamingo.learn.downloader.config.DownloaderConfig;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Recognizes "page not found" documents served with a success status. Detection is by marker
 * phrases in the body, configured under {@code downloader.scrape.not-found-markers}.
 */
@Component
public class NotFoundPageDetector {

  private final List<String> markers;

  public NotFoundPageDetector(DownloaderConfig config) {
    this.markers =
        config.getScrape().getNotFoundMarkers().stream()
            .filter(marker -> marker != null && !marker.isBlank())
            .map(marker -> marker.toLowerCase(Locale.ROOT))
            .toList();
  }

  public boolean isNotFoundPage(String html) {
    String body = html.toLowerCase(Locale.ROOT);
    return markers.stream().anyMatch(body::contains);
  }

  /** True for a body worth extracting: non-empty and not a not-found page. */
  public boolean isRealContent(String html) {
    return html != null && !html.isEmpty() && !isNotFoundPage(html);
  }
}
