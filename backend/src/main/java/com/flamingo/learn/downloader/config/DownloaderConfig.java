package com.flamingo.learn.downloader.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for catalog access, scraping, image download and output. */
@Configuration
@ConfigurationProperties(prefix = "downloader")
@Getter
@Setter
public class DownloaderConfig {

  private Api api = new Api();
  private Download download = new Download();
  private Cleanup cleanup = new Cleanup();
  private Storage storage = new Storage();
  private Scrape scrape = new Scrape();

  @Getter
  @Setter
  public static class Api {
    private String baseUrl = "https://learn.microsoft.com/api/catalog/";
    private String contentBaseUrl = "https://learn.microsoft.com";
    private String locale = "en-us";
    private Duration timeout = Duration.ofSeconds(30);
    private int retryAttempts = 5;
    private Duration retryDelay = Duration.ofSeconds(2);

    /** Unit UIDs per catalog request; keeps the query string under the server's URL limit. */
    private int unitBatchSize = 10;

    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)"
            + " Chrome/120.0 Safari/537.36";

    /** Largest response body buffered in memory (pages and images). */
    private int maxResponseBytes = 32 * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Download {
    private boolean images = true;
    private int maxConcurrentDownloads = 5;
  }

  @Getter
  @Setter
  public static class Cleanup {
    private boolean deleteImages = false;
  }

  @Getter
  @Setter
  public static class Storage {
    private String outputDir = "./downloads";
  }

  @Getter
  @Setter
  public static class Scrape {

    /** Body phrases that identify a "not found" page served with a 200 status. */
    private List<String> notFoundMarkers =
        new ArrayList<>(List.of("404 - Page not found", "We couldn't find this page"));

    /** Product-family prefixes stripped from unit slugs when probing for unit pages. */
    private List<String> slugPrefixes =
        new ArrayList<>(List.of("flow", "power-apps", "canvas-apps", "model-driven-apps"));
  }
}
