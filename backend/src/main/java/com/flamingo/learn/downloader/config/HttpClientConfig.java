package com.flamingo.learn.downloader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/** Shared WebClient for catalog, page and image requests. */
@Configuration
public class HttpClientConfig {

  @Bean
  public WebClient learnWebClient(DownloaderConfig config) {
    DownloaderConfig.Api api = config.getApi();
    return WebClient.builder()
        .defaultHeader(HttpHeaders.USER_AGENT, api.getUserAgent())
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(api.getMaxResponseBytes()))
        .build();
  }
}
