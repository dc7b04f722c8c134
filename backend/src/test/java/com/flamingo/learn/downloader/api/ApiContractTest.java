package com.flamingo.learn.downloader.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.learn.downloader.api.rest.CatalogController;
import com.flamingo.learn.downloader.api.rest.DownloadController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests pinning controller base paths.
 *
 * <ul>
 *   <li>GET /api/catalog/search - Search the catalog
 *   <li>GET /api/catalog/{type}/{uid} - Look up one entity
 *   <li>POST /api/downloads - Queue a download job
 *   <li>GET /api/downloads/{jobId} - Poll a download job
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("CatalogController API contract")
  class CatalogControllerContract {

    @Test
    @DisplayName("should be mapped to /api/catalog")
    void shouldBeMappedToApiCatalog() {
      RequestMapping mapping = CatalogController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/catalog");
    }
  }

  @Nested
  @DisplayName("DownloadController API contract")
  class DownloadControllerContract {

    @Test
    @DisplayName("should be mapped to /api/downloads")
    void shouldBeMappedToApiDownloads() {
      RequestMapping mapping = DownloadController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/downloads");
    }
  }
}
