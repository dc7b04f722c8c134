package com.flamingo.learn.downloader.api.rest;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.learn.downloader.domain.enums.EntityType;
import com.flamingo.learn.downloader.domain.model.CatalogEntity;
import com.flamingo.learn.downloader.exception.ApiError;
import com.flamingo.learn.downloader.exception.GlobalExceptionHandler;
import com.flamingo.learn.downloader.service.catalog.CatalogClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("CatalogController Tests")
class CatalogControllerTest {

  private static final String PATH_URL =
      "https://learn.microsoft.com/en-us/training/paths/power-plat-fundamentals/";

  @Mock private CatalogClient catalogClient;

  private MockMvc mockMvc;

  private final CatalogEntity path =
      CatalogEntity.builder()
          .uid("learn.power-plat-fundamentals")
          .type(EntityType.LEARNING_PATH)
          .title("Power Platform Fundamentals")
          .durationInMinutes(120)
          .url(PATH_URL)
          .childUids(List.of("learn.module-a", "learn.module-b"))
          .build();

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new CatalogController(catalogClient))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Nested
  @DisplayName("Search")
  class Search {

    @Test
    @DisplayName("Should search default types")
    void shouldSearchDefaultTypes() throws Exception {
      when(catalogClient.searchCatalog("power", CatalogController.DEFAULT_SEARCH_TYPES))
          .thenReturn(List.of(path));

      mockMvc
          .perform(get("/api/catalog/search").param("q", " power "))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$[0].uid").value("learn.power-plat-fundamentals"))
          .andExpect(jsonPath("$[0].type").value("learningPath"))
          .andExpect(jsonPath("$[0].childUids.length()").value(2));
    }

    @Test
    @DisplayName("Should honor requested types")
    void shouldParseTypes() throws Exception {
      when(catalogClient.searchCatalog("az", List.of(EntityType.COURSE, EntityType.MODULE)))
          .thenReturn(List.of());

      mockMvc
          .perform(get("/api/catalog/search").param("q", "az").param("types", "course,modules"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.length()").value(0));

      verify(catalogClient).searchCatalog("az", List.of(EntityType.COURSE, EntityType.MODULE));
    }

    @Test
    @DisplayName("Should resolve a pasted path URL directly")
    void shouldResolvePathUrl() throws Exception {
      when(catalogClient.resolveByUrl(PATH_URL)).thenReturn(Optional.of(path));

      mockMvc
          .perform(get("/api/catalog/search").param("q", PATH_URL))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.length()").value(1))
          .andExpect(jsonPath("$[0].title").value("Power Platform Fundamentals"));
    }

    @Test
    @DisplayName("Should reject blank queries")
    void shouldRejectBlankQuery() throws Exception {
      mockMvc
          .perform(get("/api/catalog/search").param("q", "  "))
          .andExpect(status().isBadRequest());

      verifyNoInteractions(catalogClient);
    }
  }

  @Nested
  @DisplayName("Lookup")
  class Lookup {

    @Test
    @DisplayName("Should return an entity by type and uid")
    void shouldReturnEntity() throws Exception {
      when(catalogClient.resolveByUid("learn.power-plat-fundamentals", EntityType.LEARNING_PATH))
          .thenReturn(Optional.of(path));

      mockMvc
          .perform(get("/api/catalog/learningPath/learn.power-plat-fundamentals"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.durationInMinutes").value(120));
    }

    @Test
    @DisplayName("Should return 404 for missing entities")
    void shouldReturnNotFound() throws Exception {
      when(catalogClient.resolveByUid(anyString(), eq(EntityType.MODULE)))
          .thenReturn(Optional.empty());

      mockMvc
          .perform(get("/api/catalog/module/learn.missing"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value(ApiError.ENTITY_NOT_FOUND));
    }
  }
}
