package com.flamingo.learn.downloader.service.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ImageReferenceMatcher Tests")
class ImageReferenceMatcherTest {

  private final Path local = Path.of("out", "images", "diagram_1a2b3c4d.png");
  private final ImageReferenceMatcher matcher =
      new ImageReferenceMatcher(
          Map.of("https://learn.example.com/training/modules/media/diagram.png", local));

  @Test
  @DisplayName("Should match the exact URL")
  void shouldMatchFullUrl() {
    assertThat(matcher.match("https://learn.example.com/training/modules/media/diagram.png"))
        .contains(local);
  }

  @Test
  @DisplayName("Should match a reference contained in the URL")
  void shouldMatchSubstring() {
    assertThat(matcher.match("/training/modules/media/diagram.png")).contains(local);
  }

  @Test
  @DisplayName("Should fall back to the base name")
  void shouldMatchBasename() {
    assertThat(matcher.match("../media/diagram.png?raw=true")).contains(local);
    assertThat(matcher.match("diagram_1a2b3c4d.png")).contains(local);
  }

  @Test
  @DisplayName("Should miss unrelated references")
  void shouldMissUnrelated() {
    assertThat(matcher.match("https://cdn.example.com/other.png")).isEmpty();
    assertThat(matcher.match("")).isEmpty();
  }

  @Test
  @DisplayName("Should try preferred URLs before the rest of the mapping")
  void shouldPreferGivenUrls() {
    String first = "https://learn.example.com/training/modules/a/media/diagram.png";
    String second = "https://learn.example.com/training/modules/b/media/diagram.png";
    Path firstLocal = Path.of("images", "diagram_aaaaaaaa.png");
    Path secondLocal = Path.of("images", "diagram_bbbbbbbb.png");
    Map<String, Path> mapping = new LinkedHashMap<>();
    mapping.put(first, firstLocal);
    mapping.put(second, secondLocal);

    Map<String, Path> preferred =
        ImageReferenceMatcher.preferring(List.of(second, "https://elsewhere/x.png"), mapping);

    assertThat(preferred).containsExactly(entry(second, secondLocal), entry(first, firstLocal));
    assertThat(new ImageReferenceMatcher(mapping).match("media/diagram.png")).contains(firstLocal);
    assertThat(new ImageReferenceMatcher(preferred).match("media/diagram.png"))
        .contains(secondLocal);
  }
}
