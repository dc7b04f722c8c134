package com.flamingo.learn.downloader.service.image;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ImageFileNamer Tests")
class ImageFileNamerTest {

  @Test
  @DisplayName("Should combine sanitized base name, URL hash and extension")
  void shouldBuildName() {
    String url = "https://learn.example.com/modules/m/media/arch-diagram.png?v=2";

    String name = ImageFileNamer.fileName(url);

    assertThat(name).isEqualTo("arch-diagram_" + ImageFileNamer.urlHash(url) + ".png");
    assertThat(ImageFileNamer.urlHash(url)).matches("[0-9a-f]{8}");
  }

  @Test
  @DisplayName("Should return the same name for the same URL")
  void shouldBeDeterministic() {
    String url = "https://learn.example.com/media/flow.svg";

    assertThat(ImageFileNamer.fileName(url)).isEqualTo(ImageFileNamer.fileName(url));
  }

  @Test
  @DisplayName("Should keep colliding base names apart")
  void shouldDistinguishSameBaseName() {
    String first = ImageFileNamer.fileName("https://learn.example.com/a/media/image.png");
    String second = ImageFileNamer.fileName("https://learn.example.com/b/media/image.png");

    assertThat(first).startsWith("image_").endsWith(".png");
    assertThat(second).startsWith("image_").endsWith(".png");
    assertThat(first).isNotEqualTo(second);
  }

  @Test
  @DisplayName("Should default the extension when missing or implausible")
  void shouldDefaultExtension() {
    assertThat(ImageFileNamer.fileName("https://h.example.com/media/picture")).endsWith(".png");
    assertThat(ImageFileNamer.fileName("https://h.example.com/media/file.document"))
        .startsWith("file_")
        .endsWith(".png");
    assertThat(ImageFileNamer.fileName("https://h.example.com/media/photo.jpeg"))
        .endsWith(".jpeg");
  }

  @Test
  @DisplayName("Should strip unsafe characters and fall back to a generic stem")
  void shouldSanitizeStem() {
    assertThat(ImageFileNamer.fileName("https://h.example.com/media/my%20shot(1).gif"))
        .startsWith("my20shot1_")
        .endsWith(".gif");
    assertThat(ImageFileNamer.fileName("https://h.example.com/media/")).startsWith("image_");
  }
}
