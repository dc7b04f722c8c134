package com.flamingo.learn.downloader.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("OutputFormat Tests")
class OutputFormatTest {

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"all", " ALL "})
  @DisplayName("Should select every format by default")
  void shouldSelectAll(String value) {
    assertThat(OutputFormat.parse(value)).containsExactlyInAnyOrder(OutputFormat.values());
  }

  @Test
  @DisplayName("Should parse aliases and skip unsupported entries")
  void shouldParseList() {
    assertThat(OutputFormat.parse("md, pdf")).containsExactly(OutputFormat.MARKDOWN);
    assertThat(OutputFormat.parse("HTML,markdown"))
        .containsExactlyInAnyOrder(OutputFormat.HTML, OutputFormat.MARKDOWN);
  }

  @Test
  @DisplayName("Should reject lists without a supported format")
  void shouldRejectUnsupported() {
    assertThatThrownBy(() -> OutputFormat.parse("pdf,docx"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("pdf,docx");
  }
}
