package com.flamingo.learn.downloader.domain.enums;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/** Document formats written for a downloaded entity. */
@Slf4j
public enum OutputFormat {
  HTML,
  MARKDOWN;

  /**
   * Parses a comma-separated format list such as {@code "html,md"} or {@code "all"}.
   *
   * @param value the format list
   * @return the selected formats, never empty
   * @throws IllegalArgumentException if no supported format is named
   */
  public static Set<OutputFormat> parse(String value) {
    if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("all")) {
      return EnumSet.allOf(OutputFormat.class);
    }
    Set<OutputFormat> formats = EnumSet.noneOf(OutputFormat.class);
    for (String part : value.split(",")) {
      switch (part.trim().toLowerCase(Locale.ROOT)) {
        case "html" -> formats.add(HTML);
        case "markdown", "md" -> formats.add(MARKDOWN);
        case "pdf" -> log.warn("PDF output is not produced; use html or markdown");
        default -> log.warn("Ignoring unknown output format '{}'", part.trim());
      }
    }
    if (formats.isEmpty()) {
      throw new IllegalArgumentException("No supported output format in '" + value + "'");
    }
    return formats;
  }
}
