package com.flamingo.learn.downloader.service.scrape;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/** URL slug helpers. */
public final class Slugs {

  private static final Pattern NON_ALPHANUMERIC_RUN = Pattern.compile("[^a-z0-9]+");
  private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");

  private Slugs() {}

  /** Lowercases, collapses every run of non-alphanumerics to one hyphen, trims edge hyphens. */
  public static String slugify(String text) {
    if (text == null) {
      return "";
    }
    String hyphenated =
        NON_ALPHANUMERIC_RUN.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("-");
    return EDGE_HYPHENS.matcher(hyphenated).replaceAll("");
  }

  /**
   * Returns the trailing UID segment used as a unit's page slug. Unit UIDs have at least three
   * dot-separated parts ({@code learn.<module>.<unit>}); anything shorter has no usable slug.
   */
  public static Optional<String> unitSlug(String unitUid) {
    if (unitUid == null) {
      return Optional.empty();
    }
    String[] parts = unitUid.split("\\.");
    if (parts.length < 3 || parts[parts.length - 1].isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(parts[parts.length - 1]);
  }

  /** Strips the query string and trailing slashes from a page URL. */
  public static String baseUrl(String pageUrl) {
    return pageUrl.split("\\?", 2)[0].replaceAll("/+$", "");
  }
}
