package com.flamingo.learn.downloader.service.image;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import org.springframework.util.DigestUtils;

/**
 * Derives local image file names from image URLs: the sanitized base name of the URL path, an
 * underscore, the first 8 hex digits of the URL's MD5 and the path's extension ({@code .png}
 * when missing or longer than four characters). Names depend on the URL only.
 */
public final class ImageFileNamer {

  static final String DEFAULT_EXTENSION = ".png";
  private static final int MAX_EXTENSION_LENGTH = 5;
  private static final int HASH_LENGTH = 8;

  private ImageFileNamer() {}

  public static String fileName(String url) {
    String name = lastSegment(urlPath(url));
    String stem = name;
    String extension = "";
    int dot = name.lastIndexOf('.');
    if (dot > 0 && dot < name.length() - 1) {
      stem = name.substring(0, dot);
      extension = name.substring(dot);
    }
    if (extension.isEmpty() || extension.length() > MAX_EXTENSION_LENGTH) {
      extension = DEFAULT_EXTENSION;
    }

    String hash = urlHash(url);
    String safeStem = sanitize(stem);
    return (safeStem.isEmpty() ? "image" : safeStem) + "_" + hash + extension;
  }

  static String urlHash(String url) {
    return DigestUtils.md5DigestAsHex(url.getBytes(StandardCharsets.UTF_8))
        .substring(0, HASH_LENGTH);
  }

  /** Final path segment of a URL or relative reference, without query or fragment. */
  static String basename(String reference) {
    String withoutQuery = reference.split("[?#]", 2)[0];
    return lastSegment(withoutQuery);
  }

  private static String sanitize(String stem) {
    StringBuilder safe = new StringBuilder(stem.length());
    stem.codePoints()
        .filter(c -> Character.isLetterOrDigit(c) || c == '-' || c == '_')
        .forEach(safe::appendCodePoint);
    return safe.toString();
  }

  private static String urlPath(String url) {
    try {
      return new URL(url).getPath();
    } catch (MalformedURLException e) {
      return url.split("[?#]", 2)[0];
    }
  }

  private static String lastSegment(String path) {
    return path.substring(path.lastIndexOf('/') + 1);
  }
}
