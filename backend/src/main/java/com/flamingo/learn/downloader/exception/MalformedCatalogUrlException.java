package com.flamingo.learn.downloader.exception;

/** Exception thrown when a URL does not identify a catalog entity. */
public class MalformedCatalogUrlException extends RuntimeException {

  private final String url;

  public MalformedCatalogUrlException(String url) {
    super("Could not extract learning path UID from URL: " + url);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
