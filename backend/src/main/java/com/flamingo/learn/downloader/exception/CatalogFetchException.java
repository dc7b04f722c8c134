package com.flamingo.learn.downloader.exception;

/** Exception thrown when a catalog request cannot be completed. */
public class CatalogFetchException extends RuntimeException {

  private final String url;

  public CatalogFetchException(String url, String message) {
    super(message);
    this.url = url;
  }

  public CatalogFetchException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
