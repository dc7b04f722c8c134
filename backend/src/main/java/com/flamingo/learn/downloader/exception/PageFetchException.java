package com.flamingo.learn.downloader.exception;

/** Exception thrown when a content page cannot be fetched after all retry attempts. */
public class PageFetchException extends RuntimeException {

  private final String url;

  public PageFetchException(String url, Throwable cause) {
    super("Failed to fetch page " + url + ": " + cause.getMessage(), cause);
    this.url = url;
  }

  public PageFetchException(String url, String message) {
    super(message);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
