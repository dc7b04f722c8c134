package com.flamingo.learn.downloader.exception;

/**
 * Exception for failures worth retrying: transport errors, timeouts, 5xx and 429 responses.
 * Status is {@code -1} when no response was received.
 */
public class TransientHttpException extends RuntimeException {

  private final String url;
  private final int status;

  public TransientHttpException(String url, int status) {
    super("HTTP " + status + " from " + url);
    this.url = url;
    this.status = status;
  }

  public TransientHttpException(String url, Throwable cause) {
    super("Request to " + url + " failed: " + cause.getMessage(), cause);
    this.url = url;
    this.status = -1;
  }

  public String getUrl() {
    return url;
  }

  public int getStatus() {
    return status;
  }

  public boolean isRateLimited() {
    return status == 429;
  }
}
