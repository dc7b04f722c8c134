package com.flamingo.learn.downloader.exception;

/** Exception thrown when a running download is interrupted. */
public class DownloadInterruptedException extends RuntimeException {

  public DownloadInterruptedException(String message) {
    super(message);
  }

  public DownloadInterruptedException(String message, InterruptedException cause) {
    super(message, cause);
  }
}
