package com.flamingo.learn.downloader.domain.enums;

/** Lifecycle of a background download job. */
public enum JobStatus {
  /** Job accepted but not started. */
  QUEUED,

  /** Items are being downloaded. */
  RUNNING,

  /** All items were attempted; see the success tally for the outcome of each. */
  COMPLETED,

  /** The job itself aborted (interrupted or unexpected error). */
  FAILED
}
