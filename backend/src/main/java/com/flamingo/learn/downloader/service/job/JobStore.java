package com.flamingo.learn.downloader.service.job;

import java.util.Collection;
import java.util.Optional;
import java.util.function.UnaryOperator;

/** Holds download jobs by id. */
public interface JobStore {

  /**
   * Registers a new queued job.
   *
   * @param totalItems number of requested items
   * @return the stored job
   */
  DownloadJob create(int totalItems);

  Optional<DownloadJob> find(String jobId);

  Collection<DownloadJob> findAll();

  /**
   * Atomically replaces a job with the result of a transition. Transitions on a finished job are
   * ignored.
   *
   * @param jobId the job
   * @param transition function from the current snapshot to the next
   * @return the stored snapshot after the call
   * @throws com.flamingo.learn.downloader.exception.JobNotFoundException if no such job exists
   */
  DownloadJob update(String jobId, UnaryOperator<DownloadJob> transition);
}
