package com.flamingo.learn.downloader.service.job;

import com.flamingo.learn.downloader.exception.JobNotFoundException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Component;

/** Process-local job store. Jobs are lost on restart. */
@Component
public class InMemoryJobStore implements JobStore {

  private final Map<String, DownloadJob> jobs = new ConcurrentHashMap<>();

  @Override
  public DownloadJob create(int totalItems) {
    DownloadJob job = DownloadJob.queued(UUID.randomUUID().toString(), totalItems);
    jobs.put(job.id(), job);
    return job;
  }

  @Override
  public Optional<DownloadJob> find(String jobId) {
    return Optional.ofNullable(jobs.get(jobId));
  }

  @Override
  public Collection<DownloadJob> findAll() {
    return List.copyOf(jobs.values());
  }

  @Override
  public DownloadJob update(String jobId, UnaryOperator<DownloadJob> transition) {
    DownloadJob updated =
        jobs.computeIfPresent(
            jobId, (id, current) -> current.isFinished() ? current : transition.apply(current));
    if (updated == null) {
      throw new JobNotFoundException(jobId);
    }
    return updated;
  }
}
