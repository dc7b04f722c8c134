package com.flamingo.learn.downloader.config;

import com.flamingo.learn.downloader.domain.enums.JobStatus;
import com.flamingo.learn.downloader.service.job.JobStore;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for download metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on the download operations.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTag(
      @Value("${spring.application.name:learn-downloader}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }

  /** Gauges over the job store: jobs waiting and jobs running. */
  @Bean
  public MeterBinder jobGauges(JobStore jobStore) {
    return registry -> {
      Gauge.builder("jobs.active", jobStore, store -> count(store, JobStatus.RUNNING))
          .description("Download jobs currently running")
          .register(registry);
      Gauge.builder("jobs.queued", jobStore, store -> count(store, JobStatus.QUEUED))
          .description("Download jobs waiting to start")
          .register(registry);
    };
  }

  static double count(JobStore store, JobStatus status) {
    return store.findAll().stream().filter(job -> job.status() == status).count();
  }
}
