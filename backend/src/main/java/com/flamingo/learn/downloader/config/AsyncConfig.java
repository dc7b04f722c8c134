package com.flamingo.learn.downloader.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for background download jobs. */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "downloadJobExecutor")
  public Executor downloadJobExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(20);
    executor.setThreadNamePrefix("download-job-");
    executor.initialize();
    return executor;
  }
}
