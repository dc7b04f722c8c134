package com.flamingo.learn.downloader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the learning content downloader service. */
@SpringBootApplication
public class LearnDownloaderApplication {

  public static void main(String[] args) {
    SpringApplication.run(LearnDownloaderApplication.class, args);
  }
}
