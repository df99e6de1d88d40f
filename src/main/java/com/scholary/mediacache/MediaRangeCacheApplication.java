package com.scholary.mediacache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaRangeCacheApplication {

  public static void main(String[] args) {
    SpringApplication.run(MediaRangeCacheApplication.class, args);
  }
}
