package com.audience.segments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SegmentEngineApplication {
  public static void main(String[] args) {
    SpringApplication.run(SegmentEngineApplication.class, args);
  }
}
