package com.audience.segments.pipeline.scheduler;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ScheduleTicker {

  private static final Logger log = LoggerFactory.getLogger(ScheduleTicker.class);

  private final MaterializationScheduler scheduler;
  private final Clock clock;

  public ScheduleTicker(MaterializationScheduler scheduler, Clock clock) {
    this.scheduler = scheduler;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${segments.scheduler.tick-interval-ms:60000}")
  public void tick() {
    log.debug("Running scheduled materialization tick");
    try {
      scheduler.tick(Instant.now(clock));
    } catch (Exception e) {
      log.error("Materialization tick failed", e);
    }
  }
}
