package com.audience.segments.pipeline.scheduler;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MaterializationWorker implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(MaterializationWorker.class);

  private final JobQueue queue;
  private final MaterializationScheduler scheduler;

  private volatile boolean running = true;

  public MaterializationWorker(JobQueue queue, MaterializationScheduler scheduler) {
    this.queue = queue;
    this.scheduler = scheduler;
  }

  @Override
  public void run() {
    log.info("MaterializationWorker started");
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        UUID jobId = queue.take();
        scheduler.execute(jobId);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (Exception e) {
        log.error("Error in MaterializationWorker loop", e);
      }
    }
    log.info("MaterializationWorker stopped");
  }

  public void shutdown() {
    this.running = false;
  }
}
