package com.audience.segments.pipeline.scheduler;

import java.util.UUID;

/**
 * Work queue between the dispatcher and the materialization workers. Holds ids of jobs
 * whose dependencies are ready.
 */
public interface JobQueue {

  /**
   * @return false if the queue is at capacity and the job was not accepted
   */
  boolean offer(UUID jobId);

  UUID take() throws InterruptedException;

  /** Non-blocking take; null when empty. */
  UUID poll();

  boolean remove(UUID jobId);

  int size();
}
