package com.audience.segments.pipeline.scheduler;

import com.audience.segments.model.MaterializationJob;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedDeque;

/** Most recent finished jobs, newest first. */
public class JobHistory {

  private final Deque<MaterializationJob> buffer = new ConcurrentLinkedDeque<>();
  private final int maxSize;

  public JobHistory(int maxSize) {
    this.maxSize = maxSize;
  }

  public void record(MaterializationJob job) {
    buffer.addFirst(job);
    while (buffer.size() > maxSize) {
      buffer.removeLast();
    }
  }

  public Optional<MaterializationJob> find(UUID jobId) {
    return buffer.stream().filter(job -> job.id().equals(jobId)).findFirst();
  }

  public List<MaterializationJob> recent(int limit) {
    return buffer.stream().limit(limit).toList();
  }
}
