package com.audience.segments.pipeline.scheduler;

import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

public class InMemoryJobQueue implements JobQueue {

  private final BlockingQueue<UUID> queue;

  public InMemoryJobQueue(int capacity) {
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  @Override
  public boolean offer(UUID jobId) {
    return queue.offer(jobId);
  }

  @Override
  public UUID take() throws InterruptedException {
    return queue.take();
  }

  @Override
  public UUID poll() {
    return queue.poll();
  }

  @Override
  public boolean remove(UUID jobId) {
    return queue.remove(jobId);
  }

  @Override
  public int size() {
    return queue.size();
  }
}
