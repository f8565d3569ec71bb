package com.audience.segments.pipeline.scheduler;

import java.time.Duration;

/**
 * Exponential backoff for transient engine failures: {@code base * 2^(attempt-1)},
 * capped at {@code max}.
 */
public record RetryPolicy(int maxAttempts, Duration baseBackoff, Duration maxBackoff) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
  }

  public boolean canRetry(int attemptsMade) {
    return attemptsMade < maxAttempts;
  }

  public Duration backoff(int attemptsMade) {
    int shift = Math.min(Math.max(attemptsMade - 1, 0), 30);
    Duration delay = baseBackoff.multipliedBy(1L << shift);
    return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
  }
}
