package com.audience.segments.model;

import com.audience.segments.enums.JobState;
import com.audience.segments.enums.TriggerKind;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of a materialization job. Transitions return a new snapshot and
 * reject moves the lifecycle does not allow.
 */
public record MaterializationJob(
    UUID id,
    Long ruleId,
    TriggerKind trigger,
    JobState state,
    int attempts,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    Instant nextAttemptAt,
    String lastError
) {

  public static MaterializationJob queued(Long ruleId, TriggerKind trigger, Instant now) {
    return new MaterializationJob(UUID.randomUUID(), ruleId, trigger, JobState.QUEUED, 0,
        now, null, null, null, null);
  }

  public MaterializationJob start(Instant now) {
    require(JobState.QUEUED, JobState.RUNNING);
    return new MaterializationJob(id, ruleId, trigger, JobState.RUNNING, attempts + 1,
        createdAt, now, null, null, lastError);
  }

  public MaterializationJob succeed(Instant now) {
    require(JobState.RUNNING, JobState.SUCCEEDED);
    return new MaterializationJob(id, ruleId, trigger, JobState.SUCCEEDED, attempts,
        createdAt, startedAt, now, null, null);
  }

  /** Failure of a running job, or of a queued job whose dependencies can never be met. */
  public MaterializationJob fail(Instant now, String error) {
    if (state != JobState.RUNNING && state != JobState.QUEUED) {
      throw illegal(JobState.FAILED);
    }
    return new MaterializationJob(id, ruleId, trigger, JobState.FAILED, attempts,
        createdAt, startedAt, now, null, error);
  }

  public MaterializationJob retryAt(Instant nextAttemptAt) {
    require(JobState.FAILED, JobState.QUEUED);
    return new MaterializationJob(id, ruleId, trigger, JobState.QUEUED, attempts,
        createdAt, startedAt, null, nextAttemptAt, lastError);
  }

  public MaterializationJob cancel(Instant now) {
    require(JobState.QUEUED, JobState.CANCELLED);
    return new MaterializationJob(id, ruleId, trigger, JobState.CANCELLED, attempts,
        createdAt, startedAt, now, null, lastError);
  }

  public boolean isDue(Instant now) {
    return nextAttemptAt == null || !now.isBefore(nextAttemptAt);
  }

  private void require(JobState from, JobState to) {
    if (state != from) {
      throw illegal(to);
    }
  }

  private IllegalStateException illegal(JobState to) {
    return new IllegalStateException("Job " + id + " cannot move from " + state + " to " + to);
  }
}
