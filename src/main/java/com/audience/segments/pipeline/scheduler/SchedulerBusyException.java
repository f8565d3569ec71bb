package com.audience.segments.pipeline.scheduler;

import java.util.UUID;

/** A job for the rule is already queued or running. */
public class SchedulerBusyException extends RuntimeException {

  private final Long ruleId;
  private final UUID existingJobId;

  public SchedulerBusyException(Long ruleId, UUID existingJobId) {
    super("Rule " + ruleId + " already has job " + existingJobId + " in flight");
    this.ruleId = ruleId;
    this.existingJobId = existingJobId;
  }

  public Long getRuleId() {
    return ruleId;
  }

  public UUID getExistingJobId() {
    return existingJobId;
  }
}
