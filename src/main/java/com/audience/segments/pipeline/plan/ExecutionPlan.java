package com.audience.segments.pipeline.plan;

import java.util.List;
import java.util.Optional;

/**
 * Materialization order in which every rule comes strictly after its dependencies.
 */
public record ExecutionPlan(List<PlannedStep> steps) {

  public ExecutionPlan {
    steps = List.copyOf(steps);
  }

  public List<Long> order() {
    return steps.stream().map(PlannedStep::ruleId).toList();
  }

  public Optional<PlannedStep> step(Long ruleId) {
    return steps.stream().filter(s -> s.ruleId().equals(ruleId)).findFirst();
  }
}
