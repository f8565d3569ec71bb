package com.audience.segments.pipeline.scheduler;

import com.audience.segments.model.RuleDto;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Rule lookups the scheduler needs. */
public interface RuleSource {

  Optional<RuleDto> findRule(Long ruleId);

  List<RuleDto> activeRules();

  void recordRun(Long ruleId, Instant finishedAt);
}
