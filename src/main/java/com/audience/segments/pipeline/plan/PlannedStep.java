package com.audience.segments.pipeline.plan;

import com.audience.segments.enums.SetOperation;
import java.util.List;

public record PlannedStep(
    Long ruleId,
    List<Long> dependsOn,
    SetOperation operation,
    String sql
) {}
