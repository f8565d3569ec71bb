package com.audience.segments.pipeline.engine;

public record BatchQuery(
    Long ruleId,
    String sql,
    String dataSourceUrl,
    String outputTable
) {}
