package com.audience.segments.model;

import com.audience.segments.enums.SetOperation;
import java.time.Instant;
import java.util.List;

public record SegmentCatalogEntry(
    Long id,
    Long ruleId,
    String segmentName,
    String tableName,
    long rowCount,
    String sqlQuery,
    List<Long> dependsOn,
    SetOperation operation,
    Instant lastRefreshedAt,
    Instant createdAt
) {

  public SegmentCatalogEntry {
    dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
  }
}
