package com.audience.segments.model;

import com.audience.segments.enums.RuleStatus;
import com.audience.segments.enums.SetOperation;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record RuleDto(
    Long id,
    @NotBlank @Size(max = 200) String name,
    String description,
    @NotNull JsonNode conditions,
    String schedule,
    LocalDate startDate,
    LocalDate endDate,
    List<Long> dependsOn,
    SetOperation operation,
    JsonNode residualCondition,
    boolean dependencyOverride,
    RuleStatus status,
    Instant lastRunAt,
    Instant createdAt,
    Instant updatedAt
) {

  public RuleDto {
    dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
  }

  public boolean isActive() {
    return status == null || status == RuleStatus.ACTIVE;
  }

  public boolean isActiveOn(LocalDate day) {
    return isActive()
        && (startDate == null || !day.isBefore(startDate))
        && (endDate == null || !day.isAfter(endDate));
  }
}
