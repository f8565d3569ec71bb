package com.audience.segments.repository;

import com.audience.segments.enums.RuleStatus;
import com.audience.segments.enums.SetOperation;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "segment_rules")
public class RuleEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false, updatable = false)
  private Long id;

  @Column(name = "name", nullable = false, unique = true)
  private String name;

  @Column(name = "description", length = 1024)
  private String description;

  @Lob
  @Column(name = "conditions_json", nullable = false)
  private String conditionsJson;

  @Column(name = "schedule", length = 64)
  private String schedule;

  @Column(name = "start_date")
  private LocalDate startDate;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "depends_on", nullable = false)
  @Convert(converter = RuleIdListConverter.class)
  private List<Long> dependsOn = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "operation", length = 16)
  private SetOperation operation;

  @Lob
  @Column(name = "residual_condition_json")
  private String residualConditionJson;

  @Column(name = "dependency_override", nullable = false)
  private boolean dependencyOverride;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private RuleStatus status;

  @Column(name = "last_run_at")
  private Instant lastRunAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  public RuleEntity() {}

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getConditionsJson() {
    return conditionsJson;
  }

  public void setConditionsJson(String conditionsJson) {
    this.conditionsJson = conditionsJson;
  }

  public String getSchedule() {
    return schedule;
  }

  public void setSchedule(String schedule) {
    this.schedule = schedule;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public void setStartDate(LocalDate startDate) {
    this.startDate = startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public void setEndDate(LocalDate endDate) {
    this.endDate = endDate;
  }

  public List<Long> getDependsOn() {
    return dependsOn;
  }

  public void setDependsOn(List<Long> dependsOn) {
    this.dependsOn = dependsOn;
  }

  public SetOperation getOperation() {
    return operation;
  }

  public void setOperation(SetOperation operation) {
    this.operation = operation;
  }

  public String getResidualConditionJson() {
    return residualConditionJson;
  }

  public void setResidualConditionJson(String residualConditionJson) {
    this.residualConditionJson = residualConditionJson;
  }

  public boolean isDependencyOverride() {
    return dependencyOverride;
  }

  public void setDependencyOverride(boolean dependencyOverride) {
    this.dependencyOverride = dependencyOverride;
  }

  public RuleStatus getStatus() {
    return status;
  }

  public void setStatus(RuleStatus status) {
    this.status = status;
  }

  public Instant getLastRunAt() {
    return lastRunAt;
  }

  public void setLastRunAt(Instant lastRunAt) {
    this.lastRunAt = lastRunAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
