package com.audience.segments.ruleengine.dependency;

import com.audience.segments.enums.SetOperation;
import com.audience.segments.ruleengine.condition.DnfClause;
import java.util.List;

/**
 * Outcome of dependency resolution for one rule. {@code residual} lists the clauses that
 * still have to be computed from raw data; an empty list means the dependencies alone
 * define the segment.
 */
public record DependencyResolution(
    Long ruleId,
    SetOperation operation,
    List<Long> dependsOn,
    List<DnfClause> residual,
    int sharedAtoms
) {

  public DependencyResolution {
    dependsOn = List.copyOf(dependsOn);
    residual = List.copyOf(residual);
  }

  public static DependencyResolution none(Long ruleId, List<DnfClause> dnf) {
    return new DependencyResolution(ruleId, null, List.of(), dnf, 0);
  }

  public boolean reusesSegments() {
    return !dependsOn.isEmpty();
  }

  public List<DependencyEdge> edges(String extraPredicate) {
    return dependsOn.stream()
        .map(dep -> new DependencyEdge(ruleId, dep, operation, extraPredicate))
        .toList();
  }
}
