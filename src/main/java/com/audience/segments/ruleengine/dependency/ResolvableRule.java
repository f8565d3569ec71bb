package com.audience.segments.ruleengine.dependency;

import com.audience.segments.ruleengine.condition.DnfClause;
import java.time.LocalDate;
import java.util.List;

/**
 * The view of a rule the resolver works on: its DNF, active window and current dependencies.
 */
public record ResolvableRule(
    Long id,
    List<DnfClause> dnf,
    LocalDate startDate,
    LocalDate endDate,
    List<Long> dependsOn
) {

  public ResolvableRule {
    dnf = List.copyOf(dnf);
    dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
  }

  public boolean overlaps(ResolvableRule other) {
    boolean startsBeforeOtherEnds = startDate == null || other.endDate == null
        || !startDate.isAfter(other.endDate);
    boolean otherStartsBeforeThisEnds = other.startDate == null || endDate == null
        || !other.startDate.isAfter(endDate);
    return startsBeforeOtherEnds && otherStartsBeforeThisEnds;
  }

  public boolean isSingleClause() {
    return dnf.size() == 1;
  }
}
