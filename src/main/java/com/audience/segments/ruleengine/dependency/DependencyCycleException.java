package com.audience.segments.ruleengine.dependency;

import java.util.List;

/**
 * Raised when accepting a dependency edge would make a rule transitively depend on itself.
 */
public class DependencyCycleException extends RuntimeException {

  private final List<Long> ruleIds;

  public DependencyCycleException(String message, List<Long> ruleIds) {
    super(message);
    this.ruleIds = List.copyOf(ruleIds);
  }

  public List<Long> getRuleIds() {
    return ruleIds;
  }
}
