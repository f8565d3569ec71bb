package com.audience.segments.ruleengine.dependency;

import com.audience.segments.enums.SetOperation;
import java.util.OptionalLong;

/**
 * An existing rule that could serve as a dependency, with the facts the ranking uses.
 */
public record ReuseCandidate(
    ResolvableRule rule,
    SetOperation operation,
    int sharedAtoms,
    OptionalLong estimatedSize
) {

  public Long ruleId() {
    return rule.id();
  }
}
