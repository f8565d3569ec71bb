package com.audience.segments.ruleengine.dependency;

import com.audience.segments.enums.SetOperation;

/**
 * Derived edge: {@code ruleId}'s segment is obtained from {@code dependsOnRuleId}'s output
 * table through {@code operation}, plus the optional extra predicate scanned from raw data.
 */
public record DependencyEdge(
    Long ruleId,
    Long dependsOnRuleId,
    SetOperation operation,
    String extraPredicate
) {}
