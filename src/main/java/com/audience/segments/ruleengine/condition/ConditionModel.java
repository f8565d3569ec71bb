package com.audience.segments.ruleengine.condition;

import java.util.List;

/**
 * Canonical form of a rule's filter: the normalized tree, its disjunctive normal form and
 * the SQL predicate rendered from the tree.
 */
public record ConditionModel(
    ConditionNode root,
    List<DnfClause> dnf,
    String predicate
) {

  public ConditionModel {
    dnf = List.copyOf(dnf);
  }

  public int atomCount() {
    return dnf.stream().mapToInt(DnfClause::size).sum();
  }
}
