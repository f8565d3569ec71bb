package com.audience.segments.ruleengine.condition;

import java.util.Comparator;

/**
 * Stable ordering of sibling nodes: comparisons first by (field, operator, value), then
 * groups by logic and rendered form.
 */
public final class CanonicalOrder implements Comparator<ConditionNode> {

  public static final CanonicalOrder INSTANCE = new CanonicalOrder();

  private static final SqlPredicateRenderer KEY_RENDERER = new SqlPredicateRenderer();

  private CanonicalOrder() {
  }

  @Override
  public int compare(ConditionNode a, ConditionNode b) {
    if (a instanceof Comparison ca && b instanceof Comparison cb) {
      return compareComparisons(ca, cb);
    }
    if (a instanceof Comparison) {
      return -1;
    }
    if (b instanceof Comparison) {
      return 1;
    }
    Group ga = (Group) a;
    Group gb = (Group) b;
    int byLogic = ga.logic().compareTo(gb.logic());
    if (byLogic != 0) {
      return byLogic;
    }
    return KEY_RENDERER.render(ga).compareTo(KEY_RENDERER.render(gb));
  }

  public static int compareComparisons(Comparison a, Comparison b) {
    int byField = a.field().column().compareTo(b.field().column());
    if (byField != 0) {
      return byField;
    }
    int byOperator = a.operator().compareTo(b.operator());
    if (byOperator != 0) {
      return byOperator;
    }
    return ConditionValues.compare(a.value(), b.value());
  }
}
