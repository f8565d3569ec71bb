package com.audience.segments.ruleengine.condition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * One conjunctive clause of a disjunctive normal form: a sorted set of atomic comparisons.
 */
public record DnfClause(List<Comparison> atoms) implements Comparable<DnfClause> {

  public DnfClause {
    TreeSet<Comparison> sorted = new TreeSet<>(CanonicalOrder::compareComparisons);
    sorted.addAll(atoms);
    atoms = List.copyOf(sorted);
  }

  public static DnfClause of(Collection<Comparison> atoms) {
    return new DnfClause(new ArrayList<>(atoms));
  }

  public int size() {
    return atoms.size();
  }

  public boolean containsAll(DnfClause other) {
    return atoms.containsAll(other.atoms);
  }

  public DnfClause minus(DnfClause other) {
    List<Comparison> remaining = new ArrayList<>(atoms);
    remaining.removeAll(other.atoms);
    return new DnfClause(remaining);
  }

  public DnfClause union(DnfClause other) {
    List<Comparison> merged = new ArrayList<>(atoms);
    merged.addAll(other.atoms);
    return new DnfClause(merged);
  }

  public boolean isEmpty() {
    return atoms.isEmpty();
  }

  /** Shorter clauses first, then atom by atom. */
  @Override
  public int compareTo(DnfClause other) {
    int bySize = Integer.compare(size(), other.size());
    if (bySize != 0) {
      return bySize;
    }
    for (int i = 0; i < size(); i++) {
      int c = CanonicalOrder.compareComparisons(atoms.get(i), other.atoms.get(i));
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }
}
