package com.audience.segments.ruleengine.dependency;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule dependency DAG with index-addressed adjacency lists. An edge {@code a -> b} means
 * rule {@code a} is derived from rule {@code b}'s segment. Every edge is checked by an
 * iterative reachability search before it is committed, so the graph stays acyclic and
 * no traversal can loop.
 */
public class DependencyGraph {

  private final Map<Long, Integer> indexById = new HashMap<>();
  private final List<Long> idByIndex = new ArrayList<>();
  private final List<Set<Integer>> dependencies = new ArrayList<>();

  public static DependencyGraph of(Collection<ResolvableRule> rules) {
    DependencyGraph graph = new DependencyGraph();
    rules.forEach(rule -> graph.addNode(rule.id()));
    for (ResolvableRule rule : rules) {
      for (Long dep : rule.dependsOn()) {
        graph.addEdge(rule.id(), dep);
      }
    }
    return graph;
  }

  public void addNode(Long ruleId) {
    indexOf(ruleId);
  }

  public boolean contains(Long ruleId) {
    return indexById.containsKey(ruleId);
  }

  /**
   * Commits {@code ruleId -> dependsOnRuleId}.
   *
   * @throws DependencyCycleException if the dependency already reaches {@code ruleId}
   */
  public void addEdge(Long ruleId, Long dependsOnRuleId) {
    if (ruleId.equals(dependsOnRuleId)) {
      throw new DependencyCycleException(
          "Rule " + ruleId + " cannot depend on itself", List.of(ruleId));
    }
    int from = indexOf(ruleId);
    int to = indexOf(dependsOnRuleId);
    if (reaches(to, from)) {
      throw new DependencyCycleException(
          "Rule " + ruleId + " depending on rule " + dependsOnRuleId + " would create a cycle",
          List.of(ruleId, dependsOnRuleId));
    }
    dependencies.get(from).add(to);
  }

  /**
   * Replaces all outgoing edges of a rule. On a cycle the previous edges are restored and
   * the exception is rethrown.
   */
  public void replaceDependencies(Long ruleId, List<Long> dependsOn) {
    int from = indexOf(ruleId);
    Set<Integer> previous = new LinkedHashSet<>(dependencies.get(from));
    dependencies.get(from).clear();
    try {
      for (Long dep : dependsOn) {
        addEdge(ruleId, dep);
      }
    } catch (DependencyCycleException e) {
      dependencies.get(from).clear();
      dependencies.get(from).addAll(previous);
      throw e;
    }
  }

  /** True if {@code ruleId} transitively depends on {@code otherRuleId}. */
  public boolean dependsOn(Long ruleId, Long otherRuleId) {
    Integer from = indexById.get(ruleId);
    Integer to = indexById.get(otherRuleId);
    if (from == null || to == null || from.equals(to)) {
      return false;
    }
    return reaches(from, to);
  }

  /** Rules that transitively depend on the given rule. */
  public Set<Long> dependentsOf(Long ruleId) {
    Set<Long> dependents = new LinkedHashSet<>();
    Integer target = indexById.get(ruleId);
    if (target == null) {
      return dependents;
    }
    for (int i = 0; i < idByIndex.size(); i++) {
      if (i != target && reaches(i, target)) {
        dependents.add(idByIndex.get(i));
      }
    }
    return dependents;
  }

  public List<Long> directDependencies(Long ruleId) {
    Integer index = indexById.get(ruleId);
    if (index == null) {
      return List.of();
    }
    return dependencies.get(index).stream().map(idByIndex::get).toList();
  }

  public Set<Long> nodes() {
    return new LinkedHashSet<>(idByIndex);
  }

  /** Kahn-style check that every node can be peeled off. */
  public boolean isAcyclic() {
    int n = idByIndex.size();
    int[] remainingDeps = new int[n];
    List<List<Integer>> dependents = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      dependents.add(new ArrayList<>());
    }
    for (int i = 0; i < n; i++) {
      remainingDeps[i] = dependencies.get(i).size();
      for (int dep : dependencies.get(i)) {
        dependents.get(dep).add(i);
      }
    }
    Deque<Integer> ready = new ArrayDeque<>();
    for (int i = 0; i < n; i++) {
      if (remainingDeps[i] == 0) {
        ready.add(i);
      }
    }
    int peeled = 0;
    while (!ready.isEmpty()) {
      int node = ready.poll();
      peeled++;
      for (int dependent : dependents.get(node)) {
        if (--remainingDeps[dependent] == 0) {
          ready.add(dependent);
        }
      }
    }
    return peeled == n;
  }

  private int indexOf(Long ruleId) {
    Integer existing = indexById.get(ruleId);
    if (existing != null) {
      return existing;
    }
    int index = idByIndex.size();
    indexById.put(ruleId, index);
    idByIndex.add(ruleId);
    dependencies.add(new LinkedHashSet<>());
    return index;
  }

  private boolean reaches(int from, int to) {
    if (from == to) {
      return true;
    }
    boolean[] visited = new boolean[idByIndex.size()];
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(from);
    visited[from] = true;
    while (!stack.isEmpty()) {
      int node = stack.pop();
      for (int next : dependencies.get(node)) {
        if (next == to) {
          return true;
        }
        if (!visited[next]) {
          visited[next] = true;
          stack.push(next);
        }
      }
    }
    return false;
  }
}
