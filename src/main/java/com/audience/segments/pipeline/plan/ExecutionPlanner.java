package com.audience.segments.pipeline.plan;

import com.audience.segments.model.RuleDto;
import com.audience.segments.ruleengine.dependency.DependencyCycleException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Orders rules topologically over their {@code dependsOn} relation and attaches the query
 * each rule is materialized with. Rules without an ordering constraint between them come
 * out by ascending id. Dependencies outside the given collection do not constrain order.
 */
@Component
public class ExecutionPlanner {

  private static final Logger log = LoggerFactory.getLogger(ExecutionPlanner.class);

  private final SegmentQueryBuilder queryBuilder;

  public ExecutionPlanner(SegmentQueryBuilder queryBuilder) {
    this.queryBuilder = queryBuilder;
  }

  public ExecutionPlan plan(Collection<RuleDto> rules) {
    Map<Long, RuleDto> byId = index(rules);
    List<PlannedStep> steps = new ArrayList<>();
    for (Long id : topologicalOrder(byId)) {
      RuleDto rule = byId.get(id);
      steps.add(new PlannedStep(id, rule.dependsOn(), rule.operation(), queryBuilder.buildQuery(rule)));
    }
    log.debug("Planned materialization order {}", steps.stream().map(PlannedStep::ruleId).toList());
    return new ExecutionPlan(steps);
  }

  /** Rule ids in materialization order, without building queries. */
  public List<Long> order(Collection<RuleDto> rules) {
    return topologicalOrder(index(rules));
  }

  private Map<Long, RuleDto> index(Collection<RuleDto> rules) {
    Map<Long, RuleDto> byId = new TreeMap<>();
    rules.forEach(rule -> byId.put(rule.id(), rule));
    return byId;
  }

  private List<Long> topologicalOrder(Map<Long, RuleDto> byId) {
    Map<Long, Integer> pendingDeps = new HashMap<>();
    Map<Long, List<Long>> dependents = new HashMap<>();
    for (RuleDto rule : byId.values()) {
      int count = 0;
      for (Long dep : rule.dependsOn()) {
        if (byId.containsKey(dep)) {
          count++;
          dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(rule.id());
        }
      }
      pendingDeps.put(rule.id(), count);
    }

    PriorityQueue<Long> ready = new PriorityQueue<>();
    pendingDeps.forEach((id, count) -> {
      if (count == 0) {
        ready.add(id);
      }
    });

    List<Long> order = new ArrayList<>();
    while (!ready.isEmpty()) {
      Long id = ready.poll();
      order.add(id);
      for (Long dependent : dependents.getOrDefault(id, List.of())) {
        if (pendingDeps.merge(dependent, -1, Integer::sum) == 0) {
          ready.add(dependent);
        }
      }
    }

    if (order.size() < byId.size()) {
      List<Long> stuck = pendingDeps.entrySet().stream()
          .filter(e -> e.getValue() > 0)
          .map(Map.Entry::getKey)
          .sorted()
          .toList();
      throw new DependencyCycleException("Rules " + stuck + " form a dependency cycle", stuck);
    }
    return order;
  }

  /** Query for a single rule, reading dependencies from their materialized tables. */
  public String queryFor(RuleDto rule) {
    return queryBuilder.buildQuery(rule);
  }
}
