package com.audience.segments.ruleengine.dependency;

import com.audience.segments.enums.SetOperation;
import com.audience.segments.ruleengine.condition.Comparison;
import com.audience.segments.ruleengine.condition.DnfClause;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds already-materialized segments a rule can be derived from.
 *
 * <p>Two kinds of reuse are recognised on the rules' disjunctive normal forms:
 * <ul>
 *   <li><b>INTERSECTION</b>: an existing single-clause rule whose atoms appear in every
 *   clause of the candidate. The candidate is that segment filtered by the remaining atoms.
 *   Several such rules with disjoint atoms are combined, one edge each.</li>
 *   <li><b>UNION</b>: an existing rule whose clauses all appear among the candidate's
 *   clauses. The candidate is the union of such segments plus any uncovered clauses.</li>
 * </ul>
 * Only active rules whose active windows overlap the candidate's are considered, and rules
 * that already depend on the candidate are excluded up front. Every chosen edge is then
 * committed against the dependency graph of all stored rules, inactive ones included,
 * which rejects cycles.
 *
 * <p>A user is in a segment when one of their transaction rows satisfies a clause.
 * Intersecting user sets is exact only if at most one operand tests per-transaction
 * fields; per-user aggregates ({@code total_spend}, {@code transaction_count}) hold on
 * every row. An INTERSECTION dependency with per-transaction atoms is therefore taken
 * only when it holds all per-transaction atoms of every candidate clause, and then it
 * is the only such dependency.
 */
@Component
public class DependencyResolver {

  private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

  private final DependencyRankingPolicy rankingPolicy;

  public DependencyResolver(DependencyRankingPolicy rankingPolicy) {
    this.rankingPolicy = rankingPolicy;
  }

  /** Resolves against a rule set in which every stored rule is also reusable. */
  public DependencyResolution resolve(ResolvableRule candidate,
                                      Collection<ResolvableRule> activeRules,
                                      SegmentSizeEstimator sizes) {
    return resolve(candidate, activeRules, activeRules, sizes);
  }

  /**
   * @param reusable rules whose segments may be reused
   * @param allRules every stored rule; their dependencies form the graph checked for cycles
   */
  public DependencyResolution resolve(ResolvableRule candidate,
                                      Collection<ResolvableRule> reusable,
                                      Collection<ResolvableRule> allRules,
                                      SegmentSizeEstimator sizes) {
    Objects.requireNonNull(candidate.id(), "candidate rule must have an id");
    DependencyGraph graph = graphWithout(candidate, allRules);
    Set<Long> dependents = graph.dependentsOf(candidate.id());

    List<ResolvableRule> eligible = reusable.stream()
        .filter(rule -> !rule.id().equals(candidate.id()))
        .filter(rule -> !dependents.contains(rule.id()))
        .filter(rule -> !rule.dnf().isEmpty())
        .filter(candidate::overlaps)
        .toList();

    DependencyResolution intersection = planIntersection(candidate, eligible, sizes);
    DependencyResolution union = planUnion(candidate, eligible, sizes);

    DependencyResolution best = intersection;
    if (union.sharedAtoms() > intersection.sharedAtoms()) {
      best = union;
    }
    if (!best.reusesSegments()) {
      log.info("No reusable segment found for rule {}; it will be computed from raw data",
          candidate.id());
      return DependencyResolution.none(candidate.id(), candidate.dnf());
    }

    for (Long dep : best.dependsOn()) {
      graph.addEdge(candidate.id(), dep);
    }
    log.info("Rule {} reuses segments {} via {} ({} shared predicate(s), {} residual clause(s))",
        candidate.id(), best.dependsOn(), best.operation(), best.sharedAtoms(),
        best.residual().size());
    return best;
  }

  /**
   * Checks a manually chosen dependency list against the graph of the other stored rules.
   *
   * @throws DependencyCycleException if the override would close a cycle
   * @throws IllegalArgumentException if a referenced rule is unknown
   */
  public void validateOverride(Long ruleId, List<Long> dependsOn, Collection<ResolvableRule> rules) {
    Map<Long, ResolvableRule> byId = rules.stream()
        .collect(Collectors.toMap(ResolvableRule::id, Function.identity()));
    for (Long dep : dependsOn) {
      if (!byId.containsKey(dep)) {
        throw new IllegalArgumentException("Rule " + ruleId + " cannot depend on unknown rule " + dep);
      }
    }
    ResolvableRule self = byId.getOrDefault(ruleId,
        new ResolvableRule(ruleId, List.of(), null, null, List.of()));
    DependencyGraph graph = graphWithout(self, rules);
    graph.replaceDependencies(ruleId, dependsOn);
  }

  private DependencyGraph graphWithout(ResolvableRule candidate, Collection<ResolvableRule> rules) {
    List<ResolvableRule> others = new ArrayList<>();
    for (ResolvableRule rule : rules) {
      if (!rule.id().equals(candidate.id())) {
        others.add(rule);
      }
    }
    DependencyGraph graph = DependencyGraph.of(others);
    graph.addNode(candidate.id());
    return graph;
  }

  private DependencyResolution planIntersection(ResolvableRule candidate,
                                                List<ResolvableRule> eligible,
                                                SegmentSizeEstimator sizes) {
    List<ReuseCandidate> ranked = new ArrayList<>();
    for (ResolvableRule rule : eligible) {
      if (!rule.isSingleClause()) {
        continue;
      }
      DnfClause atoms = rule.dnf().get(0);
      boolean inEveryClause = candidate.dnf().stream().allMatch(c -> c.containsAll(atoms));
      if (inEveryClause) {
        ranked.add(new ReuseCandidate(rule, SetOperation.INTERSECTION, atoms.size(),
            sizes.estimate(rule.id())));
      }
    }
    ranked.sort(rankingPolicy.comparator());

    List<Long> chosen = new ArrayList<>();
    Set<Comparison> covered = new HashSet<>();
    boolean rowAnchored = false;
    for (ReuseCandidate option : ranked) {
      List<Comparison> atoms = option.rule().dnf().get(0).atoms();
      if (!Collections.disjoint(covered, atoms)) {
        continue;
      }
      if (!perUserOnly(atoms)) {
        if (rowAnchored || !holdsRowLevelAtoms(candidate, atoms)) {
          continue;
        }
        rowAnchored = true;
      }
      chosen.add(option.ruleId());
      covered.addAll(atoms);
    }
    if (chosen.isEmpty()) {
      return DependencyResolution.none(candidate.id(), candidate.dnf());
    }

    DnfClause coveredClause = DnfClause.of(covered);
    List<DnfClause> remainders = new ArrayList<>();
    boolean fullyCovered = false;
    for (DnfClause clause : candidate.dnf()) {
      DnfClause rest = clause.minus(coveredClause);
      if (rest.isEmpty()) {
        fullyCovered = true;
        break;
      }
      remainders.add(rest);
    }
    List<DnfClause> residual = fullyCovered ? List.of() : absorb(remainders);
    return new DependencyResolution(candidate.id(), SetOperation.INTERSECTION, chosen, residual,
        covered.size());
  }

  private DependencyResolution planUnion(ResolvableRule candidate,
                                         List<ResolvableRule> eligible,
                                         SegmentSizeEstimator sizes) {
    if (candidate.dnf().size() < 2) {
      return DependencyResolution.none(candidate.id(), candidate.dnf());
    }
    Set<DnfClause> candidateClauses = new LinkedHashSet<>(candidate.dnf());
    List<ReuseCandidate> ranked = new ArrayList<>();
    for (ResolvableRule rule : eligible) {
      if (candidateClauses.containsAll(rule.dnf())) {
        int shared = rule.dnf().stream().mapToInt(DnfClause::size).sum();
        ranked.add(new ReuseCandidate(rule, SetOperation.UNION, shared, sizes.estimate(rule.id())));
      }
    }
    ranked.sort(rankingPolicy.comparator());

    List<Long> chosen = new ArrayList<>();
    Set<DnfClause> covered = new HashSet<>();
    int shared = 0;
    for (ReuseCandidate option : ranked) {
      if (Collections.disjoint(covered, option.rule().dnf())) {
        chosen.add(option.ruleId());
        covered.addAll(option.rule().dnf());
        shared += option.sharedAtoms();
      }
    }
    if (chosen.isEmpty()) {
      return DependencyResolution.none(candidate.id(), candidate.dnf());
    }
    List<DnfClause> residual = candidate.dnf().stream()
        .filter(clause -> !covered.contains(clause))
        .toList();
    return new DependencyResolution(candidate.id(), SetOperation.UNION, chosen, residual, shared);
  }

  private static boolean perUserOnly(Collection<Comparison> atoms) {
    return atoms.stream().allMatch(atom -> atom.field().isPerUser());
  }

  private static boolean holdsRowLevelAtoms(ResolvableRule candidate, List<Comparison> atoms) {
    return candidate.dnf().stream()
        .flatMap(clause -> clause.atoms().stream())
        .filter(atom -> !atom.field().isPerUser())
        .allMatch(atoms::contains);
  }

  private List<DnfClause> absorb(List<DnfClause> clauses) {
    List<DnfClause> result = new ArrayList<>();
    for (DnfClause clause : new TreeSet<>(clauses)) {
      if (result.stream().noneMatch(clause::containsAll)) {
        result.add(clause);
      }
    }
    return result;
  }
}
