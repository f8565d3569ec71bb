package com.audience.segments.ruleengine.dependency;

import java.util.Comparator;
import java.util.OptionalLong;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Orders reuse candidates: most shared atomic predicates first, then the smaller known
 * segment (unknown sizes last), then the lowest rule id.
 */
@Component
public class DependencyRankingPolicy {

  private final boolean preferSmallerSegments;

  public DependencyRankingPolicy(
      @Value("${segments.resolver.prefer-smaller-segments:true}") boolean preferSmallerSegments) {
    this.preferSmallerSegments = preferSmallerSegments;
  }

  public Comparator<ReuseCandidate> comparator() {
    Comparator<ReuseCandidate> order =
        Comparator.comparingInt(ReuseCandidate::sharedAtoms).reversed();
    if (preferSmallerSegments) {
      order = order.thenComparing(ReuseCandidate::estimatedSize, DependencyRankingPolicy::bySize);
    }
    return order.thenComparing(ReuseCandidate::ruleId);
  }

  private static int bySize(OptionalLong a, OptionalLong b) {
    if (a.isPresent() && b.isPresent()) {
      return Long.compare(a.getAsLong(), b.getAsLong());
    }
    if (a.isPresent()) {
      return -1;
    }
    return b.isPresent() ? 1 : 0;
  }
}
