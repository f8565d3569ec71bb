package com.audience.segments.ruleengine.dependency;

import java.util.OptionalLong;

/**
 * Estimated number of users in a rule's materialized segment, when known.
 */
@FunctionalInterface
public interface SegmentSizeEstimator {

  SegmentSizeEstimator UNKNOWN = ruleId -> OptionalLong.empty();

  OptionalLong estimate(Long ruleId);
}
