package com.audience.segments.ruleengine.condition;

/**
 * A node of a rule's filter tree: either a single field comparison or a boolean group of
 * child nodes. Nodes are immutable and built bottom-up, so a tree can never contain itself.
 */
public sealed interface ConditionNode permits Comparison, Group {
}
