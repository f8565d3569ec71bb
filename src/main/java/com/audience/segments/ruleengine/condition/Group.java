package com.audience.segments.ruleengine.condition;

import com.audience.segments.enums.GroupLogic;
import java.util.List;

public record Group(
    GroupLogic logic,
    List<ConditionNode> children
) implements ConditionNode {

  public Group {
    if (logic == null) {
      throw new ConditionValidationException("", "group logic is required");
    }
    if (children == null || children.isEmpty()) {
      throw new ConditionValidationException("", "group must have at least one child");
    }
    children = List.copyOf(children);
  }

  public static Group and(ConditionNode... children) {
    return new Group(GroupLogic.AND, List.of(children));
  }

  public static Group or(ConditionNode... children) {
    return new Group(GroupLogic.OR, List.of(children));
  }
}
