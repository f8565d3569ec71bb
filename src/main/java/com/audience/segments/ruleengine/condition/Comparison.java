package com.audience.segments.ruleengine.condition;

import com.audience.segments.enums.ComparisonOperator;
import com.audience.segments.enums.ConditionField;
import java.util.Objects;

/**
 * Atomic predicate {@code field operator value}. The value is coerced to the field's
 * canonical Java type on construction: {@code Long}, {@code BigDecimal} without trailing
 * zeros, {@code String} or {@code LocalDate}; {@code IN} carries a sorted, de-duplicated
 * list of such values.
 */
public record Comparison(
    ConditionField field,
    ComparisonOperator operator,
    Object value
) implements ConditionNode {

  public Comparison {
    if (field == null) {
      throw new ConditionValidationException("", "comparison field is required");
    }
    if (operator == null) {
      throw new ConditionValidationException("", "comparison operator is required");
    }
    value = ConditionValues.coerce(field, operator, value);
  }

  public static Comparison of(ConditionField field, ComparisonOperator operator, Object value) {
    return new Comparison(field, operator, value);
  }

  @Override
  public String toString() {
    return field.column() + " " + operator.symbol() + " " + Objects.toString(value);
  }
}
