package com.audience.segments.ruleengine.condition;

import com.audience.segments.enums.ComparisonOperator;
import com.audience.segments.enums.ConditionField;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Coerces comparison values to the canonical type of their field.
 */
final class ConditionValues {

  private ConditionValues() {
  }

  static Object coerce(ConditionField field, ComparisonOperator operator, Object raw) {
    if (operator == ComparisonOperator.IN) {
      if (!(raw instanceof Collection<?> items) || items.isEmpty()) {
        throw new ConditionValidationException("",
            "operator IN on '" + field.column() + "' requires a non-empty list of values");
      }
      TreeSet<Object> distinct = new TreeSet<>(ConditionValues::compare);
      for (Object item : items) {
        distinct.add(coerceScalar(field, item));
      }
      return List.copyOf(new ArrayList<>(distinct));
    }
    if (raw instanceof Collection<?>) {
      throw new ConditionValidationException("",
          "operator " + operator.symbol() + " on '" + field.column() + "' requires a single value");
    }
    return coerceScalar(field, raw);
  }

  private static Object coerceScalar(ConditionField field, Object raw) {
    if (raw == null) {
      throw new ConditionValidationException("", "value for '" + field.column() + "' is required");
    }
    try {
      return switch (field.type()) {
        case INTEGER -> toLong(field, raw);
        case DECIMAL -> toDecimal(field, raw);
        case STRING -> toText(field, raw);
        case DATE -> toDate(field, raw);
      };
    } catch (NumberFormatException | ArithmeticException | DateTimeParseException e) {
      throw new ConditionValidationException("",
          "value '" + raw + "' is not a valid " + field.type() + " for '" + field.column() + "'", e);
    }
  }

  private static Long toLong(ConditionField field, Object raw) {
    if (raw instanceof Long l) {
      return l;
    }
    if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
      return ((Number) raw).longValue();
    }
    if (raw instanceof BigInteger bi) {
      return bi.longValueExact();
    }
    if (raw instanceof BigDecimal bd) {
      return bd.longValueExact();
    }
    if (raw instanceof String s) {
      return Long.parseLong(s.trim());
    }
    throw mismatch(field, raw);
  }

  private static BigDecimal toDecimal(ConditionField field, Object raw) {
    BigDecimal decimal;
    if (raw instanceof BigDecimal bd) {
      decimal = bd;
    } else if (raw instanceof Double || raw instanceof Float) {
      decimal = BigDecimal.valueOf(((Number) raw).doubleValue());
    } else if (raw instanceof Number n) {
      decimal = new BigDecimal(n.toString());
    } else if (raw instanceof String s) {
      decimal = new BigDecimal(s.trim());
    } else {
      throw mismatch(field, raw);
    }
    return decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
  }

  private static String toText(ConditionField field, Object raw) {
    if (raw instanceof String s) {
      return s;
    }
    throw mismatch(field, raw);
  }

  private static LocalDate toDate(ConditionField field, Object raw) {
    if (raw instanceof LocalDate d) {
      return d;
    }
    if (raw instanceof String s) {
      return LocalDate.parse(s.trim());
    }
    throw mismatch(field, raw);
  }

  private static ConditionValidationException mismatch(ConditionField field, Object raw) {
    return new ConditionValidationException("",
        "value '" + raw + "' is not a valid " + field.type() + " for '" + field.column() + "'");
  }

  /**
   * Orders coerced values: numbers, text and dates by their natural order, lists element by
   * element. Values of different types fall back to their string form.
   */
  static int compare(Object a, Object b) {
    if (a instanceof List<?> la && b instanceof List<?> lb) {
      for (int i = 0; i < Math.min(la.size(), lb.size()); i++) {
        int c = compare(la.get(i), lb.get(i));
        if (c != 0) {
          return c;
        }
      }
      return Integer.compare(la.size(), lb.size());
    }
    if (a instanceof Long x && b instanceof Long y) {
      return x.compareTo(y);
    }
    if (a instanceof BigDecimal x && b instanceof BigDecimal y) {
      return x.compareTo(y);
    }
    if (a instanceof String x && b instanceof String y) {
      return x.compareTo(y);
    }
    if (a instanceof LocalDate x && b instanceof LocalDate y) {
      return x.compareTo(y);
    }
    return String.valueOf(a).compareTo(String.valueOf(b));
  }
}
