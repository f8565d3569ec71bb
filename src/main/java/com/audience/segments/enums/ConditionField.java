package com.audience.segments.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Transaction and user attributes a rule may filter on. Per-user aggregates are exposed
 * on every transaction row, so all fields share the same predicate language.
 */
public enum ConditionField {
  CITY_TIER("city_tier", FieldType.INTEGER, false),
  AMOUNT("amount", FieldType.DECIMAL, false),
  CATEGORY("category", FieldType.STRING, false),
  MERCHANT_NAME("merchant_name", FieldType.STRING, false),
  TRANSACTION_TYPE("transaction_type", FieldType.STRING, false),
  TRANSACTION_DATE("transaction_date", FieldType.DATE, false),
  TOTAL_SPEND("total_spend", FieldType.DECIMAL, true),
  TRANSACTION_COUNT("transaction_count", FieldType.INTEGER, true);

  private final String column;
  private final FieldType type;
  private final boolean perUser;

  ConditionField(String column, FieldType type, boolean perUser) {
    this.column = column;
    this.type = type;
    this.perUser = perUser;
  }

  public String column() {
    return column;
  }

  public FieldType type() {
    return type;
  }

  /** True if the value is the same on every transaction row of a user. */
  public boolean isPerUser() {
    return perUser;
  }

  public static Optional<ConditionField> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(f -> f.column.equals(key))
        .findFirst();
  }
}
