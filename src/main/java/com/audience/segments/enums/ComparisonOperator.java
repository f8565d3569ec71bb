package com.audience.segments.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ComparisonOperator {
  EQ("="),
  NE("!="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),
  IN("IN");

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /** Accepts either the SQL symbol or the enum name, case-insensitive. */
  public static Optional<ComparisonOperator> fromToken(String token) {
    if (token == null) {
      return Optional.empty();
    }
    String t = token.trim();
    String upper = t.toUpperCase(Locale.ROOT);
    if ("<>".equals(t)) {
      return Optional.of(NE);
    }
    if ("==".equals(t)) {
      return Optional.of(EQ);
    }
    return Arrays.stream(values())
        .filter(op -> op.symbol.equals(upper) || op.name().equals(upper))
        .findFirst();
  }
}
