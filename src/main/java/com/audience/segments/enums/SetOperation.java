package com.audience.segments.enums;

public enum SetOperation {
  INTERSECTION("INTERSECT"),
  UNION("UNION");

  private final String sqlKeyword;

  SetOperation(String sqlKeyword) {
    this.sqlKeyword = sqlKeyword;
  }

  public String sqlKeyword() {
    return sqlKeyword;
  }
}
