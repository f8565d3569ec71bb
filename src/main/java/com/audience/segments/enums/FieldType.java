package com.audience.segments.enums;

public enum FieldType {
  INTEGER,
  DECIMAL,
  STRING,
  DATE
}
