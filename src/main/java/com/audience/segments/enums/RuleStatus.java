package com.audience.segments.enums;

public enum RuleStatus {
  ACTIVE,
  INACTIVE
}
