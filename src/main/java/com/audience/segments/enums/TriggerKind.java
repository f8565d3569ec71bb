package com.audience.segments.enums;

public enum TriggerKind {
  SCHEDULED,
  MANUAL
}
