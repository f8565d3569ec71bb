package com.audience.segments.enums;

public enum GroupLogic {
  AND,
  OR
}
