package com.audience.segments.service;

/** The requested change conflicts with other rules (duplicate name, rule still depended on). */
public class RuleConflictException extends RuntimeException {

  public RuleConflictException(String message) {
    super(message);
  }
}
