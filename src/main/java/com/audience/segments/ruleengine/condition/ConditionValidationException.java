package com.audience.segments.ruleengine.condition;

/**
 * Raised when a condition tree is malformed: unknown field or operator, a value of the
 * wrong type, or an empty group. Never retried.
 */
public class ConditionValidationException extends RuntimeException {

  private final String path;
  private final String reason;

  public ConditionValidationException(String path, String reason) {
    this(path, reason, null);
  }

  public ConditionValidationException(String path, String reason, Throwable cause) {
    super(format(path, reason), cause);
    this.path = path == null ? "" : path;
    this.reason = reason;
  }

  public String getPath() {
    return path;
  }

  public String getReason() {
    return reason;
  }

  /** Re-anchors an error raised deeper in the tree at the given node path. */
  ConditionValidationException at(String nodePath) {
    if (!path.isEmpty()) {
      return this;
    }
    return new ConditionValidationException(nodePath, reason, getCause());
  }

  private static String format(String path, String reason) {
    return path == null || path.isEmpty() ? reason : reason + " (at " + path + ")";
  }
}
