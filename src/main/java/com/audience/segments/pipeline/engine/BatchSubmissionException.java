package com.audience.segments.pipeline.engine;

/** Transient engine failure; the job may be retried. */
public class BatchSubmissionException extends RuntimeException {

  public BatchSubmissionException(String message) {
    super(message);
  }

  public BatchSubmissionException(String message, Throwable cause) {
    super(message, cause);
  }
}
