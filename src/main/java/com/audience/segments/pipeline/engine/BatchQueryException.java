package com.audience.segments.pipeline.engine;

/** The query itself is broken (unknown table, bad SQL); retrying cannot help. */
public class BatchQueryException extends RuntimeException {

  public BatchQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
