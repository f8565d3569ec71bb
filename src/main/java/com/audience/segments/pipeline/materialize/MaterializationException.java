package com.audience.segments.pipeline.materialize;

/** Publishing a segment failed; the previously published table and catalog row are intact. */
public class MaterializationException extends RuntimeException {

  public MaterializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
