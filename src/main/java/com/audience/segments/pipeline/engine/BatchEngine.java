package com.audience.segments.pipeline.engine;

/**
 * External executor that runs a segment query. Submission returns immediately; the
 * returned task completes with the segment's user ids or fails.
 */
public interface BatchEngine {

  /**
   * @throws BatchSubmissionException if the engine cannot accept the query right now
   */
  BatchTask submit(BatchQuery query);
}
