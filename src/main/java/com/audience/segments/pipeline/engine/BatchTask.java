package com.audience.segments.pipeline.engine;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a submitted query. {@code terminate} stops the underlying work best-effort
 * and may be called more than once.
 */
public record BatchTask(
    CompletableFuture<SegmentResult> completion,
    Runnable terminate
) {}
