package com.audience.segments.pipeline.scheduler;

import java.time.Duration;

public record SchedulerSettings(
    String dataSourceUrl,
    int workerCount,
    Duration jobTimeout
) {}
