package com.audience.segments.config;

import com.audience.segments.pipeline.engine.BatchEngine;
import com.audience.segments.pipeline.engine.DuckDbBatchEngine;
import com.audience.segments.pipeline.materialize.MaterializationWriter;
import com.audience.segments.pipeline.materialize.SegmentCatalogRepository;
import com.audience.segments.pipeline.plan.ExecutionPlanner;
import com.audience.segments.pipeline.scheduler.InMemoryJobQueue;
import com.audience.segments.pipeline.scheduler.JobHistory;
import com.audience.segments.pipeline.scheduler.JobQueue;
import com.audience.segments.pipeline.scheduler.MaterializationScheduler;
import com.audience.segments.pipeline.scheduler.RetryPolicy;
import com.audience.segments.pipeline.scheduler.RuleSource;
import com.audience.segments.pipeline.scheduler.SchedulerSettings;
import com.audience.segments.warehouse.DuckDbWarehouse;
import com.audience.segments.warehouse.WarehouseSchemaInitializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "close")
  public DuckDbWarehouse warehouse(@Value("${segments.warehouse.url:jdbc:duckdb:}") String url)
      throws SQLException {
    DuckDbWarehouse warehouse = new DuckDbWarehouse(url);
    new WarehouseSchemaInitializer(warehouse, WarehouseSchemaInitializer.DEFAULT_SCHEMA).initialize();
    return warehouse;
  }

  @Bean
  public SegmentCatalogRepository segmentCatalogRepository(DuckDbWarehouse warehouse,
                                                           ObjectMapper objectMapper) {
    return new SegmentCatalogRepository(warehouse, objectMapper);
  }

  @Bean
  public MaterializationWriter materializationWriter(DuckDbWarehouse warehouse,
                                                     SegmentCatalogRepository catalogRepository,
                                                     Clock clock) {
    return new MaterializationWriter(warehouse, catalogRepository, clock);
  }

  @Bean(destroyMethod = "close")
  public DuckDbBatchEngine batchEngine(DuckDbWarehouse warehouse,
                                       @Value("${segments.engine.thread-count:2}") int threadCount) {
    return new DuckDbBatchEngine(warehouse, threadCount);
  }

  @Bean
  public JobQueue jobQueue(@Value("${segments.scheduler.queue-capacity:1000}") int capacity) {
    return new InMemoryJobQueue(capacity);
  }

  @Bean
  public RetryPolicy retryPolicy(
      @Value("${segments.scheduler.max-attempts:3}") int maxAttempts,
      @Value("${segments.scheduler.backoff-base-ms:5000}") long backoffBaseMs,
      @Value("${segments.scheduler.backoff-max-ms:300000}") long backoffMaxMs) {
    return new RetryPolicy(maxAttempts, Duration.ofMillis(backoffBaseMs), Duration.ofMillis(backoffMaxMs));
  }

  @Bean(initMethod = "start", destroyMethod = "stop")
  public MaterializationScheduler materializationScheduler(
      RuleSource ruleSource,
      ExecutionPlanner planner,
      BatchEngine batchEngine,
      MaterializationWriter writer,
      SegmentCatalogRepository catalogRepository,
      JobQueue jobQueue,
      RetryPolicy retryPolicy,
      DuckDbWarehouse warehouse,
      Clock clock,
      @Value("${segments.scheduler.worker-count:2}") int workerCount,
      @Value("${segments.scheduler.job-timeout-ms:600000}") long jobTimeoutMs,
      @Value("${segments.scheduler.history-size:200}") int historySize) {
    SchedulerSettings settings =
        new SchedulerSettings(warehouse.url(), workerCount, Duration.ofMillis(jobTimeoutMs));
    return new MaterializationScheduler(ruleSource, planner, batchEngine, writer,
        catalogRepository, jobQueue, new JobHistory(historySize), retryPolicy, settings, clock);
  }
}
