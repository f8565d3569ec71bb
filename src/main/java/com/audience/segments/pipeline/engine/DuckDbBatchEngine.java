package com.audience.segments.pipeline.engine;

import com.audience.segments.warehouse.DuckDbWarehouse;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs segment queries against the DuckDB warehouse on a small dedicated thread pool.
 * The pool's queue is bounded; a full pool rejects the submission.
 */
public class DuckDbBatchEngine implements BatchEngine, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(DuckDbBatchEngine.class);

  private static final List<String> STRUCTURAL_ERRORS = List.of(
      "Catalog Error", "Parser Error", "Binder Error", "Conversion Error", "Syntax Error");

  private final DuckDbWarehouse warehouse;
  private final ThreadPoolExecutor executor;

  public DuckDbBatchEngine(DuckDbWarehouse warehouse, int threadCount) {
    this.warehouse = warehouse;
    AtomicInteger counter = new AtomicInteger();
    this.executor = new ThreadPoolExecutor(threadCount, threadCount, 0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(threadCount * 4),
        r -> {
          Thread t = new Thread(r, "batch-engine-" + counter.getAndIncrement());
          t.setDaemon(true);
          return t;
        });
  }

  @Override
  public BatchTask submit(BatchQuery query) {
    CompletableFuture<SegmentResult> completion = new CompletableFuture<>();
    AtomicReference<Statement> running = new AtomicReference<>();
    Future<?> work;
    try {
      work = executor.submit(() -> execute(query, running, completion));
    } catch (RejectedExecutionException e) {
      throw new BatchSubmissionException(
          "Batch engine is saturated; query for rule " + query.ruleId() + " was not accepted", e);
    }
    log.debug("Submitted query for rule {} to {}: {}", query.ruleId(), query.dataSourceUrl(), query.sql());

    Runnable terminate = () -> {
      Statement stmt = running.get();
      if (stmt != null) {
        try {
          stmt.cancel();
        } catch (SQLException e) {
          log.warn("Could not cancel running query for rule {}", query.ruleId(), e);
        }
      }
      work.cancel(true);
      completion.cancel(true);
    };
    return new BatchTask(completion, terminate);
  }

  private void execute(BatchQuery query,
                       AtomicReference<Statement> running,
                       CompletableFuture<SegmentResult> completion) {
    try (Connection conn = warehouse.openConnection();
         Statement stmt = conn.createStatement()) {
      running.set(stmt);
      List<String> userIds = new ArrayList<>();
      try (ResultSet rs = stmt.executeQuery(query.sql())) {
        while (rs.next()) {
          userIds.add(rs.getString(1));
        }
      }
      log.info("Query for rule {} returned {} user(s)", query.ruleId(), userIds.size());
      completion.complete(new SegmentResult(userIds));
    } catch (SQLException e) {
      completion.completeExceptionally(classify(query, e));
    } catch (RuntimeException e) {
      completion.completeExceptionally(
          new BatchSubmissionException("Query for rule " + query.ruleId() + " failed", e));
    } finally {
      running.set(null);
    }
  }

  static RuntimeException classify(BatchQuery query, SQLException e) {
    String message = e.getMessage() == null ? "" : e.getMessage();
    for (String marker : STRUCTURAL_ERRORS) {
      if (message.contains(marker)) {
        return new BatchQueryException(
            "Query for rule " + query.ruleId() + " is invalid: " + message, e);
      }
    }
    return new BatchSubmissionException(
        "Query for rule " + query.ruleId() + " failed: " + message, e);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
