package com.audience.segments.pipeline.materialize;

import com.audience.segments.model.RuleDto;
import com.audience.segments.model.SegmentCatalogEntry;
import com.audience.segments.pipeline.engine.SegmentResult;
import com.audience.segments.warehouse.DuckDbWarehouse;
import com.audience.segments.warehouse.SegmentTables;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes a segment's rows as {@code segment_output_<ruleId>}.
 *
 * <p>Rows are first written to a staging table. The old output table is then dropped, the
 * staging table renamed into place and the catalog row upserted inside one warehouse
 * transaction, so a concurrent reader sees either the complete old segment or the
 * complete new one. On failure the transaction is rolled back and the staging table is
 * dropped; the previous segment stays as it was.
 */
public class MaterializationWriter {

  private static final Logger log = LoggerFactory.getLogger(MaterializationWriter.class);

  static final int INSERT_BATCH_SIZE = 1000;

  private final DuckDbWarehouse warehouse;
  private final SegmentCatalogRepository catalogRepository;
  private final Clock clock;

  public MaterializationWriter(DuckDbWarehouse warehouse,
                               SegmentCatalogRepository catalogRepository,
                               Clock clock) {
    this.warehouse = warehouse;
    this.catalogRepository = catalogRepository;
    this.clock = clock;
  }

  public SegmentCatalogEntry publish(RuleDto rule, String sqlQuery, SegmentResult result) {
    Long ruleId = rule.id();
    String outputTable = SegmentTables.outputTable(ruleId);
    String stagingTable = SegmentTables.stagingTable(ruleId,
        UUID.randomUUID().toString().replace("-", "").substring(0, 12));

    try (Connection conn = warehouse.openConnection()) {
      try {
        writeStaging(conn, stagingTable, result);
      } catch (SQLException e) {
        dropStaging(conn, stagingTable);
        throw new MaterializationException(
            "Failed to stage rows for rule " + ruleId + ": " + e.getMessage(), e);
      }

      conn.setAutoCommit(false);
      try (Statement stmt = conn.createStatement()) {
        stmt.execute("DROP TABLE IF EXISTS " + outputTable);
        stmt.execute("ALTER TABLE " + stagingTable + " RENAME TO " + outputTable);
        SegmentCatalogEntry entry = catalogRepository.upsert(conn, ruleId, result.rowCount(),
            sqlQuery, rule.dependsOn(), rule.operation(), Instant.now(clock));
        conn.commit();
        log.info("Published {} with {} row(s)", outputTable, entry.rowCount());
        return entry;
      } catch (SQLException e) {
        rollback(conn, ruleId);
        conn.setAutoCommit(true);
        dropStaging(conn, stagingTable);
        throw new MaterializationException(
            "Failed to publish segment for rule " + ruleId + ": " + e.getMessage(), e);
      }
    } catch (SQLException e) {
      throw new MaterializationException(
          "Warehouse unavailable while publishing rule " + ruleId + ": " + e.getMessage(), e);
    }
  }

  private void writeStaging(Connection conn, String stagingTable, SegmentResult result)
      throws SQLException {
    try (Statement stmt = conn.createStatement()) {
      stmt.execute("CREATE TABLE " + stagingTable + " (user_id VARCHAR NOT NULL)");
    }
    try (PreparedStatement ps = conn.prepareStatement("INSERT INTO " + stagingTable + " VALUES (?)")) {
      int pending = 0;
      for (String userId : result.userIds()) {
        ps.setString(1, userId);
        ps.addBatch();
        if (++pending == INSERT_BATCH_SIZE) {
          ps.executeBatch();
          pending = 0;
        }
      }
      if (pending > 0) {
        ps.executeBatch();
      }
    }
  }

  private void rollback(Connection conn, Long ruleId) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      log.error("Rollback failed while publishing rule {}", ruleId, e);
    }
  }

  private void dropStaging(Connection conn, String stagingTable) {
    try (Statement stmt = conn.createStatement()) {
      stmt.execute("DROP TABLE IF EXISTS " + stagingTable);
    } catch (SQLException e) {
      log.warn("Could not drop staging table {}", stagingTable, e);
    }
  }
}
