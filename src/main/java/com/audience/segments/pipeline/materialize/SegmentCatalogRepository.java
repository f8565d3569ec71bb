package com.audience.segments.pipeline.materialize;

import com.audience.segments.enums.SetOperation;
import com.audience.segments.model.SegmentCatalogEntry;
import com.audience.segments.warehouse.DuckDbWarehouse;
import com.audience.segments.warehouse.SegmentTables;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * JDBC access to the {@code segment_catalog} table in the warehouse. Writes take the
 * caller's connection so they can join the caller's transaction.
 */
public class SegmentCatalogRepository {

  private static final String COLUMNS = "id, rule_id, segment_name, table_name, row_count, "
      + "sql_query, depends_on, operation, last_refreshed_at, created_at";

  private final DuckDbWarehouse warehouse;
  private final ObjectMapper objectMapper;

  public SegmentCatalogRepository(DuckDbWarehouse warehouse, ObjectMapper objectMapper) {
    this.warehouse = warehouse;
    this.objectMapper = objectMapper;
  }

  public List<SegmentCatalogEntry> findAll() {
    return query("SELECT " + COLUMNS + " FROM " + SegmentTables.CATALOG_TABLE + " ORDER BY rule_id");
  }

  public List<SegmentCatalogEntry> findPage(long offset, int limit) {
    return query("SELECT " + COLUMNS + " FROM " + SegmentTables.CATALOG_TABLE
        + " ORDER BY rule_id LIMIT ? OFFSET ?", limit, offset);
  }

  public long count() {
    try (Connection conn = warehouse.openConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery("SELECT count(*) FROM " + SegmentTables.CATALOG_TABLE)) {
      rs.next();
      return rs.getLong(1);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to count segment catalog", e);
    }
  }

  public Optional<SegmentCatalogEntry> findById(Long id) {
    return query("SELECT " + COLUMNS + " FROM " + SegmentTables.CATALOG_TABLE + " WHERE id = ?", id)
        .stream().findFirst();
  }

  public Optional<SegmentCatalogEntry> findByRuleId(Long ruleId) {
    return query("SELECT " + COLUMNS + " FROM " + SegmentTables.CATALOG_TABLE + " WHERE rule_id = ?", ruleId)
        .stream().findFirst();
  }

  public boolean existsForRule(Long ruleId) {
    return findByRuleId(ruleId).isPresent();
  }

  /** Row count of the rule's last publish, used to rank reuse candidates. */
  public OptionalLong rowCount(Long ruleId) {
    return findByRuleId(ruleId)
        .map(entry -> OptionalLong.of(entry.rowCount()))
        .orElse(OptionalLong.empty());
  }

  /**
   * Inserts or overwrites the catalog row for {@code ruleId} on the given connection.
   * Does not commit.
   */
  public SegmentCatalogEntry upsert(Connection conn,
                                    Long ruleId,
                                    long rowCount,
                                    String sqlQuery,
                                    List<Long> dependsOn,
                                    SetOperation operation,
                                    Instant refreshedAt) throws SQLException {
    String dependsOnJson = writeDependsOn(dependsOn);
    String operationName = operation != null ? operation.name() : null;

    boolean exists;
    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT 1 FROM " + SegmentTables.CATALOG_TABLE + " WHERE rule_id = ?")) {
      ps.setLong(1, ruleId);
      try (ResultSet rs = ps.executeQuery()) {
        exists = rs.next();
      }
    }

    if (exists) {
      try (PreparedStatement ps = conn.prepareStatement("UPDATE " + SegmentTables.CATALOG_TABLE
          + " SET segment_name = ?, table_name = ?, row_count = ?, sql_query = ?, depends_on = ?,"
          + " operation = ?, last_refreshed_at = ? WHERE rule_id = ?")) {
        ps.setString(1, SegmentTables.segmentName(ruleId));
        ps.setString(2, SegmentTables.outputTable(ruleId));
        ps.setLong(3, rowCount);
        ps.setString(4, sqlQuery);
        ps.setString(5, dependsOnJson);
        setNullableString(ps, 6, operationName);
        ps.setTimestamp(7, Timestamp.from(refreshedAt));
        ps.setLong(8, ruleId);
        ps.executeUpdate();
      }
    } else {
      try (PreparedStatement ps = conn.prepareStatement("INSERT INTO " + SegmentTables.CATALOG_TABLE
          + " (" + COLUMNS + ") VALUES (nextval('segment_catalog_seq'), ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
        ps.setLong(1, ruleId);
        ps.setString(2, SegmentTables.segmentName(ruleId));
        ps.setString(3, SegmentTables.outputTable(ruleId));
        ps.setLong(4, rowCount);
        ps.setString(5, sqlQuery);
        ps.setString(6, dependsOnJson);
        setNullableString(ps, 7, operationName);
        ps.setTimestamp(8, Timestamp.from(refreshedAt));
        ps.setTimestamp(9, Timestamp.from(refreshedAt));
        ps.executeUpdate();
      }
    }

    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT " + COLUMNS + " FROM " + SegmentTables.CATALOG_TABLE + " WHERE rule_id = ?")) {
      ps.setLong(1, ruleId);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new SQLException("Catalog row for rule " + ruleId + " vanished after upsert");
        }
        return map(rs);
      }
    }
  }

  /** Drops the rule's output table and catalog row in one transaction. */
  public boolean deleteByRuleId(Long ruleId) {
    try (Connection conn = warehouse.openConnection()) {
      conn.setAutoCommit(false);
      try (PreparedStatement ps = conn.prepareStatement(
          "DELETE FROM " + SegmentTables.CATALOG_TABLE + " WHERE rule_id = ?");
           Statement stmt = conn.createStatement()) {
        ps.setLong(1, ruleId);
        int deleted = ps.executeUpdate();
        stmt.execute("DROP TABLE IF EXISTS " + SegmentTables.outputTable(ruleId));
        conn.commit();
        return deleted > 0;
      } catch (SQLException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to delete segment of rule " + ruleId, e);
    }
  }

  /**
   * Reads up to {@code limit} rows of a segment output table. The table name must be a
   * catalog-owned identifier.
   */
  public List<Map<String, Object>> sample(String tableName, int limit) {
    if (!SegmentTables.isSafeIdentifier(tableName)) {
      throw new IllegalArgumentException("Illegal table name: " + tableName);
    }
    List<Map<String, Object>> rows = new ArrayList<>();
    try (Connection conn = warehouse.openConnection();
         PreparedStatement ps = conn.prepareStatement("SELECT * FROM " + tableName + " LIMIT ?")) {
      ps.setInt(1, limit);
      try (ResultSet rs = ps.executeQuery()) {
        ResultSetMetaData meta = rs.getMetaData();
        while (rs.next()) {
          Map<String, Object> row = new LinkedHashMap<>();
          for (int i = 1; i <= meta.getColumnCount(); i++) {
            row.put(meta.getColumnLabel(i), rs.getObject(i));
          }
          rows.add(row);
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to sample " + tableName, e);
    }
    return rows;
  }

  private List<SegmentCatalogEntry> query(String sql, long... params) {
    List<SegmentCatalogEntry> entries = new ArrayList<>();
    try (Connection conn = warehouse.openConnection();
         PreparedStatement ps = conn.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) {
        ps.setLong(i + 1, params[i]);
      }
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          entries.add(map(rs));
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to read segment catalog", e);
    }
    return entries;
  }

  private SegmentCatalogEntry map(ResultSet rs) throws SQLException {
    String operation = rs.getString("operation");
    return new SegmentCatalogEntry(
        rs.getLong("id"),
        rs.getLong("rule_id"),
        rs.getString("segment_name"),
        rs.getString("table_name"),
        rs.getLong("row_count"),
        rs.getString("sql_query"),
        readDependsOn(rs.getString("depends_on")),
        operation != null ? SetOperation.valueOf(operation) : null,
        toInstant(rs.getTimestamp("last_refreshed_at")),
        toInstant(rs.getTimestamp("created_at"))
    );
  }

  private static Instant toInstant(Timestamp ts) {
    return ts != null ? ts.toInstant() : null;
  }

  private static void setNullableString(PreparedStatement ps, int index, String value)
      throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.VARCHAR);
    } else {
      ps.setString(index, value);
    }
  }

  private String writeDependsOn(List<Long> dependsOn) {
    try {
      return objectMapper.writeValueAsString(dependsOn == null ? List.of() : dependsOn);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize dependencies", e);
    }
  }

  private List<Long> readDependsOn(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json,
          objectMapper.getTypeFactory().constructCollectionType(List.class, Long.class));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to deserialize dependencies", e);
    }
  }
}
