package com.audience.segments.warehouse;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single DuckDB database instance holding raw transactions, segment output tables and the
 * segment catalog. Callers get their own connection duplicated from one root connection so
 * that every connection sees the same database, in-memory ones included.
 */
public class DuckDbWarehouse implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(DuckDbWarehouse.class);

  private final String url;
  private final DuckDBConnection root;

  public DuckDbWarehouse(String url) throws SQLException {
    this.url = url;
    this.root = (DuckDBConnection) DriverManager.getConnection(url);
    log.info("Opened DuckDB warehouse at {}", url);
  }

  public Connection openConnection() throws SQLException {
    return root.duplicate();
  }

  public String url() {
    return url;
  }

  @Override
  public void close() throws SQLException {
    root.close();
    log.info("Closed DuckDB warehouse at {}", url);
  }
}
