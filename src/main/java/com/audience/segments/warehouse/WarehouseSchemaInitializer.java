package com.audience.segments.warehouse;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the warehouse DDL from a classpath resource. Statements are separated by
 * semicolons; lines starting with {@code --} are comments.
 */
public class WarehouseSchemaInitializer {

  private static final Logger log = LoggerFactory.getLogger(WarehouseSchemaInitializer.class);

  public static final String DEFAULT_SCHEMA = "warehouse/schema.sql";

  private final DuckDbWarehouse warehouse;
  private final String resourcePath;

  public WarehouseSchemaInitializer(DuckDbWarehouse warehouse, String resourcePath) {
    this.warehouse = warehouse;
    this.resourcePath = resourcePath;
  }

  public void initialize() {
    List<String> statements = loadStatements(resourcePath);
    try (Connection conn = warehouse.openConnection();
         Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to initialize warehouse schema from " + resourcePath, e);
    }
    log.info("Applied {} warehouse DDL statement(s) from {}", statements.size(), resourcePath);
  }

  static List<String> loadStatements(String resourcePath) {
    String script;
    try (InputStream is = WarehouseSchemaInitializer.class.getClassLoader()
        .getResourceAsStream(resourcePath)) {
      if (is == null) {
        throw new IllegalStateException("Resource not found: " + resourcePath);
      }
      script = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + resourcePath, e);
    }

    StringBuilder withoutComments = new StringBuilder();
    for (String line : script.split("\n")) {
      if (!line.trim().startsWith("--")) {
        withoutComments.append(line).append('\n');
      }
    }
    List<String> statements = new ArrayList<>();
    for (String part : withoutComments.toString().split(";")) {
      String sql = part.trim();
      if (!sql.isEmpty()) {
        statements.add(sql);
      }
    }
    return statements;
  }
}
