package com.audience.segments.pipeline.materialize;

import com.audience.segments.enums.RuleStatus;
import com.audience.segments.enums.SetOperation;
import com.audience.segments.model.RuleDto;
import com.audience.segments.model.SegmentCatalogEntry;
import com.audience.segments.pipeline.engine.SegmentResult;
import com.audience.segments.warehouse.DuckDbWarehouse;
import com.audience.segments.warehouse.WarehouseSchemaInitializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MaterializationWriterTest {

  private DuckDbWarehouse warehouse;
  private SegmentCatalogRepository catalog;

  @BeforeEach
  void setUp() throws Exception {
    warehouse = new DuckDbWarehouse("jdbc:duckdb:");
    new WarehouseSchemaInitializer(warehouse, WarehouseSchemaInitializer.DEFAULT_SCHEMA).initialize();
    catalog = new SegmentCatalogRepository(warehouse, new ObjectMapper());
  }

  @AfterEach
  void tearDown() throws Exception {
    warehouse.close();
  }

  @Test
  void publishCreatesOutputTableAndCatalogRow() throws Exception {
    MaterializationWriter writer = writerAt("2024-05-01T10:00:00Z");
    RuleDto rule = rule(7L, List.of(3L), SetOperation.INTERSECTION);

    SegmentCatalogEntry entry = writer.publish(rule, "SELECT 1", new SegmentResult(List.of("u1", "u2", "u3")));

    assertThat(entry.ruleId()).isEqualTo(7L);
    assertThat(entry.segmentName()).isEqualTo("segment_7");
    assertThat(entry.tableName()).isEqualTo("segment_output_7");
    assertThat(entry.rowCount()).isEqualTo(3);
    assertThat(entry.sqlQuery()).isEqualTo("SELECT 1");
    assertThat(entry.dependsOn()).containsExactly(3L);
    assertThat(entry.operation()).isEqualTo(SetOperation.INTERSECTION);
    assertThat(entry.lastRefreshedAt()).isNotNull();
    assertThat(userIds("segment_output_7")).containsExactlyInAnyOrder("u1", "u2", "u3");
    assertThat(catalog.findByRuleId(7L)).contains(entry);
    assertThat(catalog.rowCount(7L)).hasValue(3);
  }

  @Test
  void republishReplacesRowsAndKeepsTheCatalogIdentity() throws Exception {
    RuleDto rule = rule(1L, List.of(), null);
    SegmentCatalogEntry first = writerAt("2024-05-01T10:00:00Z")
        .publish(rule, "SELECT 1", new SegmentResult(List.of("u1", "u2")));

    SegmentCatalogEntry second = writerAt("2024-05-01T11:00:00Z")
        .publish(rule, "SELECT 2", new SegmentResult(List.of("u9")));

    assertThat(second.id()).isEqualTo(first.id());
    assertThat(second.createdAt()).isEqualTo(first.createdAt());
    assertThat(second.lastRefreshedAt()).isAfter(first.lastRefreshedAt());
    assertThat(second.rowCount()).isEqualTo(1);
    assertThat(second.sqlQuery()).isEqualTo("SELECT 2");
    assertThat(userIds("segment_output_1")).containsExactly("u9");
    assertThat(catalog.findAll()).hasSize(1);
  }

  @Test
  void failedPublishLeavesThePreviousSegmentUntouched() throws Exception {
    RuleDto rule = rule(1L, List.of(), null);
    MaterializationWriter writer = writerAt("2024-05-01T10:00:00Z");
    SegmentCatalogEntry original = writer.publish(rule, "SELECT 1", new SegmentResult(List.of("u1", "u2")));

    assertThatThrownBy(() -> writer.publish(rule, "SELECT 2",
        new SegmentResult(Arrays.asList("u3", null))))
        .isInstanceOf(MaterializationException.class)
        .hasMessageContaining("rule 1");

    assertThat(userIds("segment_output_1")).containsExactlyInAnyOrder("u1", "u2");
    assertThat(catalog.findByRuleId(1L)).contains(original);
    assertThat(stagingTables()).isEmpty();
  }

  @Test
  void readersSeeEitherTheOldOrTheNewSegmentDuringRepublish() throws Exception {
    RuleDto rule = rule(1L, List.of(), null);
    writerAt("2024-05-01T10:00:00Z").publish(rule, "SELECT 1", new SegmentResult(users("old", 2000)));
    AtomicBoolean published = new AtomicBoolean();
    CountDownLatch firstRead = new CountDownLatch(1);
    List<String> reads = new CopyOnWriteArrayList<>();
    ExecutorService reader = Executors.newSingleThreadExecutor();
    try {
      Future<?> reading = reader.submit(() -> {
        try (Connection conn = warehouse.openConnection();
             Statement stmt = conn.createStatement()) {
          int readsAfterPublish = 0;
          while (readsAfterPublish < 5) {
            if (published.get()) {
              readsAfterPublish++;
            }
            try (ResultSet rs = stmt.executeQuery("SELECT count(*), "
                + "count(*) FILTER (WHERE user_id LIKE 'old-%') FROM segment_output_1")) {
              rs.next();
              reads.add(rs.getLong(1) + "/" + rs.getLong(2));
            }
            firstRead.countDown();
          }
        }
        return null;
      });
      assertThat(firstRead.await(10, TimeUnit.SECONDS)).isTrue();

      writerAt("2024-05-01T11:00:00Z").publish(rule, "SELECT 2", new SegmentResult(users("new", 3000)));
      published.set(true);
      reading.get(30, TimeUnit.SECONDS);
    } finally {
      reader.shutdownNow();
    }

    assertThat(reads).isNotEmpty().allSatisfy(read -> assertThat(read).isIn("2000/2000", "3000/0"));
    assertThat(reads.get(reads.size() - 1)).isEqualTo("3000/0");
    assertThat(stagingTables()).isEmpty();
  }

  @Test
  void catalogIsPagedInRuleOrder() {
    MaterializationWriter writer = writerAt("2024-05-01T10:00:00Z");
    for (long id : new long[] {3L, 1L, 2L}) {
      writer.publish(rule(id, List.of(), null), "SELECT 1", new SegmentResult(List.of("u1")));
    }

    assertThat(catalog.count()).isEqualTo(3);
    assertThat(catalog.findPage(1, 1)).extracting(SegmentCatalogEntry::ruleId).containsExactly(2L);
    assertThat(catalog.findPage(2, 10)).extracting(SegmentCatalogEntry::ruleId).containsExactly(3L);
  }

  @Test
  void largeResultsAreInsertedInBatches() throws Exception {
    List<String> users = new ArrayList<>();
    for (int i = 0; i < MaterializationWriter.INSERT_BATCH_SIZE * 2 + 5; i++) {
      users.add("user-" + i);
    }

    SegmentCatalogEntry entry = writerAt("2024-05-01T10:00:00Z")
        .publish(rule(2L, List.of(), null), "SELECT 1", new SegmentResult(users));

    assertThat(entry.rowCount()).isEqualTo(users.size());
    assertThat(userIds("segment_output_2")).hasSize(users.size());
  }

  @Test
  void sampleReadsFromCatalogTablesAndDeleteDropsThem() throws Exception {
    writerAt("2024-05-01T10:00:00Z")
        .publish(rule(4L, List.of(), null), "SELECT 1", new SegmentResult(List.of("a", "b", "c")));

    assertThat(catalog.sample("segment_output_4", 2)).hasSize(2)
        .allSatisfy(row -> assertThat(row).containsOnlyKeys("user_id"));
    assertThatThrownBy(() -> catalog.sample("segment_output_4; DROP TABLE segment_catalog", 2))
        .isInstanceOf(IllegalArgumentException.class);

    assertThat(catalog.deleteByRuleId(4L)).isTrue();
    assertThat(catalog.findByRuleId(4L)).isEmpty();
    assertThat(tableExists("segment_output_4")).isFalse();
  }

  private MaterializationWriter writerAt(String instant) {
    return new MaterializationWriter(warehouse, catalog,
        Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
  }

  private RuleDto rule(Long id, List<Long> dependsOn, SetOperation operation) {
    return new RuleDto(id, "rule-" + id, null, null, null, null, null, dependsOn, operation,
        null, false, RuleStatus.ACTIVE, null, null, null);
  }

  private static List<String> users(String prefix, int count) {
    List<String> users = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      users.add(prefix + "-" + i);
    }
    return users;
  }

  private List<String> userIds(String table) throws Exception {
    List<String> ids = new ArrayList<>();
    try (Connection conn = warehouse.openConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery("SELECT user_id FROM " + table)) {
      while (rs.next()) {
        ids.add(rs.getString(1));
      }
    }
    return ids;
  }

  private List<String> stagingTables() throws Exception {
    List<String> names = new ArrayList<>();
    try (Connection conn = warehouse.openConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(
             "SELECT table_name FROM information_schema.tables WHERE table_name LIKE '%staging%'")) {
      while (rs.next()) {
        names.add(rs.getString(1));
      }
    }
    return names;
  }

  private boolean tableExists(String table) throws Exception {
    try (Connection conn = warehouse.openConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(
             "SELECT count(*) FROM information_schema.tables WHERE table_name = '" + table + "'")) {
      rs.next();
      return rs.getLong(1) > 0;
    }
  }
}
