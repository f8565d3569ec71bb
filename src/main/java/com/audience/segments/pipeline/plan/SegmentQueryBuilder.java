package com.audience.segments.pipeline.plan;

import com.audience.segments.enums.SetOperation;
import com.audience.segments.model.RuleDto;
import com.audience.segments.ruleengine.condition.ConditionParser;
import com.audience.segments.warehouse.SegmentTables;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Translates a rule into the DuckDB query that yields its segment's user ids.
 *
 * <p>A rule without dependencies is a predicate scan over the raw transaction tables:
 * <pre>
 *   WITH all_transactions AS (...), enriched AS (...)
 *   SELECT DISTINCT user_id FROM enriched WHERE {predicate}
 * </pre>
 * A rule with dependencies combines their materialized output tables with INTERSECT or
 * UNION, adding a scan only for the residual predicate.
 */
@Component
public class SegmentQueryBuilder {

  static final String RAW_SOURCE = "WITH all_transactions AS ("
      + "SELECT user_id, amount, CAST(transaction_date AS DATE) AS transaction_date, "
      + "category, merchant_name, city_tier, 'UPI' AS transaction_type "
      + "FROM upi_transactions_raw "
      + "UNION ALL "
      + "SELECT user_id, amount, CAST(transaction_date AS DATE) AS transaction_date, "
      + "category, merchant_name, city_tier, 'CREDIT_CARD' AS transaction_type "
      + "FROM credit_card_transactions_raw"
      + "), enriched AS ("
      + "SELECT t.*, SUM(t.amount) OVER (PARTITION BY t.user_id) AS total_spend, "
      + "COUNT(*) OVER (PARTITION BY t.user_id) AS transaction_count "
      + "FROM all_transactions t"
      + ")";

  private final ConditionParser conditionParser;

  public SegmentQueryBuilder(ConditionParser conditionParser) {
    this.conditionParser = conditionParser;
  }

  public String buildQuery(RuleDto rule) {
    if (rule.dependsOn().isEmpty()) {
      return RAW_SOURCE + " " + scan(predicateOf(rule.conditions()));
    }
    SetOperation operation = rule.operation();
    if (operation == null) {
      throw new IllegalStateException("Rule " + rule.id() + " has dependencies but no set operation");
    }

    List<String> operands = new ArrayList<>();
    for (Long dep : rule.dependsOn()) {
      operands.add("SELECT user_id FROM " + SegmentTables.outputTable(dep));
    }
    String residual = predicateOf(rule.residualCondition());
    if (residual != null) {
      operands.add(scan(residual));
    }
    String combined = String.join(" " + operation.sqlKeyword() + " ", operands);
    return residual != null ? RAW_SOURCE + " " + combined : combined;
  }

  /**
   * Renders a stored condition tree to its predicate. Returns null for a missing tree.
   * Visible for testing.
   */
  String predicateOf(JsonNode condition) {
    if (condition == null || condition.isNull() || condition.isMissingNode()) {
      return null;
    }
    return conditionParser.normalize(condition).predicate();
  }

  private String scan(String predicate) {
    StringBuilder sb = new StringBuilder("SELECT DISTINCT user_id FROM enriched");
    if (predicate != null && !predicate.isBlank()) {
      sb.append(" WHERE ").append(predicate);
    }
    return sb.toString();
  }
}
