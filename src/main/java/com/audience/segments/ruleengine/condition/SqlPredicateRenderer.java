package com.audience.segments.ruleengine.condition;

import com.audience.segments.enums.ComparisonOperator;
import com.audience.segments.enums.GroupLogic;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders condition trees and DNF clause lists to DuckDB SQL predicates over the enriched
 * transaction view.
 */
public class SqlPredicateRenderer {

  public String render(ConditionNode node) {
    if (node instanceof Comparison c) {
      return renderComparison(c);
    }
    Group group = (Group) node;
    String joiner = group.logic() == GroupLogic.OR ? " OR " : " AND ";
    StringJoiner sj = new StringJoiner(joiner);
    for (ConditionNode child : group.children()) {
      String fragment = render(child);
      sj.add(child instanceof Group ? "(" + fragment + ")" : fragment);
    }
    return sj.toString();
  }

  public String render(List<DnfClause> clauses) {
    if (clauses.isEmpty()) {
      return null;
    }
    StringJoiner or = new StringJoiner(" OR ");
    for (DnfClause clause : clauses) {
      StringJoiner and = new StringJoiner(" AND ");
      clause.atoms().forEach(atom -> and.add(renderComparison(atom)));
      String fragment = and.toString();
      or.add(clauses.size() > 1 && clause.size() > 1 ? "(" + fragment + ")" : fragment);
    }
    return or.toString();
  }

  private String renderComparison(Comparison c) {
    String column = c.field().column();
    if (c.operator() == ComparisonOperator.IN) {
      StringJoiner values = new StringJoiner(", ", "(", ")");
      for (Object v : (List<?>) c.value()) {
        values.add(literal(v));
      }
      return column + " IN " + values;
    }
    return column + " " + c.operator().symbol() + " " + literal(c.value());
  }

  private String literal(Object value) {
    if (value instanceof BigDecimal bd) {
      return bd.toPlainString();
    }
    if (value instanceof Long l) {
      return l.toString();
    }
    if (value instanceof LocalDate d) {
      return "DATE '" + d + "'";
    }
    return "'" + escapeSql(String.valueOf(value)) + "'";
  }

  private String escapeSql(String value) {
    return value.replace("'", "''");
  }
}
