package com.audience.segments.ruleengine.condition;

import com.audience.segments.enums.ComparisonOperator;
import com.audience.segments.enums.ConditionField;
import com.audience.segments.enums.GroupLogic;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Validates raw condition JSON and brings it to canonical form.
 *
 * <p>Accepted JSON shapes:
 * <pre>
 *   {"field": "city_tier", "operator": "=", "value": 1}
 *   {"logic": "AND", "children": [ ... ]}
 *   [ ... ]                                  (shorthand for an AND group)
 * </pre>
 *
 * <p>Normalization flattens nested groups of the same logic, collapses single-child
 * groups, drops duplicate siblings and sorts siblings by {@link CanonicalOrder}, so trees
 * that differ only in sibling order normalize to equal values. Normalizing a normalized
 * tree returns an equal tree.
 */
@Component
public class ConditionParser {

  private static final Logger log = LoggerFactory.getLogger(ConditionParser.class);

  private final ObjectMapper objectMapper;
  private final SqlPredicateRenderer renderer;
  private final int maxDnfClauses;

  public ConditionParser(ObjectMapper objectMapper,
                         @Value("${segments.resolver.max-dnf-clauses:256}") int maxDnfClauses) {
    this.objectMapper = objectMapper;
    this.renderer = new SqlPredicateRenderer();
    this.maxDnfClauses = maxDnfClauses;
  }

  public ConditionModel normalize(JsonNode raw) {
    if (raw == null || raw.isNull() || raw.isMissingNode()) {
      throw new ConditionValidationException("", "condition tree is required");
    }
    return normalize(parseNode(raw, ""));
  }

  public ConditionModel normalize(ConditionNode tree) {
    ConditionNode root = canonicalize(tree);
    List<DnfClause> dnf = toDnf(root);
    String predicate = renderer.render(root);
    log.debug("Normalized condition to '{}' with {} DNF clause(s)", predicate, dnf.size());
    return new ConditionModel(root, dnf, predicate);
  }

  /** Builds the normalized tree equivalent to an OR of the given clauses. */
  public ConditionModel fromDnf(List<DnfClause> clauses) {
    List<ConditionNode> disjuncts = new ArrayList<>();
    for (DnfClause clause : clauses) {
      if (clause.isEmpty()) {
        throw new ConditionValidationException("", "empty clause cannot be expressed as a condition");
      }
      disjuncts.add(clause.size() == 1
          ? clause.atoms().get(0)
          : new Group(GroupLogic.AND, new ArrayList<>(clause.atoms())));
    }
    ConditionNode tree = disjuncts.size() == 1 ? disjuncts.get(0) : new Group(GroupLogic.OR, disjuncts);
    return normalize(tree);
  }

  public String render(List<DnfClause> clauses) {
    return renderer.render(clauses);
  }

  public JsonNode toJson(ConditionNode node) {
    if (node instanceof Comparison c) {
      ObjectNode json = objectMapper.createObjectNode();
      json.put("field", c.field().column());
      json.put("operator", c.operator().symbol());
      json.set("value", valueToJson(c.value()));
      return json;
    }
    Group group = (Group) node;
    ObjectNode json = objectMapper.createObjectNode();
    json.put("logic", group.logic().name());
    ArrayNode children = json.putArray("children");
    group.children().forEach(child -> children.add(toJson(child)));
    return json;
  }

  private JsonNode valueToJson(Object value) {
    if (value instanceof List<?> list) {
      ArrayNode array = objectMapper.createArrayNode();
      list.forEach(v -> array.add(valueToJson(v)));
      return array;
    }
    if (value instanceof Long l) {
      return objectMapper.getNodeFactory().numberNode(l);
    }
    if (value instanceof BigDecimal bd) {
      return objectMapper.getNodeFactory().numberNode(bd);
    }
    if (value instanceof LocalDate d) {
      return objectMapper.getNodeFactory().textNode(d.toString());
    }
    return objectMapper.getNodeFactory().textNode(String.valueOf(value));
  }

  private ConditionNode parseNode(JsonNode node, String path) {
    if (node.isArray()) {
      return new Group(GroupLogic.AND, parseChildren(node, path));
    }
    if (!node.isObject()) {
      throw new ConditionValidationException(path, "condition node must be an object");
    }
    if (node.has("logic") || node.has("children")) {
      return parseGroup(node, path);
    }
    if (node.has("field")) {
      return parseComparison(node, path);
    }
    throw new ConditionValidationException(path, "condition node must be a comparison or a group");
  }

  private Group parseGroup(JsonNode node, String path) {
    String logicText = node.path("logic").asText("");
    GroupLogic logic;
    try {
      logic = GroupLogic.valueOf(logicText.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConditionValidationException(path + "/logic", "unknown group logic '" + logicText + "'");
    }
    JsonNode children = node.get("children");
    if (children == null || !children.isArray()) {
      throw new ConditionValidationException(path + "/children", "group children must be an array");
    }
    try {
      return new Group(logic, parseChildren(children, path + "/children"));
    } catch (ConditionValidationException e) {
      throw e.at(path);
    }
  }

  private List<ConditionNode> parseChildren(JsonNode array, String path) {
    List<ConditionNode> children = new ArrayList<>();
    int i = 0;
    for (Iterator<JsonNode> it = array.elements(); it.hasNext(); i++) {
      children.add(parseNode(it.next(), path + "/" + i));
    }
    if (children.isEmpty()) {
      throw new ConditionValidationException(path, "group must have at least one child");
    }
    return children;
  }

  private Comparison parseComparison(JsonNode node, String path) {
    String fieldName = node.path("field").asText(null);
    ConditionField field = ConditionField.fromName(fieldName)
        .orElseThrow(() -> new ConditionValidationException(path + "/field",
            "unknown field '" + fieldName + "'"));
    String operatorToken = node.path("operator").asText("=");
    ComparisonOperator operator = ComparisonOperator.fromToken(operatorToken)
        .orElseThrow(() -> new ConditionValidationException(path + "/operator",
            "unknown operator '" + operatorToken + "'"));
    try {
      return new Comparison(field, operator, jsonToValue(node.get("value")));
    } catch (ConditionValidationException e) {
      throw e.at(path + "/value");
    }
  }

  private Object jsonToValue(JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isArray()) {
      List<Object> items = new ArrayList<>();
      value.elements().forEachRemaining(v -> items.add(jsonToValue(v)));
      return items;
    }
    if (value.isIntegralNumber()) {
      return value.canConvertToLong() ? (Object) value.longValue() : value.decimalValue();
    }
    if (value.isNumber()) {
      return value.decimalValue();
    }
    if (value.isTextual()) {
      return value.textValue();
    }
    return value;
  }

  private ConditionNode canonicalize(ConditionNode node) {
    if (node instanceof Comparison) {
      return node;
    }
    Group group = (Group) node;
    Set<ConditionNode> flattened = new LinkedHashSet<>();
    for (ConditionNode child : group.children()) {
      ConditionNode normalizedChild = canonicalize(child);
      if (normalizedChild instanceof Group g && g.logic() == group.logic()) {
        flattened.addAll(g.children());
      } else {
        flattened.add(normalizedChild);
      }
    }
    if (flattened.size() == 1) {
      return flattened.iterator().next();
    }
    List<ConditionNode> sorted = new ArrayList<>(flattened);
    sorted.sort(CanonicalOrder.INSTANCE);
    return new Group(group.logic(), sorted);
  }

  private List<DnfClause> toDnf(ConditionNode root) {
    List<DnfClause> expanded = expand(root);
    TreeSet<DnfClause> distinct = new TreeSet<>(expanded);
    List<DnfClause> absorbed = new ArrayList<>();
    for (DnfClause clause : distinct) {
      boolean subsumed = absorbed.stream().anyMatch(clause::containsAll);
      if (!subsumed) {
        absorbed.add(clause);
      }
    }
    return absorbed;
  }

  private List<DnfClause> expand(ConditionNode node) {
    if (node instanceof Comparison c) {
      return List.of(new DnfClause(List.of(c)));
    }
    Group group = (Group) node;
    if (group.logic() == GroupLogic.OR) {
      List<DnfClause> clauses = new ArrayList<>();
      for (ConditionNode child : group.children()) {
        clauses.addAll(expand(child));
        checkLimit(clauses.size());
      }
      return clauses;
    }
    List<DnfClause> product = List.of(new DnfClause(List.of()));
    for (ConditionNode child : group.children()) {
      List<DnfClause> childClauses = expand(child);
      checkLimit((long) product.size() * childClauses.size());
      List<DnfClause> next = new ArrayList<>();
      for (DnfClause left : product) {
        for (DnfClause right : childClauses) {
          next.add(left.union(right));
        }
      }
      product = next;
    }
    return product;
  }

  private void checkLimit(long clauses) {
    if (clauses > maxDnfClauses) {
      throw new ConditionValidationException("",
          "condition expands to more than " + maxDnfClauses + " disjunctive clauses");
    }
  }
}
