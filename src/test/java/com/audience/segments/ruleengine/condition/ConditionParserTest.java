package com.audience.segments.ruleengine.condition;

import com.audience.segments.enums.ComparisonOperator;
import com.audience.segments.enums.ConditionField;
import com.audience.segments.enums.GroupLogic;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionParserTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ConditionParser parser = new ConditionParser(objectMapper, 256);

  @Test
  void normalizingTwiceYieldsTheSameModel() throws Exception {
    ConditionModel once = parser.normalize(json("""
        {"logic": "AND", "children": [
          {"field": "total_spend", "operator": ">", "value": 1000},
          {"logic": "OR", "children": [
            {"field": "category", "operator": "=", "value": "Travel"},
            {"field": "category", "operator": "=", "value": "Groceries"}
          ]},
          {"field": "city_tier", "operator": "=", "value": 1}
        ]}
        """));

    ConditionModel twice = parser.normalize(once.root());

    assertThat(twice).isEqualTo(once);
    assertThat(parser.normalize(parser.toJson(once.root()))).isEqualTo(once);
  }

  @Test
  void siblingOrderDoesNotChangeTheCanonicalForm() throws Exception {
    ConditionModel a = parser.normalize(json("""
        {"logic": "AND", "children": [
          {"field": "city_tier", "operator": "=", "value": 1},
          {"field": "total_spend", "operator": ">", "value": 1000}
        ]}
        """));
    ConditionModel b = parser.normalize(json("""
        {"logic": "AND", "children": [
          {"field": "total_spend", "operator": ">", "value": 1000.00},
          {"field": "city_tier", "operator": "=", "value": 1}
        ]}
        """));

    assertThat(a.root()).isEqualTo(b.root());
    assertThat(a.predicate()).isEqualTo("city_tier = 1 AND total_spend > 1000");
    assertThat(b.predicate()).isEqualTo(a.predicate());
  }

  @Test
  void nestedGroupsOfTheSameLogicAreFlattenedAndSingleChildrenCollapsed() throws Exception {
    ConditionModel model = parser.normalize(json("""
        {"logic": "AND", "children": [
          {"logic": "AND", "children": [
            {"logic": "OR", "children": [{"field": "city_tier", "value": 2}]},
            {"field": "amount", "operator": ">=", "value": "50.50"}
          ]},
          {"field": "amount", "operator": ">=", "value": 50.5}
        ]}
        """));

    assertThat(model.root()).isEqualTo(Group.and(
        Comparison.of(ConditionField.AMOUNT, ComparisonOperator.GE, new BigDecimal("50.5")),
        Comparison.of(ConditionField.CITY_TIER, ComparisonOperator.EQ, 2L)));
    assertThat(model.predicate()).isEqualTo("amount >= 50.5 AND city_tier = 2");
  }

  @Test
  void arrayIsShorthandForAndGroup() throws Exception {
    ConditionModel model = parser.normalize(json("""
        [{"field": "city_tier", "operator": "=", "value": 1},
         {"field": "transaction_type", "operator": "=", "value": "UPI"}]
        """));

    assertThat(model.root()).isInstanceOf(Group.class);
    assertThat(((Group) model.root()).logic()).isEqualTo(GroupLogic.AND);
    assertThat(model.predicate()).isEqualTo("city_tier = 1 AND transaction_type = 'UPI'");
  }

  @Test
  void inValuesAreSortedAndDeduplicated() throws Exception {
    ConditionModel model = parser.normalize(json("""
        {"field": "category", "operator": "in", "value": ["Travel", "Food", "Travel"]}
        """));

    assertThat(model.predicate()).isEqualTo("category IN ('Food', 'Travel')");
  }

  @Test
  void literalsAreRenderedForDuckDb() throws Exception {
    ConditionModel model = parser.normalize(json("""
        [{"field": "merchant_name", "operator": "!=", "value": "O'Brien"},
         {"field": "transaction_date", "operator": ">=", "value": "2024-01-01"}]
        """));

    assertThat(model.predicate())
        .isEqualTo("merchant_name != 'O''Brien' AND transaction_date >= DATE '2024-01-01'");
  }

  @Test
  void andOverOrExpandsIntoDisjunctiveNormalForm() throws Exception {
    ConditionModel model = parser.normalize(json("""
        {"logic": "AND", "children": [
          {"logic": "OR", "children": [
            {"field": "category", "value": "Travel"},
            {"field": "category", "value": "Groceries"}
          ]},
          {"field": "city_tier", "value": 1}
        ]}
        """));

    Comparison groceries = Comparison.of(ConditionField.CATEGORY, ComparisonOperator.EQ, "Groceries");
    Comparison travel = Comparison.of(ConditionField.CATEGORY, ComparisonOperator.EQ, "Travel");
    Comparison tier1 = Comparison.of(ConditionField.CITY_TIER, ComparisonOperator.EQ, 1L);

    assertThat(model.predicate())
        .isEqualTo("city_tier = 1 AND (category = 'Groceries' OR category = 'Travel')");
    assertThat(model.dnf()).containsExactly(
        DnfClause.of(List.of(groceries, tier1)),
        DnfClause.of(List.of(travel, tier1)));
    assertThat(model.atomCount()).isEqualTo(4);
  }

  @Test
  void subsumedClausesAreAbsorbed() throws Exception {
    ConditionModel model = parser.normalize(json("""
        {"logic": "OR", "children": [
          {"field": "city_tier", "value": 1},
          [{"field": "city_tier", "value": 1}, {"field": "total_spend", "operator": ">", "value": 10}]
        ]}
        """));

    assertThat(model.dnf()).containsExactly(
        DnfClause.of(List.of(Comparison.of(ConditionField.CITY_TIER, ComparisonOperator.EQ, 1L))));
  }

  @Test
  void fromDnfRebuildsAnEquivalentTree() throws Exception {
    ConditionModel model = parser.normalize(json("""
        {"logic": "OR", "children": [
          {"field": "category", "value": "Travel"},
          {"field": "category", "value": "Groceries"}
        ]}
        """));

    ConditionModel rebuilt = parser.fromDnf(model.dnf());

    assertThat(rebuilt).isEqualTo(model);
    assertThat(parser.render(model.dnf())).isEqualTo("category = 'Groceries' OR category = 'Travel'");
  }

  @Test
  void unknownFieldIsRejectedWithItsPath() {
    assertThatThrownBy(() -> parser.normalize(json("""
        {"logic": "AND", "children": [
          {"field": "city_tier", "value": 1},
          {"field": "age", "operator": ">", "value": 30}
        ]}
        """)))
        .isInstanceOf(ConditionValidationException.class)
        .satisfies(e -> assertThat(((ConditionValidationException) e).getPath())
            .isEqualTo("/children/1/field"))
        .hasMessageContaining("unknown field 'age'");
  }

  @Test
  void valueOfTheWrongTypeIsRejected() {
    assertThatThrownBy(() -> parser.normalize(json("""
        {"field": "city_tier", "operator": "=", "value": "first"}
        """)))
        .isInstanceOf(ConditionValidationException.class)
        .satisfies(e -> assertThat(((ConditionValidationException) e).getPath()).isEqualTo("/value"));
  }

  @Test
  void unknownOperatorAndEmptyGroupAreRejected() {
    assertThatThrownBy(() -> parser.normalize(json("""
        {"field": "city_tier", "operator": "LIKE", "value": 1}
        """)))
        .isInstanceOf(ConditionValidationException.class)
        .hasMessageContaining("unknown operator 'LIKE'");

    assertThatThrownBy(() -> parser.normalize(json("""
        {"logic": "OR", "children": []}
        """)))
        .isInstanceOf(ConditionValidationException.class)
        .hasMessageContaining("at least one child");

    assertThatThrownBy(() -> parser.normalize(json("""
        {"field": "category", "operator": "IN", "value": []}
        """)))
        .isInstanceOf(ConditionValidationException.class);
  }

  @Test
  void missingTreeIsRejected() {
    assertThatThrownBy(() -> parser.normalize((JsonNode) null))
        .isInstanceOf(ConditionValidationException.class)
        .hasMessageContaining("required");
  }

  @Test
  void expansionBeyondTheClauseLimitIsRejected() {
    ConditionParser strict = new ConditionParser(objectMapper, 3);

    assertThatThrownBy(() -> strict.normalize(json("""
        [
          {"logic": "OR", "children": [{"field": "city_tier", "value": 1}, {"field": "city_tier", "value": 2}]},
          {"logic": "OR", "children": [{"field": "category", "value": "A"}, {"field": "category", "value": "B"}]}
        ]
        """)))
        .isInstanceOf(ConditionValidationException.class)
        .hasMessageContaining("more than 3");
  }

  private JsonNode json(String text) throws Exception {
    return objectMapper.readTree(text);
  }
}
