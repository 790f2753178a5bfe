package com.gentoro.graphdb.query;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphdb.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConditionEvaluatorTest {

  private static final ObjectNode ALICE =
      JacksonUtility.toObjectNode(
          Map.of(
              "id", 1,
              "name", "Alice",
              "age", 30,
              "score", 4.5,
              "active", true,
              "address", Map.of("city", "Paris"),
              "tags", List.of("a", "b")));

  private static boolean eval(Map<String, ?> condition) {
    return ConditionEvaluator.evaluate(ALICE, Condition.fromMap(condition));
  }

  @Test
  @DisplayName("Comparison operators on numbers and strings")
  void operators() {
    assertTrue(eval(Map.of("age", 30)));
    assertTrue(eval(Map.of("age", Map.of("ne", 31))));
    assertTrue(eval(Map.of("age", Map.of("gt", 29))));
    assertTrue(eval(Map.of("age", Map.of("gte", 30))));
    assertFalse(eval(Map.of("age", Map.of("lt", 30))));
    assertTrue(eval(Map.of("age", Map.of("lte", 30))));
    assertTrue(eval(Map.of("name", Map.of("lt", "Bob"))));
    assertTrue(eval(Map.of("age", Map.of("gte", 18, "lt", 65))));
    assertFalse(eval(Map.of("age", Map.of("gte", 18, "lt", 21))));
  }

  @Test
  @DisplayName("Numbers compare by value across integral and fractional forms")
  void numericEquality() {
    assertTrue(eval(Map.of("age", 30.0)));
    assertTrue(eval(Map.of("age", 30L)));
    assertTrue(eval(Map.of("score", Map.of("gt", 4))));
    assertTrue(eval(Map.of("score", Map.of("lt", new java.math.BigDecimal("4.50001")))));
  }

  @Test
  @DisplayName("Ordering across types is false; equality across types is false")
  void crossType() {
    assertFalse(eval(Map.of("age", Map.of("gt", "10"))));
    assertFalse(eval(Map.of("name", Map.of("lt", 5))));
    assertFalse(eval(Map.of("age", "30")));
    assertTrue(eval(Map.of("age", Map.of("ne", "30"))));
    assertFalse(eval(Map.of("active", Map.of("gt", false))));
    assertTrue(eval(Map.of("active", true)));
  }

  @Test
  @DisplayName("A missing field fails every comparison, ne included")
  void missingField() {
    assertFalse(eval(Map.of("email", "x")));
    assertFalse(eval(Map.of("email", Map.of("ne", "x"))));
    assertTrue(eval(Map.of("_logic", "not", "email", Map.of("ne", "x"))));
  }

  @Test
  @DisplayName("Explicit null is a value, not absence")
  void nullValue() {
    ObjectNode view = JacksonUtility.getJsonMapper().createObjectNode().putNull("email");
    assertTrue(ConditionEvaluator.evaluate(view, Condition.eq("email", null)));
    assertFalse(
        ConditionEvaluator.evaluate(view, Condition.builder().ne("email", null).build()));
    assertFalse(ConditionEvaluator.evaluate(view, Condition.builder().gt("email", 1).build()));
  }

  @Test
  @DisplayName("Structured values compare by content; dotted fields reach into them")
  void structured() {
    assertTrue(ConditionEvaluator.evaluate(ALICE, Condition.eq("tags", List.of("a", "b"))));
    assertFalse(ConditionEvaluator.evaluate(ALICE, Condition.eq("tags", List.of("b", "a"))));
    assertTrue(ConditionEvaluator.evaluate(ALICE, Condition.eq("address", Map.of("city", "Paris"))));
    assertTrue(eval(Map.of("address.city", "Paris")));
    assertTrue(eval(Map.of("tags.1", "b")));
  }

  @Test
  @DisplayName("and / or / not combine all predicates; not negates their conjunction")
  void logic() {
    assertTrue(eval(Map.of("name", "Alice", "age", 30)));
    assertFalse(eval(Map.of("name", "Alice", "age", 31)));
    assertTrue(eval(Map.of("_logic", "or", "name", "Bob", "age", 30)));
    assertFalse(eval(Map.of("_logic", "or", "name", "Bob", "age", 31)));

    // one predicate true, one false: the conjunction is false so not is true
    assertTrue(eval(Map.of("_logic", "not", "name", "Alice", "age", 31)));
    assertFalse(eval(Map.of("_logic", "not", "name", "Alice", "age", 30)));
  }

  @Test
  @DisplayName("Empty conditions: and is true, or and not are false; null is true")
  void emptyConditions() {
    assertTrue(ConditionEvaluator.evaluate(ALICE, Condition.always()));
    assertTrue(ConditionEvaluator.evaluate(ALICE, null));
    assertFalse(ConditionEvaluator.evaluate(ALICE, Condition.builder(LogicMode.OR).build()));
    assertFalse(ConditionEvaluator.evaluate(ALICE, Condition.builder(LogicMode.NOT).build()));
  }

  @Test
  @DisplayName("Reserved keys are matchable fields")
  void reservedFields() {
    assertTrue(eval(Map.of("id", 1)));
    assertTrue(eval(Map.of("id", Map.of("lt", 2))));
  }
}
