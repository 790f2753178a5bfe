package com.gentoro.graphdb.query;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Comparator;
import java.util.List;

/**
 * Evaluates a {@link Condition} against an entity view.
 *
 * <p>Comparison rules:
 *
 * <ul>
 *   <li>Numbers compare numerically, so {@code 30}, {@code 30L} and {@code 30.0} are equal.
 *   <li>Strings order lexicographically.
 *   <li>Booleans, null and structured values support only {@code eq} and {@code ne}; structured
 *       values are equal when their JSON content is (numbers inside compared numerically).
 *   <li>Ordering across different types is false. Equality across types is false, so {@code ne}
 *       is true.
 *   <li>A field missing from the view fails every comparison, {@code ne} included.
 * </ul>
 *
 * <p>Combination follows {@link LogicMode}: {@code NOT} negates the conjunction of all
 * predicates, it does not negate predicates one by one.
 */
public final class ConditionEvaluator {

  // Zero when equal; recursion into containers is done by JsonNode.equals(Comparator, JsonNode).
  private static final Comparator<JsonNode> VALUE_EQUALITY =
      (a, b) -> {
        if (a.isNumber() && b.isNumber()) return compareNumbers(a, b) == 0 ? 0 : 1;
        return a.equals(b) ? 0 : 1;
      };

  private ConditionEvaluator() {}

  public static boolean evaluate(JsonNode view, Condition condition) {
    if (condition == null) return true;
    List<FieldPredicate> predicates = condition.predicates();
    return switch (condition.logic()) {
      case AND -> allHold(view, predicates);
      case OR -> anyHolds(view, predicates);
      case NOT -> !allHold(view, predicates);
    };
  }

  static boolean holds(JsonNode view, FieldPredicate predicate) {
    JsonNode actual = FieldPath.resolve(view, predicate.field());
    if (actual == null) return false;
    for (Comparison comparison : predicate.comparisons()) {
      if (!compare(comparison.operator(), actual, comparison.operand())) return false;
    }
    return true;
  }

  static boolean compare(ComparisonOperator operator, JsonNode actual, JsonNode operand) {
    if (operator == ComparisonOperator.EQ) return valueEquals(actual, operand);
    if (operator == ComparisonOperator.NE) return !valueEquals(actual, operand);
    Integer order = order(actual, operand);
    if (order == null) return false;
    return switch (operator) {
      case GT -> order > 0;
      case GTE -> order >= 0;
      case LT -> order < 0;
      case LTE -> order <= 0;
      default -> false;
    };
  }

  private static boolean allHold(JsonNode view, List<FieldPredicate> predicates) {
    for (FieldPredicate p : predicates) {
      if (!holds(view, p)) return false;
    }
    return true;
  }

  private static boolean anyHolds(JsonNode view, List<FieldPredicate> predicates) {
    for (FieldPredicate p : predicates) {
      if (holds(view, p)) return true;
    }
    return false;
  }

  private static boolean valueEquals(JsonNode a, JsonNode b) {
    return a.equals(VALUE_EQUALITY, b);
  }

  /** Sign of {@code a - b}, or null when the two values have no common ordering. */
  private static Integer order(JsonNode a, JsonNode b) {
    if (a.isNumber() && b.isNumber()) return compareNumbers(a, b);
    if (a.isTextual() && b.isTextual()) {
      return Integer.signum(a.textValue().compareTo(b.textValue()));
    }
    return null;
  }

  private static int compareNumbers(JsonNode a, JsonNode b) {
    if (a.isIntegralNumber() && b.isIntegralNumber()) {
      return a.bigIntegerValue().compareTo(b.bigIntegerValue());
    }
    double da = a.doubleValue();
    double db = b.doubleValue();
    if (!Double.isFinite(da) || !Double.isFinite(db)) {
      return Double.compare(da, db);
    }
    return a.decimalValue().compareTo(b.decimalValue());
  }
}
