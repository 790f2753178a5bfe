package com.gentoro.graphdb.query;

import com.gentoro.graphdb.exception.ValidationException;
import com.gentoro.graphdb.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A condition over an entity view: field predicates combined by a {@link LogicMode}.
 *
 * <p>Two equivalent ways to build one. The map form, as accepted from loosely-typed callers:
 *
 * <pre>{@code
 * Condition.fromMap(Map.of(
 *     "_logic", "or",
 *     "name", "Alice",                 // literal: equality
 *     "age", Map.of("gt", 35)))        // operator map
 * }</pre>
 *
 * <p>and the builder:
 *
 * <pre>{@code
 * Condition.builder(LogicMode.OR).eq("name", "Alice").gt("age", 35).build()
 * }</pre>
 *
 * <p>In the map form a nested map is always read as an operator map; use {@link Builder#eq} to
 * compare against a structured value.
 */
public final class Condition {
  public static final String LOGIC_KEY = "_logic";

  private static final Condition ALWAYS = new Condition(LogicMode.AND, List.of());

  private final LogicMode logic;
  private final List<FieldPredicate> predicates;

  private Condition(LogicMode logic, List<FieldPredicate> predicates) {
    this.logic = logic;
    this.predicates = List.copyOf(predicates);
  }

  /** The empty {@code AND} condition, which every entity satisfies. */
  public static Condition always() {
    return ALWAYS;
  }

  public static Condition eq(String field, Object value) {
    return builder().eq(field, value).build();
  }

  public static Builder builder() {
    return new Builder(LogicMode.AND);
  }

  public static Builder builder(LogicMode logic) {
    return new Builder(logic);
  }

  /**
   * Parse the map form. Null or empty yields {@link #always()}.
   *
   * @throws ValidationException on an unknown operator or {@code _logic} value, a non-string
   *     {@code _logic}, or an empty operator map
   */
  public static Condition fromMap(Map<String, ?> values) {
    if (values == null || values.isEmpty()) return ALWAYS;
    Builder builder = builder();
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      String field = entry.getKey();
      Object value = entry.getValue();
      if (LOGIC_KEY.equals(field)) {
        if (value != null && !(value instanceof String)) {
          throw new ValidationException("_logic must be a string, got " + value);
        }
        builder.logic(LogicMode.fromToken((String) value));
        continue;
      }
      if (value instanceof Map<?, ?> operators) {
        if (operators.isEmpty()) {
          throw new ValidationException("Empty operator map for field '" + field + "'")
              .withContext("field", field);
        }
        for (Map.Entry<?, ?> op : operators.entrySet()) {
          if (!(op.getKey() instanceof String token)) {
            throw new ValidationException(
                "Operator keys must be strings, got " + op.getKey() + " for field '" + field + "'");
          }
          builder.compare(field, ComparisonOperator.fromToken(token), op.getValue());
        }
      } else {
        builder.eq(field, value);
      }
    }
    return builder.build();
  }

  public LogicMode logic() {
    return logic;
  }

  public List<FieldPredicate> predicates() {
    return predicates;
  }

  public boolean isEmpty() {
    return predicates.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition other)) return false;
    return logic == other.logic && predicates.equals(other.predicates);
  }

  @Override
  public int hashCode() {
    return Objects.hash(logic, predicates);
  }

  @Override
  public String toString() {
    return "Condition{" + logic + ", " + predicates + "}";
  }

  /** Accumulates comparisons per field, in first-mention order. */
  public static final class Builder {
    private LogicMode logic;
    private final Map<String, List<Comparison>> comparisons = new LinkedHashMap<>();

    private Builder(LogicMode logic) {
      this.logic = Objects.requireNonNull(logic, "logic");
    }

    public Builder logic(LogicMode logic) {
      this.logic = Objects.requireNonNull(logic, "logic");
      return this;
    }

    public Builder compare(String field, ComparisonOperator operator, Object operand) {
      if (field == null || field.isEmpty()) {
        throw new ValidationException("Condition field name must not be empty");
      }
      comparisons
          .computeIfAbsent(field, k -> new ArrayList<>())
          .add(new Comparison(operator, JacksonUtility.toJsonNode(operand)));
      return this;
    }

    public Builder eq(String field, Object value) {
      return compare(field, ComparisonOperator.EQ, value);
    }

    public Builder ne(String field, Object value) {
      return compare(field, ComparisonOperator.NE, value);
    }

    public Builder gt(String field, Object value) {
      return compare(field, ComparisonOperator.GT, value);
    }

    public Builder gte(String field, Object value) {
      return compare(field, ComparisonOperator.GTE, value);
    }

    public Builder lt(String field, Object value) {
      return compare(field, ComparisonOperator.LT, value);
    }

    public Builder lte(String field, Object value) {
      return compare(field, ComparisonOperator.LTE, value);
    }

    public Condition build() {
      List<FieldPredicate> predicates = new ArrayList<>(comparisons.size());
      comparisons.forEach((field, list) -> predicates.add(new FieldPredicate(field, list)));
      if (predicates.isEmpty() && logic == LogicMode.AND) return ALWAYS;
      return new Condition(logic, Collections.unmodifiableList(predicates));
    }
  }
}
