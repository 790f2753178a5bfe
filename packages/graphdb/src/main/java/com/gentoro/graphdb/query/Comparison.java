package com.gentoro.graphdb.query;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/** One operator applied to one operand, e.g. {@code gt 35}. */
public record Comparison(ComparisonOperator operator, JsonNode operand) {
  public Comparison {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(operand, "operand");
  }
}
