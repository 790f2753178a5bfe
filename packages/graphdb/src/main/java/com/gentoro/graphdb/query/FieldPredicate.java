package com.gentoro.graphdb.query;

import java.util.List;
import java.util.Objects;

/** All comparisons applied to one field; the predicate holds when every comparison holds. */
public record FieldPredicate(String field, List<Comparison> comparisons) {
  public FieldPredicate {
    Objects.requireNonNull(field, "field");
    comparisons = List.copyOf(comparisons);
  }
}
