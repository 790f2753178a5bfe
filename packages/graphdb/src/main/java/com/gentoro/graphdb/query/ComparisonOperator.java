package com.gentoro.graphdb.query;

import com.gentoro.graphdb.exception.ValidationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Comparison operators accepted in a field predicate. */
public enum ComparisonOperator {
  EQ("eq"),
  NE("ne"),
  GT("gt"),
  GTE("gte"),
  LT("lt"),
  LTE("lte");

  private final String token;

  ComparisonOperator(String token) {
    this.token = token;
  }

  public String token() {
    return token;
  }

  public static ComparisonOperator fromToken(String token) {
    if (token != null) {
      String t = token.trim().toLowerCase(Locale.ROOT);
      for (ComparisonOperator op : values()) {
        if (op.token.equals(t)) return op;
      }
    }
    String expected =
        Arrays.stream(values()).map(ComparisonOperator::token).collect(Collectors.joining(", "));
    throw new ValidationException(
            "Unknown comparison operator '" + token + "', expected one of: " + expected)
        .withContext("operator", token);
  }
}
