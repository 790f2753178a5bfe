package com.gentoro.graphdb.query;

import com.gentoro.graphdb.exception.ValidationException;
import java.util.Locale;

/** How the field predicates of one condition combine. */
public enum LogicMode {
  /** Every predicate holds. */
  AND,
  /** At least one predicate holds. */
  OR,
  /** Not every predicate holds, i.e. the negation of {@link #AND} over all predicates. */
  NOT;

  /** Parse {@code and}, {@code or} or {@code not} (case-insensitive); null means {@link #AND}. */
  public static LogicMode fromToken(String token) {
    if (token == null) return AND;
    return switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "and" -> AND;
      case "or" -> OR;
      case "not" -> NOT;
      default -> throw new ValidationException(
              "Unknown _logic value '" + token + "', expected one of: and, or, not")
          .withContext("logic", token);
    };
  }
}
