package com.gentoro.graphdb.model;

import com.gentoro.graphdb.exception.ValidationException;
import java.util.Locale;

/** Which incident relationships of a node a traversal follows. */
public enum Direction {
  /** Relationships whose source is the current node. */
  OUT,
  /** Relationships whose target is the current node. */
  IN,
  /** Both. */
  ANY;

  /** Parse {@code out}, {@code in} or {@code any} (case-insensitive); null means {@link #OUT}. */
  public static Direction fromToken(String token) {
    if (token == null) return OUT;
    return switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "out" -> OUT;
      case "in" -> IN;
      case "any" -> ANY;
      default -> throw new ValidationException(
          "Unknown direction '" + token + "', expected one of: out, in, any");
    };
  }

  public String token() {
    return name().toLowerCase(Locale.ROOT);
  }
}
