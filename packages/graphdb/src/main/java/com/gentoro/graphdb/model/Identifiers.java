package com.gentoro.graphdb.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.graphdb.exception.ValidationException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Normalization of caller-supplied node identifiers.
 *
 * <p>Identifiers are strings or numbers. Integral numbers, including a {@link BigDecimal} with no
 * fractional part, become {@link Long} and fractional numbers {@link Double}, so {@code 7},
 * {@code 7L} and an identifier decoded from a JSON file all address the same node.
 */
public final class Identifiers {
  private Identifiers() {}

  public static Object normalize(Object id) {
    if (id instanceof String) return id;
    if (id instanceof Long) return id;
    if (id instanceof Integer || id instanceof Short || id instanceof Byte) {
      return ((Number) id).longValue();
    }
    if (id instanceof BigInteger big) {
      try {
        return big.longValueExact();
      } catch (ArithmeticException e) {
        throw new ValidationException("Identifier out of range: " + id, e);
      }
    }
    if (id instanceof Double || id instanceof Float) {
      double d = ((Number) id).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new ValidationException("Identifier must be a finite number: " + id);
      }
      return d;
    }
    if (id instanceof BigDecimal dec) {
      if (dec.stripTrailingZeros().scale() <= 0) {
        return normalize(dec.toBigIntegerExact());
      }
      return normalize(dec.doubleValue());
    }
    if (id == null) {
      throw new ValidationException("Identifier must not be null");
    }
    throw new ValidationException(
        "Identifier must be a string or a number, got " + id.getClass().getSimpleName());
  }

  /** Identifier held by a JSON value, or null when the value cannot be an identifier. */
  public static Object fromJson(JsonNode node) {
    if (node == null) return null;
    if (node.isTextual()) return node.textValue();
    if (node.isIntegralNumber()) {
      return node.canConvertToLong() ? node.longValue() : null;
    }
    if (node.isNumber()) {
      double d = node.doubleValue();
      return Double.isFinite(d) ? d : null;
    }
    return null;
  }
}
