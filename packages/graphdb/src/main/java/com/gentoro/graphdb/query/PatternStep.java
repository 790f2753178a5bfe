package com.gentoro.graphdb.query;

import com.gentoro.graphdb.exception.ValidationException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** One hop of a pattern: which relationships to follow and what the next node must satisfy. */
public final class PatternStep {
  public static final String REL_TYPE_KEY = "rel_type";
  public static final String NODE_KEY = "node";
  private static final Set<String> KNOWN_KEYS = Set.of(REL_TYPE_KEY, NODE_KEY);

  private final TypeFilter typeFilter;
  private final Condition nodeCondition;

  private PatternStep(TypeFilter typeFilter, Condition nodeCondition) {
    this.typeFilter = Objects.requireNonNull(typeFilter, "typeFilter");
    this.nodeCondition = nodeCondition != null ? nodeCondition : Condition.always();
  }

  public static PatternStep of(TypeFilter typeFilter, Condition nodeCondition) {
    return new PatternStep(typeFilter, nodeCondition);
  }

  /** Follow relationships of any type to a node satisfying {@code nodeCondition}. */
  public static PatternStep to(Condition nodeCondition) {
    return new PatternStep(TypeFilter.any(), nodeCondition);
  }

  /** Follow relationships of {@code type} to a node satisfying {@code nodeCondition}. */
  public static PatternStep via(String type, Condition nodeCondition) {
    return new PatternStep(TypeFilter.of(type), nodeCondition);
  }

  /**
   * Map form: {@code {"rel_type": "FRIEND_OF", "node": {...condition...}}}. An absent {@code
   * rel_type} follows every relationship; an explicit null follows only untyped ones.
   */
  public static PatternStep fromMap(Map<String, ?> values) {
    if (values == null) return to(Condition.always());
    for (String key : values.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        throw new ValidationException(
                "Unknown pattern step key '" + key + "', expected one of " + KNOWN_KEYS)
            .withContext("key", key);
      }
    }
    TypeFilter filter = TypeFilter.any();
    if (values.containsKey(REL_TYPE_KEY)) {
      Object type = values.get(REL_TYPE_KEY);
      if (type != null && !(type instanceof String)) {
        throw new ValidationException(REL_TYPE_KEY + " must be a string or null, got " + type);
      }
      filter = TypeFilter.of((String) type);
    }
    return new PatternStep(filter, conditionOf(values.get(NODE_KEY)));
  }

  @SuppressWarnings("unchecked")
  static Condition conditionOf(Object source) {
    if (source == null) return Condition.always();
    if (source instanceof Condition condition) return condition;
    if (source instanceof Map<?, ?> map) return Condition.fromMap((Map<String, ?>) map);
    throw new ValidationException("Expected a condition map, got " + source);
  }

  public TypeFilter typeFilter() {
    return typeFilter;
  }

  public Condition nodeCondition() {
    return nodeCondition;
  }

  @Override
  public String toString() {
    return "-[" + typeFilter + "]-> " + nodeCondition;
  }
}
