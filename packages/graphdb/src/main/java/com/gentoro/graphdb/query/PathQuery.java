package com.gentoro.graphdb.query;

import com.gentoro.graphdb.exception.ValidationException;
import com.gentoro.graphdb.model.Direction;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A pattern query: start condition, steps, traversal direction and the projections applied when
 * the result is rendered.
 *
 * <pre>{@code
 * PathQuery.from(Condition.eq("name", "Alice"))
 *     .step(PatternStep.via("FRIEND_OF", Condition.eq("name", "Bob")))
 *     .direction(Direction.OUT)
 *     .build();
 * }</pre>
 */
public final class PathQuery {
  public static final String START_KEY = "start";
  public static final String PATTERN_KEY = "pattern";
  public static final String DIRECTION_KEY = "direction";
  public static final String FIELDS_KEY = "fields";
  public static final String REL_FIELDS_KEY = "rel_fields";
  private static final Set<String> KNOWN_KEYS =
      Set.of(START_KEY, PATTERN_KEY, DIRECTION_KEY, FIELDS_KEY, REL_FIELDS_KEY);

  private final Condition start;
  private final List<PatternStep> steps;
  private final Direction direction;
  private final List<String> nodeFields;
  private final List<String> relationshipFields;

  private PathQuery(Builder b) {
    this.start = b.start;
    this.steps = List.copyOf(b.steps);
    this.direction = b.direction;
    this.nodeFields = b.nodeFields == null ? List.of() : List.copyOf(b.nodeFields);
    this.relationshipFields =
        b.relationshipFields == null ? List.of() : List.copyOf(b.relationshipFields);
  }

  public static Builder from(Condition start) {
    return new Builder(start);
  }

  /**
   * Map form with keys {@code start}, {@code pattern} (list of step maps), {@code direction}
   * ({@code out}, {@code in}, {@code any}), {@code fields} and {@code rel_fields}.
   */
  @SuppressWarnings("unchecked")
  public static PathQuery fromMap(Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    for (String key : values.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        throw new ValidationException("Unknown path query key '" + key + "'")
            .withContext("key", key);
      }
    }
    Builder builder = new Builder(PatternStep.conditionOf(values.get(START_KEY)));
    Object pattern = values.get(PATTERN_KEY);
    if (pattern != null) {
      if (!(pattern instanceof List<?> list)) {
        throw new ValidationException(PATTERN_KEY + " must be a list of step maps");
      }
      for (Object step : list) {
        if (step instanceof PatternStep ps) {
          builder.step(ps);
        } else if (step == null || step instanceof Map<?, ?>) {
          builder.step(PatternStep.fromMap((Map<String, ?>) step));
        } else {
          throw new ValidationException("Pattern step must be a map, got " + step);
        }
      }
    }
    Object direction = values.get(DIRECTION_KEY);
    if (direction instanceof Direction d) {
      builder.direction(d);
    } else if (direction == null || direction instanceof String) {
      builder.direction(Direction.fromToken((String) direction));
    } else {
      throw new ValidationException(DIRECTION_KEY + " must be a string, got " + direction);
    }
    builder.nodeFields(fieldList(values.get(FIELDS_KEY), FIELDS_KEY));
    builder.relationshipFields(fieldList(values.get(REL_FIELDS_KEY), REL_FIELDS_KEY));
    return builder.build();
  }

  private static List<String> fieldList(Object value, String key) {
    if (value == null) return null;
    if (!(value instanceof List<?> list)) {
      throw new ValidationException(key + " must be a list of field names");
    }
    List<String> fields = new ArrayList<>(list.size());
    for (Object f : list) {
      if (!(f instanceof String s)) {
        throw new ValidationException(key + " entries must be strings, got " + f);
      }
      fields.add(s);
    }
    return fields;
  }

  public Condition start() {
    return start;
  }

  public List<PatternStep> steps() {
    return steps;
  }

  public Direction direction() {
    return direction;
  }

  public List<String> nodeFields() {
    return nodeFields;
  }

  public List<String> relationshipFields() {
    return relationshipFields;
  }

  @Override
  public String toString() {
    return "PathQuery{start=" + start + ", steps=" + steps + ", direction=" + direction + "}";
  }

  public static final class Builder {
    private final Condition start;
    private final List<PatternStep> steps = new ArrayList<>();
    private Direction direction = Direction.OUT;
    private List<String> nodeFields;
    private List<String> relationshipFields;

    private Builder(Condition start) {
      this.start = start != null ? start : Condition.always();
    }

    public Builder step(PatternStep step) {
      steps.add(Objects.requireNonNull(step, "step"));
      return this;
    }

    public Builder steps(List<PatternStep> values) {
      if (values != null) values.forEach(this::step);
      return this;
    }

    public Builder direction(Direction direction) {
      this.direction = direction != null ? direction : Direction.OUT;
      return this;
    }

    public Builder nodeFields(List<String> fields) {
      this.nodeFields = fields;
      return this;
    }

    public Builder relationshipFields(List<String> fields) {
      this.relationshipFields = fields;
      return this;
    }

    public PathQuery build() {
      return new PathQuery(this);
    }
  }
}
