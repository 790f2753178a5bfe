package com.gentoro.graphdb.query;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves a field name against an entity view.
 *
 * <p>An exact top-level key wins. Otherwise a dotted name such as {@code address.city} or {@code
 * tags.0} walks nested objects by key and arrays by index. Returns {@code null} when any segment
 * is absent or the value at that point cannot be traversed; an explicit JSON null is returned as
 * a null node, not as absence.
 */
public final class FieldPath {
  private FieldPath() {}

  public static JsonNode resolve(JsonNode root, String field) {
    if (root == null || field == null) return null;
    JsonNode direct = root.get(field);
    if (direct != null) return direct;
    if (field.indexOf('.') < 0) return null;

    JsonNode current = root;
    for (String segment : field.split("\\.", -1)) {
      if (segment.isEmpty()) return null;
      if (current.isObject()) {
        current = current.get(segment);
      } else if (current.isArray()) {
        // bounded length keeps parseInt from overflowing
        if (!StringUtils.isNumeric(segment) || segment.length() > 9) return null;
        current = current.get(Integer.parseInt(segment));
      } else {
        return null;
      }
      if (current == null) return null;
    }
    return current;
  }
}
