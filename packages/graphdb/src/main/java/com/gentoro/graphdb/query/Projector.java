package com.gentoro.graphdb.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphdb.utility.JacksonUtility;
import java.util.List;

/** Restricts an entity view to a caller-chosen field list. */
public final class Projector {
  private Projector() {}

  /**
   * @param view the full entity view
   * @param fields requested fields, dotted paths allowed; null or empty keeps the whole view
   * @return a detached node holding only the requested fields that resolve, in request order
   */
  public static ObjectNode project(ObjectNode view, List<String> fields) {
    if (fields == null || fields.isEmpty()) return view.deepCopy();
    ObjectNode projected = JacksonUtility.getJsonMapper().createObjectNode();
    for (String field : fields) {
      if (field == null || projected.has(field)) continue;
      JsonNode value = FieldPath.resolve(view, field);
      if (value != null) {
        projected.set(field, value.deepCopy());
      }
    }
    return projected;
  }
}
