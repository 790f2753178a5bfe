package com.gentoro.graphdb.query;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphdb.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FieldPathTest {

  private final ObjectNode view =
      JacksonUtility.toObjectNode(
          Map.of(
              "a.b", "literal",
              "a", Map.of("b", "nested", "c", Map.of("d", 4)),
              "list", List.of(Map.of("x", 1), Map.of("x", 2))));

  @Test
  @DisplayName("An exact key wins over a dotted walk")
  void exactKeyFirst() {
    assertEquals("literal", FieldPath.resolve(view, "a.b").asText());
    assertEquals(4, FieldPath.resolve(view, "a.c.d").asInt());
  }

  @Test
  @DisplayName("Arrays are indexed by numeric segments")
  void arrays() {
    assertEquals(2, FieldPath.resolve(view, "list.1.x").asInt());
    assertNull(FieldPath.resolve(view, "list.5.x"));
    assertNull(FieldPath.resolve(view, "list.first"));
    assertNull(FieldPath.resolve(view, "list.-1"));
  }

  @Test
  @DisplayName("Absent or untraversable paths resolve to null")
  void absent() {
    assertNull(FieldPath.resolve(view, "missing"));
    assertNull(FieldPath.resolve(view, "a.c.d.e"));
    assertNull(FieldPath.resolve(view, "a..b"));
    assertNull(FieldPath.resolve(view, null));
    JsonNode nested = FieldPath.resolve(view, "a.c");
    assertTrue(nested.isObject());
  }
}
