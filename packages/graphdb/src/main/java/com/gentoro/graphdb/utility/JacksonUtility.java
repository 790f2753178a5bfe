package com.gentoro.graphdb.utility;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphdb.exception.ValidationException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared Jackson mapper and the conversions between caller-facing {@code Map}s and the JSON trees
 * the store keeps internally.
 *
 * <p>Integral numbers always deserialize as {@link Long} so identifiers and attribute values read
 * back from a file compare equal to the ones written.
 */
public final class JacksonUtility {
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .enable(DeserializationFeature.USE_LONG_FOR_INTS)
          .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /** Convert a caller-supplied attribute map into an owned {@link ObjectNode}. Null is empty. */
  public static ObjectNode toObjectNode(Map<String, ?> values) {
    if (values == null) return JSON_MAPPER.createObjectNode();
    try {
      return JSON_MAPPER.valueToTree(values);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Attributes are not JSON-compatible: " + e.getMessage(), e);
    }
  }

  /** Convert an arbitrary value into a JSON tree; Java null becomes a JSON null node. */
  public static JsonNode toJsonNode(Object value) {
    if (value == null) return NullNode.getInstance();
    try {
      return JSON_MAPPER.valueToTree(value);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Value is not JSON-compatible: " + e.getMessage(), e);
    }
  }

  /** Detached {@code Map} copy of an object node, preserving key order. */
  public static Map<String, Object> toMap(ObjectNode node) {
    return JSON_MAPPER.convertValue(node, MAP_TYPE);
  }
}
