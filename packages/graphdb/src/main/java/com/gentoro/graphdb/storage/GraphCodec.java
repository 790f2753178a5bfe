package com.gentoro.graphdb.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphdb.exception.GraphDbException;
import com.gentoro.graphdb.exception.PersistenceException;
import com.gentoro.graphdb.model.Identifiers;
import com.gentoro.graphdb.store.EntityStore;
import com.gentoro.graphdb.store.Node;
import com.gentoro.graphdb.store.Relationship;
import com.gentoro.graphdb.store.Topology;
import com.gentoro.graphdb.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between an {@link EntityStore} and the persisted document:
 *
 * <pre>{@code
 * {
 *   "nodes": [ { "id": 1, "labels": ["Person"], "name": "Alice" } ],
 *   "relationships": [ { "source": 1, "target": 2, "type": "FRIEND_OF", "since": 2010 } ]
 * }
 * }</pre>
 *
 * <p>Attributes are flattened next to the reserved keys. Missing {@code nodes} or {@code
 * relationships} arrays decode as empty; anything else that does not fit the shape is rejected
 * with a {@link PersistenceException} naming the offending entry.
 */
public final class GraphCodec {
  public static final String NODES_KEY = "nodes";
  public static final String RELATIONSHIPS_KEY = "relationships";

  private GraphCodec() {}

  public static ObjectNode encode(EntityStore store) {
    ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();
    ArrayNode nodes = root.putArray(NODES_KEY);
    for (Node node : store.nodes()) {
      nodes.add(node.toView());
    }
    ArrayNode relationships = root.putArray(RELATIONSHIPS_KEY);
    for (Relationship rel : store.relationships()) {
      relationships.add(rel.toView());
    }
    return root;
  }

  public static EntityStore decode(JsonNode document, Topology topology) {
    if (document == null || !document.isObject()) {
      throw new PersistenceException(
          "Graph document must be a JSON object, got "
              + (document == null ? "nothing" : document.getNodeType()));
    }
    EntityStore store = new EntityStore(topology);
    JsonNode nodes = arrayOf(document, NODES_KEY);
    for (int i = 0; i < nodes.size(); i++) {
      decodeNode(store, nodes.get(i), i);
    }
    JsonNode relationships = arrayOf(document, RELATIONSHIPS_KEY);
    for (int i = 0; i < relationships.size(); i++) {
      decodeRelationship(store, relationships.get(i), i);
    }
    return store;
  }

  private static void decodeNode(EntityStore store, JsonNode entry, int index) {
    if (!entry.isObject()) {
      throw malformed(NODES_KEY, index, "entry is not an object");
    }
    Object id = Identifiers.fromJson(entry.get(Node.ID_KEY));
    if (id == null) {
      throw malformed(NODES_KEY, index, "missing or invalid \"" + Node.ID_KEY + "\"");
    }
    List<String> labels = new ArrayList<>();
    JsonNode labelArray = entry.get(Node.LABELS_KEY);
    if (labelArray != null && !labelArray.isNull()) {
      if (!labelArray.isArray()) {
        throw malformed(NODES_KEY, index, "\"" + Node.LABELS_KEY + "\" is not an array");
      }
      for (JsonNode label : labelArray) {
        if (!label.isTextual()) {
          throw malformed(NODES_KEY, index, "label " + label + " is not a string");
        }
        labels.add(label.textValue());
      }
    }
    ObjectNode attributes = ((ObjectNode) entry).deepCopy();
    attributes.remove(Node.RESERVED_KEYS);
    store.putNode(id, labels, attributes);
  }

  private static void decodeRelationship(EntityStore store, JsonNode entry, int index) {
    if (!entry.isObject()) {
      throw malformed(RELATIONSHIPS_KEY, index, "entry is not an object");
    }
    Object source = Identifiers.fromJson(entry.get(Relationship.SOURCE_KEY));
    Object target = Identifiers.fromJson(entry.get(Relationship.TARGET_KEY));
    if (source == null || target == null) {
      throw malformed(RELATIONSHIPS_KEY, index, "missing or invalid source/target");
    }
    String type = null;
    JsonNode typeNode = entry.get(Relationship.TYPE_KEY);
    if (typeNode != null && !typeNode.isNull()) {
      if (!typeNode.isTextual()) {
        throw malformed(RELATIONSHIPS_KEY, index, "\"type\" is not a string");
      }
      type = typeNode.textValue();
    }
    ObjectNode attributes = ((ObjectNode) entry).deepCopy();
    attributes.remove(Relationship.RESERVED_KEYS);
    try {
      store.putRelationship(source, target, type, attributes);
    } catch (GraphDbException e) {
      throw new PersistenceException(
          "Malformed graph document: " + RELATIONSHIPS_KEY + "[" + index + "]: " + e.getMessage(),
          e);
    }
  }

  private static JsonNode arrayOf(JsonNode document, String key) {
    JsonNode value = document.get(key);
    if (value == null || value.isNull()) {
      return JacksonUtility.getJsonMapper().createArrayNode();
    }
    if (!value.isArray()) {
      throw new PersistenceException("Malformed graph document: \"" + key + "\" is not an array");
    }
    return value;
  }

  private static PersistenceException malformed(String section, int index, String problem) {
    return new PersistenceException(
        "Malformed graph document: " + section + "[" + index + "]: " + problem);
  }
}
