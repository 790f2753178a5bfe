package com.gentoro.graphdb.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphdb.utility.JacksonUtility;
import java.util.Objects;
import java.util.Set;

/** A typed relationship between two nodes, owned by the entity store. */
public final class Relationship {
  public static final String SOURCE_KEY = "source";
  public static final String TARGET_KEY = "target";
  public static final String TYPE_KEY = "type";
  public static final Set<String> RESERVED_KEYS = Set.of(SOURCE_KEY, TARGET_KEY, TYPE_KEY);

  private final RelationshipKey key;
  private final Object source;
  private final Object target;
  private String type;
  private ObjectNode attributes;

  public Relationship(
      RelationshipKey key, Object source, Object target, String type, ObjectNode attributes) {
    this.key = Objects.requireNonNull(key, "key");
    this.source = Objects.requireNonNull(source, "source");
    this.target = Objects.requireNonNull(target, "target");
    this.type = type;
    this.attributes =
        attributes != null ? attributes : JacksonUtility.getJsonMapper().createObjectNode();
  }

  public RelationshipKey key() {
    return key;
  }

  public Object source() {
    return source;
  }

  public Object target() {
    return target;
  }

  /** May be null: relationships are not required to carry a type. */
  public String type() {
    return type;
  }

  public ObjectNode attributes() {
    return attributes;
  }

  void setType(String type) {
    this.type = type;
  }

  void setAttributes(ObjectNode attributes) {
    this.attributes = attributes;
  }

  public boolean isSelfLoop() {
    return source.equals(target);
  }

  /** The endpoint opposite to {@code nodeId}; the node itself for a self loop. */
  public Object otherEnd(Object nodeId) {
    if (isSelfLoop()) return source;
    return source.equals(nodeId) ? target : source;
  }

  /** Exported view: {@code source}, {@code target}, {@code type}, then the attributes. */
  public ObjectNode toView() {
    ObjectNode view = JacksonUtility.getJsonMapper().createObjectNode();
    view.set(SOURCE_KEY, JacksonUtility.toJsonNode(source));
    view.set(TARGET_KEY, JacksonUtility.toJsonNode(target));
    if (type == null) {
      view.putNull(TYPE_KEY);
    } else {
      view.put(TYPE_KEY, type);
    }
    view.setAll(attributes.deepCopy());
    return view;
  }

  Relationship copy() {
    return new Relationship(key, source, target, type, attributes.deepCopy());
  }

  @Override
  public String toString() {
    return "Relationship{" + source + " -[" + type + "]-> " + target + "}";
  }
}
