package com.gentoro.graphdb.store;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphdb.utility.JacksonUtility;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A labeled node owned by the entity store.
 *
 * <p>Instances are mutable and never handed to callers; results leave the store as detached
 * copies of {@link #toView()}.
 */
public final class Node {
  public static final String ID_KEY = "id";
  public static final String LABELS_KEY = "labels";
  public static final Set<String> RESERVED_KEYS = Set.of(ID_KEY, LABELS_KEY);

  private final Object id;
  private final LinkedHashSet<String> labels = new LinkedHashSet<>();
  private ObjectNode attributes;

  public Node(Object id, Collection<String> labels, ObjectNode attributes) {
    this.id = Objects.requireNonNull(id, "id");
    setLabels(labels);
    this.attributes =
        attributes != null ? attributes : JacksonUtility.getJsonMapper().createObjectNode();
  }

  public Object id() {
    return id;
  }

  public Set<String> labels() {
    return Collections.unmodifiableSet(labels);
  }

  public boolean hasLabel(String label) {
    return labels.contains(label);
  }

  public ObjectNode attributes() {
    return attributes;
  }

  void setLabels(Collection<String> values) {
    labels.clear();
    addLabels(values);
  }

  /** @return true when at least one label was new */
  boolean addLabels(Collection<String> values) {
    boolean changed = false;
    if (values != null) {
      for (String label : values) {
        if (label != null && labels.add(label)) changed = true;
      }
    }
    return changed;
  }

  boolean removeLabels(Collection<String> values) {
    return values != null && labels.removeAll(values);
  }

  void setAttributes(ObjectNode attributes) {
    this.attributes = attributes;
  }

  /** Exported view: {@code id}, {@code labels}, then the attributes. */
  public ObjectNode toView() {
    ObjectNode view = JacksonUtility.getJsonMapper().createObjectNode();
    view.set(ID_KEY, JacksonUtility.toJsonNode(id));
    ArrayNode labelArray = view.putArray(LABELS_KEY);
    labels.forEach(labelArray::add);
    view.setAll(attributes.deepCopy());
    return view;
  }

  Node copy() {
    return new Node(id, labels, attributes.deepCopy());
  }

  @Override
  public String toString() {
    return "Node{" + id + ", labels=" + labels + "}";
  }
}
