package com.gentoro.graphdb.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphdb.exception.NotFoundException;
import com.gentoro.graphdb.exception.ReferenceException;
import com.gentoro.graphdb.exception.ValidationException;
import com.gentoro.graphdb.model.Direction;
import com.gentoro.graphdb.model.Identifiers;
import com.gentoro.graphdb.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Owner of every node and relationship plus the adjacency index used for traversal.
 *
 * <p>Write families:
 *
 * <ul>
 *   <li>{@code put*}: create or overwrite; never fails on absence.
 *   <li>{@code merge*}: create, or merge labels and attributes into the existing record.
 *   <li>{@code patch*}: merge attributes into an existing record; {@link NotFoundException} if
 *       absent.
 *   <li>{@code remove*}: no-op when absent; returns whether something was removed.
 * </ul>
 *
 * <p>Every write validates its input before touching state, so a failing call leaves the store
 * unchanged. Attribute nodes passed in are owned by the store afterwards.
 *
 * <p>Not thread-safe.
 */
public class EntityStore {
  private static final Logger log =
      com.gentoro.graphdb.logging.LoggingService.getLogger(EntityStore.class);

  private final Topology topology;
  private final Map<Object, Node> nodes = new LinkedHashMap<>();
  private final Map<RelationshipKey, Relationship> relationships = new LinkedHashMap<>();
  // Keyed by the stored source / target; an undirected traversal reads both.
  private final Map<Object, Set<RelationshipKey>> outgoing = new HashMap<>();
  private final Map<Object, Set<RelationshipKey>> incoming = new HashMap<>();

  public EntityStore(Topology topology) {
    this.topology = Objects.requireNonNull(topology, "topology");
  }

  public Topology topology() {
    return topology;
  }

  public boolean isDirected() {
    return topology.isDirected();
  }

  // ---------------------------------------------------------------- nodes

  public Node node(Object id) {
    return nodes.get(Identifiers.normalize(id));
  }

  public Node requireNode(Object id) {
    Object key = Identifiers.normalize(id);
    Node node = nodes.get(key);
    if (node == null) {
      throw new NotFoundException("Node not found: " + key).withContext("id", key);
    }
    return node;
  }

  public boolean containsNode(Object id) {
    return nodes.containsKey(Identifiers.normalize(id));
  }

  public Collection<Node> nodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public int nodeCount() {
    return nodes.size();
  }

  /** Create the node, or replace labels and attributes of an existing one. */
  public Node putNode(Object id, Collection<String> labels, ObjectNode attributes) {
    Object key = Identifiers.normalize(id);
    ObjectNode attrs = checkAttributes(attributes, Node.RESERVED_KEYS, key);
    Node existing = nodes.get(key);
    if (existing == null) {
      Node created = new Node(key, labels, attrs);
      nodes.put(key, created);
      return created;
    }
    existing.setLabels(labels);
    existing.setAttributes(attrs);
    return existing;
  }

  /** Create the node, or append labels and merge attributes into an existing one. */
  public Node mergeNode(Object id, Collection<String> labels, ObjectNode patch) {
    Object key = Identifiers.normalize(id);
    ObjectNode attrs = checkAttributes(patch, Node.RESERVED_KEYS, key);
    Node existing = nodes.get(key);
    if (existing == null) {
      Node created = new Node(key, labels, attrs);
      nodes.put(key, created);
      return created;
    }
    existing.addLabels(labels);
    existing.attributes().setAll(attrs);
    return existing;
  }

  /** Merge attributes into an existing node. */
  public Node patchNode(Object id, ObjectNode patch) {
    Node node = requireNode(id);
    ObjectNode attrs = checkAttributes(patch, Node.RESERVED_KEYS, node.id());
    node.attributes().setAll(attrs);
    return node;
  }

  public boolean addLabels(Object id, Collection<String> labels) {
    return requireNode(id).addLabels(labels);
  }

  public boolean removeLabels(Object id, Collection<String> labels) {
    return requireNode(id).removeLabels(labels);
  }

  public boolean removeNodeAttributes(Object id, Collection<String> keys) {
    return removeKeys(requireNode(id).attributes(), keys);
  }

  /** Remove the node and every relationship touching it. */
  public boolean removeNode(Object id) {
    Object key = Identifiers.normalize(id);
    Node removed = nodes.remove(key);
    if (removed == null) return false;
    Set<RelationshipKey> incident = new LinkedHashSet<>();
    incident.addAll(outgoing.getOrDefault(key, Set.of()));
    incident.addAll(incoming.getOrDefault(key, Set.of()));
    for (RelationshipKey relKey : incident) {
      Relationship rel = relationships.remove(relKey);
      if (rel != null) unindex(rel);
    }
    outgoing.remove(key);
    incoming.remove(key);
    log.trace("Removed node {} and {} incident relationship(s)", key, incident.size());
    return true;
  }

  // -------------------------------------------------------- relationships

  public Relationship relationship(Object source, Object target) {
    return relationships.get(
        topology.keyOf(Identifiers.normalize(source), Identifiers.normalize(target)));
  }

  public Relationship requireRelationship(Object source, Object target) {
    Relationship rel = relationship(source, target);
    if (rel == null) {
      throw new NotFoundException(
              "Relationship not found: "
                  + topology.keyOf(Identifiers.normalize(source), Identifiers.normalize(target)))
          .withContext("source", source)
          .withContext("target", target);
    }
    return rel;
  }

  public boolean containsRelationship(Object source, Object target) {
    return relationship(source, target) != null;
  }

  public Collection<Relationship> relationships() {
    return Collections.unmodifiableCollection(relationships.values());
  }

  public int relationshipCount() {
    return relationships.size();
  }

  /** Create the relationship, or replace type, attributes and orientation of an existing one. */
  public Relationship putRelationship(
      Object source, Object target, String type, ObjectNode attributes) {
    Object s = Identifiers.normalize(source);
    Object t = Identifiers.normalize(target);
    requireEndpoints(s, t);
    ObjectNode attrs = checkAttributes(attributes, Relationship.RESERVED_KEYS, s + "->" + t);
    RelationshipKey key = topology.keyOf(s, t);
    Relationship existing = relationships.get(key);
    if (existing != null) {
      unindex(existing);
    }
    Relationship rel = new Relationship(key, s, t, type, attrs);
    relationships.put(key, rel);
    index(rel);
    return rel;
  }

  /**
   * Create the relationship, or merge attributes into the existing one; a non-null {@code type}
   * replaces the existing type.
   */
  public Relationship mergeRelationship(
      Object source, Object target, String type, ObjectNode patch) {
    Object s = Identifiers.normalize(source);
    Object t = Identifiers.normalize(target);
    requireEndpoints(s, t);
    Relationship existing = relationships.get(topology.keyOf(s, t));
    if (existing == null) {
      return putRelationship(s, t, type, patch);
    }
    ObjectNode attrs = checkAttributes(patch, Relationship.RESERVED_KEYS, s + "->" + t);
    if (type != null) existing.setType(type);
    existing.attributes().setAll(attrs);
    return existing;
  }

  /** Merge attributes into an existing relationship. */
  public Relationship patchRelationship(Object source, Object target, ObjectNode patch) {
    Relationship rel = requireRelationship(source, target);
    ObjectNode attrs = checkAttributes(patch, Relationship.RESERVED_KEYS, rel.key());
    rel.attributes().setAll(attrs);
    return rel;
  }

  public boolean removeRelationshipAttributes(
      Object source, Object target, Collection<String> keys) {
    return removeKeys(requireRelationship(source, target).attributes(), keys);
  }

  public boolean removeRelationship(Object source, Object target) {
    RelationshipKey key =
        topology.keyOf(Identifiers.normalize(source), Identifiers.normalize(target));
    Relationship removed = relationships.remove(key);
    if (removed == null) return false;
    unindex(removed);
    return true;
  }

  // ------------------------------------------------------------ adjacency

  /**
   * Relationships incident to {@code id} as seen through the topology. A self loop is listed once
   * even when both directions are followed.
   */
  public List<Relationship> relationshipsOf(Object id, Direction direction) {
    Objects.requireNonNull(direction, "direction");
    Object key = requireNode(id).id();
    Direction effective = topology.effective(direction);
    Set<RelationshipKey> keys = new LinkedHashSet<>();
    if (effective != Direction.IN) keys.addAll(outgoing.getOrDefault(key, Set.of()));
    if (effective != Direction.OUT) keys.addAll(incoming.getOrDefault(key, Set.of()));
    List<Relationship> result = new ArrayList<>(keys.size());
    for (RelationshipKey k : keys) {
      result.add(relationships.get(k));
    }
    return result;
  }

  /** Distinct adjacent node identifiers, in first-seen order. */
  public List<Object> neighbors(Object id, Direction direction) {
    Object key = requireNode(id).id();
    Set<Object> result = new LinkedHashSet<>();
    for (Relationship rel : relationshipsOf(key, direction)) {
      result.add(rel.otherEnd(key));
    }
    return new ArrayList<>(result);
  }

  public int degree(Object id, Direction direction) {
    return relationshipsOf(id, direction).size();
  }

  // ----------------------------------------------------------- lifecycle

  public void clear() {
    nodes.clear();
    relationships.clear();
    outgoing.clear();
    incoming.clear();
  }

  /** Deep copy sharing no mutable state with this store. */
  public EntityStore copy() {
    EntityStore copy = new EntityStore(topology);
    for (Node node : nodes.values()) {
      copy.nodes.put(node.id(), node.copy());
    }
    for (Relationship rel : relationships.values()) {
      Relationship relCopy = rel.copy();
      copy.relationships.put(relCopy.key(), relCopy);
      copy.index(relCopy);
    }
    return copy;
  }

  /** Replace all contents with those of {@code snapshot}, which must not be used afterwards. */
  public void restoreFrom(EntityStore snapshot) {
    if (snapshot.topology.isDirected() != topology.isDirected()) {
      throw new IllegalArgumentException("Cannot restore a " + snapshot.topology + " snapshot");
    }
    clear();
    nodes.putAll(snapshot.nodes);
    relationships.putAll(snapshot.relationships);
    snapshot.outgoing.forEach((k, v) -> outgoing.put(k, new LinkedHashSet<>(v)));
    snapshot.incoming.forEach((k, v) -> incoming.put(k, new LinkedHashSet<>(v)));
  }

  // -------------------------------------------------------------- helpers

  private void requireEndpoints(Object source, Object target) {
    List<Object> missing = new ArrayList<>(2);
    if (!nodes.containsKey(source)) missing.add(source);
    if (!target.equals(source) && !nodes.containsKey(target)) missing.add(target);
    if (!missing.isEmpty()) {
      throw new ReferenceException(
              "Relationship " + source + " -> " + target + " references missing node(s) " + missing)
          .withContext("source", source)
          .withContext("target", target);
    }
  }

  private static ObjectNode checkAttributes(
      ObjectNode attributes, Set<String> reserved, Object owner) {
    if (attributes == null) return JacksonUtility.getJsonMapper().createObjectNode();
    Iterator<String> names = attributes.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (reserved.contains(name)) {
        throw new ValidationException(
                "Attribute key '" + name + "' of " + owner + " is reserved, reserved: " + reserved)
            .withContext("key", name);
      }
    }
    return attributes;
  }

  private static boolean removeKeys(ObjectNode attributes, Collection<String> keys) {
    boolean changed = false;
    for (String k : keys) {
      if (attributes.remove(k) != null) changed = true;
    }
    return changed;
  }

  private void index(Relationship rel) {
    outgoing.computeIfAbsent(rel.source(), k -> new LinkedHashSet<>()).add(rel.key());
    incoming.computeIfAbsent(rel.target(), k -> new LinkedHashSet<>()).add(rel.key());
  }

  private void unindex(Relationship rel) {
    Set<RelationshipKey> out = outgoing.get(rel.source());
    if (out != null) out.remove(rel.key());
    Set<RelationshipKey> in = incoming.get(rel.target());
    if (in != null) in.remove(rel.key());
  }
}
