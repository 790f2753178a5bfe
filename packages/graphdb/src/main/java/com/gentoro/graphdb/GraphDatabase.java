package com.gentoro.graphdb;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphdb.exception.ExceptionUtil;
import com.gentoro.graphdb.exception.GraphDbException;
import com.gentoro.graphdb.exception.PersistenceException;
import com.gentoro.graphdb.logging.LoggingService;
import com.gentoro.graphdb.model.Direction;
import com.gentoro.graphdb.model.GraphPath;
import com.gentoro.graphdb.query.Condition;
import com.gentoro.graphdb.query.ConditionEvaluator;
import com.gentoro.graphdb.query.MatchedPath;
import com.gentoro.graphdb.query.PathMatcher;
import com.gentoro.graphdb.query.PathQuery;
import com.gentoro.graphdb.query.PatternStep;
import com.gentoro.graphdb.query.Projector;
import com.gentoro.graphdb.storage.GraphStorage;
import com.gentoro.graphdb.storage.GraphStorageFactory;
import com.gentoro.graphdb.storage.file.FileGraphStorage;
import com.gentoro.graphdb.store.EntityStore;
import com.gentoro.graphdb.store.Node;
import com.gentoro.graphdb.store.Relationship;
import com.gentoro.graphdb.store.Topology;
import com.gentoro.graphdb.utility.JacksonUtility;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Embedded graph database: labeled nodes, typed relationships, condition queries, pattern
 * matching and JSON-file persistence.
 *
 * <p>Write operations come in three families with distinct failure policies:
 *
 * <ul>
 *   <li>{@code add*}: create or overwrite; never fails because the entity is absent.
 *   <li>{@code set*}: create, or merge into the existing entity.
 *   <li>{@code update*}: merge into an existing entity; {@link
 *       com.gentoro.graphdb.exception.NotFoundException} when absent.
 * </ul>
 *
 * <p>{@code remove*} calls are idempotent: removing something absent is a no-op returning {@code
 * false}. Every call that changes the graph rewrites the backing file before returning (unless
 * memory-only); if that write fails the change is rolled back and the {@link
 * PersistenceException} propagates.
 *
 * <p>All results are detached copies. Not thread-safe: intended for a single writer in a single
 * process.
 */
public class GraphDatabase implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(GraphDatabase.class);

  private final GraphDatabaseOptions options;
  private final GraphStorage storage;
  private final EntityStore store;
  private final PathMatcher matcher;

  GraphDatabase(GraphDatabaseOptions options, GraphStorage storage) {
    this.options = Objects.requireNonNull(options, "options");
    this.storage = Objects.requireNonNull(storage, "storage");
    Topology topology = Topology.of(options.directed());
    this.store = storage.load(topology).orElseGet(() -> new EntityStore(topology));
    this.matcher = new PathMatcher(store);
    log.info(
        "Opened {} graph on {} storage{} with {} node(s) and {} relationship(s)",
        topology,
        storage.getStorageName(),
        storage.getLocation() != null ? " (" + storage.getLocation() + ")" : "",
        store.nodeCount(),
        store.relationshipCount());
  }

  public static GraphDatabase open(GraphDatabaseOptions options) {
    return new GraphDatabase(options, GraphStorageFactory.create(options));
  }

  /** Open from configuration, applying its {@code logging.level.*} entries first. */
  public static GraphDatabase open(Configuration configuration) {
    LoggingService.applyConfiguration(configuration);
    return open(GraphDatabaseOptions.from(configuration));
  }

  public static GraphDatabase open(Path path, boolean directed) {
    return open(GraphDatabaseOptions.builder().directed(directed).path(path.toString()).build());
  }

  public static GraphDatabase inMemory(boolean directed) {
    return open(GraphDatabaseOptions.inMemory(directed));
  }

  public GraphDatabaseOptions options() {
    return options;
  }

  public boolean isDirected() {
    return store.isDirected();
  }

  public boolean isMemoryOnly() {
    return !storage.isPersistent();
  }

  public int nodeCount() {
    return store.nodeCount();
  }

  public int relationshipCount() {
    return store.relationshipCount();
  }

  // ------------------------------------------------------------------ nodes

  /** Create the node, or replace the labels and attributes of an existing one. */
  public Map<String, Object> addNode(
      Object id, Collection<String> labels, Map<String, ?> attributes) {
    ObjectNode attrs = JacksonUtility.toObjectNode(attributes);
    Node node = mutate("addNode " + id, () -> store.putNode(id, labels, attrs));
    return view(node, null);
  }

  public Map<String, Object> addNode(Object id, Map<String, ?> attributes) {
    return addNode(id, List.of(), attributes);
  }

  /** Create the node, or add the labels and merge the attributes into an existing one. */
  public Map<String, Object> setNode(
      Object id, Collection<String> labels, Map<String, ?> attributes) {
    ObjectNode attrs = JacksonUtility.toObjectNode(attributes);
    Node node = mutate("setNode " + id, () -> store.mergeNode(id, labels, attrs));
    return view(node, null);
  }

  /** Merge attributes into an existing node. */
  public Map<String, Object> updateNode(Object id, Map<String, ?> attributes) {
    ObjectNode attrs = JacksonUtility.toObjectNode(attributes);
    Node node = mutate("updateNode " + id, () -> store.patchNode(id, attrs));
    return view(node, null);
  }

  /** @return whether any label was new */
  public boolean addLabels(Object id, String... labels) {
    store.requireNode(id);
    return mutateIf("addLabels " + id, () -> store.addLabels(id, Arrays.asList(labels)));
  }

  /** @return whether any label was present */
  public boolean removeLabels(Object id, String... labels) {
    store.requireNode(id);
    return mutateIf("removeLabels " + id, () -> store.removeLabels(id, Arrays.asList(labels)));
  }

  /** @return whether any key was present */
  public boolean removeNodeAttributes(Object id, String... keys) {
    store.requireNode(id);
    return mutateIf(
        "removeNodeAttributes " + id, () -> store.removeNodeAttributes(id, Arrays.asList(keys)));
  }

  /** Remove the node and all its relationships; a no-op when absent. */
  public boolean removeNode(Object id) {
    if (!store.containsNode(id)) return false;
    return mutateIf("removeNode " + id, () -> store.removeNode(id));
  }

  public boolean hasNode(Object id) {
    return store.containsNode(id);
  }

  public Map<String, Object> getNode(Object id) {
    return getNode(id, null);
  }

  public Map<String, Object> getNode(Object id, List<String> fields) {
    return view(store.requireNode(id), fields);
  }

  /**
   * Nodes carrying {@code label} (any label when null) that satisfy {@code condition}, projected to
   * {@code fields}.
   */
  public List<Map<String, Object>> findNodes(
      String label, Condition condition, List<String> fields) {
    List<Map<String, Object>> result = new ArrayList<>();
    for (Node node : store.nodes()) {
      if (label != null && !node.hasLabel(label)) continue;
      ObjectNode view = node.toView();
      if (ConditionEvaluator.evaluate(view, condition)) {
        result.add(JacksonUtility.toMap(Projector.project(view, fields)));
      }
    }
    log.debug("findNodes label={} {} matched {} node(s)", label, condition, result.size());
    return result;
  }

  public List<Map<String, Object>> findNodes(String label, Map<String, ?> condition) {
    return findNodes(label, Condition.fromMap(condition), null);
  }

  public List<Map<String, Object>> findNodes(Condition condition) {
    return findNodes(null, condition, null);
  }

  // ---------------------------------------------------------- relationships

  /** Create the relationship, or replace the type and attributes of an existing one. */
  public Map<String, Object> addRelationship(
      Object source, Object target, String type, Map<String, ?> attributes) {
    ObjectNode attrs = JacksonUtility.toObjectNode(attributes);
    Relationship rel =
        mutate(
            "addRelationship " + source + "->" + target,
            () -> store.putRelationship(source, target, type, attrs));
    return view(rel, null);
  }

  public Map<String, Object> addRelationship(Object source, Object target, String type) {
    return addRelationship(source, target, type, null);
  }

  /**
   * Create the relationship, or merge the attributes into an existing one; a non-null type
   * replaces the existing type.
   */
  public Map<String, Object> setRelationship(
      Object source, Object target, String type, Map<String, ?> attributes) {
    ObjectNode attrs = JacksonUtility.toObjectNode(attributes);
    Relationship rel =
        mutate(
            "setRelationship " + source + "->" + target,
            () -> store.mergeRelationship(source, target, type, attrs));
    return view(rel, null);
  }

  /** Merge attributes into an existing relationship. */
  public Map<String, Object> updateRelationship(
      Object source, Object target, Map<String, ?> attributes) {
    ObjectNode attrs = JacksonUtility.toObjectNode(attributes);
    Relationship rel =
        mutate(
            "updateRelationship " + source + "->" + target,
            () -> store.patchRelationship(source, target, attrs));
    return view(rel, null);
  }

  public boolean removeRelationshipAttributes(Object source, Object target, String... keys) {
    store.requireRelationship(source, target);
    return mutateIf(
        "removeRelationshipAttributes " + source + "->" + target,
        () -> store.removeRelationshipAttributes(source, target, Arrays.asList(keys)));
  }

  /** A no-op when absent. */
  public boolean removeRelationship(Object source, Object target) {
    if (!store.containsRelationship(source, target)) return false;
    return mutateIf(
        "removeRelationship " + source + "->" + target,
        () -> store.removeRelationship(source, target));
  }

  public boolean hasRelationship(Object source, Object target) {
    return store.containsRelationship(source, target);
  }

  public Map<String, Object> getRelationship(Object source, Object target) {
    return getRelationship(source, target, null);
  }

  public Map<String, Object> getRelationship(Object source, Object target, List<String> fields) {
    return view(store.requireRelationship(source, target), fields);
  }

  /**
   * Relationships of {@code type} (any type when null) that satisfy {@code condition}, projected
   * to {@code fields}.
   */
  public List<Map<String, Object>> findRelationships(
      String type, Condition condition, List<String> fields) {
    List<Map<String, Object>> result = new ArrayList<>();
    for (Relationship rel : store.relationships()) {
      if (type != null && !type.equals(rel.type())) continue;
      ObjectNode view = rel.toView();
      if (ConditionEvaluator.evaluate(view, condition)) {
        result.add(JacksonUtility.toMap(Projector.project(view, fields)));
      }
    }
    return result;
  }

  public List<Map<String, Object>> findRelationships(String type, Map<String, ?> condition) {
    return findRelationships(type, Condition.fromMap(condition), null);
  }

  // --------------------------------------------------------------- topology

  /** Adjacent node ids: outgoing in a directed graph, all in an undirected one. */
  public List<Object> neighbors(Object id) {
    return neighbors(id, Direction.OUT);
  }

  /** Adjacent node ids in {@code direction}; the direction is ignored when undirected. */
  public List<Object> neighbors(Object id, Direction direction) {
    return store.neighbors(id, direction);
  }

  /** Count of all incident relationships. */
  public int degree(Object id) {
    return degree(id, Direction.ANY);
  }

  public int degree(Object id, Direction direction) {
    return store.degree(id, direction);
  }

  // ---------------------------------------------------------------- matching

  /** Matched paths as node sequences, each node projected to the query's node fields. */
  public List<List<Map<String, Object>>> matchPath(PathQuery query) {
    List<List<Map<String, Object>>> result = new ArrayList<>();
    for (MatchedPath path : matcher.match(query)) {
      List<Map<String, Object>> nodes = new ArrayList<>(path.nodes().size());
      for (Node node : path.nodes()) nodes.add(view(node, query.nodeFields()));
      result.add(nodes);
    }
    return result;
  }

  /** Matched paths as node identifier sequences. */
  public List<List<Object>> matchPathIds(PathQuery query) {
    List<List<Object>> result = new ArrayList<>();
    for (MatchedPath path : matcher.match(query)) {
      List<Object> ids = new ArrayList<>(path.nodes().size());
      for (Node node : path.nodes()) ids.add(node.id());
      result.add(ids);
    }
    return result;
  }

  /** Matched paths as parallel node and relationship lists. */
  public List<GraphPath> matchFullPath(PathQuery query) {
    List<GraphPath> result = new ArrayList<>();
    for (MatchedPath path : matcher.match(query)) {
      List<Map<String, Object>> nodes = new ArrayList<>(path.nodes().size());
      for (Node node : path.nodes()) nodes.add(view(node, query.nodeFields()));
      List<Map<String, Object>> rels = new ArrayList<>(path.relationships().size());
      for (Relationship rel : path.relationships()) rels.add(view(rel, query.relationshipFields()));
      result.add(new GraphPath(nodes, rels));
    }
    return result;
  }

  /** Matched paths as one interleaved list each: node, relationship, node, ... */
  public List<List<Map<String, Object>>> matchStructuredPath(PathQuery query) {
    List<List<Map<String, Object>>> result = new ArrayList<>();
    for (MatchedPath path : matcher.match(query)) {
      List<Map<String, Object>> elements = new ArrayList<>(path.nodes().size() * 2 - 1);
      elements.add(view(path.nodes().get(0), query.nodeFields()));
      for (int i = 0; i < path.relationships().size(); i++) {
        elements.add(view(path.relationships().get(i), query.relationshipFields()));
        elements.add(view(path.nodes().get(i + 1), query.nodeFields()));
      }
      result.add(elements);
    }
    return result;
  }

  public List<List<Map<String, Object>>> matchPath(
      Condition start, List<PatternStep> pattern, Direction direction) {
    return matchPath(query(start, pattern, direction));
  }

  public List<List<Object>> matchPathIds(
      Condition start, List<PatternStep> pattern, Direction direction) {
    return matchPathIds(query(start, pattern, direction));
  }

  public List<GraphPath> matchFullPath(
      Condition start, List<PatternStep> pattern, Direction direction) {
    return matchFullPath(query(start, pattern, direction));
  }

  public List<List<Map<String, Object>>> matchStructuredPath(
      Condition start, List<PatternStep> pattern, Direction direction) {
    return matchStructuredPath(query(start, pattern, direction));
  }

  // ------------------------------------------------------------- persistence

  /** Rewrite the backing file now; nothing happens when memory-only. */
  public void save() {
    if (!storage.isPersistent()) {
      log.debug("Memory-only graph, nothing to save");
      return;
    }
    storage.save(store);
  }

  /** Write the graph to {@code target} without changing where later saves go. */
  public void saveTo(Path target) {
    new FileGraphStorage(target, options.prettyPrint(), options.atomicWrite()).save(store);
    log.info("Saved graph copy to {}", target);
  }

  /**
   * Replace the whole graph with the contents of {@code source}, then persist to the default
   * location.
   */
  public void load(Path source) {
    FileGraphStorage file =
        new FileGraphStorage(source, options.prettyPrint(), options.atomicWrite());
    EntityStore loaded =
        file.load(store.topology())
            .orElseThrow(
                () ->
                    new PersistenceException("Graph file not found: " + file.path())
                        .withContext("path", file.path().toString()));
    mutate(
        "load " + source,
        () -> {
          store.restoreFrom(loaded);
          return null;
        });
  }

  /** Remove every node and relationship. */
  public void clear() {
    mutate(
        "clear",
        () -> {
          store.clear();
          return null;
        });
  }

  @Override
  public void close() {
    storage.close();
  }

  // ----------------------------------------------------------------- helpers

  private <T> T mutate(String operation, Supplier<T> change) {
    EntityStore snapshot = storage.isPersistent() ? store.copy() : null;
    T result = change.get();
    persist(operation, snapshot);
    return result;
  }

  private boolean mutateIf(String operation, BooleanSupplier change) {
    EntityStore snapshot = storage.isPersistent() ? store.copy() : null;
    boolean changed = change.getAsBoolean();
    if (changed) {
      persist(operation, snapshot);
    }
    return changed;
  }

  private void persist(String operation, EntityStore snapshot) {
    try {
      storage.save(store);
    } catch (RuntimeException e) {
      if (snapshot != null) {
        store.restoreFrom(snapshot);
      }
      log.error(
          "{} could not be persisted, change rolled back: {}",
          operation,
          ExceptionUtil.rootCauseMessage(e));
      log.debug(
          "Persistence failure details: {} at {}",
          ExceptionUtil.toErrorDetails(e),
          ExceptionUtil.formatCompactStackTrace(e, 8));
      if (e instanceof GraphDbException) throw e;
      throw new PersistenceException(operation + " could not be persisted", e);
    }
    log.debug("{} applied", operation);
  }

  private static PathQuery query(
      Condition start, List<PatternStep> pattern, Direction direction) {
    return PathQuery.from(start).steps(pattern).direction(direction).build();
  }

  private static Map<String, Object> view(Node node, List<String> fields) {
    return JacksonUtility.toMap(Projector.project(node.toView(), fields));
  }

  private static Map<String, Object> view(Relationship rel, List<String> fields) {
    return JacksonUtility.toMap(Projector.project(rel.toView(), fields));
  }
}
