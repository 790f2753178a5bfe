package com.gentoro.graphdb;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphdb.exception.NotFoundException;
import com.gentoro.graphdb.exception.PersistenceException;
import com.gentoro.graphdb.exception.ReferenceException;
import com.gentoro.graphdb.exception.ValidationException;
import com.gentoro.graphdb.model.Direction;
import com.gentoro.graphdb.model.GraphPath;
import com.gentoro.graphdb.query.Condition;
import com.gentoro.graphdb.query.LogicMode;
import com.gentoro.graphdb.query.PathQuery;
import com.gentoro.graphdb.query.PatternStep;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphDatabaseTest {

  @TempDir Path tmp;

  GraphDatabase db;

  @BeforeEach
  void setUp() {
    db = GraphDatabase.inMemory(true);
    db.addNode("A", List.of("Person"), Map.of("name", "Alice", "age", 30));
    db.addNode("B", List.of("Person"), Map.of("name", "Bob", "age", 25));
    db.addRelationship("A", "B", "FRIEND_OF", Map.of("since", 2010));
  }

  private static PathQuery aliceToBob() {
    return PathQuery.fromMap(
        Map.of(
            "start", Map.of("name", "Alice"),
            "pattern", List.of(Map.of("rel_type", "FRIEND_OF", "node", Map.of("name", "Bob")))));
  }

  @Test
  @DisplayName("findNodes with or-logic returns only the nodes matching some predicate")
  void findNodesOr() {
    Map<String, Object> condition = new LinkedHashMap<>();
    condition.put("_logic", "or");
    condition.put("name", "Alice");
    condition.put("age", Map.of("gt", 35));

    List<Map<String, Object>> found = db.findNodes("Person", condition);
    assertEquals(1, found.size());
    assertEquals("A", found.get(0).get("id"));
    assertEquals(List.of("Person"), found.get(0).get("labels"));
    assertEquals(30L, found.get(0).get("age"));
  }

  @Test
  @DisplayName("findNodes filters by label and projects fields")
  void findNodesProjection() {
    db.addNode("C", List.of("City"), Map.of("name", "Paris"));
    assertEquals(3, db.findNodes(null, Condition.always(), null).size());
    assertEquals(2, db.findNodes("Person", Map.of()).size());
    assertTrue(db.findNodes("Robot", Map.of()).isEmpty());

    List<Map<String, Object>> names =
        db.findNodes("Person", Condition.builder().gte("age", 25).build(), List.of("name"));
    assertEquals(Set.of(Map.of("name", "Alice"), Map.of("name", "Bob")), new HashSet<>(names));

    List<Map<String, Object>> notAlice =
        db.findNodes(
            "Person",
            Condition.builder(LogicMode.NOT).eq("name", "Alice").eq("age", 30).build(),
            List.of("id"));
    assertEquals(List.of(Map.of("id", "B")), notAlice);
  }

  @Test
  @DisplayName("matchFullPath returns the Alice to Bob path with its relationship")
  void matchFullPath() {
    List<GraphPath> paths = db.matchFullPath(aliceToBob());
    assertEquals(1, paths.size());
    GraphPath path = paths.get(0);
    assertEquals(1, path.length());
    assertEquals("A", path.nodes().get(0).get("id"));
    assertEquals("B", path.nodes().get(1).get("id"));
    Map<String, Object> rel = path.relationships().get(0);
    assertEquals("A", rel.get("source"));
    assertEquals("B", rel.get("target"));
    assertEquals("FRIEND_OF", rel.get("type"));
    assertEquals(2010L, rel.get("since"));
  }

  @Test
  @DisplayName("The other path shapes: node lists, id lists and interleaved lists")
  void pathShapes() {
    assertEquals(List.of(List.of("A", "B")), db.matchPathIds(aliceToBob()));
    assertEquals(
        List.of(List.of("B", "A")),
        db.matchPathIds(Condition.eq("name", "Bob"), List.of(PatternStep.to(null)), Direction.IN));

    List<List<Map<String, Object>>> nodes =
        db.matchPath(
            PathQuery.from(Condition.eq("name", "Alice"))
                .step(PatternStep.to(null))
                .nodeFields(List.of("name"))
                .build());
    assertEquals(List.of(List.of(Map.of("name", "Alice"), Map.of("name", "Bob"))), nodes);

    List<List<Map<String, Object>>> structured =
        db.matchStructuredPath(
            PathQuery.from(Condition.eq("name", "Alice"))
                .step(PatternStep.to(null))
                .nodeFields(List.of("id"))
                .relationshipFields(List.of("type"))
                .build());
    assertEquals(
        List.of(List.of(Map.of("id", "A"), Map.of("type", "FRIEND_OF"), Map.of("id", "B"))),
        structured);
  }

  @Test
  @DisplayName("add overwrites, set merges, update requires existence")
  void writeFamilies() {
    db.setNode("A", List.of("Employee"), Map.of("team", "core"));
    Map<String, Object> merged = db.getNode("A");
    assertEquals(List.of("Person", "Employee"), merged.get("labels"));
    assertEquals("Alice", merged.get("name"));
    assertEquals("core", merged.get("team"));

    db.updateNode("A", Map.of("age", 31));
    assertEquals(31L, db.getNode("A").get("age"));
    assertThrows(NotFoundException.class, () -> db.updateNode("Z", Map.of("x", 1)));

    db.addNode("A", Map.of("fresh", true));
    Map<String, Object> replaced = db.getNode("A");
    assertEquals(List.of(), replaced.get("labels"));
    assertFalse(replaced.containsKey("name"));
    assertTrue(db.hasRelationship("A", "B"), "overwriting a node keeps its relationships");

    db.setRelationship("A", "B", null, Map.of("weight", 2));
    Map<String, Object> rel = db.getRelationship("A", "B");
    assertEquals("FRIEND_OF", rel.get("type"));
    assertEquals(2010L, rel.get("since"));
    assertEquals(2L, rel.get("weight"));

    db.updateRelationship("A", "B", Map.of("since", 2011));
    assertEquals(2011L, db.getRelationship("A", "B").get("since"));
    assertThrows(NotFoundException.class, () -> db.updateRelationship("B", "A", Map.of()));

    db.addRelationship("A", "B", "KNOWS");
    assertEquals(
        Map.of("source", "A", "target", "B", "type", "KNOWS"), db.getRelationship("A", "B"));
  }

  @Test
  @DisplayName("Labels and attributes can be added and removed individually")
  void labelsAndAttributes() {
    assertTrue(db.addLabels("A", "Admin", "Person"));
    assertFalse(db.addLabels("A", "Admin"));
    assertTrue(db.removeLabels("A", "Admin"));
    assertFalse(db.removeLabels("A", "Admin"));

    assertTrue(db.removeNodeAttributes("A", "age"));
    assertFalse(db.removeNodeAttributes("A", "age"));
    assertEquals(Map.of("id", "A", "labels", List.of("Person"), "name", "Alice"), db.getNode("A"));

    assertTrue(db.removeRelationshipAttributes("A", "B", "since"));
    assertFalse(db.getRelationship("A", "B").containsKey("since"));
    assertThrows(NotFoundException.class, () -> db.addLabels("Z", "X"));
    assertThrows(NotFoundException.class, () -> db.removeRelationshipAttributes("B", "A", "x"));
  }

  @Test
  @DisplayName("Error taxonomy: missing endpoints, missing entities, invalid input")
  void errors() {
    assertThrows(ReferenceException.class, () -> db.addRelationship("A", "Z", "R"));
    assertThrows(NotFoundException.class, () -> db.getNode("Z"));
    assertThrows(NotFoundException.class, () -> db.getRelationship("B", "A"));
    assertThrows(ValidationException.class, () -> db.addNode("C", Map.of("id", "X")));
    assertThrows(
        ValidationException.class, () -> db.findNodes(null, Map.of("age", Map.of("like", 3))));
    assertFalse(db.hasNode("C"));
  }

  @Test
  @DisplayName("removeNode cascades and removals of absent entities are no-ops")
  void removal() {
    assertTrue(db.removeNode("A"));
    assertFalse(db.removeNode("A"));
    assertEquals(0, db.relationshipCount());
    assertFalse(db.removeRelationship("A", "B"));
    assertEquals(1, db.nodeCount());
  }

  @Test
  @DisplayName("Results are detached from the store")
  void detachedResults() {
    Map<String, Object> node = db.getNode("A");
    node.put("name", "Mallory");
    assertEquals("Alice", db.getNode("A").get("name"));
  }

  @Test
  @DisplayName("neighbors defaults to outgoing; degree defaults to all directions")
  void topology() {
    assertEquals(List.of("B"), db.neighbors("A"));
    assertEquals(List.of(), db.neighbors("B"));
    assertEquals(List.of("A"), db.neighbors("B", Direction.IN));
    assertEquals(1, db.degree("B"));
    assertEquals(0, db.degree("B", Direction.OUT));
    assertTrue(db.isDirected());

    GraphDatabase undirected = GraphDatabase.inMemory(false);
    undirected.addNode(1, Map.of());
    undirected.addNode(2, Map.of());
    undirected.addRelationship(2, 1, null);
    assertEquals(List.of(2L), undirected.neighbors(1));
    assertTrue(undirected.hasRelationship(1, 2));
    assertNull(undirected.getRelationship(1, 2).get("type"));
  }

  @Test
  @DisplayName("findRelationships filters by type and condition")
  void findRelationships() {
    db.addNode("C", List.of(), Map.of());
    db.addRelationship("B", "C", "KNOWS", Map.of("since", 2020));
    assertEquals(2, db.findRelationships(null, Map.of()).size());
    assertEquals(1, db.findRelationships("KNOWS", Map.of()).size());
    assertEquals(
        List.of(Map.of("source", "A")),
        db.findRelationships(
            null, Condition.builder().lt("since", 2015).build(), List.of("source")));
  }

  @Test
  @DisplayName("A file-backed database persists every change and reloads it")
  void fileRoundTrip() {
    Path file = tmp.resolve("graph.json");
    try (GraphDatabase first = GraphDatabase.open(file, true)) {
      first.addNode(1, List.of("Person"), Map.of("name", "Alice", "tags", List.of("x")));
      first.addNode(2, List.of("Person"), Map.of("name", "Bob", "address", Map.of("city", "Rome")));
      first.addRelationship(1, 2, "FRIEND_OF", Map.of("since", 2010));
      assertTrue(Files.exists(file));
      assertFalse(first.isMemoryOnly());
    }

    try (GraphDatabase second = GraphDatabase.open(file, true)) {
      assertEquals(2, second.nodeCount());
      assertEquals(1, second.relationshipCount());
      assertEquals(
          Map.of(
              "id", 2L,
              "labels", List.of("Person"),
              "name", "Bob",
              "address", Map.of("city", "Rome")),
          second.getNode(2));
      assertEquals("FRIEND_OF", second.getRelationship(1, 2).get("type"));
      assertEquals(List.of("x"), second.getNode(1).get("tags"));
      assertEquals(1, second.findNodes(null, Map.of("address.city", "Rome")).size());
    }
  }

  @Test
  @DisplayName("Repeating an add with identical data leaves the graph unchanged")
  void addIsIdempotent() {
    Map<String, Object> attrs = Map.of("name", "Carol", "scores", List.of(1, 2));
    db.addNode("C", List.of("Person"), attrs);
    db.addRelationship("B", "C", "FRIEND_OF", Map.of("since", 2020));
    Map<String, Object> node = db.getNode("C");
    Map<String, Object> rel = db.getRelationship("B", "C");
    Set<Map<String, Object>> nodes = new HashSet<>(db.findNodes(Condition.always()));
    Set<Map<String, Object>> rels = new HashSet<>(db.findRelationships(null, Map.of()));

    db.addNode("C", List.of("Person"), attrs);
    db.addRelationship("B", "C", "FRIEND_OF", Map.of("since", 2020));

    assertEquals(node, db.getNode("C"));
    assertEquals(rel, db.getRelationship("B", "C"));
    assertEquals(3, db.nodeCount());
    assertEquals(2, db.relationshipCount());
    assertEquals(nodes, new HashSet<>(db.findNodes(Condition.always())));
    assertEquals(rels, new HashSet<>(db.findRelationships(null, Map.of())));
  }

  @Test
  @DisplayName("Reopening a saved file yields the same node and relationship views")
  void reloadPreservesViews() {
    for (boolean directed : new boolean[] {true, false}) {
      Path file = tmp.resolve("views-" + directed + ".json");
      Set<Map<String, Object>> nodes;
      Set<Map<String, Object>> rels;
      try (GraphDatabase first = GraphDatabase.open(file, directed)) {
        first.addNode(1, List.of("Person"), Map.of("name", "Alice", "age", 30, "height", 1.7));
        first.addNode("1", List.of("Tag", "Label"), Map.of("tags", List.of("x", "y")));
        first.addNode(2.5, List.of(), Map.of("address", Map.of("city", "Rome", "zip", 100)));
        first.addRelationship(1, "1", "TAGGED", Map.of("weight", 0.5));
        first.addRelationship("1", 2.5, null, Map.of());
        first.addRelationship(2.5, 2.5, "SELF", Map.of("note", "loop"));
        first.addNode(1, List.of("Person"), Map.of("name", "Alice", "age", 30, "height", 1.7));
        nodes = new HashSet<>(first.findNodes(Condition.always()));
        rels = new HashSet<>(first.findRelationships(null, Map.of()));
        assertEquals(3, nodes.size());
        assertEquals(3, rels.size());
      }

      try (GraphDatabase second = GraphDatabase.open(file, directed)) {
        String mode = directed ? "directed" : "undirected";
        assertEquals(nodes, new HashSet<>(second.findNodes(Condition.always())), mode);
        assertEquals(rels, new HashSet<>(second.findRelationships(null, Map.of())), mode);
        assertNull(second.getRelationship("1", 2.5).get("type"));
      }
    }
  }

  @Test
  @DisplayName("saveTo writes a copy; load replaces the graph")
  void saveToAndLoad() {
    Path copy = tmp.resolve("copy.json");
    db.saveTo(copy);
    assertTrue(Files.exists(copy));

    db.clear();
    assertEquals(0, db.nodeCount());

    db.load(copy);
    assertEquals(2, db.nodeCount());
    assertEquals(1, db.relationshipCount());
    assertEquals("Alice", db.getNode("A").get("name"));

    assertThrows(PersistenceException.class, () -> db.load(tmp.resolve("absent.json")));
    assertEquals(2, db.nodeCount());
    db.save();
  }

  @Test
  @DisplayName("Configuration selects topology and storage")
  void fromConfiguration() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("graph.directed", true);
    config.addProperty("graph.path", tmp.resolve("configured.json").toString());
    try (GraphDatabase configured = GraphDatabase.open(config)) {
      assertTrue(configured.isDirected());
      assertFalse(configured.isMemoryOnly());
      configured.addNode("n", Map.of());
    }
    assertTrue(Files.exists(tmp.resolve("configured.json")));
  }
}
