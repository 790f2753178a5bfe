package com.gentoro.graphdb.query;

import com.gentoro.graphdb.store.Node;
import com.gentoro.graphdb.store.Relationship;
import java.util.ArrayList;
import java.util.List;

/** A path found by the {@link PathMatcher}, still referencing store records. */
public record MatchedPath(List<Node> nodes, List<Relationship> relationships) {

  public MatchedPath {
    nodes = List.copyOf(nodes);
    relationships = List.copyOf(relationships);
  }

  static MatchedPath startingAt(Node node) {
    return new MatchedPath(List.of(node), List.of());
  }

  public Node tail() {
    return nodes.get(nodes.size() - 1);
  }

  MatchedPath extend(Relationship relationship, Node next) {
    List<Node> extendedNodes = new ArrayList<>(nodes.size() + 1);
    extendedNodes.addAll(nodes);
    extendedNodes.add(next);
    List<Relationship> extendedRels = new ArrayList<>(relationships.size() + 1);
    extendedRels.addAll(relationships);
    extendedRels.add(relationship);
    return new MatchedPath(extendedNodes, extendedRels);
  }
}
