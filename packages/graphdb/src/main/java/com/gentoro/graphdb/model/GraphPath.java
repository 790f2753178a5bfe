package com.gentoro.graphdb.model;

import java.util.List;
import java.util.Map;

/**
 * A matched path rendered as parallel node and relationship lists: {@code nodes.size() ==
 * relationships.size() + 1}, relationship {@code i} joins nodes {@code i} and {@code i + 1}.
 */
public record GraphPath(List<Map<String, Object>> nodes, List<Map<String, Object>> relationships) {

  public GraphPath {
    nodes = List.copyOf(nodes);
    relationships = List.copyOf(relationships);
  }

  /** Number of hops. */
  public int length() {
    return relationships.size();
  }
}
