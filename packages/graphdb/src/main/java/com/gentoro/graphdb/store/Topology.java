package com.gentoro.graphdb.store;

import com.gentoro.graphdb.model.Direction;

/**
 * Direction policy of a graph, chosen once at construction.
 *
 * <p>The entity store consults it to key relationships and to decide which incident relationships
 * a neighbor, degree or traversal request actually sees.
 */
public interface Topology {

  boolean isDirected();

  /** Identity under which a relationship between {@code source} and {@code target} is stored. */
  RelationshipKey keyOf(Object source, Object target);

  /** The direction really followed when {@code requested} is asked for. */
  Direction effective(Direction requested);

  static Topology of(boolean directed) {
    return directed ? Directed.INSTANCE : Undirected.INSTANCE;
  }

  /** {@code (a, b)} and {@code (b, a)} are distinct; directions are honored as requested. */
  final class Directed implements Topology {
    static final Directed INSTANCE = new Directed();

    private Directed() {}

    @Override
    public boolean isDirected() {
      return true;
    }

    @Override
    public RelationshipKey keyOf(Object source, Object target) {
      return RelationshipKey.ordered(source, target);
    }

    @Override
    public Direction effective(Direction requested) {
      return requested;
    }

    @Override
    public String toString() {
      return "directed";
    }
  }

  /** {@code (a, b)} and {@code (b, a)} are the same relationship; every request sees both ends. */
  final class Undirected implements Topology {
    static final Undirected INSTANCE = new Undirected();

    private Undirected() {}

    @Override
    public boolean isDirected() {
      return false;
    }

    @Override
    public RelationshipKey keyOf(Object source, Object target) {
      return RelationshipKey.unordered(source, target);
    }

    @Override
    public Direction effective(Direction requested) {
      return Direction.ANY;
    }

    @Override
    public String toString() {
      return "undirected";
    }
  }
}
