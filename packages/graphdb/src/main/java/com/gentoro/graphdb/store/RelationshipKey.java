package com.gentoro.graphdb.store;

import java.util.Objects;

/**
 * Identity of a relationship: the ordered endpoint pair in a directed graph, the unordered pair in
 * an undirected one.
 */
public final class RelationshipKey {
  private final Object first;
  private final Object second;
  private final boolean ordered;

  private RelationshipKey(Object first, Object second, boolean ordered) {
    this.first = Objects.requireNonNull(first, "first");
    this.second = Objects.requireNonNull(second, "second");
    this.ordered = ordered;
  }

  public static RelationshipKey ordered(Object source, Object target) {
    return new RelationshipKey(source, target, true);
  }

  public static RelationshipKey unordered(Object a, Object b) {
    return new RelationshipKey(a, b, false);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RelationshipKey other)) return false;
    if (ordered != other.ordered) return false;
    if (first.equals(other.first) && second.equals(other.second)) return true;
    return !ordered && first.equals(other.second) && second.equals(other.first);
  }

  @Override
  public int hashCode() {
    if (ordered) return Objects.hash(first, second, true);
    // symmetric for the unordered form
    return first.hashCode() + second.hashCode();
  }

  @Override
  public String toString() {
    return first + (ordered ? "->" : "--") + second;
  }
}
