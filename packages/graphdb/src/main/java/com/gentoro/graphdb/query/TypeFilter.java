package com.gentoro.graphdb.query;

import java.util.Objects;

/**
 * Relationship-type restriction of a pattern step.
 *
 * <ul>
 *   <li>{@link #any()}: no restriction; typed and untyped relationships both pass.
 *   <li>{@link #untyped()}: only relationships without a type.
 *   <li>{@link #of(String)}: only relationships of exactly that type.
 * </ul>
 */
public final class TypeFilter {
  private enum Kind {
    ANY,
    UNTYPED,
    TYPED
  }

  private static final TypeFilter ANY = new TypeFilter(Kind.ANY, null);
  private static final TypeFilter UNTYPED = new TypeFilter(Kind.UNTYPED, null);

  private final Kind kind;
  private final String type;

  private TypeFilter(Kind kind, String type) {
    this.kind = kind;
    this.type = type;
  }

  public static TypeFilter any() {
    return ANY;
  }

  public static TypeFilter untyped() {
    return UNTYPED;
  }

  /** Exactly {@code type}; a null type means {@link #untyped()}. */
  public static TypeFilter of(String type) {
    return type == null ? UNTYPED : new TypeFilter(Kind.TYPED, type);
  }

  public boolean matches(String relationshipType) {
    return switch (kind) {
      case ANY -> true;
      case UNTYPED -> relationshipType == null;
      case TYPED -> type.equals(relationshipType);
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TypeFilter other)) return false;
    return kind == other.kind && Objects.equals(type, other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, type);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case ANY -> "*";
      case UNTYPED -> "<untyped>";
      case TYPED -> type;
    };
  }
}
