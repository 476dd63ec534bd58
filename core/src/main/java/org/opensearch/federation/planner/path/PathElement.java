/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.path;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One segment of a {@link ResponsePath}: an object key, the any-index marker {@code @} that fans
 * out over list elements, or a type condition {@code ... on T}.
 */
public abstract class PathElement {

  public static Key key(String name) {
    return new Key(name);
  }

  public static AnyIndex anyIndex() {
    return AnyIndex.INSTANCE;
  }

  public static TypeCondition typeCondition(String typeName) {
    return new TypeCondition(typeName);
  }

  /**
   * Parses the rendering produced by {@link #toString()}.
   *
   * @throws IllegalArgumentException if the text is empty
   */
  public static PathElement parse(String text) {
    if (text == null || text.isEmpty()) {
      throw new IllegalArgumentException("Empty path element");
    }
    if ("@".equals(text)) {
      return anyIndex();
    }
    if (text.startsWith(TypeCondition.PREFIX)) {
      return typeCondition(text.substring(TypeCondition.PREFIX.length()));
    }
    return key(text);
  }

  /** Descends into the named field of an object. */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static class Key extends PathElement {
    private final String name;

    private Key(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Fans out over every element of a list. */
  public static class AnyIndex extends PathElement {
    private static final AnyIndex INSTANCE = new AnyIndex();

    private AnyIndex() {}

    @Override
    public String toString() {
      return "@";
    }
  }

  /** Keeps only values whose runtime type is the given type or one of its subtypes. */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static class TypeCondition extends PathElement {
    private static final String PREFIX = "... on ";

    private final String typeName;

    private TypeCondition(String typeName) {
      this.typeName = typeName;
    }

    @Override
    public String toString() {
      return PREFIX + typeName;
    }
  }
}
