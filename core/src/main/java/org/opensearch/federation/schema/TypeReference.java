/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A possibly wrapped type reference such as {@code [Product!]!}. */
@Getter
@EqualsAndHashCode
public class TypeReference {

  private final String text;

  /** The innermost named type. */
  private final String namedType;

  /** Number of list wrappers around the named type. */
  private final int listDepth;

  private TypeReference(String text, String namedType, int listDepth) {
    this.text = text;
    this.namedType = namedType;
    this.listDepth = listDepth;
  }

  /**
   * Parses a reference as written in a schema.
   *
   * @param text reference text, e.g. {@code [String]!}
   * @return the parsed reference
   * @throws IllegalArgumentException if the brackets are unbalanced or the name is missing
   */
  public static TypeReference parse(String text) {
    String trimmed = text.replace(" ", "");
    int depth = 0;
    int start = 0;
    int end = trimmed.length();
    while (start < end && trimmed.charAt(start) == '[') {
      depth++;
      start++;
    }
    int closing = 0;
    while (end > start && (trimmed.charAt(end - 1) == ']' || trimmed.charAt(end - 1) == '!')) {
      if (trimmed.charAt(end - 1) == ']') {
        closing++;
      }
      end--;
    }
    if (closing != depth || start == end) {
      throw new IllegalArgumentException("Malformed type reference: " + text);
    }
    return new TypeReference(trimmed, trimmed.substring(start, end), depth);
  }

  public boolean isList() {
    return listDepth > 0;
  }

  @Override
  public String toString() {
    return text;
  }
}
