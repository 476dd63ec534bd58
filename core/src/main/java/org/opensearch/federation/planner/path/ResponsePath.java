/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.path;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Immutable address of a position in a response, relative to the response root. */
@Getter
@EqualsAndHashCode
public class ResponsePath {

  public static final ResponsePath ROOT = new ResponsePath(List.of());

  private final List<PathElement> elements;

  public ResponsePath(List<PathElement> elements) {
    this.elements = ImmutableList.copyOf(elements);
  }

  /** Builds a path from element renderings, e.g. {@code ("t", "@", "... on Book")}. */
  public static ResponsePath of(String... elements) {
    ImmutableList.Builder<PathElement> builder = ImmutableList.builder();
    for (String element : elements) {
      builder.add(PathElement.parse(element));
    }
    return new ResponsePath(builder.build());
  }

  public ResponsePath append(PathElement element) {
    return new ResponsePath(
        ImmutableList.<PathElement>builder().addAll(elements).add(element).build());
  }

  public ResponsePath append(ResponsePath suffix) {
    return new ResponsePath(
        ImmutableList.<PathElement>builder().addAll(elements).addAll(suffix.elements).build());
  }

  /** Appends a field key followed by one {@code @} per list wrapper of the field's type. */
  public ResponsePath appendField(String responseKey, int listDepth) {
    ImmutableList.Builder<PathElement> builder =
        ImmutableList.<PathElement>builder().addAll(elements).add(PathElement.key(responseKey));
    for (int i = 0; i < listDepth; i++) {
      builder.add(PathElement.anyIndex());
    }
    return new ResponsePath(builder.build());
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public int size() {
    return elements.size();
  }

  public boolean startsWith(ResponsePath prefix) {
    return prefix.size() <= size() && elements.subList(0, prefix.size()).equals(prefix.elements);
  }

  /**
   * Returns the remainder of this path after {@code prefix}.
   *
   * @throws IllegalArgumentException if this path does not start with {@code prefix}
   */
  public ResponsePath relativeTo(ResponsePath prefix) {
    if (!startsWith(prefix)) {
      throw new IllegalArgumentException(this + " does not start with " + prefix);
    }
    return new ResponsePath(elements.subList(prefix.size(), size()));
  }

  /** Element renderings, as used in serialized plans. */
  public List<String> toStringList() {
    return elements.stream().map(PathElement::toString).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return String.join(".", toStringList());
  }
}
