/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * An ordered list of selections. After normalization {@code parentType} names the type the
 * selections apply to; parsed field sets and raw documents leave it null.
 */
@Getter
@EqualsAndHashCode
public class SelectionSet {

  private final String parentType;

  private final List<Selection> selections;

  public SelectionSet(String parentType, List<? extends Selection> selections) {
    this.parentType = parentType;
    this.selections = ImmutableList.copyOf(selections);
  }

  public static SelectionSet empty(String parentType) {
    return new SelectionSet(parentType, List.of());
  }

  public boolean isEmpty() {
    return selections.isEmpty();
  }

  /** Returns the field selections directly in this set, ignoring fragments. */
  public List<Field> fields() {
    return selections.stream()
        .filter(selection -> selection instanceof Field)
        .map(selection -> (Field) selection)
        .collect(Collectors.toList());
  }

  /** Renders the selections without the enclosing braces, as used for field sets. */
  public String toFieldSetString() {
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < selections.size(); i++) {
      if (i > 0) {
        out.append(' ');
      }
      selections.get(i).print(out);
    }
    return out.toString();
  }

  void print(StringBuilder out) {
    out.append("{ ").append(toFieldSetString()).append(" }");
  }

  @Override
  public String toString() {
    StringBuilder out = new StringBuilder();
    print(out);
    return out.toString();
  }
}
