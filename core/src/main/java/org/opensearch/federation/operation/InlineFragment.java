/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** An inline fragment, {@code ... on Type { ... }}. */
@Getter
@EqualsAndHashCode(callSuper = false)
public class InlineFragment extends Selection {

  /** Type condition, or null when the fragment does not narrow the type. */
  private final String typeCondition;

  private final List<String> directives;

  private final SelectionSet selectionSet;

  public InlineFragment(String typeCondition, List<String> directives, SelectionSet selectionSet) {
    this.typeCondition = typeCondition;
    this.directives = ImmutableList.copyOf(directives);
    this.selectionSet = selectionSet;
  }

  public InlineFragment(String typeCondition, SelectionSet selectionSet) {
    this(typeCondition, List.of(), selectionSet);
  }

  @Override
  void print(StringBuilder out) {
    out.append("...");
    if (typeCondition != null) {
      out.append(" on ").append(typeCondition);
    }
    for (String directive : directives) {
      out.append(' ').append(directive);
    }
    out.append(' ');
    selectionSet.print(out);
  }
}
