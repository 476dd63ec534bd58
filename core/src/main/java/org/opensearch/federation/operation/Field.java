/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A field selection, optionally aliased, with literal argument values and directives. */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Field extends Selection {

  /** Alias, or null when the field is not aliased. */
  private final String alias;

  private final String name;

  /** Argument name to literal value text, in document order. */
  private final Map<String, String> arguments;

  /** Directive applications as literal text, e.g. {@code @include(if: )}. */
  private final List<String> directives;

  /** Variables referenced by the arguments and directives of this field (not its children). */
  private final Set<String> variableUsages;

  /** Sub-selection, or null for leaf fields. */
  private final SelectionSet selectionSet;

  public Field(
      String alias,
      String name,
      Map<String, String> arguments,
      List<String> directives,
      Set<String> variableUsages,
      SelectionSet selectionSet) {
    this.alias = Strings.emptyToNull(alias);
    this.name = name;
    this.arguments = ImmutableMap.copyOf(arguments);
    this.directives = ImmutableList.copyOf(directives);
    this.variableUsages = ImmutableSet.copyOf(variableUsages);
    this.selectionSet = selectionSet;
  }

  /** Creates an unaliased field without arguments. */
  public static Field of(String name, SelectionSet selectionSet) {
    return new Field(null, name, Map.of(), List.of(), Set.of(), selectionSet);
  }

  /** Key under which this field appears in a response. */
  public String getResponseKey() {
    return alias != null ? alias : name;
  }

  public boolean isLeaf() {
    return selectionSet == null;
  }

  /** Returns a copy of this field with a different sub-selection. */
  public Field withSelectionSet(SelectionSet newSelectionSet) {
    return new Field(alias, name, arguments, directives, variableUsages, newSelectionSet);
  }

  /** Returns a copy of this field under a different response key. */
  public Field withAlias(String newAlias) {
    return new Field(newAlias, name, arguments, directives, variableUsages, selectionSet);
  }

  /**
   * Text identifying what this field fetches, ignoring alias and sub-selection. Two fields with
   * the same response key and different signatures cannot share one response slot.
   */
  public String signature() {
    StringBuilder out = new StringBuilder(name);
    printArguments(out);
    return out.toString();
  }

  @Override
  void print(StringBuilder out) {
    if (alias != null) {
      out.append(alias).append(": ");
    }
    out.append(name);
    printArguments(out);
    for (String directive : directives) {
      out.append(' ').append(directive);
    }
    if (selectionSet != null) {
      out.append(' ');
      selectionSet.print(out);
    }
  }

  private void printArguments(StringBuilder out) {
    if (arguments.isEmpty()) {
      return;
    }
    out.append('(');
    boolean first = true;
    for (Map.Entry<String, String> argument : arguments.entrySet()) {
      if (!first) {
        out.append(", ");
      }
      out.append(argument.getKey()).append(": ").append(argument.getValue());
      first = false;
    }
    out.append(')');
  }
}
