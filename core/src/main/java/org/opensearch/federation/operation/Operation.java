/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A single executable operation. Normalized operations contain no fragment spreads. */
@Getter
@ToString
@EqualsAndHashCode
public class Operation {

  private final OperationType operationType;

  /** Operation name, or null for anonymous operations. */
  private final String name;

  private final List<VariableDefinition> variableDefinitions;

  private final SelectionSet selectionSet;

  public Operation(
      OperationType operationType,
      String name,
      List<VariableDefinition> variableDefinitions,
      SelectionSet selectionSet) {
    this.operationType = operationType;
    this.name = name;
    this.variableDefinitions = ImmutableList.copyOf(variableDefinitions);
    this.selectionSet = selectionSet;
  }

  public Optional<VariableDefinition> variable(String variableName) {
    return variableDefinitions.stream().filter(v -> v.getName().equals(variableName)).findFirst();
  }
}
