/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.opensearch.federation.exception.InvalidOperationException;

/** A parsed executable document: operations plus named fragments. */
@Getter
public class Document {

  private final List<Operation> operations;

  private final Map<String, FragmentDefinition> fragments;

  public Document(List<Operation> operations, Map<String, FragmentDefinition> fragments) {
    this.operations = ImmutableList.copyOf(operations);
    this.fragments = ImmutableMap.copyOf(fragments);
  }

  /**
   * Selects the operation to execute.
   *
   * @param operationName requested operation, or null when the document has a single operation
   * @return the selected operation
   * @throws InvalidOperationException if the operation cannot be selected unambiguously
   */
  public Operation operation(String operationName) {
    if (operationName == null) {
      if (operations.size() != 1) {
        throw new InvalidOperationException(
            "Operation name is required when the document contains "
                + operations.size()
                + " operations");
      }
      return operations.get(0);
    }
    return operations.stream()
        .filter(operation -> operationName.equals(operation.getName()))
        .findFirst()
        .orElseThrow(
            () -> new InvalidOperationException("Unknown operation named " + operationName));
  }
}
