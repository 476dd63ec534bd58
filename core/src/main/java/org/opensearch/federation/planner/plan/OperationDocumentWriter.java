/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.opensearch.federation.operation.OperationType;
import org.opensearch.federation.operation.SelectionSet;
import org.opensearch.federation.operation.VariableDefinition;

/** Renders the operation documents sent to services. */
public final class OperationDocumentWriter {

  public static final String REPRESENTATIONS = "representations";

  private static final VariableDefinition REPRESENTATIONS_DEFINITION =
      new VariableDefinition(REPRESENTATIONS, "[_Any!]!", null);

  private OperationDocumentWriter() {}

  /**
   * Renders a root fetch, e.g. {@code { me { id } }} or {@code query Me__accounts__0($v: ID) { ...
   * }}. The shorthand form is used for anonymous queries without variables.
   */
  public static String rootOperation(
      OperationType type,
      String operationName,
      List<VariableDefinition> variables,
      SelectionSet selectionSet) {
    if (type == OperationType.QUERY && operationName == null && variables.isEmpty()) {
      return selectionSet.toString();
    }
    return header(type, operationName, variables) + " " + selectionSet;
  }

  /**
   * Renders an entity fetch: {@code query($representations: [_Any!]!) { _entities(representations:
   * $representations) { ... on T { ... } } }}.
   */
  public static String entityOperation(
      String operationName, List<VariableDefinition> variables, SelectionSet entitySelection) {
    List<VariableDefinition> definitions = new ArrayList<>(List.of(REPRESENTATIONS_DEFINITION));
    definitions.addAll(variables);
    return header(OperationType.QUERY, operationName, definitions)
        + " { _entities(representations: $"
        + REPRESENTATIONS
        + ") "
        + entitySelection
        + " }";
  }

  private static String header(
      OperationType type, String operationName, List<VariableDefinition> variables) {
    StringBuilder out = new StringBuilder(type.getKeyword());
    if (operationName != null) {
      out.append(' ').append(operationName);
    }
    if (!variables.isEmpty()) {
      out.append(
          variables.stream()
              .map(VariableDefinition::toDocumentString)
              .collect(Collectors.joining(", ", "(", ")")));
    }
    return out.toString();
  }
}
