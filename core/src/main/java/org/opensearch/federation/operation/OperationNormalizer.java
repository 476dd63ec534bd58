/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.exception.InvalidOperationException;
import org.opensearch.federation.schema.FieldDefinition;
import org.opensearch.federation.schema.GraphModel;
import org.opensearch.federation.schema.TypeDefinition;

/**
 * Expands fragments of an operation against the unified schema.
 *
 * <p>The normalized operation has a parent type on every selection set, contains no fragment
 * spreads, and keeps inline fragments only where they narrow an abstract type to a more specific
 * type. Fragments that can never match are dropped. {@code @skip}/{@code @include} on a removed
 * fragment are pushed down onto the fields it contained.
 */
@Log4j2
@RequiredArgsConstructor
public class OperationNormalizer {

  private static final Pattern VARIABLE = Pattern.compile("\\$([_A-Za-z][_0-9A-Za-z]*)");

  private final GraphModel graphModel;

  private final int maxDepth;

  public OperationNormalizer(GraphModel graphModel) {
    this(graphModel, OperationParser.DEFAULT_MAX_DEPTH);
  }

  /**
   * Normalizes one operation of a parsed document.
   *
   * @param document parsed document
   * @param operationName operation to normalize, or null for single-operation documents
   * @return the normalized operation
   * @throws InvalidOperationException if the operation does not validate against the schema
   */
  public Operation normalize(Document document, String operationName) {
    Operation operation = document.operation(operationName);
    String rootType =
        graphModel
            .rootType(operation.getOperationType())
            .orElseThrow(
                () ->
                    new InvalidOperationException(
                        "Schema does not support " + operation.getOperationType().getKeyword()));
    Context context = new Context(document.getFragments(), operation);
    SelectionSet selectionSet =
        normalizeSelectionSet(operation.getSelectionSet(), rootType, List.of(), context, 1);
    log.debug("Normalized operation {}: {}", operation.getName(), selectionSet);
    return new Operation(
        operation.getOperationType(),
        operation.getName(),
        operation.getVariableDefinitions(),
        selectionSet);
  }

  private SelectionSet normalizeSelectionSet(
      SelectionSet selectionSet,
      String parentType,
      List<String> inheritedDirectives,
      Context context,
      int depth) {
    if (depth > maxDepth) {
      throw new InvalidOperationException(
          "Selection nesting exceeds the maximum depth of " + maxDepth);
    }
    List<Selection> normalized = new ArrayList<>();
    appendSelections(selectionSet, parentType, inheritedDirectives, context, depth, normalized);
    return new SelectionSet(parentType, normalized);
  }

  private void appendSelections(
      SelectionSet selectionSet,
      String parentType,
      List<String> inheritedDirectives,
      Context context,
      int depth,
      List<Selection> out) {
    for (Selection selection : selectionSet.getSelections()) {
      if (selection instanceof Field) {
        out.add(normalizeField((Field) selection, parentType, inheritedDirectives, context, depth));
      } else if (selection instanceof InlineFragment) {
        InlineFragment fragment = (InlineFragment) selection;
        appendFragment(
            fragment.getTypeCondition(),
            fragment.getSelectionSet(),
            concat(inheritedDirectives, fragment.getDirectives()),
            parentType,
            context,
            depth,
            out);
      } else if (selection instanceof FragmentSpread) {
        String name = ((FragmentSpread) selection).getFragmentName();
        FragmentDefinition definition = context.fragments.get(name);
        if (definition == null) {
          throw new InvalidOperationException("Unknown fragment " + name);
        }
        if (context.activeFragments.contains(name)) {
          throw new InvalidOperationException("Fragment " + name + " spreads itself");
        }
        context.activeFragments.push(name);
        appendFragment(
            definition.getTypeCondition(),
            definition.getSelectionSet(),
            inheritedDirectives,
            parentType,
            context,
            depth,
            out);
        context.activeFragments.pop();
      }
    }
  }

  private void appendFragment(
      String typeCondition,
      SelectionSet selectionSet,
      List<String> directives,
      String parentType,
      Context context,
      int depth,
      List<Selection> out) {
    if (typeCondition == null
        || typeCondition.equals(parentType)
        || graphModel.isSubtype(typeCondition, parentType)) {
      appendSelections(selectionSet, parentType, directives, context, depth, out);
      return;
    }
    TypeDefinition condition =
        graphModel
            .findType(typeCondition)
            .orElseThrow(() -> new InvalidOperationException("Unknown type " + typeCondition));
    if (!condition.getKind().isComposite()) {
      throw new InvalidOperationException("Cannot narrow to non-composite type " + typeCondition);
    }
    boolean overlaps =
        graphModel.possibleRuntimeTypes(typeCondition).stream()
            .anyMatch(runtimeType -> graphModel.isSubtype(parentType, runtimeType));
    if (!overlaps) {
      log.debug("Dropping fragment on {} that never applies to {}", typeCondition, parentType);
      return;
    }
    out.add(
        new InlineFragment(
            typeCondition,
            normalizeSelectionSet(selectionSet, typeCondition, directives, context, depth + 1)));
  }

  private Field normalizeField(
      Field field,
      String parentType,
      List<String> inheritedDirectives,
      Context context,
      int depth) {
    FieldDefinition definition =
        graphModel
            .field(parentType, field.getName())
            .orElseThrow(
                () ->
                    new InvalidOperationException(
                        "Cannot query field " + field.getName() + " on type " + parentType));
    if (definition.isInaccessible()) {
      throw new InvalidOperationException(
          "Cannot query field " + field.getName() + " on type " + parentType);
    }
    List<String> directives = concat(inheritedDirectives, field.getDirectives());
    Set<String> variables = new LinkedHashSet<>(field.getVariableUsages());
    for (String directive : inheritedDirectives) {
      Matcher matcher = VARIABLE.matcher(directive);
      while (matcher.find()) {
        variables.add(matcher.group(1));
      }
    }
    for (String variable : variables) {
      if (context.operation.variable(variable).isEmpty()) {
        throw new InvalidOperationException("Variable $" + variable + " is not defined");
      }
    }
    String fieldType = definition.getType().getNamedType();
    boolean composite = graphModel.type(fieldType).getKind().isComposite();
    if (composite && field.isLeaf()) {
      throw new InvalidOperationException(
          "Field " + parentType + "." + field.getName() + " of type " + fieldType
              + " must have a selection of subfields");
    }
    if (!composite && !field.isLeaf()) {
      throw new InvalidOperationException(
          "Field " + parentType + "." + field.getName() + " must not have a selection");
    }
    SelectionSet children =
        composite
            ? normalizeSelectionSet(
                field.getSelectionSet(), fieldType, List.of(), context, depth + 1)
            : null;
    return new Field(
        field.getAlias(),
        field.getName(),
        field.getArguments(),
        directives,
        variables,
        children);
  }

  private static List<String> concat(List<String> first, List<String> second) {
    if (first.isEmpty()) {
      return second;
    }
    List<String> result = new ArrayList<>(first);
    for (String directive : second) {
      if (!result.contains(directive)) {
        result.add(directive);
      }
    }
    return result;
  }

  private static class Context {
    private final Map<String, FragmentDefinition> fragments;
    private final Operation operation;
    private final Deque<String> activeFragments = new ArrayDeque<>();

    Context(Map<String, FragmentDefinition> fragments, Operation operation) {
      this.fragments = fragments;
      this.operation = operation;
    }
  }
}
