/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.operation.Field;
import org.opensearch.federation.operation.InlineFragment;
import org.opensearch.federation.operation.Operation;
import org.opensearch.federation.operation.OperationType;
import org.opensearch.federation.operation.Selection;
import org.opensearch.federation.operation.SelectionSet;
import org.opensearch.federation.operation.VariableDefinition;
import org.opensearch.federation.planner.fetch.FetchGroup;
import org.opensearch.federation.planner.fetch.GroupSelection;
import org.opensearch.federation.planner.path.PathElement;
import org.opensearch.federation.planner.schedule.ScheduledNode;
import org.opensearch.federation.planner.schedule.ScheduledNodeVisitor;
import org.opensearch.federation.schema.FieldDefinition;

/**
 * Lowers scheduled fetch groups into plan nodes. Sequence and parallel steps map one to one; each
 * group becomes a {@link FetchNode}, wrapped in a {@link FlattenNode} at the group's path when it
 * fetches entities.
 *
 * <p>Within one selection level (sibling type conditions included), a response key already taken
 * by a field with another name, other arguments or another declared type is replaced by {@code
 * <key>__alias_<n>}, and a {@link FetchDataRewrite.KeyRenamer} restores the requested key.
 */
@Log4j2
public class PlanEmitter implements ScheduledNodeVisitor<PlanNode, Object> {

  private static final String ALIAS_SEPARATOR = "__alias_";

  private final Operation operation;

  private final boolean operationNames;

  /**
   * @param operation normalized client operation the groups were built from
   * @param operationNames whether to name subgraph operations after a named client operation
   */
  public PlanEmitter(Operation operation, boolean operationNames) {
    this.operation = operation;
    this.operationNames = operationNames;
  }

  public PlanNode emit(ScheduledNode scheduled) {
    return scheduled.accept(this, null);
  }

  @Override
  public PlanNode visitGroup(ScheduledNode.GroupStep node, Object context) {
    FetchGroup group = node.getGroup();
    FetchNode fetch = fetch(group);
    return group.isEntity() ? new FlattenNode(group.getPath(), fetch) : fetch;
  }

  @Override
  public PlanNode visitSequence(ScheduledNode.SequenceStep node, Object context) {
    return new SequenceNode(
        node.getNodes().stream()
            .map(child -> child.accept(this, context))
            .collect(Collectors.toList()));
  }

  @Override
  public PlanNode visitParallel(ScheduledNode.ParallelStep node, Object context) {
    return new ParallelNode(
        node.getNodes().stream()
            .map(child -> child.accept(this, context))
            .collect(Collectors.toList()));
  }

  /** Emits the fetch of one group. */
  public FetchNode fetch(FetchGroup group) {
    Aliasing aliasing = new Aliasing();
    List<String> path = new ArrayList<>();
    if (group.isEntity()) {
      path.add(PathElement.typeCondition(group.getParentType()).toString());
    }
    SelectionSet selectionSet = aliasing.rewrite(group.getSelection(), path);

    Set<String> usages = new LinkedHashSet<>();
    collectVariables(selectionSet, usages);
    List<VariableDefinition> definitions =
        usages.stream()
            .map(operation::variable)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    String operationName = operationName(group);

    String document;
    String requires = null;
    OperationType operationKind;
    if (group.isEntity()) {
      operationKind = OperationType.QUERY;
      document =
          OperationDocumentWriter.entityOperation(
              operationName,
              definitions,
              new SelectionSet(
                  null, List.of(new InlineFragment(group.getParentType(), selectionSet))));
      requires = group.getInputs().toSelectionSet().toFieldSetString();
    } else {
      operationKind = operation.getOperationType();
      document =
          OperationDocumentWriter.rootOperation(
              operationKind, operationName, definitions, selectionSet);
    }
    log.debug("Emitted fetch {} to {}: {}", group.getId(), group.getService(), document);
    return new FetchNode(
        group.getService(),
        group.getId(),
        operationKind,
        operationName,
        new ArrayList<>(usages),
        document,
        requires,
        group.getInputRewrites(),
        aliasing.rewrites);
  }

  private String operationName(FetchGroup group) {
    if (!operationNames || operation.getName() == null) {
      return null;
    }
    return operation.getName()
        + "__"
        + group.getService().replaceAll("[^_0-9A-Za-z]", "_")
        + "__"
        + group.getId();
  }

  private static void collectVariables(SelectionSet selectionSet, Set<String> usages) {
    for (Selection selection : selectionSet.getSelections()) {
      if (selection instanceof Field) {
        Field field = (Field) selection;
        usages.addAll(field.getVariableUsages());
        if (!field.isLeaf()) {
          collectVariables(field.getSelectionSet(), usages);
        }
      } else if (selection instanceof InlineFragment) {
        collectVariables(((InlineFragment) selection).getSelectionSet(), usages);
      }
    }
  }

  /** Renders a group selection, aliasing conflicting response keys. One instance per fetch. */
  private static class Aliasing {
    private final List<FetchDataRewrite> rewrites = new ArrayList<>();
    private int counter;

    SelectionSet rewrite(GroupSelection selection, List<String> path) {
      return new SelectionSet(
          selection.getParentType(), level(selection, path, new HashMap<>()));
    }

    /**
     * @param scope response key to the identity of the field that claimed it at this level
     */
    private List<Selection> level(
        GroupSelection selection, List<String> path, Map<String, String> scope) {
      List<Selection> selections = new ArrayList<>();
      for (GroupSelection.Item item : selection.getItems()) {
        if (item.isFragment()) {
          String condition = item.getTypeCondition();
          List<String> fragmentPath =
              append(path, PathElement.typeCondition(condition).toString());
          List<Selection> nested = level(item.getSelection(), fragmentPath, scope);
          if (!nested.isEmpty()) {
            selections.add(new InlineFragment(condition, new SelectionSet(condition, nested)));
          }
          continue;
        }
        Field field = item.getField();
        String key = field.getResponseKey();
        String identity = field.signature() + ":" + item.getDeclaredType();
        String claimed = scope.putIfAbsent(key, identity);
        String emittedKey = key;
        if (claimed != null && !claimed.equals(identity)) {
          emittedKey = key + ALIAS_SEPARATOR + counter++;
          field = field.withAlias(emittedKey);
          log.debug("Aliased {} as {} at {}", key, emittedKey, path);
        }
        if (item.getSelection() != null) {
          List<Selection> children =
              level(item.getSelection(), append(path, emittedKey), new HashMap<>());
          if (children.isEmpty()) {
            children = List.of(Field.of(FieldDefinition.TYPENAME.getName(), null));
          }
          String childType = item.getSelection().getParentType();
          field = field.withSelectionSet(new SelectionSet(childType, children));
        }
        if (!emittedKey.equals(key)) {
          rewrites.add(new FetchDataRewrite.KeyRenamer(append(path, emittedKey), key));
        }
        selections.add(field);
      }
      return selections;
    }

    private static List<String> append(List<String> path, String element) {
      List<String> result = new ArrayList<>(path);
      result.add(element);
      return result;
    }
  }
}
