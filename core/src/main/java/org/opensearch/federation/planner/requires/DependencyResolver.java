/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.requires;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.exception.RequirementCycleException;
import org.opensearch.federation.exception.UnreachableRequirementException;
import org.opensearch.federation.operation.Field;
import org.opensearch.federation.operation.InlineFragment;
import org.opensearch.federation.operation.Selection;
import org.opensearch.federation.operation.SelectionSet;
import org.opensearch.federation.planner.path.PathElement;
import org.opensearch.federation.planner.path.ResponsePath;
import org.opensearch.federation.schema.FieldDefinition;
import org.opensearch.federation.schema.FieldOwnership;
import org.opensearch.federation.schema.GraphModel;
import org.opensearch.federation.schema.TypeReference;

/**
 * Computes the transitive {@code @requires} closure of a field.
 *
 * <p>Each required field is attributed to its true owner: the requiring service when it resolves
 * the field itself, otherwise the first service in declaration order that resolves it. The owner's
 * own requirements for that field are expanded in turn. The walk uses an explicit stack; a field
 * that reappears while its own requirements are being expanded is a cycle.
 *
 * <p>One resolver serves one planning call and memoises the closures it computes. It is not
 * thread safe.
 */
@Log4j2
@RequiredArgsConstructor
public class DependencyResolver {

  private final GraphModel graphModel;

  private final Map<String, DependencyClosure> closures = new HashMap<>();

  /**
   * Returns the dependency closure of {@code typeName.fieldName} as resolved by {@code service}.
   *
   * @throws RequirementCycleException if the closure references the field itself
   * @throws UnreachableRequirementException if a required field has no resolving service
   */
  public DependencyClosure resolve(String typeName, String fieldName, String service) {
    String cacheKey = typeName + "." + fieldName + "@" + service;
    DependencyClosure closure = closures.get(cacheKey);
    if (closure == null) {
      closure = compute(typeName, fieldName, service);
      closures.put(cacheKey, closure);
      log.debug("Resolved requirements of {}: {}", cacheKey, closure.getEntries());
    }
    return closure;
  }

  private DependencyClosure compute(String typeName, String fieldName, String service) {
    Optional<FieldOwnership> ownership = graphModel.ownership(typeName, fieldName, service);
    if (ownership.isEmpty() || !ownership.get().hasRequires()) {
      return DependencyClosure.empty(typeName, fieldName, service);
    }
    Walk walk = new Walk(typeName + "." + fieldName);
    walk.stack.push(
        new SelectionFrame(
            ResponsePath.ROOT,
            typeName,
            service,
            ownership.get().getRequires(),
            null,
            null,
            true,
            false,
            walk.direct));
    walk.run();
    return new DependencyClosure(typeName, fieldName, service, walk.ordered, walk.direct);
  }

  private String ownerOf(String requester, String typeName, String fieldName) {
    if (FieldDefinition.TYPENAME.getName().equals(fieldName)
        || graphModel.canResolve(requester, typeName, fieldName)) {
      return requester;
    }
    List<FieldOwnership> resolvers = graphModel.resolvers(typeName, fieldName);
    if (resolvers.isEmpty()) {
      throw new UnreachableRequirementException(typeName, fieldName, "no service resolves it");
    }
    return resolvers.get(0).getService();
  }

  /** State of one closure computation. */
  private class Walk {
    private final Deque<Frame> stack = new ArrayDeque<>();
    private final Deque<String> active = new ArrayDeque<>();
    private final Map<String, RequiredField> byKey = new LinkedHashMap<>();
    private final List<RequiredField> ordered = new ArrayList<>();
    private final List<RequiredField> direct = new ArrayList<>();

    Walk(String anchorCoordinate) {
      active.addLast(anchorCoordinate);
    }

    void run() {
      while (!stack.isEmpty()) {
        Frame top = stack.peek();
        if (top instanceof SelectionFrame) {
          SelectionFrame frame = (SelectionFrame) top;
          if (!frame.selections.hasNext()) {
            stack.pop();
          } else {
            visit(frame, frame.selections.next());
          }
        } else {
          EntryFrame frame = (EntryFrame) top;
          if (!frame.expanded) {
            expand(frame);
          } else {
            stack.pop();
            emit(frame);
          }
        }
      }
    }

    private void visit(SelectionFrame frame, Selection selection) {
      if (selection instanceof InlineFragment) {
        InlineFragment fragment = (InlineFragment) selection;
        String condition =
            fragment.getTypeCondition() != null ? fragment.getTypeCondition() : frame.parentType;
        ResponsePath prefix =
            condition.equals(frame.parentType)
                ? frame.prefix
                : frame.prefix.append(PathElement.typeCondition(condition));
        stack.push(frame.narrow(prefix, condition, fragment.getSelectionSet()));
        return;
      }
      if (!(selection instanceof Field)) {
        return;
      }
      Field field = (Field) selection;
      RequiredField existing = byKey.get(key(frame.prefix, frame.parentType, field.getName()));
      if (existing != null) {
        if (frame.direct) {
          existing.markDirect();
        }
        frame.attach(existing);
        if (!field.isLeaf()) {
          pushChildren(existing, field, frame.requester, frame.direct);
        }
        return;
      }
      String owner = ownerOf(frame.requester, frame.parentType, field.getName());
      boolean inaccessible =
          graphModel
              .field(frame.parentType, field.getName())
              .map(FieldDefinition::isInaccessible)
              .orElse(false);
      RequiredField entry =
          new RequiredField(
              frame.prefix,
              frame.parentType,
              field.getName(),
              owner,
              !owner.equals(frame.requester),
              frame.direct,
              inaccessible,
              frame.parent);
      frame.attach(entry);
      stack.push(new EntryFrame(entry, field, frame.requester, frame.direct));
    }

    private void expand(EntryFrame frame) {
      frame.expanded = true;
      RequiredField entry = frame.entry;
      Optional<FieldOwnership> ownership =
          graphModel.ownership(entry.getParentType(), entry.getFieldName(), entry.getService());
      if (ownership.isEmpty() || !ownership.get().hasRequires()) {
        return;
      }
      String coordinate = entry.coordinate();
      if (active.contains(coordinate)) {
        List<String> cycle = new ArrayList<>();
        boolean onCycle = false;
        for (String activeCoordinate : active) {
          onCycle |= activeCoordinate.equals(coordinate);
          if (onCycle) {
            cycle.add(activeCoordinate);
          }
        }
        cycle.add(coordinate);
        throw new RequirementCycleException(cycle);
      }
      active.addLast(coordinate);
      frame.activated = true;
      stack.push(
          new SelectionFrame(
              entry.getPrefix(),
              entry.getParentType(),
              entry.getService(),
              ownership.get().getRequires(),
              entry,
              entry.getParent(),
              false,
              false,
              null));
    }

    private void emit(EntryFrame frame) {
      if (frame.activated) {
        active.removeLast();
      }
      RequiredField entry = frame.entry;
      String key = key(entry.getPrefix(), entry.getParentType(), entry.getFieldName());
      RequiredField canonical = byKey.putIfAbsent(key, entry);
      if (canonical == null) {
        ordered.add(entry);
        canonical = entry;
      }
      if (!frame.field.isLeaf()) {
        pushChildren(canonical, frame.field, frame.requester, frame.direct);
      }
    }

    private void pushChildren(RequiredField entry, Field field, String requester, boolean direct) {
      TypeReference type =
          graphModel
              .field(entry.getParentType(), entry.getFieldName())
              .map(FieldDefinition::getType)
              .orElseThrow(
                  () ->
                      new UnreachableRequirementException(
                          entry.getParentType(), entry.getFieldName(), "field is not defined"));
      stack.push(
          new SelectionFrame(
              entry.getPrefix().appendField(entry.getFieldName(), type.getListDepth()),
              type.getNamedType(),
              requester,
              field.getSelectionSet(),
              null,
              entry,
              direct,
              true,
              null));
    }

    private String key(ResponsePath prefix, String parentType, String fieldName) {
      return prefix + "|" + parentType + "." + fieldName;
    }
  }

  private abstract static class Frame {}

  /** Iterates one requirement selection set. */
  private static class SelectionFrame extends Frame {
    private final ResponsePath prefix;
    private final String parentType;
    private final String requester;
    private final Iterator<Selection> selections;
    private final RequiredField requiredBy;
    private final RequiredField parent;
    private final boolean direct;
    private final boolean nested;
    private final List<RequiredField> anchorRequirements;

    SelectionFrame(
        ResponsePath prefix,
        String parentType,
        String requester,
        SelectionSet selectionSet,
        RequiredField requiredBy,
        RequiredField parent,
        boolean direct,
        boolean nested,
        List<RequiredField> anchorRequirements) {
      this.prefix = prefix;
      this.parentType = parentType;
      this.requester = requester;
      this.selections = selectionSet.getSelections().iterator();
      this.requiredBy = requiredBy;
      this.parent = parent;
      this.direct = direct;
      this.nested = nested;
      this.anchorRequirements = anchorRequirements;
    }

    SelectionFrame narrow(ResponsePath newPrefix, String typeName, SelectionSet selectionSet) {
      return new SelectionFrame(
          newPrefix,
          typeName,
          requester,
          selectionSet,
          requiredBy,
          parent,
          direct,
          nested,
          anchorRequirements);
    }

    void attach(RequiredField entry) {
      if (nested) {
        parent.addChild(entry);
      } else if (requiredBy != null) {
        requiredBy.addRequirement(entry);
      } else if (!anchorRequirements.contains(entry)) {
        anchorRequirements.add(entry);
      }
    }
  }

  /** Expands the requirements of one entry, then emits it. */
  private static class EntryFrame extends Frame {
    private final RequiredField entry;
    private final Field field;
    private final String requester;
    private final boolean direct;
    private boolean expanded;
    private boolean activated;

    EntryFrame(RequiredField entry, Field field, String requester, boolean direct) {
      this.entry = entry;
      this.field = field;
      this.requester = requester;
      this.direct = direct;
    }
  }
}
