/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.fetch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.exception.AmbiguousOwnershipException;
import org.opensearch.federation.exception.InternalPlanningException;
import org.opensearch.federation.exception.UnreachableRequirementException;
import org.opensearch.federation.operation.Field;
import org.opensearch.federation.operation.InlineFragment;
import org.opensearch.federation.operation.Operation;
import org.opensearch.federation.operation.OperationType;
import org.opensearch.federation.operation.Selection;
import org.opensearch.federation.operation.SelectionSet;
import org.opensearch.federation.planner.path.PathElement;
import org.opensearch.federation.planner.path.ResponsePath;
import org.opensearch.federation.planner.plan.FetchDataRewrite;
import org.opensearch.federation.planner.requires.DependencyClosure;
import org.opensearch.federation.planner.requires.DependencyResolver;
import org.opensearch.federation.planner.requires.RequiredField;
import org.opensearch.federation.schema.EntityKey;
import org.opensearch.federation.schema.FieldDefinition;
import org.opensearch.federation.schema.FieldOwnership;
import org.opensearch.federation.schema.GraphModel;
import org.opensearch.federation.schema.TypeReference;

/**
 * Partitions a normalized operation into fetch groups.
 *
 * <p>The selection tree is walked depth first from an explicit work deque. A field joins the
 * current group when the group's service resolves it without requirements (directly or through
 * {@code @provides}). Otherwise the field moves to an entity group of an owning service at the
 * same response path; the current group then selects {@code __typename} and the chosen key so the
 * entity can be represented. A field with {@code @requires} first has its requirement closure
 * placed the same way, and its group runs after every group producing a required field.
 *
 * <p>Owner choice: the current service, then a service that already has a joinable group at the
 * path, then the first resolving service in declaration order that has a resolvable key. Key
 * choice: a key already selected by the current group, then one the current service resolves,
 * then the first declared one.
 */
@Log4j2
@RequiredArgsConstructor
public class FetchGroupBuilder {

  private static final Field TYPENAME = Field.of(FieldDefinition.TYPENAME.getName(), null);

  private final GraphModel graphModel;

  private final DependencyResolver dependencyResolver;

  private int nextId;

  /**
   * Builds the fetch group graphs of an operation. Queries produce a single graph. Mutation root
   * fields must run in order, so every run of consecutive root fields handled by the same service
   * produces its own graph, and the graphs run one after the other.
   *
   * @param operation normalized operation
   * @return graphs in execution order; empty when nothing needs to be fetched
   */
  public List<FetchGroupGraph> build(Operation operation) {
    String rootType = operation.getSelectionSet().getParentType();
    List<FetchGroupGraph> graphs = new ArrayList<>();
    if (operation.getOperationType() != OperationType.MUTATION) {
      Pass pass = new Pass(rootType);
      for (Field field : rootFields(operation.getSelectionSet())) {
        pass.addRootField(field, rootService(rootType, field, pass.rootGroups.keySet()));
      }
      if (!pass.graph.isEmpty()) {
        graphs.add(pass.finish());
      }
      return graphs;
    }
    Pass pass = null;
    String service = null;
    for (Field field : rootFields(operation.getSelectionSet())) {
      String owner =
          rootService(rootType, field, service != null ? Set.of(service) : Set.of());
      if (pass == null || !owner.equals(service)) {
        if (pass != null) {
          graphs.add(pass.finish());
        }
        pass = new Pass(rootType);
        service = owner;
      }
      pass.addRootField(field, owner);
    }
    if (pass != null) {
      graphs.add(pass.finish());
    }
    return graphs;
  }

  private List<Field> rootFields(SelectionSet selectionSet) {
    List<Field> fields = new ArrayList<>();
    for (Selection selection : selectionSet.getSelections()) {
      if (!(selection instanceof Field)) {
        throw new InternalPlanningException(
            "Root selection set was not normalized: " + selectionSet);
      }
      Field field = (Field) selection;
      // __typename of the root type is answered by the executor.
      if (!FieldDefinition.TYPENAME.getName().equals(field.getName())) {
        fields.add(field);
      }
    }
    return fields;
  }

  private String rootService(String rootType, Field field, Set<String> preferred) {
    List<FieldOwnership> resolvers = graphModel.resolvers(rootType, field.getName());
    if (resolvers.isEmpty()) {
      throw new UnreachableRequirementException(
          rootType, field.getName(), "no service resolves it");
    }
    return resolvers.stream()
        .map(FieldOwnership::getService)
        .filter(preferred::contains)
        .findFirst()
        .orElse(resolvers.get(0).getService());
  }

  private boolean isLocal(
      String service, String typeName, String fieldName, SelectionSet provided) {
    if (FieldDefinition.TYPENAME.getName().equals(fieldName)) {
      return true;
    }
    if (provided != null
        && provided.fields().stream().anyMatch(field -> field.getName().equals(fieldName))) {
      return true;
    }
    return graphModel
        .ownership(typeName, fieldName, service)
        .map(ownership -> !ownership.isExternal() && !ownership.hasRequires())
        .orElse(false);
  }

  /** Fields a service provides inside the sub-selection of one of its fields. */
  private SelectionSet providedChild(
      String service, String typeName, String fieldName, SelectionSet provided) {
    Optional<FieldOwnership> ownership = graphModel.ownership(typeName, fieldName, service);
    if (ownership.isPresent() && ownership.get().hasProvides()) {
      return ownership.get().getProvides();
    }
    if (provided != null) {
      for (Field field : provided.fields()) {
        if (field.getName().equals(fieldName)) {
          return field.getSelectionSet();
        }
      }
    }
    return null;
  }

  private static SelectionSet narrowProvided(SelectionSet provided, String typeName) {
    if (provided == null) {
      return null;
    }
    List<Selection> selections = new ArrayList<>();
    for (Selection selection : provided.getSelections()) {
      if (selection instanceof Field) {
        selections.add(selection);
      } else if (selection instanceof InlineFragment) {
        InlineFragment fragment = (InlineFragment) selection;
        if (fragment.getTypeCondition() == null
            || fragment.getTypeCondition().equals(typeName)) {
          selections.addAll(fragment.getSelectionSet().getSelections());
        }
      }
    }
    return new SelectionSet(typeName, selections);
  }

  /** Groups and indexes built for one graph. */
  private class Pass {
    private final FetchGroupGraph graph = new FetchGroupGraph();
    private final String rootType;
    private final Map<String, FetchGroup> rootGroups = new LinkedHashMap<>();
    private final Map<String, List<FetchGroup>> entityGroups = new HashMap<>();

    /** Producer of every argument-free, unaliased field, keyed by parent path and field name. */
    private final Map<String, Cursor> available = new HashMap<>();

    private final Deque<WorkItem> work = new ArrayDeque<>();

    Pass(String rootType) {
      this.rootType = rootType;
    }

    void addRootField(Field field, String service) {
      FetchGroup group = rootGroups.get(service);
      if (group == null) {
        group = FetchGroup.root(nextId++, service, rootType);
        graph.addGroup(group);
        rootGroups.put(service, group);
        log.debug("Created {}", group);
      }
      Cursor cursor = new Cursor(group, ResponsePath.ROOT, rootType, group.getSelection(), null);
      Cursor child = append(cursor, field);
      if (!field.isLeaf()) {
        run(new WorkItem(child, field.getSelectionSet()));
      }
    }

    FetchGroupGraph finish() {
      List<String> errors = graph.validate();
      if (!errors.isEmpty()) {
        throw new InternalPlanningException(
            "Invalid fetch group graph: " + String.join("; ", errors));
      }
      log.debug("Built {}", graph);
      return graph;
    }

    private void run(WorkItem start) {
      work.push(start);
      while (!work.isEmpty()) {
        WorkItem item = work.pop();
        List<WorkItem> children = new ArrayList<>();
        for (Selection selection : item.selectionSet.getSelections()) {
          if (selection instanceof Field) {
            Field field = (Field) selection;
            for (Cursor placed : place(item.cursor, field)) {
              if (!field.isLeaf()) {
                children.add(new WorkItem(placed, field.getSelectionSet()));
              }
            }
          } else if (selection instanceof InlineFragment) {
            InlineFragment fragment = (InlineFragment) selection;
            children.add(
                new WorkItem(
                    item.cursor.narrow(fragment.getTypeCondition()), fragment.getSelectionSet()));
          }
        }
        for (int i = children.size() - 1; i >= 0; i--) {
          work.push(children.get(i));
        }
      }
    }

    /** Places a field and returns the positions of its sub-selection, one per placement. */
    private List<Cursor> place(Cursor cursor, Field field) {
      if (isLocal(cursor, field.getName())) {
        return List.of(append(cursor, field));
      }
      if (graphModel.type(cursor.parentType).isAbstract()) {
        return placeOnAbstractType(cursor, field);
      }
      return List.of(placeOnObjectType(cursor, field));
    }

    private List<Cursor> placeOnAbstractType(Cursor cursor, Field field) {
      String typeName = cursor.parentType;
      for (FieldOwnership owner : graphModel.resolvers(typeName, field.getName())) {
        if (!graphModel.resolvableKeys(typeName, owner.getService()).isEmpty()) {
          FetchGroup group =
              entityGroup(cursor, owner.getService(), typeName, null, null, Set.of(), true);
          return List.of(append(entryCursor(group, cursor), field));
        }
      }
      List<String> runtimeTypes =
          graphModel.possibleRuntimeTypes(typeName, cursor.group.getService());
      if (runtimeTypes.isEmpty()) {
        throw new AmbiguousOwnershipException(
            String.format(
                "Cannot determine the service resolving %s.%s at [%s]: service %s exposes no"
                    + " implementation of %s",
                typeName, field.getName(), cursor.path, cursor.group.getService(), typeName));
      }
      log.debug("Dispatching {}.{} over {}", typeName, field.getName(), runtimeTypes);
      List<Cursor> placed = new ArrayList<>();
      for (String runtimeType : runtimeTypes) {
        placed.addAll(place(cursor.narrow(runtimeType), field));
      }
      return placed;
    }

    private Cursor placeOnObjectType(Cursor cursor, Field field) {
      String typeName = cursor.parentType;
      String owner = chooseOwner(cursor, field.getName());
      FieldOwnership ownership =
          graphModel
              .ownership(typeName, field.getName(), owner)
              .orElseThrow(
                  () ->
                      new InternalPlanningException(
                          "Service " + owner + " does not declare " + typeName + "." + field));
      SelectionSet requires = null;
      Set<FetchGroup> predecessors = new LinkedHashSet<>();
      if (ownership.hasRequires()) {
        DependencyClosure closure =
            dependencyResolver.resolve(typeName, field.getName(), owner);
        Map<RequiredField, List<Cursor>> placed = placeRequirements(cursor, closure);
        predecessors.addAll(producers(closure.getDirectRequirements(), placed));
        requires = ownership.getRequires();
      }
      FetchGroup group =
          entityGroup(cursor, owner, typeName, null, requires, predecessors, false);
      return append(entryCursor(group, cursor), field);
    }

    private String chooseOwner(Cursor cursor, String fieldName) {
      String typeName = cursor.parentType;
      List<FieldOwnership> resolvers = graphModel.resolvers(typeName, fieldName);
      if (resolvers.isEmpty()) {
        throw new UnreachableRequirementException(typeName, fieldName, "no service resolves it");
      }
      String current = cursor.group.getService();
      for (FieldOwnership resolver : resolvers) {
        if (resolver.getService().equals(current) && hasResolvableKey(typeName, current)) {
          return current;
        }
      }
      for (FieldOwnership resolver : resolvers) {
        boolean joinable =
            entityGroupsAt(resolver.getService(), cursor.path, typeName).stream()
                .anyMatch(group -> canJoin(group, Set.of(cursor.group)));
        if (joinable) {
          return resolver.getService();
        }
      }
      for (FieldOwnership resolver : resolvers) {
        if (hasResolvableKey(typeName, resolver.getService())) {
          return resolver.getService();
        }
      }
      throw new UnreachableRequirementException(
          typeName,
          fieldName,
          String.format(
              "none of %s declares a resolvable key for %s",
              resolvers.stream().map(FieldOwnership::getService).collect(Collectors.toList()),
              typeName));
    }

    /**
     * Places every entry of a requirement closure, in closure order, relative to the position of
     * the requiring field.
     */
    private Map<RequiredField, List<Cursor>> placeRequirements(
        Cursor cursor, DependencyClosure closure) {
      Map<RequiredField, List<Cursor>> placed = new HashMap<>();
      for (RequiredField entry : closure.getEntries()) {
        List<Cursor> bases;
        ResponsePath basePrefix;
        if (entry.getParent() == null) {
          bases = List.of(cursor);
          basePrefix = ResponsePath.ROOT;
        } else {
          RequiredField parent = entry.getParent();
          bases = placed.getOrDefault(parent, List.of());
          basePrefix =
              parent
                  .getPrefix()
                  .appendField(
                      parent.getFieldName(),
                      fieldType(parent.getParentType(), parent.getFieldName()).getListDepth());
        }
        List<Cursor> results = new ArrayList<>();
        for (Cursor base : bases) {
          Cursor at = base;
          for (PathElement element : entry.getPrefix().relativeTo(basePrefix).getElements()) {
            if (element instanceof PathElement.TypeCondition) {
              at = at.narrow(((PathElement.TypeCondition) element).getTypeName());
            }
          }
          results.addAll(placeRequirement(at, entry, placed));
        }
        placed.put(entry, results);
      }
      return placed;
    }

    private List<Cursor> placeRequirement(
        Cursor cursor, RequiredField entry, Map<RequiredField, List<Cursor>> placed) {
      Cursor existing = available.get(availabilityKey(cursor.path, entry.getFieldName()));
      if (existing != null) {
        return List.of(existing);
      }
      Field field = Field.of(entry.getFieldName(), null);
      if (entry.getRequirements().isEmpty()) {
        return place(cursor, field);
      }
      SelectionSet requires =
          graphModel
              .ownership(entry.getParentType(), entry.getFieldName(), entry.getService())
              .map(FieldOwnership::getRequires)
              .orElseThrow(
                  () ->
                      new InternalPlanningException(
                          "Requirement " + entry + " has no declaring service"));
      FetchGroup group =
          entityGroup(
              cursor,
              entry.getService(),
              entry.getParentType(),
              null,
              requires,
              producers(entry.getRequirements(), placed),
              false);
      return List.of(append(entryCursor(group, cursor), field));
    }

    /** Groups producing the given entries and everything nested in them. */
    private Set<FetchGroup> producers(
        List<RequiredField> entries, Map<RequiredField, List<Cursor>> placed) {
      Set<FetchGroup> groups = new LinkedHashSet<>();
      Deque<RequiredField> pending = new ArrayDeque<>(entries);
      while (!pending.isEmpty()) {
        RequiredField entry = pending.pop();
        for (Cursor cursor : placed.getOrDefault(entry, List.of())) {
          groups.add(cursor.group);
        }
        pending.addAll(entry.getChildren());
      }
      return groups;
    }

    /**
     * Returns an entity group of {@code service} for {@code typeName} at the cursor's path that
     * runs after the cursor's group and the given predecessors, reusing an existing group when
     * that creates no cycle.
     *
     * @param key key to use for a new group, or null to choose one
     * @param requires required fields to add to the representations, or null
     * @param interfaceObject the entity is looked up through its abstract type
     */
    private FetchGroup entityGroup(
        Cursor cursor,
        String service,
        String typeName,
        EntityKey key,
        SelectionSet requires,
        Set<FetchGroup> predecessors,
        boolean interfaceObject) {
      Set<FetchGroup> before = new LinkedHashSet<>();
      before.add(cursor.group);
      before.addAll(predecessors);
      for (FetchGroup candidate : entityGroupsAt(service, cursor.path, typeName)) {
        if (canJoin(candidate, before)) {
          if (requires != null) {
            candidate.getInputs().addFragment(typeName).addFieldSet(requires, graphModel);
          }
          before.forEach(group -> graph.addDependency(group, candidate));
          return candidate;
        }
      }

      EntityKey chosen = key != null ? key : chooseKey(cursor, service, typeName);
      before.addAll(addKeyFields(cursor, chosen));
      FetchGroup group = FetchGroup.entity(nextId++, service, typeName, cursor.path);
      graph.addGroup(group);
      if (interfaceObject) {
        for (String runtimeType :
            graphModel.possibleRuntimeTypes(typeName, cursor.group.getService())) {
          GroupSelection input = group.getInputs().addFragment(runtimeType);
          addTypename(input);
          input.addFieldSet(chosen.getFieldSet(), graphModel);
          group.addInputRewrite(
              new FetchDataRewrite.ValueSetter(
                  List.of(
                      PathElement.typeCondition(runtimeType).toString(),
                      FieldDefinition.TYPENAME.getName()),
                  typeName));
        }
      } else {
        GroupSelection input = group.getInputs().addFragment(typeName);
        addTypename(input);
        input.addFieldSet(chosen.getFieldSet(), graphModel);
        if (requires != null) {
          input.addFieldSet(requires, graphModel);
        }
      }
      before.forEach(predecessor -> graph.addDependency(predecessor, group));
      entityGroups
          .computeIfAbsent(groupKey(service, cursor.path, typeName), k -> new ArrayList<>())
          .add(group);
      log.debug(
          "Created {} for {} keyed by {} after {}",
          group,
          typeName,
          chosen.getFieldSet().toFieldSetString(),
          before.stream().map(FetchGroup::getId).collect(Collectors.toList()));
      return group;
    }

    private EntityKey chooseKey(Cursor cursor, String service, String typeName) {
      List<EntityKey> keys = graphModel.resolvableKeys(typeName, service);
      if (keys.isEmpty()) {
        throw new UnreachableRequirementException(
            typeName,
            FieldDefinition.TYPENAME.getName(),
            "service " + service + " declares no resolvable key for " + typeName);
      }
      for (EntityKey key : keys) {
        if (cursor.node.containsFieldSet(key.getFieldSet())) {
          return key;
        }
      }
      for (EntityKey key : keys) {
        if (resolvesLocally(cursor, key.getFieldSet())) {
          return key;
        }
      }
      return keys.get(0);
    }

    /**
     * Selects {@code __typename} and the key fields at the cursor. Key fields the cursor's service
     * cannot resolve are taken from an existing producer or fetched through another service.
     *
     * @return groups other than the cursor's group that produce key fields
     */
    private Set<FetchGroup> addKeyFields(Cursor cursor, EntityKey key) {
      Set<FetchGroup> producers = new LinkedHashSet<>();
      append(cursor, TYPENAME);
      Deque<WorkItem> pending = new ArrayDeque<>();
      pending.push(new WorkItem(cursor, key.getFieldSet()));
      while (!pending.isEmpty()) {
        WorkItem item = pending.pop();
        for (Selection selection : item.selectionSet.getSelections()) {
          if (selection instanceof InlineFragment) {
            InlineFragment fragment = (InlineFragment) selection;
            pending.push(
                new WorkItem(
                    item.cursor.narrow(fragment.getTypeCondition()), fragment.getSelectionSet()));
          } else if (selection instanceof Field) {
            Field field = (Field) selection;
            Cursor produced = provideKeyField(item.cursor, field, producers);
            if (!field.isLeaf()) {
              pending.push(new WorkItem(produced, field.getSelectionSet()));
            }
          }
        }
      }
      producers.remove(cursor.group);
      return producers;
    }

    private Cursor provideKeyField(Cursor cursor, Field field, Set<FetchGroup> producers) {
      if (isLocal(cursor, field.getName())) {
        return append(cursor, field);
      }
      Cursor existing = available.get(availabilityKey(cursor.path, field.getName()));
      if (existing != null) {
        producers.add(existing.group);
        return existing;
      }
      for (FieldOwnership resolver : graphModel.resolvers(cursor.parentType, field.getName())) {
        if (resolver.getService().equals(cursor.group.getService())) {
          continue;
        }
        for (EntityKey key :
            graphModel.resolvableKeys(cursor.parentType, resolver.getService())) {
          if (resolvesLocally(cursor, key.getFieldSet())) {
            FetchGroup group =
                entityGroup(
                    cursor,
                    resolver.getService(),
                    cursor.parentType,
                    key,
                    null,
                    Set.of(),
                    false);
            producers.add(group);
            return append(entryCursor(group, cursor), field);
          }
        }
      }
      throw new UnreachableRequirementException(
          cursor.parentType,
          field.getName(),
          String.format(
              "no key of %s leads from service %s to a service resolving it",
              cursor.parentType, cursor.group.getService()));
    }

    /** Adds a field at the cursor and returns the position of its sub-selection. */
    private Cursor append(Cursor cursor, Field field) {
      TypeReference type = fieldType(cursor.parentType, field.getName());
      boolean composite =
          graphModel
              .findType(type.getNamedType())
              .map(definition -> definition.getKind().isComposite())
              .orElse(false);
      GroupSelection child =
          cursor.node.addField(field, type.getText(), composite ? type.getNamedType() : null);
      Cursor produced =
          new Cursor(
              cursor.group,
              cursor.path.appendField(field.getResponseKey(), type.getListDepth()),
              type.getNamedType(),
              child,
              providedChild(
                  cursor.group.getService(), cursor.parentType, field.getName(), cursor.provided));
      if (field.getAlias() == null && field.getArguments().isEmpty()) {
        available.putIfAbsent(availabilityKey(cursor.path, field.getName()), produced);
      }
      return produced;
    }

    private void addTypename(GroupSelection selection) {
      selection.addField(TYPENAME, FieldDefinition.TYPENAME.getType().getText(), null);
    }

    private Cursor entryCursor(FetchGroup group, Cursor from) {
      return new Cursor(group, from.path, group.getParentType(), group.getSelection(), null);
    }

    private boolean isLocal(Cursor cursor, String fieldName) {
      return FetchGroupBuilder.this.isLocal(
          cursor.group.getService(), cursor.parentType, fieldName, cursor.provided);
    }

    private boolean resolvesLocally(Cursor cursor, SelectionSet fieldSet) {
      String service = cursor.group.getService();
      Deque<LocalCheck> pending = new ArrayDeque<>();
      pending.push(new LocalCheck(cursor.parentType, cursor.provided, fieldSet));
      while (!pending.isEmpty()) {
        LocalCheck check = pending.pop();
        for (Selection selection : check.selectionSet.getSelections()) {
          if (selection instanceof InlineFragment) {
            InlineFragment fragment = (InlineFragment) selection;
            String condition =
                fragment.getTypeCondition() != null ? fragment.getTypeCondition() : check.typeName;
            pending.push(
                new LocalCheck(
                    condition,
                    narrowProvided(check.provided, condition),
                    fragment.getSelectionSet()));
          } else if (selection instanceof Field) {
            Field field = (Field) selection;
            if (!FetchGroupBuilder.this.isLocal(
                service, check.typeName, field.getName(), check.provided)) {
              return false;
            }
            if (!field.isLeaf()) {
              pending.push(
                  new LocalCheck(
                      fieldType(check.typeName, field.getName()).getNamedType(),
                      providedChild(service, check.typeName, field.getName(), check.provided),
                      field.getSelectionSet()));
            }
          }
        }
      }
      return true;
    }

    private boolean canJoin(FetchGroup candidate, Set<FetchGroup> before) {
      for (FetchGroup group : before) {
        if (group == candidate || graph.reaches(candidate, group)) {
          return false;
        }
      }
      return true;
    }

    private boolean hasResolvableKey(String typeName, String service) {
      return !graphModel.resolvableKeys(typeName, service).isEmpty();
    }

    private List<FetchGroup> entityGroupsAt(String service, ResponsePath path, String typeName) {
      return entityGroups.getOrDefault(groupKey(service, path, typeName), List.of());
    }

    private TypeReference fieldType(String typeName, String fieldName) {
      return graphModel
          .field(typeName, fieldName)
          .map(FieldDefinition::getType)
          .orElseThrow(
              () ->
                  new InternalPlanningException(
                      "Field " + typeName + "." + fieldName + " is not defined"));
    }
  }

  private static String groupKey(String service, ResponsePath path, String typeName) {
    return service + "|" + path + "|" + typeName;
  }

  private static String availabilityKey(ResponsePath path, String fieldName) {
    return path + "|" + fieldName;
  }

  /** A position inside a fetch group: where fields selected at a response path are added. */
  private static class Cursor {
    private final FetchGroup group;
    private final ResponsePath path;
    private final String parentType;
    private final GroupSelection node;

    /** Fields the group's service provides at this position, or null. */
    private final SelectionSet provided;

    Cursor(
        FetchGroup group,
        ResponsePath path,
        String parentType,
        GroupSelection node,
        SelectionSet provided) {
      this.group = group;
      this.path = path;
      this.parentType = parentType;
      this.node = node;
      this.provided = provided;
    }

    Cursor narrow(String typeName) {
      if (typeName == null || typeName.equals(parentType)) {
        return this;
      }
      return new Cursor(
          group,
          path.append(PathElement.typeCondition(typeName)),
          typeName,
          node.addFragment(typeName),
          narrowProvided(provided, typeName));
    }
  }

  private static class WorkItem {
    private final Cursor cursor;
    private final SelectionSet selectionSet;

    WorkItem(Cursor cursor, SelectionSet selectionSet) {
      this.cursor = cursor;
      this.selectionSet = selectionSet;
    }
  }

  private static class LocalCheck {
    private final String typeName;
    private final SelectionSet provided;
    private final SelectionSet selectionSet;

    LocalCheck(String typeName, SelectionSet provided, SelectionSet selectionSet) {
      this.typeName = typeName;
      this.provided = provided;
      this.selectionSet = selectionSet;
    }
  }
}
