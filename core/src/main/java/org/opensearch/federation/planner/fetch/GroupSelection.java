/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.fetch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.opensearch.federation.operation.Field;
import org.opensearch.federation.operation.InlineFragment;
import org.opensearch.federation.operation.Selection;
import org.opensearch.federation.operation.SelectionSet;
import org.opensearch.federation.schema.FieldDefinition;
import org.opensearch.federation.schema.GraphModel;
import org.opensearch.federation.schema.TypeReference;

/**
 * Mutable, insertion-ordered selection tree of a fetch group. Fields with the same response key
 * and signature share one item and merge their sub-selections; type conditions share one item per
 * type.
 */
public class GroupSelection {

  @Getter private final String parentType;

  private final Map<String, Item> items = new LinkedHashMap<>();

  public GroupSelection(String parentType) {
    this.parentType = parentType;
  }

  public List<Item> getItems() {
    return Collections.unmodifiableList(new ArrayList<>(items.values()));
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  /**
   * Adds a field, ignoring its sub-selection.
   *
   * @param field field to add
   * @param declaredType declared type of the field, as written in the schema
   * @param childType named type of the field when it is composite, else null
   * @return the sub-selection of the field, or null for leaf fields
   */
  public GroupSelection addField(Field field, String declaredType, String childType) {
    String identity = "field:" + field.getResponseKey() + ":" + field.signature();
    Item item = items.get(identity);
    if (item == null) {
      item =
          new Item(
              field.withSelectionSet(null),
              null,
              declaredType,
              childType != null ? new GroupSelection(childType) : null);
      items.put(identity, item);
    }
    return item.selection;
  }

  /** Adds a type condition and returns its sub-selection. */
  public GroupSelection addFragment(String typeCondition) {
    return items
        .computeIfAbsent(
            "on:" + typeCondition,
            key -> new Item(null, typeCondition, null, new GroupSelection(typeCondition)))
        .selection;
  }

  /**
   * Adds a federation field set (a key or {@code requires} selection), typing each field through
   * the schema.
   */
  public void addFieldSet(SelectionSet fieldSet, GraphModel graphModel) {
    for (Selection selection : fieldSet.getSelections()) {
      if (selection instanceof InlineFragment) {
        InlineFragment fragment = (InlineFragment) selection;
        GroupSelection target =
            fragment.getTypeCondition() == null
                    || fragment.getTypeCondition().equals(parentType)
                ? this
                : addFragment(fragment.getTypeCondition());
        target.addFieldSet(fragment.getSelectionSet(), graphModel);
      } else if (selection instanceof Field) {
        Field field = (Field) selection;
        TypeReference type =
            graphModel
                .field(parentType, field.getName())
                .map(FieldDefinition::getType)
                .orElseThrow(
                    () ->
                        new IllegalArgumentException(
                            "Unknown field " + parentType + "." + field.getName()));
        GroupSelection child =
            addField(field, type.getText(), field.isLeaf() ? null : type.getNamedType());
        if (child != null) {
          child.addFieldSet(field.getSelectionSet(), graphModel);
        }
      }
    }
  }

  /** Whether every field of a field set is already selected, by name and without arguments. */
  public boolean containsFieldSet(SelectionSet fieldSet) {
    for (Selection selection : fieldSet.getSelections()) {
      if (selection instanceof InlineFragment) {
        InlineFragment fragment = (InlineFragment) selection;
        String condition = fragment.getTypeCondition();
        GroupSelection target =
            condition == null || condition.equals(parentType) ? this : fragmentSelection(condition);
        if (target == null || !target.containsFieldSet(fragment.getSelectionSet())) {
          return false;
        }
      } else if (selection instanceof Field) {
        Field field = (Field) selection;
        Item item = items.get("field:" + field.getName() + ":" + field.getName());
        if (item == null) {
          return false;
        }
        if (!field.isLeaf()
            && (item.selection == null
                || !item.selection.containsFieldSet(field.getSelectionSet()))) {
          return false;
        }
      }
    }
    return true;
  }

  /** Merges another selection into this one, keeping this selection's order first. */
  public void merge(GroupSelection other) {
    for (Item item : other.items.values()) {
      GroupSelection target =
          item.isFragment()
              ? addFragment(item.typeCondition)
              : addField(
                  item.field,
                  item.declaredType,
                  item.selection != null ? item.selection.parentType : null);
      if (target != null && item.selection != null) {
        target.merge(item.selection);
      }
    }
  }

  /** Renders the tree as a selection set, sub-selections included. */
  public SelectionSet toSelectionSet() {
    List<Selection> selections = new ArrayList<>();
    for (Item item : items.values()) {
      if (item.isFragment()) {
        if (!item.selection.isEmpty()) {
          selections.add(new InlineFragment(item.typeCondition, item.selection.toSelectionSet()));
        }
      } else if (item.selection == null) {
        selections.add(item.field);
      } else {
        selections.add(item.field.withSelectionSet(item.selection.toNonEmptySelectionSet()));
      }
    }
    return new SelectionSet(parentType, selections);
  }

  /** Like {@link #toSelectionSet()}, but selects {@code __typename} rather than nothing. */
  private SelectionSet toNonEmptySelectionSet() {
    SelectionSet selectionSet = toSelectionSet();
    if (selectionSet.isEmpty()) {
      return new SelectionSet(
          parentType, List.of(Field.of(FieldDefinition.TYPENAME.getName(), null)));
    }
    return selectionSet;
  }

  private GroupSelection fragmentSelection(String typeCondition) {
    Item item = items.get("on:" + typeCondition);
    return item != null ? item.selection : null;
  }

  @Override
  public String toString() {
    return toSelectionSet().toString();
  }

  /** A field or a type condition, with its sub-selection. */
  @Getter
  public static class Item {
    /** Field without sub-selection, or null for type conditions. */
    private final Field field;

    /** Type condition, or null for fields. */
    private final String typeCondition;

    private final String declaredType;

    private final GroupSelection selection;

    private Item(
        Field field, String typeCondition, String declaredType, GroupSelection selection) {
      this.field = field;
      this.typeCondition = typeCondition;
      this.declaredType = declaredType;
      this.selection = selection;
    }

    public boolean isFragment() {
      return typeCondition != null;
    }
  }
}
