/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.fetch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Fetch groups plus precedes-edges: an edge {@code a -> b} means {@code b} consumes data {@code a}
 * produces. Groups are kept in id order so every traversal is deterministic.
 */
public class FetchGroupGraph {

  private final Map<Integer, FetchGroup> groups = new TreeMap<>();

  public void addGroup(FetchGroup group) {
    if (groups.putIfAbsent(group.getId(), group) != null) {
      throw new IllegalArgumentException("Duplicate fetch group id " + group.getId());
    }
  }

  /**
   * Records that {@code before} must complete before {@code after} starts.
   *
   * @throws IllegalArgumentException on a self edge or a group that is not in the graph
   */
  public void addDependency(FetchGroup before, FetchGroup after) {
    require(before);
    require(after);
    if (before.getId() == after.getId()) {
      throw new IllegalArgumentException(
          "Fetch group " + before.getId() + " cannot precede itself");
    }
    before.getSuccessorIdsInternal().add(after.getId());
    after.getPredecessorIdsInternal().add(before.getId());
  }

  public List<FetchGroup> getGroups() {
    return new ArrayList<>(groups.values());
  }

  public FetchGroup group(int id) {
    FetchGroup group = groups.get(id);
    if (group == null) {
      throw new IllegalArgumentException("Unknown fetch group " + id);
    }
    return group;
  }

  public boolean contains(FetchGroup group) {
    return groups.get(group.getId()) == group;
  }

  public int size() {
    return groups.size();
  }

  public boolean isEmpty() {
    return groups.isEmpty();
  }

  /** Groups without predecessors, in id order. */
  public List<FetchGroup> roots() {
    return groups.values().stream()
        .filter(group -> group.getPredecessorIds().isEmpty())
        .collect(Collectors.toList());
  }

  public List<FetchGroup> predecessors(FetchGroup group) {
    return group.getPredecessorIds().stream().map(this::group).collect(Collectors.toList());
  }

  public List<FetchGroup> successors(FetchGroup group) {
    return group.getSuccessorIds().stream().map(this::group).collect(Collectors.toList());
  }

  /** Whether a non-empty chain of edges leads from {@code from} to {@code to}. */
  public boolean reaches(FetchGroup from, FetchGroup to) {
    Deque<Integer> pending = new ArrayDeque<>(from.getSuccessorIds());
    Set<Integer> seen = new HashSet<>();
    while (!pending.isEmpty()) {
      int id = pending.pop();
      if (id == to.getId()) {
        return true;
      }
      if (seen.add(id)) {
        pending.addAll(group(id).getSuccessorIds());
      }
    }
    return false;
  }

  /**
   * Merges {@code source} into {@code target}: selections, inputs and rewrites are folded into the
   * target, the source's edges are moved to it and the source is removed.
   *
   * @throws IllegalArgumentException if either group is reachable from the other
   */
  public void merge(FetchGroup target, FetchGroup source) {
    require(target);
    require(source);
    if (target == source || reaches(target, source) || reaches(source, target)) {
      throw new IllegalArgumentException(
          "Cannot merge dependent fetch groups " + target.getId() + " and " + source.getId());
    }
    target.absorb(source);
    for (FetchGroup predecessor : predecessors(source)) {
      predecessor.getSuccessorIdsInternal().remove(source.getId());
      addDependency(predecessor, target);
    }
    for (FetchGroup successor : successors(source)) {
      successor.getPredecessorIdsInternal().remove(source.getId());
      addDependency(target, successor);
    }
    groups.remove(source.getId());
  }

  /**
   * Checks structural invariants.
   *
   * @return error messages, empty when the graph is valid
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    Map<Integer, Integer> inDegree = new HashMap<>();
    for (FetchGroup group : groups.values()) {
      for (int id : group.getSuccessorIds()) {
        if (!groups.containsKey(id)) {
          errors.add("Fetch group " + group.getId() + " precedes unknown group " + id);
        }
      }
      for (int id : group.getPredecessorIds()) {
        if (!groups.containsKey(id)) {
          errors.add("Fetch group " + group.getId() + " depends on unknown group " + id);
        }
      }
      if (group.isEntity() && group.getPredecessorIds().isEmpty()) {
        errors.add("Entity fetch group " + group.getId() + " has no group producing its inputs");
      }
      if (group.getSelection().isEmpty()) {
        errors.add("Fetch group " + group.getId() + " selects nothing");
      }
      inDegree.put(group.getId(), group.getPredecessorIds().size());
    }
    if (!errors.isEmpty()) {
      return errors;
    }
    Deque<Integer> ready = new ArrayDeque<>();
    inDegree.forEach(
        (id, degree) -> {
          if (degree == 0) {
            ready.add(id);
          }
        });
    int visited = 0;
    while (!ready.isEmpty()) {
      FetchGroup group = groups.get(ready.pop());
      visited++;
      for (int id : group.getSuccessorIds()) {
        if (inDegree.merge(id, -1, Integer::sum) == 0) {
          ready.add(id);
        }
      }
    }
    if (visited != groups.size()) {
      errors.add("Fetch group dependencies contain a cycle");
    }
    return errors;
  }

  private void require(FetchGroup group) {
    if (!contains(group)) {
      throw new IllegalArgumentException("Fetch group " + group.getId() + " is not in the graph");
    }
  }

  @Override
  public String toString() {
    return groups.values().stream()
        .map(group -> group.getId() + "->" + group.getSuccessorIds())
        .collect(Collectors.joining(", ", "FetchGroupGraph{", "}"));
  }
}
