/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.fetch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.Getter;
import org.opensearch.federation.planner.path.ResponsePath;
import org.opensearch.federation.planner.plan.FetchDataRewrite;

/**
 * One call to one service at one response path. Root groups select root fields; entity groups
 * receive representations built from {@link #getInputs()} and select fields of the entities they
 * resolve.
 */
@Getter
public class FetchGroup {

  /** Creation order; unique within a planning call. */
  private final int id;

  private final String service;

  private final FetchGroupKind kind;

  /** Type at the entry point: the root type, or the entity type looked up. */
  private final String parentType;

  /** Path at which the fetched data is merged into the response. */
  private final ResponsePath path;

  private final GroupSelection selection;

  /**
   * Representation selection for entity groups: one type condition per looked-up type holding
   * {@code __typename}, key and required fields. Empty for root groups.
   */
  private final GroupSelection inputs;

  private final List<FetchDataRewrite> inputRewrites = new ArrayList<>();

  private final SortedSet<Integer> predecessorIds = new TreeSet<>();

  private final SortedSet<Integer> successorIds = new TreeSet<>();

  public FetchGroup(
      int id, String service, FetchGroupKind kind, String parentType, ResponsePath path) {
    this.id = id;
    this.service = service;
    this.kind = kind;
    this.parentType = parentType;
    this.path = path;
    this.selection = new GroupSelection(parentType);
    this.inputs = new GroupSelection(null);
  }

  public static FetchGroup root(int id, String service, String rootType) {
    return new FetchGroup(id, service, FetchGroupKind.ROOT_FIELD, rootType, ResponsePath.ROOT);
  }

  public static FetchGroup entity(int id, String service, String typeName, ResponsePath path) {
    return new FetchGroup(id, service, FetchGroupKind.ENTITY, typeName, path);
  }

  public boolean isEntity() {
    return kind == FetchGroupKind.ENTITY;
  }

  public List<FetchDataRewrite> getInputRewrites() {
    return Collections.unmodifiableList(inputRewrites);
  }

  public SortedSet<Integer> getPredecessorIds() {
    return Collections.unmodifiableSortedSet(predecessorIds);
  }

  public SortedSet<Integer> getSuccessorIds() {
    return Collections.unmodifiableSortedSet(successorIds);
  }

  public void addInputRewrite(FetchDataRewrite rewrite) {
    if (!inputRewrites.contains(rewrite)) {
      inputRewrites.add(rewrite);
    }
  }

  SortedSet<Integer> getPredecessorIdsInternal() {
    return predecessorIds;
  }

  SortedSet<Integer> getSuccessorIdsInternal() {
    return successorIds;
  }

  /** Groups that can be merged share service, kind, path and entry type. */
  public boolean isMergeableWith(FetchGroup other) {
    return service.equals(other.service)
        && kind == other.kind
        && path.equals(other.path)
        && parentType.equals(other.parentType);
  }

  /** Folds the selections and inputs of another group into this one. Edges are not touched. */
  void absorb(FetchGroup other) {
    selection.merge(other.selection);
    inputs.merge(other.inputs);
    other.inputRewrites.forEach(this::addInputRewrite);
  }

  @Override
  public String toString() {
    return String.format(
        "FetchGroup{id=%d, service=%s, kind=%s, path=%s}", id, service, kind, path);
  }
}
