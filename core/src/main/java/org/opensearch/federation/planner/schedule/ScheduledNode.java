/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.schedule;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.federation.planner.fetch.FetchGroup;

/** Scheduled fetch groups: a single group step, or a sequence or parallel set of steps. */
public abstract class ScheduledNode {

  public abstract <R, C> R accept(ScheduledNodeVisitor<R, C> visitor, C context);

  /** Runs one fetch group. */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static class GroupStep extends ScheduledNode {
    private final FetchGroup group;

    public GroupStep(FetchGroup group) {
      this.group = group;
    }

    @Override
    public <R, C> R accept(ScheduledNodeVisitor<R, C> visitor, C context) {
      return visitor.visitGroup(this, context);
    }

    @Override
    public String toString() {
      return String.valueOf(group.getId());
    }
  }

  /** Runs its nodes one after the other. */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static class SequenceStep extends ScheduledNode {
    private final List<ScheduledNode> nodes;

    public SequenceStep(List<ScheduledNode> nodes) {
      this.nodes = ImmutableList.copyOf(nodes);
    }

    @Override
    public <R, C> R accept(ScheduledNodeVisitor<R, C> visitor, C context) {
      return visitor.visitSequence(this, context);
    }

    @Override
    public String toString() {
      return "Sequence" + nodes;
    }
  }

  /** Runs its nodes without any ordering between them. */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static class ParallelStep extends ScheduledNode {
    private final List<ScheduledNode> nodes;

    public ParallelStep(List<ScheduledNode> nodes) {
      this.nodes = ImmutableList.copyOf(nodes);
    }

    @Override
    public <R, C> R accept(ScheduledNodeVisitor<R, C> visitor, C context) {
      return visitor.visitParallel(this, context);
    }

    @Override
    public String toString() {
      return "Parallel" + nodes;
    }
  }
}
