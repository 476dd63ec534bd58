/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Runs its nodes with no ordering between their completions. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class ParallelNode extends PlanNode {

  private final List<PlanNode> nodes;

  public ParallelNode(List<PlanNode> nodes) {
    this.nodes = ImmutableList.copyOf(nodes);
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitParallel(this, context);
  }

  @Override
  public String getKind() {
    return "Parallel";
  }
}
