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

/** Runs its nodes in order; each node may consume the data fetched by the previous ones. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class SequenceNode extends PlanNode {

  private final List<PlanNode> nodes;

  public SequenceNode(List<PlanNode> nodes) {
    this.nodes = ImmutableList.copyOf(nodes);
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitSequence(this, context);
  }

  @Override
  public String getKind() {
    return "Sequence";
  }
}
