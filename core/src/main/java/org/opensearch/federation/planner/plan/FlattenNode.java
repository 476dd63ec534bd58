/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.federation.planner.path.ResponsePath;

/**
 * Re-enters execution at a response path before running its child: the executor collects the
 * values at {@code path}, fanning out over arrays and narrowing on type conditions, and merges the
 * child's results back into them.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class FlattenNode extends PlanNode {

  private final ResponsePath path;

  private final PlanNode node;

  public FlattenNode(ResponsePath path, PlanNode node) {
    this.path = path;
    this.node = node;
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFlatten(this, context);
  }

  @Override
  public String getKind() {
    return "Flatten";
  }
}
