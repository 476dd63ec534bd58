/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

/**
 * Node of a query plan handed to the executor. Variants are dispatched through {@link
 * PlanNodeVisitor}.
 */
public abstract class PlanNode {

  public abstract <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context);

  /** Tag used in serialized and formatted plans. */
  public abstract String getKind();
}
