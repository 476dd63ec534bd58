/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

/**
 * Visitor over {@link PlanNode} variants.
 *
 * @param <R> return type
 * @param <C> context type
 */
public interface PlanNodeVisitor<R, C> {

  R visitFetch(FetchNode node, C context);

  R visitFlatten(FlattenNode node, C context);

  R visitSequence(SequenceNode node, C context);

  R visitParallel(ParallelNode node, C context);
}
