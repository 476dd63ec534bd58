/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.schedule;

/**
 * Visitor over {@link ScheduledNode} variants.
 *
 * @param <R> return type
 * @param <C> context type
 */
public interface ScheduledNodeVisitor<R, C> {

  R visitGroup(ScheduledNode.GroupStep node, C context);

  R visitSequence(ScheduledNode.SequenceStep node, C context);

  R visitParallel(ScheduledNode.ParallelStep node, C context);
}
