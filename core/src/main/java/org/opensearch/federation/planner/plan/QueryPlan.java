/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Result of planning one operation. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class QueryPlan {

  /** Root node, or null when the operation needs no fetch (e.g. {@code { __typename }}). */
  private final PlanNode node;

  private final QueryPlanningStatistics statistics;

  public Optional<PlanNode> root() {
    return Optional.ofNullable(node);
  }

  @Override
  public String toString() {
    return QueryPlanFormatter.format(this);
  }
}
