/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Counters collected while planning one operation. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class QueryPlanningStatistics {

  public static final QueryPlanningStatistics EMPTY = new QueryPlanningStatistics(0, 0, 0);

  /** Number of fetch group graphs built; more than one only for mutations. */
  private final int graphCount;

  /** Fetch groups created by the builder. */
  private final int groupsBuilt;

  /** Fetch groups left after merging; one fetch node is emitted per group. */
  private final int groupsEmitted;

  public int getGroupsMerged() {
    return groupsBuilt - groupsEmitted;
  }
}
