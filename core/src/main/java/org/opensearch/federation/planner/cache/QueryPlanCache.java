/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.cache;

import java.util.Optional;
import org.opensearch.federation.planner.plan.QueryPlan;

/**
 * Cache of query plans. Consulted by callers of the planner; the planner itself never caches.
 * Implementations must be safe for concurrent use.
 */
public interface QueryPlanCache {

  Optional<QueryPlan> get(QueryPlanCacheKey key);

  void put(QueryPlanCacheKey key, QueryPlan plan);

  void invalidateAll();

  long size();
}
