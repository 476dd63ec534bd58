/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.planner.cache.QueryPlanCache;
import org.opensearch.federation.planner.cache.QueryPlanCacheKey;
import org.opensearch.federation.planner.plan.QueryPlan;
import org.opensearch.federation.schema.GraphModel;
import org.opensearch.federation.schema.SchemaRegistry;

/** Plans operations against the current schema snapshot, reusing cached plans. */
@Log4j2
@RequiredArgsConstructor
public class QueryPlanService {

  private final SchemaRegistry schemaRegistry;

  private final QueryPlanCache planCache;

  private final QueryPlannerConfig config;

  public QueryPlan plan(String document, String operationName) {
    // Read the version before the model.
    String schemaVersion = schemaRegistry.getSchemaVersion();
    GraphModel graphModel = schemaRegistry.getGraphModel();
    QueryPlanCacheKey key = QueryPlanCacheKey.of(schemaVersion, document, operationName, config);
    Optional<QueryPlan> cached = planCache.get(key);
    if (cached.isPresent()) {
      log.debug("Plan cache hit for {}", key);
      return cached.get();
    }
    QueryPlan plan = new QueryPlanner(graphModel, config).plan(document, operationName);
    planCache.put(key, plan);
    return plan;
  }
}
