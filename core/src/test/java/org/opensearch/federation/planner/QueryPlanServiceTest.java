/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.opensearch.federation.exception.InvalidOperationException;
import org.opensearch.federation.planner.cache.InMemoryQueryPlanCache;
import org.opensearch.federation.planner.cache.QueryPlanCache;
import org.opensearch.federation.planner.cache.QueryPlanCacheKey;
import org.opensearch.federation.planner.plan.FetchNode;
import org.opensearch.federation.planner.plan.QueryPlan;
import org.opensearch.federation.planner.plan.QueryPlanningStatistics;
import org.opensearch.federation.schema.SchemaFixtures;
import org.opensearch.federation.schema.SchemaRegistry;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryPlanServiceTest {

  private static final String QUERY = "{ me { name } }";

  @Mock private SchemaRegistry schemaRegistry;

  @Mock private QueryPlanCache planCache;

  private final QueryPlannerConfig config = QueryPlannerConfig.defaults();

  @Test
  void cache_miss_plans_and_stores_the_plan() {
    when(schemaRegistry.getSchemaVersion()).thenReturn("v1");
    when(schemaRegistry.getGraphModel()).thenReturn(SchemaFixtures.storefront());
    when(planCache.get(any())).thenReturn(Optional.empty());

    QueryPlan plan = new QueryPlanService(schemaRegistry, planCache, config).plan(QUERY, null);

    FetchNode fetch = (FetchNode) plan.getNode();
    assertEquals("accounts", fetch.getServiceName());
    assertEquals("{ me { name } }", fetch.getOperation());
    verify(planCache).put(eq(QueryPlanCacheKey.of("v1", QUERY, null, config)), eq(plan));
  }

  @Test
  void cache_hit_returns_the_cached_plan() {
    QueryPlan cached = new QueryPlan(null, QueryPlanningStatistics.EMPTY);
    when(schemaRegistry.getSchemaVersion()).thenReturn("v1");
    when(schemaRegistry.getGraphModel()).thenReturn(SchemaFixtures.storefront());
    when(planCache.get(QueryPlanCacheKey.of("v1", QUERY, null, config)))
        .thenReturn(Optional.of(cached));

    QueryPlan plan = new QueryPlanService(schemaRegistry, planCache, config).plan(QUERY, null);

    assertSame(cached, plan);
    verify(planCache, never()).put(any(), any());
  }

  @Test
  void schema_version_change_replans() {
    when(schemaRegistry.getSchemaVersion()).thenReturn("v1", "v1", "v2");
    when(schemaRegistry.getGraphModel()).thenReturn(SchemaFixtures.storefront());
    QueryPlanService service =
        new QueryPlanService(schemaRegistry, new InMemoryQueryPlanCache(10), config);

    QueryPlan first = service.plan(QUERY, null);
    QueryPlan second = service.plan(QUERY, null);
    QueryPlan third = service.plan(QUERY, null);

    assertSame(first, second);
    assertNotSame(first, third);
    assertEquals(first, third);
  }

  @Test
  void invalid_operations_are_not_cached() {
    when(schemaRegistry.getSchemaVersion()).thenReturn("v1");
    when(schemaRegistry.getGraphModel()).thenReturn(SchemaFixtures.storefront());
    when(planCache.get(any())).thenReturn(Optional.empty());
    QueryPlanService service = new QueryPlanService(schemaRegistry, planCache, config);

    assertThrows(InvalidOperationException.class, () -> service.plan("{ me { email } }", null));
    verify(planCache, never()).put(any(), any());
  }
}
