/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.util.Optional;
import org.opensearch.federation.common.setting.Settings;
import org.opensearch.federation.planner.plan.QueryPlan;

/** Size-bounded plan cache backed by a Guava {@link Cache}. */
public class InMemoryQueryPlanCache implements QueryPlanCache {

  private final Cache<QueryPlanCacheKey, QueryPlan> cache;

  public InMemoryQueryPlanCache(long maximumSize) {
    if (maximumSize < 0) {
      throw new IllegalArgumentException("Plan cache size must not be negative: " + maximumSize);
    }
    this.cache = CacheBuilder.newBuilder().maximumSize(maximumSize).build();
  }

  public static InMemoryQueryPlanCache from(Settings settings) {
    Long maximumSize = settings.getSettingValue(Settings.Key.PLAN_CACHE_MAX_SIZE);
    return new InMemoryQueryPlanCache(maximumSize);
  }

  @Override
  public Optional<QueryPlan> get(QueryPlanCacheKey key) {
    return Optional.ofNullable(cache.getIfPresent(key));
  }

  @Override
  public void put(QueryPlanCacheKey key, QueryPlan plan) {
    cache.put(key, plan);
  }

  @Override
  public void invalidateAll() {
    cache.invalidateAll();
  }

  @Override
  public long size() {
    return cache.size();
  }
}
