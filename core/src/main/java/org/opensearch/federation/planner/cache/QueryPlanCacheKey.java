/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.cache;

import com.google.common.base.Strings;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.federation.planner.QueryPlannerConfig;

/**
 * SHA-256 digest of everything a plan depends on: schema version, operation text, operation name
 * and the planner options that change the plan.
 */
@Getter
@EqualsAndHashCode
public class QueryPlanCacheKey {

  private final String digest;

  private QueryPlanCacheKey(String digest) {
    this.digest = digest;
  }

  public static QueryPlanCacheKey of(
      String schemaVersion, String document, String operationName, QueryPlannerConfig config) {
    Hasher hasher = Hashing.sha256().newHasher();
    putField(hasher, schemaVersion);
    putField(hasher, document);
    putField(hasher, operationName);
    hasher.putInt(config.getMaxSelectionDepth());
    hasher.putBoolean(config.isMergeGroups());
    hasher.putBoolean(config.isOperationNames());
    return new QueryPlanCacheKey(hasher.hash().toString());
  }

  // Length prefix keeps ("ab", "c") and ("a", "bc") apart; null and "" differ by the marker.
  private static void putField(Hasher hasher, String value) {
    hasher.putBoolean(value != null);
    String text = Strings.nullToEmpty(value);
    hasher.putInt(text.length());
    hasher.putString(text, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return digest;
  }
}
