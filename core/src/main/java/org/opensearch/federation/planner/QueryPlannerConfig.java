/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.federation.common.setting.DefaultSettings;
import org.opensearch.federation.common.setting.Settings;

/** Planner options read from {@link Settings}. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class QueryPlannerConfig {

  /** Operations nested deeper than this are rejected. */
  private final int maxSelectionDepth;

  /** Whether compatible fetch groups are merged before scheduling. */
  private final boolean mergeGroups;

  /** Whether subgraph operations are named after a named client operation. */
  private final boolean operationNames;

  public static QueryPlannerConfig from(Settings settings) {
    Integer maxDepth = settings.getSettingValue(Settings.Key.PLANNER_MAX_SELECTION_DEPTH);
    Boolean merge = settings.getSettingValue(Settings.Key.PLANNER_MERGE_GROUPS_ENABLED);
    Boolean names = settings.getSettingValue(Settings.Key.PLANNER_OPERATION_NAMES_ENABLED);
    if (maxDepth == null || maxDepth < 1) {
      throw new IllegalArgumentException(
          String.format(
              "Invalid value [%s] for setting [%s]",
              maxDepth, Settings.Key.PLANNER_MAX_SELECTION_DEPTH.getKeyValue()));
    }
    return new QueryPlannerConfig(
        maxDepth, !Boolean.FALSE.equals(merge), !Boolean.FALSE.equals(names));
  }

  public static QueryPlannerConfig defaults() {
    return from(new DefaultSettings());
  }
}
