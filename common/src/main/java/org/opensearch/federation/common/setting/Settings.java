/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.common.setting;

import com.google.common.base.Strings;
import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Federation planner settings. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Query planner settings. */
    PLANNER_MAX_SELECTION_DEPTH("plugins.federation.planner.max_selection_depth"),
    PLANNER_MERGE_GROUPS_ENABLED("plugins.federation.planner.merge_groups.enabled"),
    PLANNER_OPERATION_NAMES_ENABLED("plugins.federation.planner.operation_names.enabled"),

    /** Plan cache settings. */
    PLAN_CACHE_MAX_SIZE("plugins.federation.plan_cache.max_size");

    @Getter private final String keyValue;

    /**
     * Looks up a key by its dotted name.
     *
     * @param keyValue dotted setting name
     * @return the key, or empty if the name is unknown
     */
    public static Optional<Key> of(String keyValue) {
      if (Strings.isNullOrEmpty(keyValue)) {
        return Optional.empty();
      }
      return Arrays.stream(Key.values())
          .filter(key -> key.keyValue.equals(keyValue))
          .findFirst();
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);
}
