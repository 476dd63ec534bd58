/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

/**
 * In-process {@link Settings} backed by built-in defaults. Overrides can be supplied as typed
 * values or as dotted-name properties; property values are converted to the type of the default.
 */
public class DefaultSettings extends Settings {

  private static final Map<Key, Object> DEFAULTS =
      ImmutableMap.<Key, Object>builder()
          .put(Key.PLANNER_MAX_SELECTION_DEPTH, 128)
          .put(Key.PLANNER_MERGE_GROUPS_ENABLED, true)
          .put(Key.PLANNER_OPERATION_NAMES_ENABLED, true)
          .put(Key.PLAN_CACHE_MAX_SIZE, 1000L)
          .build();

  private final Map<Key, Object> values;

  public DefaultSettings() {
    this(Map.of());
  }

  public DefaultSettings(Map<Key, Object> overrides) {
    this.values = new EnumMap<>(Key.class);
    this.values.putAll(DEFAULTS);
    this.values.putAll(overrides);
  }

  /**
   * Creates settings from dotted-name properties, e.g. {@code
   * plugins.federation.planner.max_selection_depth=64}.
   *
   * @param properties property overrides
   * @return settings with the overrides applied
   * @throws IllegalArgumentException if a property name is unknown or its value is malformed
   */
  public static DefaultSettings fromProperties(Properties properties) {
    Map<Key, Object> overrides = new EnumMap<>(Key.class);
    for (String name : properties.stringPropertyNames()) {
      Key key =
          Key.of(name).orElseThrow(() -> new IllegalArgumentException("Unknown setting: " + name));
      overrides.put(key, convert(key, properties.getProperty(name).trim()));
    }
    return new DefaultSettings(overrides);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  private static Object convert(Key key, String raw) {
    Object defaultValue = DEFAULTS.get(key);
    try {
      if (defaultValue instanceof Boolean) {
        if (!raw.equalsIgnoreCase("true") && !raw.equalsIgnoreCase("false")) {
          throw new IllegalArgumentException("not a boolean");
        }
        return Boolean.parseBoolean(raw);
      } else if (defaultValue instanceof Integer) {
        return Integer.parseInt(raw);
      } else if (defaultValue instanceof Long) {
        return Long.parseLong(raw);
      }
      return raw;
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("Invalid value [%s] for setting [%s]", raw, key.getKeyValue()), e);
    }
  }
}
