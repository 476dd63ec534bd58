/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.common.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.federation.common.setting.Settings.Key;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DefaultSettingsTest {

  @Test
  void should_expose_defaults() {
    Settings settings = new DefaultSettings();

    assertEquals(128, (int) settings.getSettingValue(Key.PLANNER_MAX_SELECTION_DEPTH));
    assertTrue(settings.<Boolean>getSettingValue(Key.PLANNER_MERGE_GROUPS_ENABLED));
    assertEquals(1000L, (long) settings.getSettingValue(Key.PLAN_CACHE_MAX_SIZE));
  }

  @Test
  void should_apply_typed_overrides() {
    Settings settings = new DefaultSettings(Map.of(Key.PLANNER_MERGE_GROUPS_ENABLED, false));

    assertFalse(settings.<Boolean>getSettingValue(Key.PLANNER_MERGE_GROUPS_ENABLED));
    assertTrue(settings.<Boolean>getSettingValue(Key.PLANNER_OPERATION_NAMES_ENABLED));
  }

  @Test
  void should_convert_property_overrides_to_default_types() {
    Properties properties = new Properties();
    properties.setProperty("plugins.federation.planner.max_selection_depth", "16");
    properties.setProperty("plugins.federation.planner.operation_names.enabled", "false");

    Settings settings = DefaultSettings.fromProperties(properties);

    assertEquals(16, (int) settings.getSettingValue(Key.PLANNER_MAX_SELECTION_DEPTH));
    assertFalse(settings.<Boolean>getSettingValue(Key.PLANNER_OPERATION_NAMES_ENABLED));
  }

  @Test
  void should_reject_unknown_property() {
    Properties properties = new Properties();
    properties.setProperty("plugins.federation.unknown", "1");

    assertThrows(IllegalArgumentException.class, () -> DefaultSettings.fromProperties(properties));
  }

  @Test
  void should_reject_malformed_property_value() {
    Properties properties = new Properties();
    properties.setProperty("plugins.federation.planner.merge_groups.enabled", "yes");

    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> DefaultSettings.fromProperties(properties));
    assertTrue(e.getMessage().contains("merge_groups.enabled"));
  }

  @Test
  void should_look_up_key_by_name() {
    assertEquals(
        Key.PLAN_CACHE_MAX_SIZE, Key.of("plugins.federation.plan_cache.max_size").orElseThrow());
    assertTrue(Key.of("").isEmpty());
  }
}
