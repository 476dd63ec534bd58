/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ResponsePathTest {

  @Test
  void elements_parse_from_their_rendering() {
    ResponsePath path = ResponsePath.of("topProducts", "@", "... on Book");

    assertInstanceOf(PathElement.Key.class, path.getElements().get(0));
    assertInstanceOf(PathElement.AnyIndex.class, path.getElements().get(1));
    PathElement.TypeCondition condition =
        assertInstanceOf(PathElement.TypeCondition.class, path.getElements().get(2));
    assertEquals("Book", condition.getTypeName());
    assertEquals(List.of("topProducts", "@", "... on Book"), path.toStringList());
    assertEquals("topProducts.@.... on Book", path.toString());
  }

  @Test
  void append_field_adds_one_marker_per_list_wrapper() {
    ResponsePath path = ResponsePath.of("me").appendField("matrix", 2);

    assertEquals(ResponsePath.of("me", "matrix", "@", "@"), path);
  }

  @Test
  void relative_to_strips_a_prefix() {
    ResponsePath path = ResponsePath.of("me", "reviews", "@", "author");

    assertTrue(path.startsWith(ResponsePath.of("me", "reviews")));
    assertFalse(path.startsWith(ResponsePath.of("reviews")));
    assertEquals(ResponsePath.of("@", "author"), path.relativeTo(ResponsePath.of("me", "reviews")));
    assertThrows(IllegalArgumentException.class, () -> path.relativeTo(ResponsePath.of("x")));
  }

  @Test
  void root_is_empty() {
    assertTrue(ResponsePath.ROOT.isEmpty());
    assertEquals("", ResponsePath.ROOT.toString());
    assertEquals(ResponsePath.of("a"), ResponsePath.ROOT.append(PathElement.key("a")));
  }

  @Test
  void empty_element_is_rejected() {
    assertThrows(IllegalArgumentException.class, () -> ResponsePath.of("a", ""));
  }
}
