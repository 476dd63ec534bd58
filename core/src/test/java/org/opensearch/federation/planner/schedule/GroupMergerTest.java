/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.federation.operation.Field;
import org.opensearch.federation.planner.fetch.FetchGroup;
import org.opensearch.federation.planner.fetch.FetchGroupGraph;
import org.opensearch.federation.planner.path.ResponsePath;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GroupMergerTest {

  private final FetchGroupGraph graph = new FetchGroupGraph();

  private final GroupMerger merger = new GroupMerger();

  @Test
  void independent_groups_of_one_service_at_one_path_are_merged() {
    FetchGroup root = root();
    FetchGroup first = entity(1, "B", "t", "a");
    FetchGroup second = entity(2, "B", "t", "b");
    graph.addDependency(root, first);
    graph.addDependency(root, second);

    assertEquals(1, merger.merge(graph));

    assertEquals(2, graph.size());
    assertEquals("{ a b }", graph.group(1).getSelection().toString());
  }

  @Test
  void merging_twice_changes_nothing() {
    FetchGroup root = root();
    graph.addDependency(root, entity(1, "B", "t", "a"));
    graph.addDependency(root, entity(2, "B", "t", "b"));
    graph.addDependency(root, entity(3, "B", "t", "c"));
    merger.merge(graph);
    String once = graph.toString();
    String selection = graph.group(1).getSelection().toString();

    assertEquals(0, merger.merge(graph));

    assertEquals(once, graph.toString());
    assertEquals(selection, graph.group(1).getSelection().toString());
    assertEquals("{ a b c }", selection);
  }

  @Test
  void dependent_groups_stay_apart() {
    FetchGroup root = root();
    FetchGroup first = entity(1, "B", "t", "a");
    FetchGroup middle = entity(2, "C", "t", "x");
    FetchGroup second = entity(3, "B", "t", "b");
    graph.addDependency(root, first);
    graph.addDependency(first, middle);
    graph.addDependency(middle, second);

    assertEquals(0, merger.merge(graph));
    assertEquals(4, graph.size());
  }

  @Test
  void groups_at_different_paths_stay_apart() {
    FetchGroup root = root();
    graph.addDependency(root, entity(1, "B", "t", "a"));
    graph.addDependency(root, entity(2, "B", "u", "a"));

    assertEquals(0, merger.merge(graph));
  }

  private FetchGroup root() {
    FetchGroup group = FetchGroup.root(0, "A", "Query");
    group.getSelection().addField(Field.of("t", null), "T", null);
    graph.addGroup(group);
    return group;
  }

  private FetchGroup entity(int id, String service, String path, String field) {
    FetchGroup group = FetchGroup.entity(id, service, "T", ResponsePath.of(path));
    group.getSelection().addField(Field.of(field, null), "String", null);
    graph.addGroup(group);
    return group;
  }
}
