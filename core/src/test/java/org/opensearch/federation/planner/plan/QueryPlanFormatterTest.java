/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.federation.operation.OperationType;
import org.opensearch.federation.planner.path.ResponsePath;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryPlanFormatterTest {

  @Test
  void empty_plan() {
    QueryPlan plan = new QueryPlan(null, QueryPlanningStatistics.EMPTY);

    assertEquals("QueryPlan {\n}", QueryPlanFormatter.format(plan));
  }

  @Test
  void nested_plan_is_indented_by_depth() {
    FetchNode root =
        new FetchNode(
            "accounts", 0, OperationType.QUERY, null, null, "{ me { __typename id } }", null,
            null, null);
    FetchNode entities =
        new FetchNode(
            "reviews",
            1,
            OperationType.QUERY,
            null,
            null,
            "query(...) { ... }",
            "... on User { __typename id }",
            null,
            List.of(new FetchDataRewrite.KeyRenamer(List.of("... on User", "n__alias_0"), "n")));
    QueryPlan plan =
        new QueryPlan(
            new SequenceNode(List.of(root, new FlattenNode(ResponsePath.of("me"), entities))),
            QueryPlanningStatistics.EMPTY);

    assertEquals(
        "QueryPlan {\n"
            + "  Sequence {\n"
            + "    Fetch(service: \"accounts\", id: 0) {\n"
            + "      { me { __typename id } }\n"
            + "    },\n"
            + "    Flatten(path: \"me\") {\n"
            + "      Fetch(service: \"reviews\", id: 1) {\n"
            + "        ... on User { __typename id } =>\n"
            + "        query(...) { ... }\n"
            + "        output rename ... on User.n__alias_0 => n\n"
            + "      },\n"
            + "    },\n"
            + "  },\n"
            + "}",
        plan.toString());
  }

  @Test
  void input_rewrites_are_listed_before_outputs() {
    FetchNode fetch =
        new FetchNode(
            "a",
            2,
            OperationType.QUERY,
            null,
            null,
            "op",
            "req",
            List.of(new FetchDataRewrite.ValueSetter(List.of("__typename"), "User")),
            List.of(new FetchDataRewrite.KeyRenamer(List.of("x__alias_0"), "x")));

    assertEquals(
        "QueryPlan {\n"
            + "  Fetch(service: \"a\", id: 2) {\n"
            + "    req =>\n"
            + "    op\n"
            + "    input set __typename = User\n"
            + "    output rename x__alias_0 => x\n"
            + "  },\n"
            + "}",
        QueryPlanFormatter.format(new QueryPlan(fetch, QueryPlanningStatistics.EMPTY)));
  }
}
