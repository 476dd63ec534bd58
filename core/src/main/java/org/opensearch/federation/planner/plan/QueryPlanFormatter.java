/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import java.util.List;

/**
 * Renders a query plan as indented text, for logs and test expectations:
 *
 * <pre>
 * QueryPlan {
 *   Sequence {
 *     Fetch(service: "accounts", id: 0) {
 *       { me { __typename id } }
 *     },
 *     Flatten(path: "me") {
 *       Fetch(service: "reviews", id: 1) {
 *         ... on User { __typename id } =&gt;
 *         query($representations: [_Any!]!) { _entities(...) { ... on User { body } } }
 *       },
 *     },
 *   },
 * }
 * </pre>
 */
public final class QueryPlanFormatter implements PlanNodeVisitor<Void, Integer> {

  private static final String INDENT = "  ";

  private final StringBuilder out = new StringBuilder();

  private QueryPlanFormatter() {}

  public static String format(QueryPlan plan) {
    QueryPlanFormatter formatter = new QueryPlanFormatter();
    formatter.out.append("QueryPlan {\n");
    if (plan.getNode() != null) {
      plan.getNode().accept(formatter, 1);
    }
    formatter.out.append('}');
    return formatter.out.toString();
  }

  @Override
  public Void visitFetch(FetchNode node, Integer depth) {
    line(
        depth,
        String.format("Fetch(service: \"%s\", id: %d) {", node.getServiceName(), node.getId()));
    if (node.getRequires() != null) {
      line(depth + 1, node.getRequires() + " =>");
    }
    line(depth + 1, node.getOperation());
    for (FetchDataRewrite rewrite : node.getInputRewrites()) {
      line(depth + 1, "input " + describe(rewrite));
    }
    for (FetchDataRewrite rewrite : node.getOutputRewrites()) {
      line(depth + 1, "output " + describe(rewrite));
    }
    line(depth, "},");
    return null;
  }

  @Override
  public Void visitFlatten(FlattenNode node, Integer depth) {
    line(depth, "Flatten(path: \"" + node.getPath() + "\") {");
    node.getNode().accept(this, depth + 1);
    line(depth, "},");
    return null;
  }

  @Override
  public Void visitSequence(SequenceNode node, Integer depth) {
    return block("Sequence", node.getNodes(), depth);
  }

  @Override
  public Void visitParallel(ParallelNode node, Integer depth) {
    return block("Parallel", node.getNodes(), depth);
  }

  private Void block(String kind, List<PlanNode> nodes, int depth) {
    line(depth, kind + " {");
    for (PlanNode child : nodes) {
      child.accept(this, depth + 1);
    }
    line(depth, "},");
    return null;
  }

  private static String describe(FetchDataRewrite rewrite) {
    String path = String.join(".", rewrite.getPath());
    if (rewrite instanceof FetchDataRewrite.KeyRenamer) {
      return "rename " + path + " => " + ((FetchDataRewrite.KeyRenamer) rewrite).getRenameKeyTo();
    }
    return "set " + path + " = " + ((FetchDataRewrite.ValueSetter) rewrite).getSetValueTo();
  }

  private void line(int depth, String text) {
    for (int i = 0; i < depth; i++) {
      out.append(INDENT);
    }
    out.append(text).append('\n');
  }
}
