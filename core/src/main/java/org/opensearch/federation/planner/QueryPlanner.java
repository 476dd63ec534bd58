/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.operation.Document;
import org.opensearch.federation.operation.Operation;
import org.opensearch.federation.operation.OperationNormalizer;
import org.opensearch.federation.operation.OperationParser;
import org.opensearch.federation.planner.fetch.FetchGroupBuilder;
import org.opensearch.federation.planner.fetch.FetchGroupGraph;
import org.opensearch.federation.planner.plan.PlanEmitter;
import org.opensearch.federation.planner.plan.PlanNode;
import org.opensearch.federation.planner.plan.QueryPlan;
import org.opensearch.federation.planner.plan.QueryPlanningStatistics;
import org.opensearch.federation.planner.plan.SequenceNode;
import org.opensearch.federation.planner.requires.DependencyResolver;
import org.opensearch.federation.planner.schedule.GroupMerger;
import org.opensearch.federation.planner.schedule.GroupScheduler;
import org.opensearch.federation.schema.GraphModel;

/**
 * Plans client operations against a unified schema.
 *
 * <p>Planning normalizes the operation, partitions it into fetch groups, merges compatible groups,
 * schedules them and emits the plan tree. It is pure and synchronous: no I/O, no state kept
 * between calls. One planner can serve concurrent callers since the {@link GraphModel} is only
 * read.
 */
@Log4j2
public class QueryPlanner {

  @Getter private final GraphModel graphModel;

  @Getter private final QueryPlannerConfig config;

  public QueryPlanner(GraphModel graphModel) {
    this(graphModel, QueryPlannerConfig.defaults());
  }

  public QueryPlanner(GraphModel graphModel, QueryPlannerConfig config) {
    this.graphModel = graphModel;
    this.config = config;
  }

  /**
   * Parses, normalizes and plans one operation of a document.
   *
   * @param document executable document text
   * @param operationName operation to plan, or null when the document holds a single operation
   * @return the query plan
   * @throws org.opensearch.federation.exception.QueryPlanningException if the operation is
   *     invalid or cannot be planned
   */
  public QueryPlan plan(String document, String operationName) {
    Document parsed = OperationParser.parseDocument(document, config.getMaxSelectionDepth());
    Operation operation =
        new OperationNormalizer(graphModel, config.getMaxSelectionDepth())
            .normalize(parsed, operationName);
    return plan(operation);
  }

  /**
   * Plans an operation already normalized by {@link OperationNormalizer}.
   *
   * @param operation normalized operation
   * @return the query plan
   */
  public QueryPlan plan(Operation operation) {
    FetchGroupBuilder builder =
        new FetchGroupBuilder(graphModel, new DependencyResolver(graphModel));
    List<FetchGroupGraph> graphs = builder.build(operation);

    GroupMerger merger = new GroupMerger();
    GroupScheduler scheduler = new GroupScheduler();
    PlanEmitter emitter = new PlanEmitter(operation, config.isOperationNames());
    int groupsBuilt = 0;
    int groupsEmitted = 0;
    List<PlanNode> nodes = new ArrayList<>();
    for (FetchGroupGraph graph : graphs) {
      groupsBuilt += graph.size();
      if (config.isMergeGroups()) {
        merger.merge(graph);
      }
      groupsEmitted += graph.size();
      nodes.add(emitter.emit(scheduler.schedule(graph)));
    }

    QueryPlan plan =
        new QueryPlan(
            sequence(nodes),
            new QueryPlanningStatistics(graphs.size(), groupsBuilt, groupsEmitted));
    log.info(
        "Planned {} {}: {} fetch groups, {} after merging",
        operation.getOperationType().getKeyword(),
        operation.getName() != null ? operation.getName() : "<anonymous>",
        groupsBuilt,
        groupsEmitted);
    return plan;
  }

  private static PlanNode sequence(List<PlanNode> nodes) {
    if (nodes.isEmpty()) {
      return null;
    }
    if (nodes.size() == 1) {
      return nodes.get(0);
    }
    List<PlanNode> flattened = new ArrayList<>();
    for (PlanNode node : nodes) {
      if (node instanceof SequenceNode) {
        flattened.addAll(((SequenceNode) node).getNodes());
      } else {
        flattened.add(node);
      }
    }
    return new SequenceNode(flattened);
  }
}
