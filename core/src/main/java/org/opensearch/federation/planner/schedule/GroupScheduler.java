/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.schedule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.exception.InternalPlanningException;
import org.opensearch.federation.planner.fetch.FetchGroup;
import org.opensearch.federation.planner.fetch.FetchGroupGraph;

/**
 * Arranges a fetch group graph into sequences and parallel branches.
 *
 * <p>Starting from the groups without predecessors, each group is followed by those of its
 * successors whose predecessors have all completed within the same branch. Groups that become
 * ready together run in parallel. A group waiting on several parallel branches is delayed until
 * the enclosing parallel step completes, which yields {@code Sequence[Parallel[a, b], merge]}.
 */
@Log4j2
public class GroupScheduler {

  /**
   * Schedules every group of the graph.
   *
   * @throws InternalPlanningException if the graph is empty, cyclic or otherwise invalid
   */
  public ScheduledNode schedule(FetchGroupGraph graph) {
    if (graph.isEmpty()) {
      throw new InternalPlanningException("No fetch groups to schedule");
    }
    List<String> errors = graph.validate();
    if (!errors.isEmpty()) {
      throw new InternalPlanningException(
          "Cannot schedule fetch groups: " + String.join("; ", errors));
    }
    Set<Integer> processed = new HashSet<>();
    ScheduledNode node = level(graph, graph.roots(), processed);
    if (processed.size() != graph.size()) {
      List<Integer> unscheduled =
          graph.getGroups().stream()
              .map(FetchGroup::getId)
              .filter(id -> !processed.contains(id))
              .collect(Collectors.toList());
      throw new InternalPlanningException("Fetch groups " + unscheduled + " were never scheduled");
    }
    log.debug("Scheduled {} as {}", graph, node);
    return node;
  }

  private ScheduledNode level(
      FetchGroupGraph graph, List<FetchGroup> ready, Set<Integer> processed) {
    if (ready.isEmpty()) {
      throw new InternalPlanningException("Fetch group dependencies contain a cycle");
    }
    if (ready.size() == 1) {
      return chain(graph, ready.get(0), processed);
    }
    Set<Integer> before = new HashSet<>(processed);
    List<ScheduledNode> branches = new ArrayList<>();
    for (FetchGroup group : ready) {
      Set<Integer> branch = new HashSet<>(before);
      branches.add(chain(graph, group, branch));
      processed.addAll(branch);
    }
    ScheduledNode parallel = parallel(branches);

    TreeMap<Integer, FetchGroup> delayed = new TreeMap<>();
    for (int id : processed) {
      if (!before.contains(id)) {
        for (FetchGroup successor : graph.successors(graph.group(id))) {
          if (isReady(successor, processed)) {
            delayed.put(successor.getId(), successor);
          }
        }
      }
    }
    if (delayed.isEmpty()) {
      return parallel;
    }
    return sequence(List.of(parallel, level(graph, new ArrayList<>(delayed.values()), processed)));
  }

  private ScheduledNode chain(FetchGroupGraph graph, FetchGroup group, Set<Integer> processed) {
    processed.add(group.getId());
    List<FetchGroup> children =
        graph.successors(group).stream()
            .filter(successor -> isReady(successor, processed))
            .collect(Collectors.toList());
    ScheduledNode step = new ScheduledNode.GroupStep(group);
    if (children.isEmpty()) {
      return step;
    }
    return sequence(List.of(step, level(graph, children, processed)));
  }

  private static boolean isReady(FetchGroup group, Set<Integer> processed) {
    return !processed.contains(group.getId())
        && processed.containsAll(group.getPredecessorIds());
  }

  private static ScheduledNode sequence(List<ScheduledNode> nodes) {
    List<ScheduledNode> flattened = new ArrayList<>();
    for (ScheduledNode node : nodes) {
      if (node instanceof ScheduledNode.SequenceStep) {
        flattened.addAll(((ScheduledNode.SequenceStep) node).getNodes());
      } else {
        flattened.add(node);
      }
    }
    return flattened.size() == 1 ? flattened.get(0) : new ScheduledNode.SequenceStep(flattened);
  }

  private static ScheduledNode parallel(List<ScheduledNode> nodes) {
    List<ScheduledNode> flattened = new ArrayList<>();
    for (ScheduledNode node : nodes) {
      if (node instanceof ScheduledNode.ParallelStep) {
        flattened.addAll(((ScheduledNode.ParallelStep) node).getNodes());
      } else {
        flattened.add(node);
      }
    }
    return flattened.size() == 1 ? flattened.get(0) : new ScheduledNode.ParallelStep(flattened);
  }
}
