/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.schedule;

import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.planner.fetch.FetchGroup;
import org.opensearch.federation.planner.fetch.FetchGroupGraph;

/**
 * Merges fetch groups that target the same service with the same kind, path and entry type and
 * have no path between them in the dependency graph. The lower id survives, so selections keep
 * the order in which the query first requested them. Running the merger twice changes nothing.
 */
@Log4j2
public class GroupMerger {

  /**
   * Merges the graph in place.
   *
   * @return number of groups removed
   */
  public int merge(FetchGroupGraph graph) {
    int removed = 0;
    while (mergeFirstPair(graph)) {
      removed++;
    }
    return removed;
  }

  private boolean mergeFirstPair(FetchGroupGraph graph) {
    List<FetchGroup> groups = graph.getGroups();
    for (int i = 0; i < groups.size(); i++) {
      FetchGroup target = groups.get(i);
      for (int j = i + 1; j < groups.size(); j++) {
        FetchGroup source = groups.get(j);
        if (target.isMergeableWith(source)
            && !graph.reaches(target, source)
            && !graph.reaches(source, target)) {
          log.debug("Merging {} into {}", source, target);
          graph.merge(target, source);
          return true;
        }
      }
    }
    return false;
  }
}
