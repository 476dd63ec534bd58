/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import java.util.List;
import lombok.Getter;

/** Thrown when a field's transitive {@code requires} closure references the field itself. */
public class RequirementCycleException extends QueryPlanningException {

  /** Coordinates ({@code Type.field}) on the cycle, starting and ending with the same field. */
  @Getter private final List<String> cycle;

  public RequirementCycleException(List<String> cycle) {
    super(
        PlanningErrorCode.REQUIREMENT_CYCLE,
        "Cyclic @requires dependency: " + String.join(" -> ", cycle));
    this.cycle = List.copyOf(cycle);
  }
}
