/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

/** Invariant violation inside the planner. Indicates a planner defect, never bad input. */
public class InternalPlanningException extends QueryPlanningException {

  public InternalPlanningException(String message) {
    super(PlanningErrorCode.INTERNAL_PLANNING_ERROR, message);
  }
}
