/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

/** Thrown when the service owning a field on an abstract type cannot be determined uniquely. */
public class AmbiguousOwnershipException extends QueryPlanningException {

  public AmbiguousOwnershipException(String message) {
    super(PlanningErrorCode.AMBIGUOUS_OWNERSHIP, message);
  }
}
