/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

/** The operation cannot be parsed or does not validate against the unified schema. */
public class InvalidOperationException extends QueryPlanningException {

  public InvalidOperationException(String message) {
    super(PlanningErrorCode.INVALID_OPERATION, message);
  }
}
