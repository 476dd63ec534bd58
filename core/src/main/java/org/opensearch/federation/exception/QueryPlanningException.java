/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import lombok.Getter;

/**
 * Base class of all query planning failures. Planning never recovers from these: no partial plan
 * is produced and the caller is expected to surface the error as a top-level failure.
 */
public class QueryPlanningException extends RuntimeException {

  @Getter private final PlanningErrorCode errorCode;

  public QueryPlanningException(PlanningErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public QueryPlanningException(PlanningErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }
}
