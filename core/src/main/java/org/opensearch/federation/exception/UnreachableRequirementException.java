/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import lombok.Getter;

/** Thrown when no service can produce a field from the position where it is needed. */
public class UnreachableRequirementException extends QueryPlanningException {

  @Getter private final String typeName;

  @Getter private final String fieldName;

  public UnreachableRequirementException(String typeName, String fieldName, String reason) {
    super(
        PlanningErrorCode.UNREACHABLE_REQUIREMENT,
        String.format("Cannot reach field %s.%s: %s", typeName, fieldName, reason));
    this.typeName = typeName;
    this.fieldName = fieldName;
  }
}
