/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

/** Classification of query planning failures. */
public enum PlanningErrorCode {
  /** A field's transitive requirements reference the field itself. */
  REQUIREMENT_CYCLE,

  /** A required field has no service that can produce it given the available keys. */
  UNREACHABLE_REQUIREMENT,

  /** The owning service of a field on an abstract type cannot be determined. */
  AMBIGUOUS_OWNERSHIP,

  /** An internal invariant was violated. Always a defect. */
  INTERNAL_PLANNING_ERROR,

  /** The operation is not valid against the unified schema. */
  INVALID_OPERATION
}
