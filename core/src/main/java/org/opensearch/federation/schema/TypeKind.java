/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

/** Kinds of named types in the unified schema. */
public enum TypeKind {
  OBJECT,
  INTERFACE,
  UNION,
  SCALAR,
  ENUM,
  INPUT_OBJECT;

  /** Interfaces and unions, whose runtime type is one of several object types. */
  public boolean isAbstract() {
    return this == INTERFACE || this == UNION;
  }

  /** Types that carry a selection set. */
  public boolean isComposite() {
    return this == OBJECT || isAbstract();
  }
}
