/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.federation.operation.SelectionSet;

/** How one service declares one field: resolvable or {@code @external}, with requirements. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class FieldOwnership {

  private final String typeName;

  private final String fieldName;

  private final String service;

  /** Declared for shape or requirement purposes only; not resolvable by this service. */
  private final boolean external;

  /** {@code @requires} field set on the parent type, or null. */
  private final SelectionSet requires;

  /** {@code @provides} field set on the field's type, or null. */
  private final SelectionSet provides;

  public boolean hasRequires() {
    return requires != null && !requires.isEmpty();
  }

  public boolean hasProvides() {
    return provides != null && !provides.isEmpty();
  }

  /** Schema coordinate, {@code Type.field}. */
  public String coordinate() {
    return typeName + "." + fieldName;
  }
}
