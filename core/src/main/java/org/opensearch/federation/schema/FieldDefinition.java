/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** A field of a composite type in the unified schema. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class FieldDefinition {

  /** Meta field present on every composite type. */
  public static final FieldDefinition TYPENAME =
      new FieldDefinition("__typename", TypeReference.parse("String!"), false);

  private final String name;

  private final TypeReference type;

  /** Hidden from the public schema; still usable as a cross-service input. */
  private final boolean inaccessible;
}
