/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** A variable declared by an operation, {@code $name: Type = default}. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class VariableDefinition {

  private final String name;

  /** Type as written, e.g. {@code [ID!]!}. */
  private final String type;

  /** Default value literal, or null. */
  private final String defaultValue;

  /** Renders the definition as it appears in an operation header. */
  public String toDocumentString() {
    return "$" + name + ": " + type + (defaultValue != null ? " = " + defaultValue : "");
  }
}
