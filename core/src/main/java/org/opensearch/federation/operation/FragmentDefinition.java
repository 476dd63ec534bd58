/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** A named fragment, {@code fragment Name on Type { ... }}. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class FragmentDefinition {

  private final String name;

  private final String typeCondition;

  private final SelectionSet selectionSet;
}
