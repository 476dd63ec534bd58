/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** A named fragment spread, {@code ...Name}. Removed by the {@link OperationNormalizer}. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class FragmentSpread extends Selection {

  private final String fragmentName;

  @Override
  void print(StringBuilder out) {
    out.append("...").append(fragmentName);
  }
}
