/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

/**
 * A member of a {@link SelectionSet}: a {@link Field}, an {@link InlineFragment} or, before
 * normalization only, a {@link FragmentSpread}.
 */
public abstract class Selection {

  /** Appends the document text of this selection to the builder. */
  abstract void print(StringBuilder out);

  @Override
  public String toString() {
    StringBuilder out = new StringBuilder();
    print(out);
    return out.toString();
  }
}
