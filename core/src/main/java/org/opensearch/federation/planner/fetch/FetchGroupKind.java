/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.fetch;

/** How a fetch group enters its service. */
public enum FetchGroupKind {
  /** Selects root fields of the query or mutation type. */
  ROOT_FIELD,

  /** Looks entities up by key through {@code _entities(representations:)}. */
  ENTITY
}
