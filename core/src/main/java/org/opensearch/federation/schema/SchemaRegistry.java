/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

/**
 * Source of the composed unified schema. Composition and validation happen outside the planner;
 * the registry only hands out immutable snapshots.
 */
public interface SchemaRegistry {

  /** Returns the current schema snapshot. The snapshot is shared read-only by planning calls. */
  GraphModel getGraphModel();

  /** Returns an identifier that changes whenever {@link #getGraphModel()} changes. */
  String getSchemaVersion();
}
