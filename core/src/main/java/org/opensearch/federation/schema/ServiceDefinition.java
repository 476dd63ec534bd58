/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** A service (subgraph) owning a partition of the unified schema. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class ServiceDefinition {

  private final String name;

  /** Routing URL; metadata only, never used while planning. */
  private final String url;
}
