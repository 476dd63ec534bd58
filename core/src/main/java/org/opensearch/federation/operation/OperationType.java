/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Root operation kinds of an executable document. */
@RequiredArgsConstructor
public enum OperationType {
  QUERY("query"),
  MUTATION("mutation"),
  SUBSCRIPTION("subscription");

  /** Keyword used for this operation type in a document. */
  @Getter private final String keyword;
}
