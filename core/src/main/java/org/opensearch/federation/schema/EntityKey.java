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

/**
 * An {@code @key} of an entity type in one service. Keys with {@code resolvable = false} only
 * describe the shape of references and are never used to fetch the entity from that service.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class EntityKey {

  /** Type the key applies to; for inherited keys, the implementing type. */
  private final String typeName;

  private final String service;

  private final SelectionSet fieldSet;

  private final boolean resolvable;

  /** Type the key was declared on; differs from {@link #typeName} for inherited keys. */
  private final String declaringType;

  public EntityKey(String typeName, String service, SelectionSet fieldSet, boolean resolvable) {
    this(typeName, service, fieldSet, resolvable, typeName);
  }

  /** Returns this key as inherited by an implementing or member type. */
  public EntityKey inheritedBy(String implementingType) {
    return new EntityKey(implementingType, service, fieldSet, resolvable, declaringType);
  }

  public boolean isInherited() {
    return !typeName.equals(declaringType);
  }
}
