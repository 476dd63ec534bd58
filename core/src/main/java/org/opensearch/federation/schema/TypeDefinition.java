/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * A named type of the unified schema. Types reference each other by name only; the {@link
 * GraphModel} resolves names.
 */
@Getter
@ToString
public class TypeDefinition {

  private final String name;

  private final TypeKind kind;

  private final Map<String, FieldDefinition> fields;

  /** Interfaces implemented by an object or interface type, in declaration order. */
  private final List<String> interfaces;

  /** Object types an interface or union can resolve to, in declaration order. */
  private final List<String> possibleTypes;

  public TypeDefinition(
      String name,
      TypeKind kind,
      Map<String, FieldDefinition> fields,
      List<String> interfaces,
      List<String> possibleTypes) {
    this.name = name;
    this.kind = kind;
    this.fields = ImmutableMap.copyOf(fields);
    this.interfaces = ImmutableList.copyOf(interfaces);
    this.possibleTypes = ImmutableList.copyOf(possibleTypes);
  }

  /** Looks up a field, including the implicit {@code __typename} of composite types. */
  public Optional<FieldDefinition> field(String fieldName) {
    if (FieldDefinition.TYPENAME.getName().equals(fieldName) && kind.isComposite()) {
      return Optional.of(FieldDefinition.TYPENAME);
    }
    return Optional.ofNullable(fields.get(fieldName));
  }

  public boolean isAbstract() {
    return kind.isAbstract();
  }
}
