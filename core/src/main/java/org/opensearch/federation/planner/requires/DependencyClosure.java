/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.requires;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.federation.planner.path.ResponsePath;

/**
 * Transitive {@code @requires} closure of one field in one service. Entries are ordered so that
 * every entry follows the entries it requires and the field it is nested in.
 */
@Getter
@ToString
public class DependencyClosure {

  private final String typeName;

  private final String fieldName;

  private final String service;

  private final List<RequiredField> entries;

  /** Top-level fields of the anchor's own {@code requires} selection, in selection order. */
  private final List<RequiredField> directRequirements;

  public DependencyClosure(
      String typeName,
      String fieldName,
      String service,
      List<RequiredField> entries,
      List<RequiredField> directRequirements) {
    this.typeName = typeName;
    this.fieldName = fieldName;
    this.service = service;
    this.entries = ImmutableList.copyOf(entries);
    this.directRequirements = ImmutableList.copyOf(directRequirements);
  }

  public static DependencyClosure empty(String typeName, String fieldName, String service) {
    return new DependencyClosure(typeName, fieldName, service, List.of(), List.of());
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /** Entries the requiring service cannot resolve itself. */
  public List<RequiredField> getExternalRequirements() {
    return entries.stream().filter(RequiredField::isExternal).collect(Collectors.toList());
  }

  public Optional<RequiredField> entry(ResponsePath prefix, String parentType, String field) {
    return entries.stream()
        .filter(
            entry ->
                entry.getPrefix().equals(prefix)
                    && entry.getParentType().equals(parentType)
                    && entry.getFieldName().equals(field))
        .findFirst();
  }
}
