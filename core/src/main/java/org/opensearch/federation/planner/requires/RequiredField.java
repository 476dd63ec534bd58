/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.requires;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.federation.planner.path.ResponsePath;

/**
 * One field that must be resolved before the field a {@link DependencyClosure} is anchored on.
 * Entries are identified by their position relative to the anchor type, so a field reached through
 * several requirement branches is a single entry.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RequiredField {

  /** Position of the field's parent object relative to the anchor's parent object. */
  @EqualsAndHashCode.Include private final ResponsePath prefix;

  @EqualsAndHashCode.Include private final String parentType;

  @EqualsAndHashCode.Include private final String fieldName;

  /** Service chosen to produce the field. */
  private final String service;

  /** The requiring service declares the field {@code @external}, so it must come from elsewhere. */
  private final boolean external;

  /** Part of the anchor field's own {@code requires} selection, not only of a transitive one. */
  private boolean direct;

  private final boolean inaccessible;

  /** Enclosing field when this entry is nested in a composite required field, else null. */
  private final RequiredField parent;

  private final List<RequiredField> requirements = new ArrayList<>();

  private final List<RequiredField> children = new ArrayList<>();

  public RequiredField(
      ResponsePath prefix,
      String parentType,
      String fieldName,
      String service,
      boolean external,
      boolean direct,
      boolean inaccessible,
      RequiredField parent) {
    this.prefix = prefix;
    this.parentType = parentType;
    this.fieldName = fieldName;
    this.service = service;
    this.external = external;
    this.direct = direct;
    this.inaccessible = inaccessible;
    this.parent = parent;
  }

  /** Entries the owning service needs before it can resolve this field. */
  public List<RequiredField> getRequirements() {
    return Collections.unmodifiableList(requirements);
  }

  /** Entries selected inside this field when it is composite. */
  public List<RequiredField> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public String coordinate() {
    return parentType + "." + fieldName;
  }

  void markDirect() {
    direct = true;
  }

  void addRequirement(RequiredField requirement) {
    if (!requirements.contains(requirement)) {
      requirements.add(requirement);
    }
  }

  void addChild(RequiredField child) {
    if (!children.contains(child)) {
      children.add(child);
    }
  }

  @Override
  public String toString() {
    String path = prefix.isEmpty() ? "" : prefix + ".";
    return path + coordinate() + "@" + service + (external ? " (external)" : "");
  }
}
