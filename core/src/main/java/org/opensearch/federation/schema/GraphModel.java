/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.opensearch.federation.exception.InvalidOperationException;
import org.opensearch.federation.operation.Field;
import org.opensearch.federation.operation.OperationParser;
import org.opensearch.federation.operation.OperationType;
import org.opensearch.federation.operation.SelectionSet;

/**
 * Read-only view of the composed unified schema together with per-service ownership: which
 * service resolves which field, which fields are {@code @external}, {@code @requires} and {@code
 * @provides} field sets, and entity keys.
 *
 * <p>Types are stored in an arena keyed by name and reference each other by name, so a model can
 * be shared by concurrent planning calls without copying. Instances are immutable once built.
 */
public class GraphModel {

  private final Map<String, TypeDefinition> types;
  private final Map<String, ServiceDefinition> services;
  private final Map<String, Integer> serviceOrder;
  private final Map<String, List<FieldOwnership>> ownerships;
  private final Map<String, List<EntityKey>> keys;
  private final Map<String, Set<String>> serviceTypes;
  private final Map<String, List<String>> unionsByMember;
  private final Map<OperationType, String> rootTypes;

  private GraphModel(Builder builder) {
    this.types = ImmutableMap.copyOf(builder.buildTypes());
    this.services = ImmutableMap.copyOf(builder.services);
    ImmutableMap.Builder<String, Integer> order = ImmutableMap.builder();
    int index = 0;
    for (String service : services.keySet()) {
      order.put(service, index++);
    }
    this.serviceOrder = order.build();

    Map<String, List<FieldOwnership>> ownershipsByCoordinate = new LinkedHashMap<>();
    for (FieldOwnership ownership : builder.ownerships.values()) {
      ownershipsByCoordinate
          .computeIfAbsent(ownership.coordinate(), c -> new ArrayList<>())
          .add(ownership);
    }
    ImmutableMap.Builder<String, List<FieldOwnership>> sortedOwnerships = ImmutableMap.builder();
    ownershipsByCoordinate.forEach(
        (coordinate, list) -> {
          list.sort((a, b) -> serviceOrder.get(a.getService()) - serviceOrder.get(b.getService()));
          sortedOwnerships.put(coordinate, ImmutableList.copyOf(list));
        });
    this.ownerships = sortedOwnerships.build();

    ImmutableMap.Builder<String, List<EntityKey>> sortedKeys = ImmutableMap.builder();
    builder.keys.forEach(
        (type, list) -> {
          List<EntityKey> copy = new ArrayList<>(list);
          copy.sort((a, b) -> serviceOrder.get(a.getService()) - serviceOrder.get(b.getService()));
          sortedKeys.put(type, ImmutableList.copyOf(copy));
        });
    this.keys = sortedKeys.build();

    ImmutableMap.Builder<String, Set<String>> declared = ImmutableMap.builder();
    builder.serviceTypes.forEach((service, set) -> declared.put(service, ImmutableSet.copyOf(set)));
    this.serviceTypes = declared.build();

    Map<String, List<String>> unions = new LinkedHashMap<>();
    for (TypeDefinition type : types.values()) {
      if (type.getKind() == TypeKind.UNION) {
        for (String member : type.getPossibleTypes()) {
          unions.computeIfAbsent(member, m -> new ArrayList<>()).add(type.getName());
        }
      }
    }
    ImmutableMap.Builder<String, List<String>> unionMembers = ImmutableMap.builder();
    unions.forEach((member, list) -> unionMembers.put(member, ImmutableList.copyOf(list)));
    this.unionsByMember = unionMembers.build();

    EnumMap<OperationType, String> roots = new EnumMap<>(OperationType.class);
    for (OperationType operationType : OperationType.values()) {
      String configured = builder.rootTypes.get(operationType);
      String defaultName =
          operationType.getKeyword().substring(0, 1).toUpperCase()
              + operationType.getKeyword().substring(1);
      if (configured != null) {
        roots.put(operationType, configured);
      } else if (types.containsKey(defaultName)) {
        roots.put(operationType, defaultName);
      }
    }
    this.rootTypes = roots;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Services in declaration order. Declaration order breaks every ownership tie. */
  public List<ServiceDefinition> getServices() {
    return ImmutableList.copyOf(services.values());
  }

  public Optional<ServiceDefinition> service(String name) {
    return Optional.ofNullable(services.get(name));
  }

  /** Position of a service in declaration order. */
  public int serviceOrder(String service) {
    Integer order = serviceOrder.get(service);
    if (order == null) {
      throw new IllegalArgumentException("Unknown service: " + service);
    }
    return order;
  }

  public Map<String, TypeDefinition> getTypes() {
    return types;
  }

  public Optional<TypeDefinition> findType(String name) {
    return Optional.ofNullable(types.get(name));
  }

  /**
   * Returns a type by name.
   *
   * @throws IllegalArgumentException if the type does not exist
   */
  public TypeDefinition type(String name) {
    TypeDefinition type = types.get(name);
    if (type == null) {
      throw new IllegalArgumentException("Unknown type: " + name);
    }
    return type;
  }

  public Optional<FieldDefinition> field(String typeName, String fieldName) {
    return findType(typeName).flatMap(type -> type.field(fieldName));
  }

  /** Root type for an operation type, if the schema defines one. */
  public Optional<String> rootType(OperationType operationType) {
    return Optional.ofNullable(rootTypes.get(operationType));
  }

  public boolean isRootType(String typeName) {
    return rootTypes.containsValue(typeName);
  }

  /** All declarations of a field across services, in service declaration order. */
  public List<FieldOwnership> ownerships(String typeName, String fieldName) {
    return ownerships.getOrDefault(typeName + "." + fieldName, List.of());
  }

  /** Declarations of a field by services that can resolve it (not {@code @external}). */
  public List<FieldOwnership> resolvers(String typeName, String fieldName) {
    return ownerships(typeName, fieldName).stream()
        .filter(ownership -> !ownership.isExternal())
        .collect(Collectors.toList());
  }

  public Optional<FieldOwnership> ownership(String typeName, String fieldName, String service) {
    return ownerships(typeName, fieldName).stream()
        .filter(ownership -> ownership.getService().equals(service))
        .findFirst();
  }

  /**
   * Whether a service resolves a field itself. {@code __typename} is resolvable by every service
   * declaring the type.
   */
  public boolean canResolve(String service, String typeName, String fieldName) {
    if (FieldDefinition.TYPENAME.getName().equals(fieldName)) {
      return declares(service, typeName);
    }
    return ownership(typeName, fieldName, service).map(o -> !o.isExternal()).orElse(false);
  }

  /** Whether a service's schema declares a type at all. */
  public boolean declares(String service, String typeName) {
    return serviceTypes.getOrDefault(service, Set.of()).contains(typeName);
  }

  /**
   * Keys a service declares for a type. An object type without keys of its own in that service
   * inherits the keys the service declares on its interfaces, then on the unions containing it.
   */
  public List<EntityKey> keys(String typeName, String service) {
    List<EntityKey> declared =
        keys.getOrDefault(typeName, List.of()).stream()
            .filter(key -> key.getService().equals(service))
            .collect(Collectors.toList());
    if (!declared.isEmpty()) {
      return declared;
    }
    TypeDefinition type = types.get(typeName);
    if (type == null || type.getKind() != TypeKind.OBJECT) {
      return List.of();
    }
    List<EntityKey> inherited = new ArrayList<>();
    List<String> supertypes = new ArrayList<>(type.getInterfaces());
    supertypes.addAll(unionsByMember.getOrDefault(typeName, List.of()));
    for (String supertype : supertypes) {
      for (EntityKey key : keys.getOrDefault(supertype, List.of())) {
        if (key.getService().equals(service)) {
          inherited.add(key.inheritedBy(typeName));
        }
      }
    }
    return inherited;
  }

  /** Keys usable to fetch the type from a service. */
  public List<EntityKey> resolvableKeys(String typeName, String service) {
    return keys(typeName, service).stream()
        .filter(EntityKey::isResolvable)
        .collect(Collectors.toList());
  }

  /** Whether any service declares a key for the type. */
  public boolean isEntity(String typeName) {
    return keys.containsKey(typeName);
  }

  /** Object types a value of the given type can have at runtime. */
  public List<String> possibleRuntimeTypes(String typeName) {
    TypeDefinition type = type(typeName);
    if (type.getKind() == TypeKind.OBJECT) {
      return List.of(typeName);
    }
    return type.getPossibleTypes();
  }

  /** Runtime types of an abstract type that a given service knows about. */
  public List<String> possibleRuntimeTypes(String typeName, String service) {
    return possibleRuntimeTypes(typeName).stream()
        .filter(runtimeType -> declares(service, runtimeType))
        .collect(Collectors.toList());
  }

  /**
   * Whether {@code candidate} is {@code parent} or one of its subtypes (implementing type,
   * interface extending it, or union member).
   */
  public boolean isSubtype(String parent, String candidate) {
    if (parent.equals(candidate)) {
      return true;
    }
    TypeDefinition parentType = types.get(parent);
    if (parentType == null || !parentType.isAbstract()) {
      return false;
    }
    if (parentType.getKind() == TypeKind.UNION) {
      return parentType.getPossibleTypes().contains(candidate);
    }
    Deque<String> pending = new ArrayDeque<>();
    Set<String> seen = new HashSet<>();
    pending.push(candidate);
    while (!pending.isEmpty()) {
      TypeDefinition current = types.get(pending.pop());
      if (current == null || !seen.add(current.getName())) {
        continue;
      }
      if (current.getInterfaces().contains(parent)) {
        return true;
      }
      current.getInterfaces().forEach(pending::push);
    }
    return false;
  }

  /** Accumulates schema facts; {@link #build()} validates cross references. */
  public static class Builder {
    private static final List<String> BUILT_IN_SCALARS =
        List.of("ID", "String", "Int", "Float", "Boolean");

    private final Map<String, ServiceDefinition> services = new LinkedHashMap<>();
    private final Map<String, TypeKind> typeKinds = new LinkedHashMap<>();
    private final Map<String, Map<String, FieldDefinition>> fields = new LinkedHashMap<>();
    private final Map<String, Set<String>> interfaces = new LinkedHashMap<>();
    private final Map<String, Set<String>> unionMembers = new LinkedHashMap<>();
    private final Map<String, FieldOwnership> ownerships = new LinkedHashMap<>();
    private final Map<String, List<EntityKey>> keys = new LinkedHashMap<>();
    private final Map<String, Set<String>> serviceTypes = new LinkedHashMap<>();
    private final Map<OperationType, String> rootTypes = new EnumMap<>(OperationType.class);

    Builder() {
      for (String scalar : BUILT_IN_SCALARS) {
        type(scalar, TypeKind.SCALAR);
      }
    }

    public Builder service(String name) {
      return service(name, null);
    }

    public Builder service(String name, String url) {
      services.putIfAbsent(name, new ServiceDefinition(name, url));
      serviceTypes.putIfAbsent(name, new LinkedHashSet<>());
      return this;
    }

    /** Declares a type, or confirms the kind of an already declared type. */
    public Builder type(String name, TypeKind kind) {
      TypeKind existing = typeKinds.putIfAbsent(name, kind);
      if (existing != null && existing != kind) {
        throw new IllegalArgumentException(
            String.format("Type %s declared as both %s and %s", name, existing, kind));
      }
      fields.putIfAbsent(name, new LinkedHashMap<>());
      return this;
    }

    public Builder field(String typeName, String fieldName, String typeReference) {
      return field(typeName, fieldName, typeReference, false);
    }

    public Builder field(
        String typeName, String fieldName, String typeReference, boolean inaccessible) {
      requireType(typeName);
      FieldDefinition existing = fields.get(typeName).get(fieldName);
      fields
          .get(typeName)
          .put(
              fieldName,
              new FieldDefinition(
                  fieldName,
                  TypeReference.parse(typeReference),
                  inaccessible || (existing != null && existing.isInaccessible())));
      return this;
    }

    public Builder implementsInterface(String typeName, String interfaceName) {
      requireType(typeName);
      interfaces.computeIfAbsent(typeName, t -> new LinkedHashSet<>()).add(interfaceName);
      return this;
    }

    public Builder unionMember(String unionName, String memberName) {
      requireType(unionName);
      unionMembers.computeIfAbsent(unionName, u -> new LinkedHashSet<>()).add(memberName);
      return this;
    }

    public Builder rootType(OperationType operationType, String typeName) {
      rootTypes.put(operationType, typeName);
      return this;
    }

    /** Records that a service's schema declares a type, without owning any of its fields. */
    public Builder declare(String service, String typeName) {
      requireService(service).add(typeName);
      return this;
    }

    /** Declares that a service resolves a field. */
    public Builder owner(String typeName, String fieldName, String service) {
      return ownership(typeName, fieldName, service, false, null, null);
    }

    /** Declares a field as {@code @external} in a service. */
    public Builder external(String typeName, String fieldName, String service) {
      return ownership(typeName, fieldName, service, true, null, null);
    }

    /** Declares that a service resolves a field once the given field set is available. */
    public Builder requires(String typeName, String fieldName, String service, String fieldSet) {
      return ownership(typeName, fieldName, service, false, fieldSet, null);
    }

    /** Declares that a service resolves a field and can provide the given nested fields. */
    public Builder provides(String typeName, String fieldName, String service, String fieldSet) {
      return ownership(typeName, fieldName, service, false, null, fieldSet);
    }

    /**
     * Declares a field in a service with all of its federation annotations.
     *
     * @param requires {@code @requires} field set text, or null
     * @param provides {@code @provides} field set text, or null
     */
    public Builder ownership(
        String typeName,
        String fieldName,
        String service,
        boolean external,
        String requires,
        String provides) {
      requireService(service).add(typeName);
      String coordinate = typeName + "." + fieldName + "@" + service;
      FieldOwnership previous = ownerships.get(coordinate);
      SelectionSet requiresSet =
          requires != null
              ? parseFieldSet(requires, coordinate)
              : previous != null ? previous.getRequires() : null;
      SelectionSet providesSet =
          provides != null
              ? parseFieldSet(provides, coordinate)
              : previous != null ? previous.getProvides() : null;
      ownerships.put(
          coordinate,
          new FieldOwnership(typeName, fieldName, service, external, requiresSet, providesSet));
      return this;
    }

    public Builder key(String typeName, String service, String fieldSet) {
      return key(typeName, service, fieldSet, true);
    }

    public Builder key(String typeName, String service, String fieldSet, boolean resolvable) {
      requireService(service).add(typeName);
      keys.computeIfAbsent(typeName, t -> new ArrayList<>())
          .add(
              new EntityKey(
                  typeName,
                  service,
                  parseFieldSet(fieldSet, typeName + "@" + service),
                  resolvable));
      return this;
    }

    /**
     * Validates cross references and freezes the model.
     *
     * @throws IllegalArgumentException if an ownership, key or field set references an unknown
     *     service, type or field
     */
    public GraphModel build() {
      for (FieldOwnership ownership : ownerships.values()) {
        requireField(ownership.getTypeName(), ownership.getFieldName());
        if (ownership.hasRequires()) {
          validateFieldSet(ownership.getTypeName(), ownership.getRequires());
        }
        if (ownership.hasProvides()) {
          String providedType =
              fields
                  .get(ownership.getTypeName())
                  .get(ownership.getFieldName())
                  .getType()
                  .getNamedType();
          validateFieldSet(providedType, ownership.getProvides());
        }
      }
      keys.forEach(
          (type, list) -> {
            requireType(type);
            list.forEach(key -> validateFieldSet(type, key.getFieldSet()));
          });
      interfaces.forEach((type, list) -> list.forEach(this::requireType));
      unionMembers.forEach((type, list) -> list.forEach(this::requireType));
      serviceTypes.forEach((service, set) -> set.forEach(this::requireType));
      rootTypes.values().forEach(this::requireType);
      return new GraphModel(this);
    }

    private Map<String, TypeDefinition> buildTypes() {
      Map<String, TypeDefinition> built = new LinkedHashMap<>();
      for (Map.Entry<String, TypeKind> entry : typeKinds.entrySet()) {
        String name = entry.getKey();
        List<String> possibleTypes = new ArrayList<>();
        if (entry.getValue() == TypeKind.UNION) {
          possibleTypes.addAll(unionMembers.getOrDefault(name, Set.of()));
        } else if (entry.getValue() == TypeKind.INTERFACE) {
          for (Map.Entry<String, TypeKind> candidate : typeKinds.entrySet()) {
            if (candidate.getValue() == TypeKind.OBJECT
                && implementsTransitively(candidate.getKey(), name)) {
              possibleTypes.add(candidate.getKey());
            }
          }
        }
        built.put(
            name,
            new TypeDefinition(
                name,
                entry.getValue(),
                fields.get(name),
                new ArrayList<>(interfaces.getOrDefault(name, Set.of())),
                possibleTypes));
      }
      return built;
    }

    private boolean implementsTransitively(String typeName, String interfaceName) {
      Deque<String> pending = new ArrayDeque<>(interfaces.getOrDefault(typeName, Set.of()));
      Set<String> seen = new HashSet<>();
      while (!pending.isEmpty()) {
        String current = pending.pop();
        if (current.equals(interfaceName)) {
          return true;
        }
        if (seen.add(current)) {
          pending.addAll(interfaces.getOrDefault(current, Set.of()));
        }
      }
      return false;
    }

    private void validateFieldSet(String typeName, SelectionSet fieldSet) {
      Deque<Map.Entry<String, SelectionSet>> pending = new ArrayDeque<>();
      pending.push(Map.entry(typeName, fieldSet));
      while (!pending.isEmpty()) {
        Map.Entry<String, SelectionSet> next = pending.pop();
        for (Field field : next.getValue().fields()) {
          if (FieldDefinition.TYPENAME.getName().equals(field.getName())) {
            continue;
          }
          FieldDefinition definition = requireField(next.getKey(), field.getName());
          if (!field.isLeaf()) {
            pending.push(Map.entry(definition.getType().getNamedType(), field.getSelectionSet()));
          }
        }
      }
    }

    private SelectionSet parseFieldSet(String fieldSet, String context) {
      try {
        return OperationParser.parseFieldSet(fieldSet);
      } catch (InvalidOperationException e) {
        throw new IllegalArgumentException(
            "Invalid field set \"" + fieldSet + "\" on " + context, e);
      }
    }

    private Set<String> requireService(String service) {
      Set<String> declared = serviceTypes.get(service);
      if (declared == null) {
        throw new IllegalArgumentException("Unknown service: " + service);
      }
      return declared;
    }

    private void requireType(String typeName) {
      if (!typeKinds.containsKey(typeName)) {
        throw new IllegalArgumentException("Unknown type: " + typeName);
      }
    }

    private FieldDefinition requireField(String typeName, String fieldName) {
      requireType(typeName);
      FieldDefinition field = fields.get(typeName).get(fieldName);
      if (field == null) {
        throw new IllegalArgumentException("Unknown field: " + typeName + "." + fieldName);
      }
      return field;
    }
  }
}
