/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.path;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.opensearch.federation.schema.GraphModel;

/**
 * Selects the values a {@link ResponsePath} addresses in a JSON response. This is the addressing
 * contract executors rely on when merging partial results:
 *
 * <ul>
 *   <li>a key descends into an object field, and into every element when the value is a list;
 *   <li>{@code @} fans out over every element of a list;
 *   <li>{@code ... on T} keeps a value whose {@code __typename} is {@code T} or a subtype of it.
 *       On a list the condition is checked per element. A value without {@code __typename} is
 *       kept.
 * </ul>
 *
 * <p>Explicit JSON {@code null} values are never selected, including a null in the last slot of
 * the path. Callers that need to visit null slots, for example to null out a failed entity, walk
 * the parent values instead.
 */
@RequiredArgsConstructor
public class ResponsePathMatcher {

  private static final String TYPENAME = "__typename";

  private final GraphModel graphModel;

  /**
   * Returns the values at {@code path}, in document order. Nulls and missing fields are skipped at
   * every step, so the result never contains a JSON {@code null}.
   */
  public List<JsonNode> select(JsonNode root, ResponsePath path) {
    List<JsonNode> current = new ArrayList<>();
    if (root != null && !root.isNull()) {
      current.add(root);
    }
    for (PathElement element : path.getElements()) {
      List<JsonNode> next = new ArrayList<>();
      for (JsonNode value : current) {
        apply(element, value, next);
      }
      current = next;
    }
    return current;
  }

  private void apply(PathElement element, JsonNode value, List<JsonNode> out) {
    if (element instanceof PathElement.Key) {
      String name = ((PathElement.Key) element).getName();
      if (value.isArray()) {
        value.forEach(item -> apply(element, item, out));
      } else if (value.isObject()) {
        addIfPresent(value.get(name), out);
      }
    } else if (element instanceof PathElement.AnyIndex) {
      if (value.isArray()) {
        value.forEach(item -> addIfPresent(item, out));
      }
    } else if (element instanceof PathElement.TypeCondition) {
      String typeName = ((PathElement.TypeCondition) element).getTypeName();
      if (value.isArray()) {
        value.forEach(item -> apply(element, item, out));
      } else if (value.isObject() && matchesType(value, typeName)) {
        out.add(value);
      }
    }
  }

  private boolean matchesType(JsonNode value, String typeName) {
    JsonNode typename = value.get(TYPENAME);
    if (typename == null || !typename.isTextual()) {
      return true;
    }
    return graphModel.isSubtype(typeName, typename.asText());
  }

  private static void addIfPresent(JsonNode value, List<JsonNode> out) {
    if (value != null && !value.isNull()) {
      out.add(value);
    }
  }
}
