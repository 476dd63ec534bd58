/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.federation.exception.InvalidOperationException;
import org.opensearch.federation.schema.GraphModel;
import org.opensearch.federation.schema.SchemaFixtures;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class OperationNormalizerTest {

  private final GraphModel graphModel = SchemaFixtures.storefront();

  private final OperationNormalizer normalizer = new OperationNormalizer(graphModel);

  @Test
  void fragment_spreads_are_expanded_in_place() {
    Operation operation =
        normalize(
            "query Me { me { ...UserFields reviews { body } } }"
                + " fragment UserFields on User { id name }");

    assertEquals("{ me { id name reviews { body } } }", operation.getSelectionSet().toString());
    assertEquals("Me", operation.getName());
  }

  @Test
  void every_selection_set_carries_its_parent_type() {
    Operation operation = normalize("{ me { id } }");

    assertEquals("Query", operation.getSelectionSet().getParentType());
    Field me = operation.getSelectionSet().fields().get(0);
    assertEquals("User", me.getSelectionSet().getParentType());
  }

  @Test
  void fragment_narrowing_an_abstract_type_is_kept() {
    Operation operation =
        normalize("{ topProducts { upc ... on Book { pages } ... on Product { name } } }");

    assertEquals(
        "{ topProducts { upc ... on Book { pages } name } }",
        operation.getSelectionSet().toString());
  }

  @Test
  void fragment_that_never_applies_is_dropped() {
    Operation operation = normalize("{ me { id ... on Book { pages } } }");

    assertEquals("{ me { id } }", operation.getSelectionSet().toString());
  }

  @Test
  void directives_of_a_flattened_fragment_move_to_its_fields() {
    Operation operation =
        normalize("query($skip: Boolean!) { me { ... on User @skip(if: $skip) { id } name } }");

    assertEquals(
        "{ me { id @skip(if: $skip) name } }", operation.getSelectionSet().toString());
    Field id = operation.getSelectionSet().fields().get(0).getSelectionSet().fields().get(0);
    assertEquals(Set.of("skip"), id.getVariableUsages());
  }

  @Test
  void unknown_and_inaccessible_fields_are_rejected() {
    assertThrows(InvalidOperationException.class, () -> normalize("{ me { email } }"));
    assertThrows(InvalidOperationException.class, () -> normalize("{ me { ssn } }"));
  }

  @Test
  void undefined_variables_are_rejected() {
    InvalidOperationException error =
        assertThrows(
            InvalidOperationException.class, () -> normalize("{ me @skip(if: $x) { id } }"));

    assertTrue(error.getMessage().contains("$x"));
  }

  @Test
  void selections_must_match_the_field_type() {
    assertThrows(InvalidOperationException.class, () -> normalize("{ me }"));
    assertThrows(InvalidOperationException.class, () -> normalize("{ me { id { x } } }"));
  }

  @Test
  void fragment_problems_are_rejected() {
    assertThrows(InvalidOperationException.class, () -> normalize("{ me { ...Missing } }"));
    assertThrows(
        InvalidOperationException.class,
        () ->
            normalize(
                "{ me { ...A } } fragment A on User { ...B } fragment B on User { ...A id }"));
    assertThrows(
        InvalidOperationException.class, () -> normalize("{ me { ... on Nowhere { id } } }"));
  }

  @Test
  void operation_type_without_root_is_rejected() {
    assertThrows(InvalidOperationException.class, () -> normalize("subscription { me { id } }"));
  }

  @Test
  void nesting_beyond_the_limit_is_rejected() {
    OperationNormalizer shallow = new OperationNormalizer(graphModel, 2);
    Document document = OperationParser.parseDocument("{ me { reviews { id } } }");

    assertThrows(InvalidOperationException.class, () -> shallow.normalize(document, null));
  }

  private Operation normalize(String source) {
    return normalizer.normalize(OperationParser.parseDocument(source), null);
  }
}
