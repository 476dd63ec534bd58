/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.federation.exception.AmbiguousOwnershipException;
import org.opensearch.federation.exception.InvalidOperationException;
import org.opensearch.federation.exception.PlanningErrorCode;
import org.opensearch.federation.exception.RequirementCycleException;
import org.opensearch.federation.exception.UnreachableRequirementException;
import org.opensearch.federation.operation.OperationType;
import org.opensearch.federation.planner.plan.FetchDataRewrite;
import org.opensearch.federation.planner.plan.FetchNode;
import org.opensearch.federation.planner.plan.FlattenNode;
import org.opensearch.federation.planner.plan.ParallelNode;
import org.opensearch.federation.planner.plan.PlanNode;
import org.opensearch.federation.planner.plan.QueryPlan;
import org.opensearch.federation.planner.plan.QueryPlanSerializer;
import org.opensearch.federation.planner.plan.SequenceNode;
import org.opensearch.federation.planner.path.ResponsePath;
import org.opensearch.federation.schema.GraphModel;
import org.opensearch.federation.schema.SchemaFixtures;
import org.opensearch.federation.schema.TypeKind;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryPlannerTest {

  private static final String ENTITIES_PREFIX =
      "query($representations: [_Any!]!) { _entities(representations: $representations) ";

  @Test
  void required_field_from_another_service_is_fetched_in_between() {
    QueryPlan plan =
        new QueryPlanner(SchemaFixtures.requiresAcrossServices()).plan("{ t { b } }", null);

    List<PlanNode> steps = sequence(plan.getNode());
    assertEquals(3, steps.size());

    FetchNode root = fetch(steps.get(0));
    assertEquals("A", root.getServiceName());
    assertEquals("{ t { __typename id } }", root.getOperation());
    assertEquals(OperationType.QUERY, root.getOperationKind());
    assertNull(root.getRequires());

    FetchNode producer = flattened(steps.get(1), ResponsePath.of("t"));
    assertEquals("B", producer.getServiceName());
    assertEquals("... on T { __typename id }", producer.getRequires());
    assertEquals(ENTITIES_PREFIX + "{ ... on T { a } } }", producer.getOperation());

    FetchNode consumer = flattened(steps.get(2), ResponsePath.of("t"));
    assertEquals("C", consumer.getServiceName());
    assertEquals("... on T { __typename id a }", consumer.getRequires());
    assertEquals(ENTITIES_PREFIX + "{ ... on T { b } } }", consumer.getOperation());

    assertEquals(3, plan.getStatistics().getGroupsBuilt());
    assertEquals(3, plan.getStatistics().getGroupsEmitted());
  }

  @Test
  void entity_fetches_under_a_list_flatten_over_every_element() {
    QueryPlan plan =
        new QueryPlanner(SchemaFixtures.requiresAcrossServices()).plan("{ ts { b } }", null);

    List<PlanNode> steps = sequence(plan.getNode());
    assertEquals("{ ts { __typename id } }", fetch(steps.get(0)).getOperation());
    assertEquals("B", flattened(steps.get(1), ResponsePath.of("ts", "@")).getServiceName());
    assertEquals("C", flattened(steps.get(2), ResponsePath.of("ts", "@")).getServiceName());
  }

  @Test
  void independent_requirements_are_fetched_in_parallel() {
    QueryPlan plan = new QueryPlanner(SchemaFixtures.diamond()).plan("{ t { d } }", null);

    List<PlanNode> steps = sequence(plan.getNode());
    assertEquals(3, steps.size());
    assertEquals("A", fetch(steps.get(0)).getServiceName());

    ParallelNode parallel = assertInstanceOf(ParallelNode.class, steps.get(1));
    assertEquals(2, parallel.getNodes().size());
    FetchNode x = flattened(parallel.getNodes().get(0), ResponsePath.of("t"));
    FetchNode y = flattened(parallel.getNodes().get(1), ResponsePath.of("t"));
    assertEquals("X", x.getServiceName());
    assertEquals(ENTITIES_PREFIX + "{ ... on T { x } } }", x.getOperation());
    assertEquals("Y", y.getServiceName());
    assertEquals(ENTITIES_PREFIX + "{ ... on T { y } } }", y.getOperation());

    FetchNode d = flattened(steps.get(2), ResponsePath.of("t"));
    assertEquals("D", d.getServiceName());
    assertEquals("... on T { __typename id x y }", d.getRequires());
  }

  @Test
  void requirement_chain_across_n_services_runs_n_stages_in_order() {
    int length = 4;
    QueryPlan plan =
        new QueryPlanner(SchemaFixtures.requiresChain(length)).plan("{ t { f4 } }", null);

    List<PlanNode> steps = sequence(plan.getNode());
    assertEquals(length, steps.size());
    FetchNode root = fetch(steps.get(0));
    assertEquals("S1", root.getServiceName());
    assertEquals("{ t { f1 __typename id } }", root.getOperation());
    for (int k = 2; k <= length; k++) {
      FetchNode stage = flattened(steps.get(k - 1), ResponsePath.of("t"));
      assertEquals("S" + k, stage.getServiceName());
      assertEquals("... on T { __typename id f" + (k - 1) + " }", stage.getRequires());
      assertEquals(ENTITIES_PREFIX + "{ ... on T { f" + k + " } } }", stage.getOperation());
    }
  }

  @Test
  void requirement_shared_by_parallel_fields_is_fetched_once() {
    QueryPlan plan =
        new QueryPlanner(SchemaFixtures.sharedRequirementDiamond()).plan("{ t { d } }", null);

    List<PlanNode> steps = sequence(plan.getNode());
    assertEquals(4, steps.size());
    assertEquals("A", fetch(steps.get(0)).getServiceName());

    FetchNode z = flattened(steps.get(1), ResponsePath.of("t"));
    assertEquals("Z", z.getServiceName());
    assertEquals(ENTITIES_PREFIX + "{ ... on T { z } } }", z.getOperation());

    ParallelNode parallel = assertInstanceOf(ParallelNode.class, steps.get(2));
    assertEquals(2, parallel.getNodes().size());
    FetchNode x = flattened(parallel.getNodes().get(0), ResponsePath.of("t"));
    FetchNode y = flattened(parallel.getNodes().get(1), ResponsePath.of("t"));
    assertEquals("X", x.getServiceName());
    assertEquals("... on T { __typename id z }", x.getRequires());
    assertEquals("Y", y.getServiceName());
    assertEquals("... on T { __typename id z }", y.getRequires());

    FetchNode d = flattened(steps.get(3), ResponsePath.of("t"));
    assertEquals("D", d.getServiceName());
    assertEquals("... on T { __typename id x y }", d.getRequires());
    assertEquals(5, plan.getStatistics().getGroupsEmitted());
  }

  @Test
  void entity_fetch_uses_the_key_the_parent_service_can_resolve() {
    QueryPlan plan = new QueryPlanner(twoKeySchema(false)).plan("{ t { name } }", null);

    List<PlanNode> steps = sequence(plan.getNode());
    assertEquals(2, steps.size());
    assertEquals("{ t { __typename id } }", fetch(steps.get(0)).getOperation());
    FetchNode entities = flattened(steps.get(1), ResponsePath.of("t"));
    assertEquals("B", entities.getServiceName());
    assertEquals("... on T { __typename id }", entities.getRequires());
  }

  @Test
  void entity_fetch_prefers_a_key_already_selected_over_the_first_declared_one() {
    QueryPlan plan = new QueryPlanner(twoKeySchema(true)).plan("{ t { upc name } }", null);

    List<PlanNode> steps = sequence(plan.getNode());
    assertEquals(2, steps.size());
    FetchNode entities = flattened(steps.get(1), ResponsePath.of("t"));
    assertEquals("B", entities.getServiceName());
    assertEquals("... on T { __typename upc }", entities.getRequires());
  }

  @Test
  void inaccessible_field_is_fetched_when_a_requirement_needs_it() {
    GraphModel graphModel =
        GraphModel.builder()
            .service("A")
            .service("B")
            .service("C")
            .type("Query", TypeKind.OBJECT)
            .type("T", TypeKind.OBJECT)
            .field("Query", "t", "T")
            .field("T", "id", "ID!")
            .field("T", "secret", "String", true)
            .field("T", "b", "String")
            .owner("Query", "t", "A")
            .key("T", "A", "id")
            .owner("T", "id", "A")
            .key("T", "B", "id")
            .owner("T", "id", "B")
            .owner("T", "secret", "B")
            .key("T", "C", "id")
            .owner("T", "id", "C")
            .external("T", "secret", "C")
            .requires("T", "b", "C", "secret")
            .build();
    QueryPlanner planner = new QueryPlanner(graphModel);

    List<PlanNode> steps = sequence(planner.plan("{ t { b } }", null).getNode());
    assertEquals(
        ENTITIES_PREFIX + "{ ... on T { secret } } }",
        flattened(steps.get(1), ResponsePath.of("t")).getOperation());
    assertEquals(
        "... on T { __typename id secret }",
        flattened(steps.get(2), ResponsePath.of("t")).getRequires());

    assertThrows(InvalidOperationException.class, () -> planner.plan("{ t { secret } }", null));
  }

  @Test
  void identical_inputs_serialize_to_identical_plans() {
    String query = "query Top { topProducts { name shippingEstimate } me { reviews { body } } }";
    QueryPlanSerializer serializer = new QueryPlanSerializer();

    String first =
        serializer.serialize(new QueryPlanner(SchemaFixtures.storefront()).plan(query, null));
    String second =
        serializer.serialize(new QueryPlanner(SchemaFixtures.storefront()).plan(query, null));

    assertEquals(first, second);
  }

  @Test
  void merging_pass_does_not_change_groups_already_shared() {
    String query = "{ topProducts { name inStock shippingEstimate } me { reviews { body } } }";
    GraphModel storefront = SchemaFixtures.storefront();
    QueryPlanSerializer serializer = new QueryPlanSerializer();

    QueryPlan merged =
        new QueryPlanner(storefront, new QueryPlannerConfig(128, true, true)).plan(query, null);
    QueryPlan unmerged =
        new QueryPlanner(storefront, new QueryPlannerConfig(128, false, true)).plan(query, null);

    assertEquals(serializer.serialize(unmerged), serializer.serialize(merged));
    assertEquals(0, merged.getStatistics().getGroupsMerged());
  }

  @Test
  void abstract_field_dispatches_over_runtime_types() {
    QueryPlan plan =
        new QueryPlanner(SchemaFixtures.storefront())
            .plan("{ topProducts { name shippingEstimate } }", null);

    List<PlanNode> steps = sequence(plan.getNode());
    assertEquals(2, steps.size());
    FetchNode root = fetch(steps.get(0));
    assertEquals("products", root.getServiceName());
    assertEquals(
        "{ topProducts { name ... on Book { price weight __typename upc }"
            + " ... on Movie { price weight __typename upc } } }",
        root.getOperation());

    ParallelNode parallel = assertInstanceOf(ParallelNode.class, steps.get(1));
    FetchNode book =
        flattened(parallel.getNodes().get(0), ResponsePath.of("topProducts", "@", "... on Book"));
    assertEquals("inventory", book.getServiceName());
    assertEquals("... on Book { __typename upc price weight }", book.getRequires());
    assertEquals(ENTITIES_PREFIX + "{ ... on Book { shippingEstimate } } }", book.getOperation());
    FetchNode movie =
        flattened(parallel.getNodes().get(1), ResponsePath.of("topProducts", "@", "... on Movie"));
    assertEquals("... on Movie { __typename upc price weight }", movie.getRequires());
  }

  @Test
  void provided_fields_stay_in_the_providing_fetch() {
    QueryPlan plan =
        new QueryPlanner(SchemaFixtures.storefront())
            .plan("{ me { name reviews { author { name } } } }", null);

    List<PlanNode> steps = sequence(plan.getNode());
    assertEquals(2, steps.size());
    assertEquals("{ me { name __typename id } }", fetch(steps.get(0)).getOperation());
    FetchNode reviews = flattened(steps.get(1), ResponsePath.of("me"));
    assertEquals(
        ENTITIES_PREFIX + "{ ... on User { reviews { author { name } } } } }",
        reviews.getOperation());
  }

  @Test
  void mutation_root_fields_run_in_document_order() {
    QueryPlan plan =
        new QueryPlanner(SchemaFixtures.storefront())
            .plan("mutation { login { name } addReview { body } logout }", null);

    List<PlanNode> steps = sequence(plan.getNode());
    assertEquals(3, steps.size());
    assertEquals("mutation { login { name } }", fetch(steps.get(0)).getOperation());
    assertEquals("reviews", fetch(steps.get(1)).getServiceName());
    assertEquals("mutation { addReview { body } }", fetch(steps.get(1)).getOperation());
    assertEquals("mutation { logout }", fetch(steps.get(2)).getOperation());
    assertEquals(OperationType.MUTATION, fetch(steps.get(2)).getOperationKind());
    assertEquals(3, plan.getStatistics().getGraphCount());
  }

  @Test
  void named_operation_names_subgraph_operations_and_forwards_variables() {
    GraphModel graphModel = SchemaFixtures.requiresAcrossServices();
    String query = "query GetT($id: ID!) { t(id: $id) { b } }";

    List<PlanNode> steps = sequence(new QueryPlanner(graphModel).plan(query, "GetT").getNode());
    FetchNode root = fetch(steps.get(0));
    assertEquals("GetT__A__0", root.getOperationName());
    assertEquals(List.of("id"), root.getVariableUsages());
    assertEquals(
        "query GetT__A__0($id: ID!) { t(id: $id) { __typename id } }", root.getOperation());
    FetchNode entity = flattened(steps.get(1), ResponsePath.of("t"));
    assertEquals("GetT__B__1", entity.getOperationName());
    assertTrue(entity.getVariableUsages().isEmpty());
    assertTrue(entity.getOperation().startsWith("query GetT__B__1($representations: [_Any!]!)"));

    QueryPlannerConfig anonymous = new QueryPlannerConfig(128, true, false);
    FetchNode unnamed =
        fetch(sequence(new QueryPlanner(graphModel, anonymous).plan(query, null).getNode()).get(0));
    assertNull(unnamed.getOperationName());
    assertEquals("query($id: ID!) { t(id: $id) { __typename id } }", unnamed.getOperation());
  }

  @Test
  void root_typename_alone_needs_no_fetch() {
    QueryPlan plan =
        new QueryPlanner(SchemaFixtures.requiresAcrossServices()).plan("{ __typename }", null);

    assertNull(plan.getNode());
    assertFalse(plan.root().isPresent());
    assertEquals(
        "{\"kind\":\"QueryPlan\",\"node\":null}", new QueryPlanSerializer().serialize(plan));
  }

  @Test
  void requirement_without_resolving_service_is_unreachable() {
    GraphModel graphModel =
        GraphModel.builder()
            .service("A")
            .service("C")
            .type("Query", TypeKind.OBJECT)
            .type("T", TypeKind.OBJECT)
            .field("Query", "t", "T")
            .field("T", "id", "ID!")
            .field("T", "a", "String")
            .field("T", "b", "String")
            .owner("Query", "t", "A")
            .key("T", "A", "id")
            .owner("T", "id", "A")
            .key("T", "C", "id")
            .owner("T", "id", "C")
            .external("T", "a", "C")
            .requires("T", "b", "C", "a")
            .build();

    UnreachableRequirementException e =
        assertThrows(
            UnreachableRequirementException.class,
            () -> new QueryPlanner(graphModel).plan("{ t { b } }", null));
    assertEquals("T", e.getTypeName());
    assertEquals("a", e.getFieldName());
    assertEquals(PlanningErrorCode.UNREACHABLE_REQUIREMENT, e.getErrorCode());
  }

  @Test
  void field_owned_by_a_service_without_keys_is_unreachable() {
    GraphModel graphModel =
        GraphModel.builder()
            .service("A")
            .service("B")
            .type("Query", TypeKind.OBJECT)
            .type("T", TypeKind.OBJECT)
            .field("Query", "t", "T")
            .field("T", "id", "ID!")
            .field("T", "hidden", "String")
            .owner("Query", "t", "A")
            .key("T", "A", "id")
            .owner("T", "id", "A")
            .owner("T", "hidden", "B")
            .build();

    assertThrows(
        UnreachableRequirementException.class,
        () -> new QueryPlanner(graphModel).plan("{ t { hidden } }", null));
  }

  @Test
  void mutually_requiring_fields_are_reported_as_a_cycle() {
    GraphModel graphModel =
        GraphModel.builder()
            .service("R")
            .service("S1")
            .service("S2")
            .type("Query", TypeKind.OBJECT)
            .type("T", TypeKind.OBJECT)
            .field("Query", "t", "T")
            .field("T", "id", "ID!")
            .field("T", "x", "String")
            .field("T", "y", "String")
            .owner("Query", "t", "R")
            .key("T", "R", "id")
            .owner("T", "id", "R")
            .key("T", "S1", "id")
            .owner("T", "id", "S1")
            .external("T", "y", "S1")
            .requires("T", "x", "S1", "y")
            .key("T", "S2", "id")
            .owner("T", "id", "S2")
            .external("T", "x", "S2")
            .requires("T", "y", "S2", "x")
            .build();

    RequirementCycleException e =
        assertThrows(
            RequirementCycleException.class,
            () -> new QueryPlanner(graphModel).plan("{ t { x } }", null));
    assertEquals(List.of("T.x", "T.y", "T.x"), e.getCycle());
  }

  @Test
  void abstract_field_without_known_implementation_is_ambiguous() {
    GraphModel graphModel =
        GraphModel.builder()
            .service("A")
            .service("B")
            .type("Query", TypeKind.OBJECT)
            .type("Node", TypeKind.INTERFACE)
            .type("U", TypeKind.OBJECT)
            .implementsInterface("U", "Node")
            .field("Query", "node", "Node")
            .field("Node", "name", "String")
            .field("U", "name", "String")
            .owner("Query", "node", "A")
            .owner("Node", "name", "B")
            .owner("U", "name", "B")
            .build();

    assertThrows(
        AmbiguousOwnershipException.class,
        () -> new QueryPlanner(graphModel).plan("{ node { name } }", null));
  }

  @Test
  void interface_entity_rewrites_typename_of_representations() {
    GraphModel graphModel =
        GraphModel.builder()
            .service("A")
            .service("B")
            .type("Query", TypeKind.OBJECT)
            .type("Node", TypeKind.INTERFACE)
            .type("U", TypeKind.OBJECT)
            .type("P", TypeKind.OBJECT)
            .implementsInterface("U", "Node")
            .implementsInterface("P", "Node")
            .field("Query", "node", "Node")
            .field("Node", "id", "ID!")
            .field("Node", "label", "String")
            .field("U", "id", "ID!")
            .field("P", "id", "ID!")
            .owner("Query", "node", "A")
            .owner("Node", "id", "A")
            .owner("U", "id", "A")
            .owner("P", "id", "A")
            .key("U", "A", "id")
            .key("P", "A", "id")
            .key("Node", "B", "id")
            .owner("Node", "id", "B")
            .owner("Node", "label", "B")
            .build();

    List<PlanNode> steps =
        sequence(new QueryPlanner(graphModel).plan("{ node { label } }", null).getNode());
    FetchNode entity = flattened(steps.get(1), ResponsePath.of("node"));
    assertEquals("B", entity.getServiceName());
    assertEquals(
        "... on U { __typename id } ... on P { __typename id }", entity.getRequires());
    assertEquals(
        List.of(
            new FetchDataRewrite.ValueSetter(List.of("... on U", "__typename"), "Node"),
            new FetchDataRewrite.ValueSetter(List.of("... on P", "__typename"), "Node")),
        entity.getInputRewrites());
    assertEquals(ENTITIES_PREFIX + "{ ... on Node { label } } }", entity.getOperation());
  }

  @Test
  void selection_deeper_than_configured_depth_is_rejected() {
    QueryPlanner planner =
        new QueryPlanner(
            SchemaFixtures.storefront(), new QueryPlannerConfig(2, true, true));

    assertThrows(
        InvalidOperationException.class,
        () -> planner.plan("{ me { reviews { body } } }", null));
  }

  private static List<PlanNode> sequence(PlanNode node) {
    return assertInstanceOf(SequenceNode.class, node).getNodes();
  }

  private static FetchNode fetch(PlanNode node) {
    return assertInstanceOf(FetchNode.class, node);
  }

  private static FetchNode flattened(PlanNode node, ResponsePath path) {
    FlattenNode flatten = assertInstanceOf(FlattenNode.class, node);
    assertEquals(path, flatten.getPath());
    return fetch(flatten.getNode());
  }

  /**
   * B declares {@code @key(fields: "upc") @key(fields: "id")} and owns {@code name}. A owns
   * {@code Query.t} and {@code T.id}, and {@code T.upc} as well when {@code parentResolvesUpc}.
   */
  private static GraphModel twoKeySchema(boolean parentResolvesUpc) {
    GraphModel.Builder builder =
        GraphModel.builder()
            .service("A")
            .service("B")
            .type("Query", TypeKind.OBJECT)
            .type("T", TypeKind.OBJECT)
            .field("Query", "t", "T")
            .field("T", "id", "ID!")
            .field("T", "upc", "String!")
            .field("T", "name", "String")
            .owner("Query", "t", "A")
            .key("T", "A", "id")
            .owner("T", "id", "A")
            .key("T", "B", "upc")
            .key("T", "B", "id")
            .owner("T", "upc", "B")
            .owner("T", "id", "B")
            .owner("T", "name", "B");
    if (parentResolvesUpc) {
      builder.owner("T", "upc", "A");
    }
    return builder.build();
  }
}
