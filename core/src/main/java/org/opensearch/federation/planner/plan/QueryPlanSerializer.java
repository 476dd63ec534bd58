/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Serializes query plans to the JSON shape executors consume. Every node is tagged with {@code
 * kind}; fields are written in a fixed order so identical plans serialize to identical bytes.
 */
public class QueryPlanSerializer implements PlanNodeVisitor<JsonNode, Void> {

  private final ObjectMapper objectMapper;

  public QueryPlanSerializer() {
    this(new ObjectMapper());
  }

  public QueryPlanSerializer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public ObjectNode toJson(QueryPlan plan) {
    ObjectNode json = objectMapper.createObjectNode();
    json.put("kind", "QueryPlan");
    if (plan.getNode() == null) {
      json.putNull("node");
    } else {
      json.set("node", plan.getNode().accept(this, null));
    }
    return json;
  }

  public String serialize(QueryPlan plan) {
    try {
      return objectMapper.writeValueAsString(toJson(plan));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize query plan", e);
    }
  }

  @Override
  public JsonNode visitFetch(FetchNode node, Void context) {
    ObjectNode json = objectMapper.createObjectNode();
    json.put("kind", node.getKind());
    json.put("serviceName", node.getServiceName());
    json.put("id", node.getId());
    json.put("operationKind", node.getOperationKind().getKeyword());
    json.put("operationName", node.getOperationName());
    ArrayNode variables = json.putArray("variableUsages");
    node.getVariableUsages().forEach(variables::add);
    json.put("operation", node.getOperation());
    json.put("requires", node.getRequires());
    json.set("inputRewrites", rewrites(node.getInputRewrites()));
    json.set("outputRewrites", rewrites(node.getOutputRewrites()));
    return json;
  }

  @Override
  public JsonNode visitFlatten(FlattenNode node, Void context) {
    ObjectNode json = objectMapper.createObjectNode();
    json.put("kind", node.getKind());
    ArrayNode path = json.putArray("path");
    node.getPath().toStringList().forEach(path::add);
    json.set("node", node.getNode().accept(this, context));
    return json;
  }

  @Override
  public JsonNode visitSequence(SequenceNode node, Void context) {
    return children(node.getKind(), node.getNodes());
  }

  @Override
  public JsonNode visitParallel(ParallelNode node, Void context) {
    return children(node.getKind(), node.getNodes());
  }

  private ObjectNode children(String kind, List<PlanNode> nodes) {
    ObjectNode json = objectMapper.createObjectNode();
    json.put("kind", kind);
    ArrayNode array = json.putArray("nodes");
    for (PlanNode child : nodes) {
      array.add(child.accept(this, null));
    }
    return json;
  }

  private ArrayNode rewrites(List<FetchDataRewrite> rewrites) {
    ArrayNode array = objectMapper.createArrayNode();
    for (FetchDataRewrite rewrite : rewrites) {
      ObjectNode json = array.addObject();
      json.put("kind", rewrite.getKind());
      ArrayNode path = json.putArray("path");
      rewrite.getPath().forEach(path::add);
      if (rewrite instanceof FetchDataRewrite.ValueSetter) {
        json.put("setValueTo", ((FetchDataRewrite.ValueSetter) rewrite).getSetValueTo());
      } else if (rewrite instanceof FetchDataRewrite.KeyRenamer) {
        json.put("renameKeyTo", ((FetchDataRewrite.KeyRenamer) rewrite).getRenameKeyTo());
      }
    }
    return array;
  }
}
