/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.federation.operation.OperationType;

/** One request to one service. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class FetchNode extends PlanNode {

  private final String serviceName;

  /** Id of the fetch group this fetch was emitted from. */
  private final int id;

  private final OperationType operationKind;

  /** Name of the subgraph operation, or null when it is anonymous. */
  private final String operationName;

  /** Client variables the operation forwards, in first-use order. */
  private final List<String> variableUsages;

  /** Operation document sent to the service. */
  private final String operation;

  /**
   * Selection used to build representations from already fetched data, e.g. {@code ... on User {
   * __typename id }}. Null for root fetches.
   */
  private final String requires;

  private final List<FetchDataRewrite> inputRewrites;

  private final List<FetchDataRewrite> outputRewrites;

  public FetchNode(
      String serviceName,
      int id,
      OperationType operationKind,
      String operationName,
      List<String> variableUsages,
      String operation,
      String requires,
      List<FetchDataRewrite> inputRewrites,
      List<FetchDataRewrite> outputRewrites) {
    this.serviceName = serviceName;
    this.id = id;
    this.operationKind = operationKind;
    this.operationName = operationName;
    this.variableUsages = variableUsages == null ? List.of() : ImmutableList.copyOf(variableUsages);
    this.operation = operation;
    this.requires = requires;
    this.inputRewrites = inputRewrites == null ? List.of() : ImmutableList.copyOf(inputRewrites);
    this.outputRewrites = outputRewrites == null ? List.of() : ImmutableList.copyOf(outputRewrites);
  }

  public boolean isEntityFetch() {
    return requires != null;
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFetch(this, context);
  }

  @Override
  public String getKind() {
    return "Fetch";
  }
}
