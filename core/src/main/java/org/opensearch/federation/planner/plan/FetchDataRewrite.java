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

/**
 * A rewrite the executor applies to the data flowing into or out of a fetch. Paths are relative to
 * each representation (inputs) or each fetched entity (outputs); a key descends into every list
 * element it meets.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class FetchDataRewrite {

  private final List<String> path;

  protected FetchDataRewrite(List<String> path) {
    this.path = ImmutableList.copyOf(path);
  }

  /** Tag used in serialized plans. */
  public abstract String getKind();

  /** Replaces the value at {@code path} with a constant. */
  @Getter
  @ToString(callSuper = true)
  @EqualsAndHashCode(callSuper = true)
  public static class ValueSetter extends FetchDataRewrite {
    private final String setValueTo;

    public ValueSetter(List<String> path, String setValueTo) {
      super(path);
      this.setValueTo = setValueTo;
    }

    @Override
    public String getKind() {
      return "ValueSetter";
    }
  }

  /** Renames the key at {@code path}; used to map an alias back to the requested response key. */
  @Getter
  @ToString(callSuper = true)
  @EqualsAndHashCode(callSuper = true)
  public static class KeyRenamer extends FetchDataRewrite {
    private final String renameKeyTo;

    public KeyRenamer(List<String> path, String renameKeyTo) {
      super(path);
      this.renameKeyTo = renameKeyTo;
    }

    @Override
    public String getKind() {
      return "KeyRenamer";
    }
  }
}
