/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.unicefdata.sdmx.metadata;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;

/**
 * Metadata for one indicator code.
 *
 * <p>Instances are immutable. The direct dataflow list keeps the order in
 * which the sync recorded it, with duplicates removed.
 */
public final class IndicatorEntry {
  private final String code;
  private final String name;
  private final ImmutableList<String> directDataflows;
  private final IndicatorTier tier;
  private final @Nullable String tierReason;
  private final ImmutableSet<String> disaggregations;
  private final ImmutableSet<String> disaggregationsWithTotals;

  private IndicatorEntry(Builder builder) {
    this.code = builder.code;
    this.name = builder.name == null ? "" : builder.name;
    this.directDataflows = ImmutableList.copyOf(builder.directDataflows);
    this.tier = builder.tier;
    this.tierReason = builder.tierReason;
    this.disaggregations = ImmutableSet.copyOf(builder.disaggregations);
    this.disaggregationsWithTotals = ImmutableSet.copyOf(builder.disaggregationsWithTotals);
  }

  public static Builder builder(String code) {
    return new Builder(code);
  }

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  /** Dataflows known to carry this indicator, possibly empty. */
  public ImmutableList<String> getDirectDataflows() {
    return directDataflows;
  }

  public IndicatorTier getTier() {
    return tier;
  }

  public @Nullable String getTierReason() {
    return tierReason;
  }

  /** Dimension ids along which this indicator is disaggregated. */
  public ImmutableSet<String> getDisaggregations() {
    return disaggregations;
  }

  /** Dimension ids for which a {@code _T} total exists. */
  public ImmutableSet<String> getDisaggregationsWithTotals() {
    return disaggregationsWithTotals;
  }

  /**
   * Whether the sync recorded which dimensions carry totals. When it did not,
   * every dimension is assumed to carry {@code _T}.
   */
  public boolean isTotalsMetadataPresent() {
    return !disaggregationsWithTotals.isEmpty();
  }

  /** Whether {@code dimensionId} has a {@code _T} total for this indicator. */
  public boolean hasTotals(String dimensionId) {
    return disaggregationsWithTotals.contains(dimensionId.toUpperCase(Locale.ROOT));
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IndicatorEntry)) {
      return false;
    }
    IndicatorEntry that = (IndicatorEntry) o;
    return code.equals(that.code)
        && name.equals(that.name)
        && directDataflows.equals(that.directDataflows)
        && tier == that.tier
        && disaggregations.equals(that.disaggregations)
        && disaggregationsWithTotals.equals(that.disaggregationsWithTotals);
  }

  @Override public int hashCode() {
    return Objects.hash(code, name, directDataflows, tier);
  }

  @Override public String toString() {
    return "IndicatorEntry{" + code + ", tier=" + tier + ", dataflows=" + directDataflows + "}";
  }

  /**
   * Builder for IndicatorEntry.
   */
  public static final class Builder {
    private final String code;
    private @Nullable String name;
    private final LinkedHashSet<String> directDataflows = new LinkedHashSet<String>();
    private IndicatorTier tier = IndicatorTier.VERIFIED;
    private @Nullable String tierReason;
    private final LinkedHashSet<String> disaggregations = new LinkedHashSet<String>();
    private final LinkedHashSet<String> disaggregationsWithTotals = new LinkedHashSet<String>();

    private Builder(String code) {
      if (code == null || code.trim().isEmpty()) {
        throw new IllegalArgumentException("Indicator code must not be empty");
      }
      this.code = code.trim();
    }

    public Builder name(@Nullable String name) {
      this.name = name;
      return this;
    }

    public Builder dataflow(String dataflow) {
      if (dataflow != null && !dataflow.trim().isEmpty()) {
        directDataflows.add(dataflow.trim());
      }
      return this;
    }

    public Builder dataflows(Collection<String> dataflows) {
      for (String dataflow : dataflows) {
        dataflow(dataflow);
      }
      return this;
    }

    public Builder tier(IndicatorTier tier) {
      this.tier = tier;
      return this;
    }

    public Builder tierReason(@Nullable String tierReason) {
      this.tierReason = tierReason;
      return this;
    }

    public Builder disaggregations(Collection<String> dimensionIds) {
      for (String id : dimensionIds) {
        disaggregations.add(id.toUpperCase(Locale.ROOT));
      }
      return this;
    }

    public Builder disaggregationsWithTotals(Collection<String> dimensionIds) {
      for (String id : dimensionIds) {
        disaggregationsWithTotals.add(id.toUpperCase(Locale.ROOT));
      }
      return this;
    }

    public IndicatorEntry build() {
      return new IndicatorEntry(this);
    }
  }
}
