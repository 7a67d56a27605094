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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable snapshot of the metadata tables that drive dataflow resolution
 * and response normalization.
 *
 * <p>A snapshot is built once by {@link MetadataStoreLoader} and shared by
 * every concurrent query; it has no mutators. Refreshing metadata means
 * building a new snapshot and swapping it in {@link MetadataCache}.
 */
public final class MetadataStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataStore.class);

  private final ImmutableSortedMap<String, IndicatorEntry> indicators;
  private final ImmutableMap<String, ImmutableList<String>> fallbackSequences;
  private final ImmutableMap<String, DataflowSchema> dataflows;
  private final ImmutableSet<String> regionCodes;
  private final ImmutableMap<String, String> countryNames;
  private final @Nullable Instant syncedAt;
  private final String source;
  private final boolean degraded;
  private final String universalDataflow;

  private MetadataStore(Builder builder) {
    this.indicators = ImmutableSortedMap.copyOf(builder.indicators);
    this.fallbackSequences = ImmutableMap.copyOf(builder.fallbackSequences);
    this.dataflows = ImmutableMap.copyOf(builder.dataflows);
    this.regionCodes = ImmutableSet.copyOf(builder.regionCodes);
    this.countryNames = ImmutableMap.copyOf(builder.countryNames);
    this.syncedAt = builder.syncedAt;
    this.source = builder.source;
    this.degraded = builder.degraded;
    this.universalDataflow = builder.universalDataflow;
  }

  public static Builder builder(String universalDataflow) {
    return new Builder(universalDataflow);
  }

  /**
   * A snapshot holding only the built-in fallback sequences; used when no
   * metadata table can be read.
   */
  public static MetadataStore defaults(String universalDataflow) {
    return builder(universalDataflow)
        .fallbackSequences(DefaultFallbackSequences.create(universalDataflow))
        .source("built-in defaults")
        .degraded(true)
        .build();
  }

  public @Nullable IndicatorEntry getIndicator(String code) {
    return indicators.get(code);
  }

  public ImmutableSortedMap<String, IndicatorEntry> getIndicators() {
    return indicators;
  }

  /** Stored sequence for a prefix, or null. Keys are upper-case. */
  public @Nullable ImmutableList<String> getFallbackSequence(String prefix) {
    return fallbackSequences.get(prefix.toUpperCase(Locale.ROOT));
  }

  /** The {@code DEFAULT} sequence, if the table defines one. */
  public @Nullable ImmutableList<String> getDefaultSequence() {
    return fallbackSequences.get(DefaultFallbackSequences.DEFAULT_KEY);
  }

  public ImmutableMap<String, ImmutableList<String>> getFallbackSequences() {
    return fallbackSequences;
  }

  public @Nullable DataflowSchema getDataflowSchema(String dataflowId) {
    return dataflows.get(dataflowId);
  }

  public ImmutableMap<String, DataflowSchema> getDataflowSchemas() {
    return dataflows;
  }

  /**
   * Every dataflow id the metadata mentions, from schemas, fallback
   * sequences and indicator entries, sorted.
   */
  public ImmutableSortedSet<String> getDataflowIds() {
    ImmutableSortedSet.Builder<String> ids = ImmutableSortedSet.naturalOrder();
    ids.addAll(dataflows.keySet());
    for (ImmutableList<String> seq : fallbackSequences.values()) {
      ids.addAll(seq);
    }
    for (IndicatorEntry entry : indicators.values()) {
      ids.addAll(entry.getDirectDataflows());
    }
    return ids.build();
  }

  /** Whether an area code denotes a regional or global aggregate. */
  public boolean isAggregate(String areaCode) {
    return regionCodes.contains(areaCode);
  }

  /** Display name for a country or region code, or null. */
  public @Nullable String getAreaName(String areaCode) {
    return countryNames.get(areaCode);
  }

  public String getUniversalDataflow() {
    return universalDataflow;
  }

  public @Nullable Instant getSyncedAt() {
    return syncedAt;
  }

  /** Whether one or more tables failed to load and defaults were used instead. */
  public boolean isDegraded() {
    return degraded;
  }

  /**
   * Whether the sync timestamp is older than {@code threshold} at
   * {@code now}. A snapshot without a timestamp counts as stale.
   */
  public boolean isStale(Duration threshold, Instant now) {
    return syncedAt == null || syncedAt.plus(threshold).isBefore(now);
  }

  /**
   * Finds indicators whose code or name contains {@code keyword},
   * case-insensitively.
   *
   * @param keyword text to look for; null or empty matches every indicator
   * @param dataflow restricts results to indicators listing this dataflow; may be null
   * @param includeAllTiers whether indicators without data are included
   * @return matching entries ordered by code
   */
  public List<IndicatorEntry> searchIndicators(@Nullable String keyword,
      @Nullable String dataflow, boolean includeAllTiers) {
    String needle = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
    List<IndicatorEntry> result = new ArrayList<IndicatorEntry>();
    for (IndicatorEntry entry : indicators.values()) {
      if (!includeAllTiers && entry.getTier().isUnreliable()) {
        continue;
      }
      if (dataflow != null
          && !entry.getDirectDataflows().contains(dataflow.toUpperCase(Locale.ROOT))) {
        continue;
      }
      if (needle.isEmpty()
          || entry.getCode().toLowerCase(Locale.ROOT).contains(needle)
          || entry.getName().toLowerCase(Locale.ROOT).contains(needle)) {
        result.add(entry);
      }
    }
    return result;
  }

  @Override public String toString() {
    return "MetadataStore{source=" + source
        + ", indicators=" + indicators.size()
        + ", sequences=" + fallbackSequences.size()
        + ", dataflows=" + dataflows.size()
        + ", syncedAt=" + syncedAt
        + (degraded ? ", degraded" : "")
        + "}";
  }

  /**
   * Builder for MetadataStore.
   */
  public static final class Builder {
    private final String universalDataflow;
    private final Map<String, IndicatorEntry> indicators = new TreeMap<String, IndicatorEntry>();
    private final Map<String, ImmutableList<String>> fallbackSequences =
        new LinkedHashMap<String, ImmutableList<String>>();
    private final Map<String, DataflowSchema> dataflows =
        new LinkedHashMap<String, DataflowSchema>();
    private final Set<String> regionCodes = new LinkedHashSet<String>();
    private final Map<String, String> countryNames = new LinkedHashMap<String, String>();
    private @Nullable Instant syncedAt;
    private String source = "unknown";
    private boolean degraded;

    private Builder(String universalDataflow) {
      this.universalDataflow = universalDataflow;
    }

    public Builder indicator(IndicatorEntry entry) {
      indicators.put(entry.getCode(), entry);
      return this;
    }

    /**
     * Adds a fallback sequence. Repeated dataflow ids are dropped with a
     * warning, keeping the first occurrence; order is otherwise preserved.
     */
    public Builder fallbackSequence(String prefix, List<String> dataflowIds) {
      LinkedHashSet<String> unique = new LinkedHashSet<String>();
      for (String id : dataflowIds) {
        if (id == null || id.trim().isEmpty()) {
          continue;
        }
        if (!unique.add(id.trim())) {
          LOGGER.warn("Fallback sequence for prefix '{}' lists dataflow {} more than once;"
              + " keeping the first occurrence", prefix, id);
        }
      }
      if (unique.isEmpty()) {
        LOGGER.warn("Ignoring empty fallback sequence for prefix '{}'", prefix);
        return this;
      }
      fallbackSequences.put(prefix.toUpperCase(Locale.ROOT), ImmutableList.copyOf(unique));
      return this;
    }

    public Builder fallbackSequences(Map<String, ? extends List<String>> sequences) {
      for (Map.Entry<String, ? extends List<String>> e : sequences.entrySet()) {
        fallbackSequence(e.getKey(), e.getValue());
      }
      return this;
    }

    public Builder dataflow(DataflowSchema schema) {
      dataflows.put(schema.getId(), schema);
      return this;
    }

    public Builder regionCode(String code) {
      regionCodes.add(code);
      return this;
    }

    public Builder areaName(String code, String name) {
      countryNames.put(code, name);
      return this;
    }

    public Builder syncedAt(@Nullable Instant syncedAt) {
      this.syncedAt = syncedAt;
      return this;
    }

    public Builder source(String source) {
      this.source = source;
      return this;
    }

    public Builder degraded(boolean degraded) {
      this.degraded = degraded;
      return this;
    }

    public boolean hasFallbackSequences() {
      return !fallbackSequences.isEmpty();
    }

    public MetadataStore build() {
      return new MetadataStore(this);
    }
  }
}
