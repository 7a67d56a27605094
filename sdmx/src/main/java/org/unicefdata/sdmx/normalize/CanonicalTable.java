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
package org.unicefdata.sdmx.normalize;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Normalized result of one indicator query.
 *
 * <p>The column list is exactly {@link SchemaLevel#getColumns()} of the
 * requested level, whichever dataflow supplied the rows.
 */
public final class CanonicalTable {
  private final String indicatorCode;
  private final @Nullable String sourceDataflow;
  private final SchemaLevel level;
  private final ImmutableList<CanonicalRecord> records;
  private final ImmutableList<String> triedDataflows;

  public CanonicalTable(String indicatorCode, @Nullable String sourceDataflow,
      SchemaLevel level, List<CanonicalRecord> records, List<String> triedDataflows) {
    this.indicatorCode = indicatorCode;
    this.sourceDataflow = sourceDataflow;
    this.level = level;
    this.records = ImmutableList.copyOf(records);
    this.triedDataflows = ImmutableList.copyOf(triedDataflows);
  }

  /** A table with the level's columns and no rows. */
  public static CanonicalTable empty(String indicatorCode, SchemaLevel level) {
    return new CanonicalTable(indicatorCode, null, level,
        ImmutableList.<CanonicalRecord>of(), ImmutableList.<String>of());
  }

  /** Copy of this table recording the dataflows tried to obtain it. */
  public CanonicalTable withTriedDataflows(List<String> tried) {
    return new CanonicalTable(indicatorCode, sourceDataflow, level, records, tried);
  }

  public String getIndicatorCode() {
    return indicatorCode;
  }

  /** Dataflow whose response produced the rows, or null for an empty table. */
  public @Nullable String getSourceDataflow() {
    return sourceDataflow;
  }

  public SchemaLevel getLevel() {
    return level;
  }

  public ImmutableList<CanonicalColumn> getColumns() {
    return level.getColumns();
  }

  public ImmutableList<String> getColumnNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (CanonicalColumn column : level.getColumns()) {
      names.add(column.getColumnName());
    }
    return names.build();
  }

  public ImmutableList<CanonicalRecord> getRecords() {
    return records;
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  /** Dataflows tried in order, ending with the one that answered. */
  public ImmutableList<String> getTriedDataflows() {
    return triedDataflows;
  }

  @Override public String toString() {
    return "CanonicalTable{" + indicatorCode + " from " + sourceDataflow
        + ", level=" + level + ", rows=" + records.size() + "}";
  }
}
