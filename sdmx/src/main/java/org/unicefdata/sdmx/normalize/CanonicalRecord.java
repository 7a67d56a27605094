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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row of a canonical table.
 *
 * <p>A record carries a value slot for every column its schema level
 * declares, null where the source had no value. Asking for a column the
 * level does not declare is an error, so code that works on one level
 * cannot silently read a column that another dataflow happened to return.
 */
public final class CanonicalRecord {
  private final SchemaLevel level;
  private final @Nullable Object[] values;

  CanonicalRecord(SchemaLevel level, @Nullable Object[] values) {
    if (values.length != level.getColumns().size()) {
      throw new IllegalArgumentException("Expected " + level.getColumns().size()
          + " values for " + level + ", got " + values.length);
    }
    this.level = level;
    this.values = values;
  }

  public SchemaLevel getLevel() {
    return level;
  }

  /**
   * Returns the value of a column.
   *
   * @throws IllegalArgumentException if the record's level does not declare the column
   */
  public @Nullable Object get(CanonicalColumn column) {
    return values[indexOf(column)];
  }

  public @Nullable String getString(CanonicalColumn column) {
    Object value = get(column);
    return value == null ? null : value.toString();
  }

  public @Nullable Double getDouble(CanonicalColumn column) {
    Object value = get(column);
    return value instanceof Number ? ((Number) value).doubleValue() : null;
  }

  public @Nullable Integer getInteger(CanonicalColumn column) {
    Object value = get(column);
    return value instanceof Number ? ((Number) value).intValue() : null;
  }

  /** Values in column order; the list may contain nulls. */
  public List<Object> getValues() {
    return Collections.unmodifiableList(Arrays.asList(values.clone()));
  }

  /** Column name to value, in column order. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    ImmutableList<CanonicalColumn> columns = level.getColumns();
    for (int i = 0; i < columns.size(); i++) {
      map.put(columns.get(i).getColumnName(), values[i]);
    }
    return map;
  }

  private int indexOf(CanonicalColumn column) {
    int index = level.getColumns().indexOf(column);
    if (index < 0) {
      throw new IllegalArgumentException(
          "Column " + column + " is not part of the " + level + " schema");
    }
    return index;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CanonicalRecord)) {
      return false;
    }
    CanonicalRecord that = (CanonicalRecord) o;
    return level == that.level && Arrays.equals(values, that.values);
  }

  @Override public int hashCode() {
    return 31 * level.hashCode() + Arrays.hashCode(values);
  }

  @Override public String toString() {
    return toMap().toString();
  }
}
