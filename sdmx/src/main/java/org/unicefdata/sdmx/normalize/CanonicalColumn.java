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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Columns of the canonical table.
 *
 * <p>Each column has a fixed name, a value type, and optionally the SDMX
 * component it is read from. Columns without a component are derived during
 * normalization or read from the label columns the API adds when labels are
 * requested ({@code Geographic area}, {@code Unit of measure}, ...).
 */
public enum CanonicalColumn {
  ISO3("iso3", "REF_AREA", String.class),
  COUNTRY("country", null, String.class),
  PERIOD("period", "TIME_PERIOD", Double.class),
  GEO_TYPE("geo_type", null, Integer.class),
  INDICATOR("indicator", "INDICATOR", String.class),
  INDICATOR_NAME("indicator_name", null, String.class),
  VALUE("value", "OBS_VALUE", Double.class),
  UNIT("unit", "UNIT_MEASURE", String.class),
  UNIT_NAME("unit_name", null, String.class),
  SEX("sex", "SEX", String.class),
  AGE("age", "AGE", String.class),
  WEALTH_QUINTILE("wealth_quintile", "WEALTH_QUINTILE", String.class),
  RESIDENCE("residence", "RESIDENCE", String.class),
  MATERNAL_EDU_LVL("maternal_edu_lvl", "MATERNAL_EDU_LVL", String.class),
  LOWER_BOUND("lower_bound", "LOWER_BOUND", Double.class),
  UPPER_BOUND("upper_bound", "UPPER_BOUND", Double.class),
  OBS_STATUS("obs_status", "OBS_STATUS", String.class),
  OBS_STATUS_NAME("obs_status_name", null, String.class),
  DATA_SOURCE("data_source", "DATA_SOURCE", String.class),
  REF_PERIOD("ref_period", "REF_PERIOD", String.class),
  COUNTRY_NOTES("country_notes", "COUNTRY_NOTES", String.class),
  TIME_DETAIL("time_detail", "TIME_DETAIL", String.class),
  CURRENT_AGE("current_age", "CURRENT_AGE", String.class),
  DISABILITY_STATUS("disability_status", "DISABILITY_STATUS", String.class),
  EDUCATION_LEVEL("education_level", "EDUCATION_LEVEL", String.class),
  ETHNIC_GROUP("ethnic_group", "ETHNIC_GROUP", String.class),
  SERVICE_TYPE("service_type", "SERVICE_TYPE", String.class),
  HCF_TYPE("hcf_type", "HCF_TYPE", String.class),
  OBS_FOOTNOTE("obs_footnote", "OBS_FOOTNOTE", String.class),
  SOURCE_LINK("source_link", "SOURCE_LINK", String.class),
  SERIES_FOOTNOTE("series_footnote", "SERIES_FOOTNOTE", String.class),
  OBS_CONF("obs_conf", "OBS_CONF", String.class),
  UNIT_MULTIPLIER("unit_multiplier", "UNIT_MULTIPLIER", String.class);

  private static final ImmutableMap<String, CanonicalColumn> BY_SDMX_ID;
  private static final ImmutableMap<String, CanonicalColumn> BY_NAME;

  static {
    ImmutableMap.Builder<String, CanonicalColumn> bySdmx = ImmutableMap.builder();
    ImmutableMap.Builder<String, CanonicalColumn> byName = ImmutableMap.builder();
    for (CanonicalColumn column : values()) {
      if (column.sdmxId != null) {
        bySdmx.put(column.sdmxId, column);
      }
      byName.put(column.columnName, column);
    }
    BY_SDMX_ID = bySdmx.build();
    BY_NAME = byName.build();
  }

  private final String columnName;
  private final @Nullable String sdmxId;
  private final Class<?> type;

  CanonicalColumn(String columnName, @Nullable String sdmxId, Class<?> type) {
    this.columnName = columnName;
    this.sdmxId = sdmxId;
    this.type = type;
  }

  public String getColumnName() {
    return columnName;
  }

  /** SDMX component the column is read from, or null for derived columns. */
  public @Nullable String getSdmxId() {
    return sdmxId;
  }

  public Class<?> getType() {
    return type;
  }

  public boolean isNumeric() {
    return type == Double.class;
  }

  public static @Nullable CanonicalColumn forSdmxId(String sdmxId) {
    return BY_SDMX_ID.get(sdmxId);
  }

  public static @Nullable CanonicalColumn forName(String columnName) {
    return BY_NAME.get(columnName);
  }

  @Override public String toString() {
    return columnName;
  }
}
