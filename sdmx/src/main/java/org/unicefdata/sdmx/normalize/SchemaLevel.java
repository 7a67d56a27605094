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

import static org.unicefdata.sdmx.normalize.CanonicalColumn.AGE;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.COUNTRY;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.COUNTRY_NOTES;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.CURRENT_AGE;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.DATA_SOURCE;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.DISABILITY_STATUS;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.EDUCATION_LEVEL;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.ETHNIC_GROUP;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.GEO_TYPE;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.HCF_TYPE;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.INDICATOR;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.INDICATOR_NAME;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.ISO3;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.LOWER_BOUND;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.MATERNAL_EDU_LVL;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.OBS_CONF;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.OBS_FOOTNOTE;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.OBS_STATUS;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.OBS_STATUS_NAME;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.PERIOD;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.REF_PERIOD;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.RESIDENCE;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.SERIES_FOOTNOTE;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.SERVICE_TYPE;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.SEX;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.SOURCE_LINK;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.TIME_DETAIL;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.UNIT;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.UNIT_MULTIPLIER;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.UNIT_NAME;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.UPPER_BOUND;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.VALUE;
import static org.unicefdata.sdmx.normalize.CanonicalColumn.WEALTH_QUINTILE;

/**
 * Column set of the canonical table. The set and its order depend only on
 * the level, never on which dataflow answered.
 */
public enum SchemaLevel {
  /** Identification and the observation only. */
  MINIMAL(ImmutableList.of(ISO3, COUNTRY, INDICATOR, PERIOD, VALUE)),

  /** Adds the common disaggregations, bounds and provenance. */
  STANDARD(ImmutableList.of(ISO3, COUNTRY, PERIOD, GEO_TYPE, INDICATOR, INDICATOR_NAME,
      VALUE, UNIT, SEX, AGE, WEALTH_QUINTILE, RESIDENCE, LOWER_BOUND, UPPER_BOUND,
      OBS_STATUS, DATA_SOURCE)),

  /** The standard column set used by published indicator tables. */
  EXTENDED(ImmutableList.of(ISO3, COUNTRY, PERIOD, GEO_TYPE, INDICATOR, INDICATOR_NAME,
      VALUE, UNIT, UNIT_NAME, SEX, AGE, WEALTH_QUINTILE, RESIDENCE, MATERNAL_EDU_LVL,
      LOWER_BOUND, UPPER_BOUND, OBS_STATUS, OBS_STATUS_NAME, DATA_SOURCE, REF_PERIOD,
      COUNTRY_NOTES, TIME_DETAIL, CURRENT_AGE)),

  /** Every known column. */
  FULL(ImmutableList.<CanonicalColumn>builder()
      .add(ISO3, COUNTRY, PERIOD, GEO_TYPE, INDICATOR, INDICATOR_NAME,
          VALUE, UNIT, UNIT_NAME, SEX, AGE, WEALTH_QUINTILE, RESIDENCE, MATERNAL_EDU_LVL,
          LOWER_BOUND, UPPER_BOUND, OBS_STATUS, OBS_STATUS_NAME, DATA_SOURCE, REF_PERIOD,
          COUNTRY_NOTES, TIME_DETAIL, CURRENT_AGE)
      .add(DISABILITY_STATUS, EDUCATION_LEVEL, ETHNIC_GROUP, SERVICE_TYPE, HCF_TYPE,
          OBS_FOOTNOTE, SERIES_FOOTNOTE, SOURCE_LINK, OBS_CONF, UNIT_MULTIPLIER)
      .build());

  private final ImmutableList<CanonicalColumn> columns;

  SchemaLevel(ImmutableList<CanonicalColumn> columns) {
    this.columns = columns;
  }

  /** Declared columns in output order. */
  public ImmutableList<CanonicalColumn> getColumns() {
    return columns;
  }

  public boolean declares(CanonicalColumn column) {
    return columns.contains(column);
  }
}
