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

import org.unicefdata.sdmx.QuerySpec;
import org.unicefdata.sdmx.metadata.IndicatorEntry;
import org.unicefdata.sdmx.metadata.MetadataStore;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ResponseNormalizer}.
 */
@Tag("unit")
public class ResponseNormalizerTest {
  private static final String CODE = "CME_MRY0T4";

  private final ResponseNormalizer normalizer =
      new ResponseNormalizer(PeriodConvention.MONTH_OVER_TWELVE, true);

  /** One observation with the given extra columns. */
  private static Map<String, String> obs(String area, String period, String value,
      String... extra) {
    Map<String, String> row = new LinkedHashMap<String, String>();
    row.put("REF_AREA", area);
    row.put("INDICATOR", CODE);
    row.put("TIME_PERIOD", period);
    row.put("OBS_VALUE", value);
    for (int i = 0; i + 1 < extra.length; i += 2) {
      row.put(extra[i], extra[i + 1]);
    }
    return row;
  }

  private static MetadataStore store(IndicatorEntry entry) {
    MetadataStore.Builder builder = MetadataStore.builder("GLOBAL_DATAFLOW")
        .areaName("ALB", "Albania")
        .areaName("BGD", "Bangladesh")
        .regionCode("UNICEF_SSA");
    if (entry != null) {
      builder.indicator(entry);
    }
    return builder.build();
  }

  private CanonicalTable normalize(List<Map<String, String>> rows, QuerySpec query,
      IndicatorEntry entry) {
    return normalizer.normalize(rows,
        new NormalizationContext(CODE, "CME", query, store(entry)));
  }

  private CanonicalTable normalize(List<Map<String, String>> rows, QuerySpec query) {
    return normalize(rows, query, null);
  }

  private CanonicalTable normalize(List<Map<String, String>> rows) {
    return normalize(rows, QuerySpec.defaults());
  }

  private static List<String> column(CanonicalTable table, CanonicalColumn column) {
    List<String> values = new ArrayList<String>();
    for (CanonicalRecord record : table.getRecords()) {
      values.add(record.getString(column));
    }
    return values;
  }

  @Test void testExtendedColumnsAreFixed() {
    CanonicalTable table = normalize(Arrays.asList(obs("ALB", "2020", "9.7")));
    assertEquals(Arrays.asList("iso3", "country", "period", "geo_type", "indicator",
            "indicator_name", "value", "unit", "unit_name", "sex", "age", "wealth_quintile",
            "residence", "maternal_edu_lvl", "lower_bound", "upper_bound", "obs_status",
            "obs_status_name", "data_source", "ref_period", "country_notes", "time_detail",
            "current_age"),
        table.getColumnNames());
  }

  @Test void testMinimalColumns() {
    CanonicalTable table = normalize(Arrays.asList(obs("ALB", "2020", "9.7")),
        QuerySpec.builder().schemaLevel(SchemaLevel.MINIMAL).build());
    assertEquals(Arrays.asList("iso3", "country", "indicator", "period", "value"),
        table.getColumnNames());
    assertEquals(5, table.getRecords().get(0).getValues().size());
  }

  @Test void testUndeclaredColumnIsRejected() {
    CanonicalTable table = normalize(Arrays.asList(obs("ALB", "2020", "9.7")),
        QuerySpec.builder().schemaLevel(SchemaLevel.MINIMAL).build());
    CanonicalRecord record = table.getRecords().get(0);
    assertThrows(IllegalArgumentException.class, () -> {
      record.get(CanonicalColumn.SEX);
    });
  }

  @Test void testFullLevelKeepsDetailColumns() {
    CanonicalTable table = normalize(Arrays.asList(
            obs("ALB", "2020", "9.7", "OBS_FOOTNOTE", "Modelled estimate")),
        QuerySpec.builder().schemaLevel(SchemaLevel.FULL).build());
    assertEquals(CanonicalColumn.values().length, table.getColumns().size());
    assertEquals("Modelled estimate",
        table.getRecords().get(0).getString(CanonicalColumn.OBS_FOOTNOTE));
  }

  @Test void testCodesAndLabelsAreMapped() {
    CanonicalTable table = normalize(Arrays.asList(
        obs("ALB", "2020", "9.7",
            "Geographic area", "Republic of Albania",
            "UNIT_MEASURE", "D_PER_1000_B",
            "Unit of measure", "Deaths per 1000 live births",
            "LOWER_BOUND", "8.1",
            "OBS_STATUS", "A")));
    CanonicalRecord record = table.getRecords().get(0);

    assertEquals("ALB", record.getString(CanonicalColumn.ISO3));
    assertEquals("Republic of Albania", record.getString(CanonicalColumn.COUNTRY));
    assertEquals(Double.valueOf(2020.0), record.getDouble(CanonicalColumn.PERIOD));
    assertEquals(Double.valueOf(9.7), record.get(CanonicalColumn.VALUE));
    assertEquals(Double.valueOf(8.1), record.get(CanonicalColumn.LOWER_BOUND));
    assertEquals("D_PER_1000_B", record.getString(CanonicalColumn.UNIT));
    assertEquals("Deaths per 1000 live births", record.getString(CanonicalColumn.UNIT_NAME));
    assertEquals("A", record.getString(CanonicalColumn.OBS_STATUS));
    assertNull(record.get(CanonicalColumn.UPPER_BOUND));
  }

  @Test void testNamesFromMetadataWhenLabelsAreMissing() {
    IndicatorEntry entry = IndicatorEntry.builder(CODE)
        .name("Under-five mortality rate")
        .dataflow("CME")
        .build();
    CanonicalTable table = normalize(Arrays.asList(obs("BGD", "2020", "27.3")),
        QuerySpec.defaults(), entry);
    CanonicalRecord record = table.getRecords().get(0);

    assertEquals("Bangladesh", record.getString(CanonicalColumn.COUNTRY));
    assertEquals("Under-five mortality rate", record.getString(CanonicalColumn.INDICATOR_NAME));
  }

  @Test void testGeoTypeMarksAggregates() {
    CanonicalTable table = normalize(Arrays.asList(
        obs("UNICEF_SSA", "2020", "70.1"),
        obs("ALB", "2020", "9.7")));

    assertEquals(Arrays.asList("ALB", "UNICEF_SSA"), column(table, CanonicalColumn.ISO3));
    List<CanonicalRecord> records = table.getRecords();
    assertEquals(Integer.valueOf(0), records.get(0).getInteger(CanonicalColumn.GEO_TYPE));
    assertEquals(Integer.valueOf(1), records.get(1).getInteger(CanonicalColumn.GEO_TYPE));
  }

  @Test void testSortedByCountryThenPeriod() {
    CanonicalTable table = normalize(Arrays.asList(
        obs("BGD", "2019", "30.8"),
        obs("ALB", "2020", "9.7"),
        obs("ALB", "2018", "10.2")));

    assertEquals(Arrays.asList("ALB", "ALB", "BGD"), column(table, CanonicalColumn.ISO3));
    assertEquals(Arrays.asList("2018.0", "2020.0", "2019.0"),
        column(table, CanonicalColumn.PERIOD));
  }

  @Test void testSexDefaultsToTotal() {
    CanonicalTable table = normalize(Arrays.asList(
        obs("ALB", "2020", "9.7", "SEX", "_T"),
        obs("ALB", "2020", "8.9", "SEX", "F"),
        obs("ALB", "2020", "10.4", "SEX", "M")));

    assertEquals(Arrays.asList("_T"), column(table, CanonicalColumn.SEX));
  }

  @Test void testExplicitFilterOverridesTotals() {
    CanonicalTable table = normalize(Arrays.asList(
            obs("ALB", "2020", "9.7", "SEX", "_T"),
            obs("ALB", "2020", "8.9", "SEX", "F"),
            obs("ALB", "2020", "10.4", "SEX", "M")),
        QuerySpec.builder().sex("F", "M").build());

    assertEquals(Arrays.asList("F", "M"), column(table, CanonicalColumn.SEX));
  }

  @Test void testFilterOnMissingColumnIsIgnored() {
    CanonicalTable table = normalize(Arrays.asList(obs("ALB", "2020", "9.7")),
        QuerySpec.builder().filter("RESIDENCE", "U").build());
    assertEquals(1, table.size());
  }

  @Test void testRawModeKeepsEveryBreakdown() {
    CanonicalTable table = normalize(Arrays.asList(
            obs("ALB", "2020", "9.7", "SEX", "_T"),
            obs("ALB", "2020", "8.9", "SEX", "F"),
            obs("ALB", "2020", "10.4", "SEX", "M")),
        QuerySpec.builder().raw(true).build());

    assertEquals(3, table.size());
  }

  @Test void testWealthTotalFollowsIndicatorMetadata() {
    List<Map<String, String>> rows = Arrays.asList(
        obs("ALB", "2020", "9.7", "WEALTH_QUINTILE", "_T"),
        obs("ALB", "2020", "14.2", "WEALTH_QUINTILE", "Q1"));

    IndicatorEntry sexOnly = IndicatorEntry.builder(CODE)
        .dataflow("CME")
        .disaggregations(Arrays.asList("SEX", "WEALTH_QUINTILE"))
        .disaggregationsWithTotals(Arrays.asList("SEX"))
        .build();
    assertEquals(2, normalize(rows, QuerySpec.defaults(), sexOnly).size());

    IndicatorEntry withWealth = IndicatorEntry.builder(CODE)
        .dataflow("CME")
        .disaggregationsWithTotals(Arrays.asList("SEX", "WEALTH_QUINTILE"))
        .build();
    assertEquals(Arrays.asList("_T"),
        column(normalize(rows, QuerySpec.defaults(), withWealth),
            CanonicalColumn.WEALTH_QUINTILE));

    assertEquals(Arrays.asList("_T"),
        column(normalize(rows), CanonicalColumn.WEALTH_QUINTILE));
  }

  @Test void testAgeFallsBackToFirstAggregatePresent() {
    CanonicalTable noTotal = normalize(Arrays.asList(
        obs("ALB", "2020", "11.3", "AGE", "M0T5"),
        obs("ALB", "2020", "13.9", "AGE", "Y0T4"),
        obs("ALB", "2020", "17.2", "AGE", "M6T23")));
    assertEquals(Arrays.asList("Y0T4"), column(noTotal, CanonicalColumn.AGE));

    CanonicalTable withTotal = normalize(Arrays.asList(
        obs("ALB", "2020", "13.9", "AGE", "Y0T4"),
        obs("ALB", "2020", "12.0", "AGE", "_T")));
    assertEquals(Arrays.asList("_T"), column(withTotal, CanonicalColumn.AGE));

    CanonicalTable single = normalize(Arrays.asList(obs("ALB", "2020", "11.3", "AGE", "M0T5")));
    assertEquals(Arrays.asList("M0T5"), column(single, CanonicalColumn.AGE));
  }

  @Test void testDisabilityBaselineWithoutTotal() {
    IndicatorEntry entry = IndicatorEntry.builder("MNCH_SAB")
        .dataflow("MNCH")
        .disaggregations(Arrays.asList("SEX", "DISABILITY_STATUS"))
        .disaggregationsWithTotals(Arrays.asList("SEX"))
        .build();
    CanonicalTable table = normalize(Arrays.asList(
            obs("ALB", "2020", "99.1", "DISABILITY_STATUS", "PD"),
            obs("ALB", "2020", "97.0", "DISABILITY_STATUS", "PWD")),
        QuerySpec.builder().schemaLevel(SchemaLevel.FULL).build(), entry);

    assertEquals(Arrays.asList("PD"), column(table, CanonicalColumn.DISABILITY_STATUS));
  }

  @Test void testDisabilityTotalWhenListed() {
    IndicatorEntry entry = IndicatorEntry.builder("MNCH_SAB")
        .dataflow("MNCH")
        .disaggregationsWithTotals(Arrays.asList("DISABILITY_STATUS"))
        .build();
    CanonicalTable table = normalize(Arrays.asList(
            obs("ALB", "2020", "98.5", "DISABILITY_STATUS", "_T"),
            obs("ALB", "2020", "99.1", "DISABILITY_STATUS", "PD"),
            obs("ALB", "2020", "97.0", "DISABILITY_STATUS", "PWD")),
        QuerySpec.builder().schemaLevel(SchemaLevel.FULL).build(), entry);

    assertEquals(Arrays.asList("_T"), column(table, CanonicalColumn.DISABILITY_STATUS));
  }

  @Test void testRowsWithoutValueOrPeriodAreDropped() {
    List<Map<String, String>> rows = Arrays.asList(
        obs("ALB", "2020", "9.7"),
        obs("ALB", "2019", ""),
        obs("ALB", "2018", "NaN"),
        obs("ALB", "not a year", "10.0"));

    assertEquals(1, normalize(rows).size());

    ResponseNormalizer keepAll = new ResponseNormalizer(PeriodConvention.MONTH_OVER_TWELVE, false);
    CanonicalTable kept = keepAll.normalize(rows,
        new NormalizationContext(CODE, "CME", QuerySpec.defaults(), store(null)));
    assertEquals(4, kept.size());
    assertNull(kept.getRecords().get(3).get(CanonicalColumn.PERIOD));
  }

  @Test void testYearListKeepsListedYearsOnly() {
    CanonicalTable table = normalize(Arrays.asList(
            obs("ALB", "2015", "12.0"),
            obs("ALB", "2018", "10.9"),
            obs("ALB", "2020-06", "9.7")),
        QuerySpec.builder().years("2015,2020").build());

    assertEquals(Arrays.asList("2015.0", "2020.5"), column(table, CanonicalColumn.PERIOD));
  }

  @Test void testYearFilterUsesReportedYear() {
    CanonicalTable table = normalize(Arrays.asList(
            obs("ALB", "2019-12", "1.0"),
            obs("ALB", "2020-06", "2.0"),
            obs("ALB", "2020-12", "3.0")),
        QuerySpec.builder().years("2020").build());

    assertEquals(Arrays.asList("2.0", "3.0"), column(table, CanonicalColumn.VALUE));
    assertEquals(Arrays.asList("2020.5", "2021.0"), column(table, CanonicalColumn.PERIOD));
  }

  @Test void testYearRangeKeepsDecemberAtBothEdges() {
    CanonicalTable table = normalize(Arrays.asList(
            obs("ALB", "2014-12", "1.0"),
            obs("ALB", "2015-12", "2.0"),
            obs("ALB", "2020-12", "3.0"),
            obs("ALB", "2021-01", "4.0")),
        QuerySpec.builder().years("2015:2020").build());

    assertEquals(Arrays.asList("2.0", "3.0"), column(table, CanonicalColumn.VALUE));
  }

  @Test void testCountriesFilteredAfterFetch() {
    CanonicalTable table = normalize(Arrays.asList(
            obs("ALB", "2020", "9.7"),
            obs("BGD", "2020", "27.3")),
        QuerySpec.builder().countries("ALB").build());

    assertEquals(Arrays.asList("ALB"), column(table, CanonicalColumn.ISO3));
  }

  @Test void testEmptyResponseKeepsColumns() {
    CanonicalTable table = normalize(new ArrayList<Map<String, String>>());
    assertTrue(table.isEmpty());
    assertEquals(SchemaLevel.EXTENDED.getColumns(), table.getColumns());
    assertEquals("CME", table.getSourceDataflow());
  }
}
