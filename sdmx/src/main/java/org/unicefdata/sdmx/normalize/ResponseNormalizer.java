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
import org.unicefdata.sdmx.YearSpec;
import org.unicefdata.sdmx.metadata.IndicatorEntry;
import org.unicefdata.sdmx.metadata.MetadataStore;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Doubles;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw CSV rows from any dataflow into a {@link CanonicalTable}.
 *
 * <p>Normalization is deterministic and runs in this order:
 * <ol>
 *   <li>rename SDMX components to canonical column names;</li>
 *   <li>keep only the requested countries and the caller's explicit
 *       disaggregation codes;</li>
 *   <li>reduce every unconstrained disaggregation to its total (see below);</li>
 *   <li>convert periods to decimal years and numeric cells to doubles,
 *       dropping rows without a period or value when configured to;</li>
 *   <li>keep only the requested years;</li>
 *   <li>derive {@code geo_type} and the country and indicator names;</li>
 *   <li>project onto the columns of the requested {@link SchemaLevel} and
 *       sort by {@code iso3}, then {@code period}.</li>
 * </ol>
 *
 * <h3>Totals</h3>
 * For a dimension the caller did not constrain:
 * <ul>
 *   <li>{@code sex}: {@code _T} when present;</li>
 *   <li>{@code age}, when more than one age group is present: {@code _T},
 *       otherwise the first of {@code Y0T4, Y0T14, Y0T17, Y15T49, ALLAGE}
 *       present;</li>
 *   <li>wealth quintile, residence, maternal education, education level,
 *       ethnic group and facility type: {@code _T} when present and the
 *       indicator's metadata lists the dimension as having totals, or
 *       records no totals at all;</li>
 *   <li>{@code disability_status}: {@code _T} when the metadata lists a
 *       total, otherwise {@code PD} as the baseline.</li>
 * </ul>
 * The rules never look at which dataflow answered, so the same indicator
 * yields the same rows whichever candidate succeeds.
 */
public class ResponseNormalizer {
  private static final Logger LOGGER = LoggerFactory.getLogger(ResponseNormalizer.class);

  static final String TOTAL = "_T";
  static final String WITHOUT_DISABILITY = "PD";
  static final ImmutableList<String> AGE_TOTALS =
      ImmutableList.of(TOTAL, "Y0T4", "Y0T14", "Y0T17", "Y15T49", "ALLAGE");
  static final ImmutableList<String> TOTALS_DIMENSIONS =
      ImmutableList.of("WEALTH_QUINTILE", "RESIDENCE", "MATERNAL_EDU_LVL", "EDUCATION_LEVEL",
          "ETHNIC_GROUP", "HCF_TYPE");

  /** Label columns the API adds next to the code columns. */
  private static final ImmutableMap<String, CanonicalColumn> LABEL_HEADERS =
      ImmutableMap.<String, CanonicalColumn>builder()
          .put("Geographic area", CanonicalColumn.COUNTRY)
          .put("Indicator", CanonicalColumn.INDICATOR_NAME)
          .put("Unit of measure", CanonicalColumn.UNIT_NAME)
          .put("Observation Status", CanonicalColumn.OBS_STATUS_NAME)
          .build();

  private static final Comparator<String> NULLS_LAST_STRING =
      Comparator.nullsLast(Comparator.<String>naturalOrder());
  private static final Comparator<Double> NULLS_LAST_DOUBLE =
      Comparator.nullsLast(Comparator.<Double>naturalOrder());

  private final PeriodConverter periodConverter;
  private final boolean dropMissing;

  public ResponseNormalizer(PeriodConvention convention, boolean dropMissing) {
    this.periodConverter = new PeriodConverter(convention);
    this.dropMissing = dropMissing;
  }

  /**
   * Normalizes the rows of one successful response.
   *
   * @param rawRows rows keyed by CSV header
   * @param context indicator, dataflow, query and metadata
   * @return table with exactly the columns of the query's schema level
   */
  public CanonicalTable normalize(List<Map<String, String>> rawRows,
      NormalizationContext context) {
    QuerySpec query = context.getQuery();
    List<Map<String, String>> rows = rename(rawRows);
    rows = filterCountries(rows, query.getCountries());
    rows = applyExplicitFilters(rows, query);
    if (!query.isRaw()) {
      rows = applyDefaultTotals(rows, context);
    }

    SchemaLevel level = query.getSchemaLevel();
    List<CanonicalRecord> records = toRecords(rows, context, level);
    records.sort(
        Comparator.comparing((CanonicalRecord r) -> r.getString(CanonicalColumn.ISO3),
                NULLS_LAST_STRING)
            .thenComparing(r -> r.getDouble(CanonicalColumn.PERIOD), NULLS_LAST_DOUBLE));

    LOGGER.debug("Normalized {} raw rows of {} from {} into {} records",
        rawRows.size(), context.getIndicatorCode(), context.getDataflowId(), records.size());
    return new CanonicalTable(context.getIndicatorCode(), context.getDataflowId(), level,
        records, ImmutableList.<String>of());
  }

  /** Canonical column name for a CSV header or SDMX dimension id. */
  static String columnNameFor(String header) {
    String trimmed = header.trim();
    CanonicalColumn label = LABEL_HEADERS.get(trimmed);
    if (label != null) {
      return label.getColumnName();
    }
    CanonicalColumn column = CanonicalColumn.forSdmxId(trimmed);
    if (column != null) {
      return column.getColumnName();
    }
    return trimmed.toLowerCase(Locale.ROOT);
  }

  private static List<Map<String, String>> rename(List<Map<String, String>> rawRows) {
    List<Map<String, String>> result = new ArrayList<Map<String, String>>(rawRows.size());
    for (Map<String, String> raw : rawRows) {
      Map<String, String> row = new LinkedHashMap<String, String>();
      for (Map.Entry<String, String> e : raw.entrySet()) {
        String name = columnNameFor(e.getKey());
        String value = e.getValue() == null ? null : e.getValue().trim();
        if (value != null && value.isEmpty()) {
          value = null;
        }
        if (value != null || !row.containsKey(name)) {
          row.put(name, value);
        }
      }
      result.add(row);
    }
    return result;
  }

  private static List<Map<String, String>> filterCountries(List<Map<String, String>> rows,
      List<String> countries) {
    if (countries.isEmpty()) {
      return rows;
    }
    Set<String> wanted = new HashSet<String>(countries);
    List<Map<String, String>> result = new ArrayList<Map<String, String>>();
    for (Map<String, String> row : rows) {
      if (wanted.contains(row.get(CanonicalColumn.ISO3.getColumnName()))) {
        result.add(row);
      }
    }
    return result;
  }

  private static List<Map<String, String>> applyExplicitFilters(
      List<Map<String, String>> rows, QuerySpec query) {
    List<Map<String, String>> result = rows;
    for (Map.Entry<String, ImmutableList<String>> filter : query.getFilters().entrySet()) {
      String column = columnNameFor(filter.getKey());
      if (!hasColumn(result, column)) {
        LOGGER.debug("Response has no {} column; filter {} ignored", column, filter.getValue());
        continue;
      }
      result = keep(result, column, new HashSet<String>(filter.getValue()));
    }
    return result;
  }

  private static List<Map<String, String>> applyDefaultTotals(List<Map<String, String>> rows,
      NormalizationContext context) {
    QuerySpec query = context.getQuery();
    IndicatorEntry entry = context.getIndicator();
    Map<String, String> applied = new LinkedHashMap<String, String>();
    Map<String, Set<String>> available = new LinkedHashMap<String, Set<String>>();
    List<Map<String, String>> result = rows;

    if (!query.isConstrained("SEX")) {
      result = keepIfPresent(result, "sex", TOTAL, applied, available);
    }

    if (!query.isConstrained("AGE")) {
      Set<String> ages = distinct(result, "age");
      if (ages.size() > 1) {
        available.put("age", ages);
        for (String candidate : AGE_TOTALS) {
          if (ages.contains(candidate)) {
            result = keep(result, "age", ImmutableList.of(candidate));
            applied.put("age", candidate);
            break;
          }
        }
      }
    }

    for (String dimension : TOTALS_DIMENSIONS) {
      if (query.isConstrained(dimension)) {
        continue;
      }
      boolean hasTotals = entry == null
          || !entry.isTotalsMetadataPresent()
          || entry.hasTotals(dimension);
      if (hasTotals) {
        result = keepIfPresent(result, columnNameFor(dimension), TOTAL, applied, available);
      }
    }

    if (!query.isConstrained("DISABILITY_STATUS")) {
      String column = CanonicalColumn.DISABILITY_STATUS.getColumnName();
      Set<String> statuses = distinct(result, column);
      boolean hasTotals = entry != null && entry.hasTotals("DISABILITY_STATUS");
      if (hasTotals && statuses.contains(TOTAL)) {
        result = keep(result, column, ImmutableList.of(TOTAL));
        applied.put(column, TOTAL);
      } else if (!hasTotals && statuses.size() > 1 && statuses.contains(WITHOUT_DISABILITY)) {
        result = keep(result, column, ImmutableList.of(WITHOUT_DISABILITY));
        applied.put(column, WITHOUT_DISABILITY);
      }
      if (statuses.size() > 1) {
        available.put(column, statuses);
      }
    }

    if (!available.isEmpty()) {
      LOGGER.info("Disaggregated data available for {}: {}. Defaults used: {}."
              + " Set filters or raw mode to access other breakdowns.",
          context.getIndicatorCode(), available, applied);
    }
    return result;
  }

  private static List<Map<String, String>> keepIfPresent(List<Map<String, String>> rows,
      String column, String code, Map<String, String> applied,
      Map<String, Set<String>> available) {
    Set<String> values = distinct(rows, column);
    if (values.size() > 1 || (values.size() == 1 && !values.contains(code))) {
      available.put(column, values);
    }
    if (!values.contains(code)) {
      return rows;
    }
    applied.put(column, code);
    return keep(rows, column, ImmutableList.of(code));
  }

  private static List<Map<String, String>> keep(List<Map<String, String>> rows, String column,
      Collection<String> codes) {
    List<Map<String, String>> result = new ArrayList<Map<String, String>>();
    for (Map<String, String> row : rows) {
      if (codes.contains(row.get(column))) {
        result.add(row);
      }
    }
    return result;
  }

  private static boolean hasColumn(List<Map<String, String>> rows, String column) {
    for (Map<String, String> row : rows) {
      if (row.containsKey(column)) {
        return true;
      }
    }
    return false;
  }

  private static Set<String> distinct(List<Map<String, String>> rows, String column) {
    Set<String> values = new LinkedHashSet<String>();
    for (Map<String, String> row : rows) {
      String value = row.get(column);
      if (value != null) {
        values.add(value);
      }
    }
    return values;
  }

  private List<CanonicalRecord> toRecords(List<Map<String, String>> rows,
      NormalizationContext context, SchemaLevel level) {
    MetadataStore metadata = context.getMetadata();
    YearSpec years = context.getQuery().getYears();
    ImmutableList<CanonicalColumn> columns = level.getColumns();
    List<CanonicalRecord> records = new ArrayList<CanonicalRecord>(rows.size());
    int missingPeriod = 0;
    int missingValue = 0;

    for (Map<String, String> row : rows) {
      String rawPeriod = row.get(CanonicalColumn.PERIOD.getColumnName());
      Double period = periodConverter.toDecimalYear(rawPeriod);
      Double value = parseNumber(row.get(CanonicalColumn.VALUE.getColumnName()));
      if (dropMissing && (period == null || value == null)) {
        if (period == null) {
          missingPeriod++;
        }
        if (value == null) {
          missingValue++;
        }
        continue;
      }
      Integer year = PeriodConverter.yearOf(rawPeriod);
      if (year != null && !years.accepts(year)) {
        continue;
      }

      String iso3 = row.get(CanonicalColumn.ISO3.getColumnName());
      Object[] values = new Object[columns.size()];
      for (int i = 0; i < columns.size(); i++) {
        CanonicalColumn column = columns.get(i);
        switch (column) {
          case PERIOD:
            values[i] = period;
            break;
          case VALUE:
            values[i] = value;
            break;
          case GEO_TYPE:
            values[i] = iso3 == null ? null : (metadata.isAggregate(iso3) ? 1 : 0);
            break;
          case COUNTRY:
            values[i] = firstNonEmpty(row.get(column.getColumnName()),
                iso3 == null ? null : metadata.getAreaName(iso3));
            break;
          case INDICATOR_NAME:
            values[i] = firstNonEmpty(row.get(column.getColumnName()),
                indicatorName(metadata, row, context));
            break;
          default:
            String cell = row.get(column.getColumnName());
            values[i] = column.isNumeric() ? parseNumber(cell) : cell;
            break;
        }
      }
      records.add(new CanonicalRecord(level, values));
    }

    if (missingPeriod + missingValue > 0) {
      LOGGER.info("Dropped rows of {} with missing data: {} without period, {} without value",
          context.getIndicatorCode(), missingPeriod, missingValue);
    }
    return records;
  }

  private static @Nullable String indicatorName(MetadataStore metadata, Map<String, String> row,
      NormalizationContext context) {
    String code = row.get(CanonicalColumn.INDICATOR.getColumnName());
    IndicatorEntry entry = metadata.getIndicator(code == null ? context.getIndicatorCode() : code);
    return entry == null ? null : entry.getName();
  }

  private static @Nullable String firstNonEmpty(@Nullable String first, @Nullable String second) {
    if (first != null && !first.isEmpty()) {
      return first;
    }
    return second == null || second.isEmpty() ? null : second;
  }

  /** Parses a numeric cell; anything that is not a finite number becomes null. */
  static @Nullable Double parseNumber(@Nullable String cell) {
    if (cell == null) {
      return null;
    }
    Double parsed = Doubles.tryParse(cell.trim());
    if (parsed == null || parsed.isNaN() || parsed.isInfinite()) {
      return null;
    }
    return parsed;
  }
}
