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
package org.unicefdata.sdmx;

import org.unicefdata.sdmx.normalize.SchemaLevel;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parameters of a single indicator query, independent of the indicator code.
 *
 * <p>Disaggregation filters are keyed by SDMX dimension id ({@code SEX},
 * {@code AGE}, {@code WEALTH_QUINTILE}, ...). Keys are accepted in either
 * case and stored upper-cased.
 */
public final class QuerySpec {
  private static final QuerySpec DEFAULT = builder().build();

  private final ImmutableList<String> countries;
  private final YearSpec years;
  private final ImmutableMap<String, ImmutableList<String>> filters;
  private final SchemaLevel schemaLevel;
  private final @Nullable String preferredDataflow;
  private final boolean totalsInKey;
  private final boolean raw;

  private QuerySpec(Builder builder) {
    this.countries = ImmutableList.copyOf(builder.countries);
    this.years = builder.years;
    ImmutableMap.Builder<String, ImmutableList<String>> f = ImmutableMap.builder();
    for (Map.Entry<String, Set<String>> e : builder.filters.entrySet()) {
      f.put(e.getKey(), ImmutableList.copyOf(e.getValue()));
    }
    this.filters = f.build();
    this.schemaLevel = builder.schemaLevel;
    this.preferredDataflow = builder.preferredDataflow;
    this.totalsInKey = builder.totalsInKey;
    this.raw = builder.raw;
  }

  /** All countries, all years, extended schema. */
  public static QuerySpec defaults() {
    return DEFAULT;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.countries.addAll(countries);
    b.years = years;
    for (Map.Entry<String, ImmutableList<String>> e : filters.entrySet()) {
      b.filters.put(e.getKey(), new LinkedHashSet<String>(e.getValue()));
    }
    b.schemaLevel = schemaLevel;
    b.preferredDataflow = preferredDataflow;
    b.totalsInKey = totalsInKey;
    b.raw = raw;
    return b;
  }

  /** ISO3 codes in request order; empty means all countries. */
  public ImmutableList<String> getCountries() {
    return countries;
  }

  public YearSpec getYears() {
    return years;
  }

  public ImmutableMap<String, ImmutableList<String>> getFilters() {
    return filters;
  }

  /** Codes the caller asked for on a dimension, or an empty list if unconstrained. */
  public ImmutableList<String> getFilter(String dimensionId) {
    ImmutableList<String> codes = filters.get(dimensionId.toUpperCase(Locale.ROOT));
    return codes == null ? ImmutableList.<String>of() : codes;
  }

  public boolean isConstrained(String dimensionId) {
    return filters.containsKey(dimensionId.toUpperCase(Locale.ROOT));
  }

  public SchemaLevel getSchemaLevel() {
    return schemaLevel;
  }

  /** Dataflow to try before the resolved candidates, or null. */
  public @Nullable String getPreferredDataflow() {
    return preferredDataflow;
  }

  /** Whether unconstrained dimensions with totals are requested as {@code _T} in the key. */
  public boolean isTotalsInKey() {
    return totalsInKey;
  }

  /** Whether the default totals filtering is skipped. */
  public boolean isRaw() {
    return raw;
  }

  @Override public String toString() {
    return "QuerySpec{countries=" + (countries.isEmpty() ? "all" : countries)
        + ", years=" + years
        + ", filters=" + filters
        + ", schemaLevel=" + schemaLevel
        + (preferredDataflow == null ? "" : ", dataflow=" + preferredDataflow)
        + "}";
  }

  /**
   * Builder for QuerySpec. Validation happens in {@link #build()} and in the
   * individual setters; invalid input raises {@link IllegalArgumentException}.
   */
  public static final class Builder {
    private final Set<String> countries = new LinkedHashSet<String>();
    private YearSpec years = YearSpec.all();
    private final Map<String, Set<String>> filters = new LinkedHashMap<String, Set<String>>();
    private SchemaLevel schemaLevel = SchemaLevel.EXTENDED;
    private @Nullable String preferredDataflow;
    private boolean totalsInKey;
    private boolean raw;

    private Builder() {
    }

    public Builder countries(String... iso3Codes) {
      return countries(Arrays.asList(iso3Codes));
    }

    public Builder countries(Collection<String> iso3Codes) {
      for (String code : iso3Codes) {
        if (code == null || code.trim().length() != 3) {
          throw new IllegalArgumentException(
              "Country code must be a 3-letter ISO3 code, got '" + code + "'");
        }
        countries.add(code.trim().toUpperCase(Locale.ROOT));
      }
      return this;
    }

    public Builder years(YearSpec years) {
      this.years = years;
      return this;
    }

    public Builder years(String expression) {
      this.years = YearSpec.parse(expression);
      return this;
    }

    public Builder startYear(int start) {
      this.years = YearSpec.range(start, years.getEnd());
      return this;
    }

    public Builder endYear(int end) {
      this.years = YearSpec.range(years.getStart(), end);
      return this;
    }

    /** Restricts a dimension to the given codes, keeping their order. */
    public Builder filter(String dimensionId, String... codes) {
      return filter(dimensionId, Arrays.asList(codes));
    }

    public Builder filter(String dimensionId, List<String> codes) {
      if (dimensionId == null || dimensionId.trim().isEmpty()) {
        throw new IllegalArgumentException("Dimension id must not be empty");
      }
      if (codes.isEmpty()) {
        throw new IllegalArgumentException(
            "Filter on " + dimensionId + " must name at least one code");
      }
      String key = dimensionId.trim().toUpperCase(Locale.ROOT);
      if (key.equals("REF_AREA") || key.equals("INDICATOR")) {
        throw new IllegalArgumentException(
            key + " is set through countries() and the indicator code, not filter()");
      }
      Set<String> set = filters.get(key);
      if (set == null) {
        set = new LinkedHashSet<String>();
        filters.put(key, set);
      }
      set.addAll(codes);
      return this;
    }

    /** Shorthand for {@code filter("SEX", codes)}. */
    public Builder sex(String... codes) {
      return filter("SEX", codes);
    }

    public Builder schemaLevel(SchemaLevel schemaLevel) {
      this.schemaLevel = schemaLevel;
      return this;
    }

    public Builder preferredDataflow(@Nullable String dataflow) {
      this.preferredDataflow = dataflow == null || dataflow.trim().isEmpty()
          ? null : dataflow.trim().toUpperCase(Locale.ROOT);
      return this;
    }

    public Builder totalsInKey(boolean totalsInKey) {
      this.totalsInKey = totalsInKey;
      return this;
    }

    public Builder raw(boolean raw) {
      this.raw = raw;
      return this;
    }

    public QuerySpec build() {
      return new QuerySpec(this);
    }
  }
}
