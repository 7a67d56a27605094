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

import com.google.common.collect.ImmutableSortedSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * Years requested by a query.
 *
 * <p>A year specification is one of:
 * <ul>
 *   <li>all years ({@link #all()}),</li>
 *   <li>a contiguous range with optional open ends ({@link #range}),</li>
 *   <li>an explicit list of years that need not be contiguous ({@link #of}).</li>
 * </ul>
 *
 * <p>The server is always asked for the enclosing range; an explicit list
 * is applied again after the response is normalized.
 */
public final class YearSpec {
  /** Earliest year accepted in a query. */
  public static final int MIN_YEAR = 1900;

  private static final YearSpec ALL = new YearSpec(null, null, ImmutableSortedSet.<Integer>of());

  private final @Nullable Integer start;
  private final @Nullable Integer end;
  private final ImmutableSortedSet<Integer> years;

  private YearSpec(@Nullable Integer start, @Nullable Integer end,
      ImmutableSortedSet<Integer> years) {
    this.start = start;
    this.end = end;
    this.years = years;
  }

  public static YearSpec all() {
    return ALL;
  }

  /** A single year. */
  public static YearSpec of(int year) {
    return range(year, year);
  }

  /** An explicit list of years; duplicates are ignored. */
  public static YearSpec of(Collection<Integer> years) {
    if (years.isEmpty()) {
      return ALL;
    }
    for (Integer year : years) {
      checkYear(year);
    }
    ImmutableSortedSet<Integer> sorted = ImmutableSortedSet.copyOf(years);
    if (sorted.size() == 1) {
      return of(sorted.first());
    }
    return new YearSpec(sorted.first(), sorted.last(), sorted);
  }

  /** A contiguous range; either end may be null for an open bound. */
  public static YearSpec range(@Nullable Integer start, @Nullable Integer end) {
    if (start != null) {
      checkYear(start);
    }
    if (end != null) {
      checkYear(end);
    }
    if (start != null && end != null && start > end) {
      throw new IllegalArgumentException(
          "Start year " + start + " is after end year " + end);
    }
    if (start == null && end == null) {
      return ALL;
    }
    return new YearSpec(start, end, ImmutableSortedSet.<Integer>of());
  }

  /**
   * Parses a year expression: {@code 2020}, {@code 2015:2023},
   * {@code 2015,2018,2020}, or empty / {@code all} for every year.
   *
   * @throws IllegalArgumentException if the expression is malformed
   */
  public static YearSpec parse(@Nullable String text) {
    if (text == null) {
      return ALL;
    }
    String trimmed = text.trim();
    if (trimmed.isEmpty() || trimmed.toLowerCase(Locale.ROOT).equals("all")) {
      return ALL;
    }
    if (trimmed.contains(":")) {
      String[] parts = trimmed.split(":", -1);
      if (parts.length != 2) {
        throw new IllegalArgumentException("Invalid year range '" + text + "'");
      }
      return range(parseBound(parts[0], text), parseBound(parts[1], text));
    }
    if (trimmed.contains(",")) {
      ImmutableSortedSet.Builder<Integer> builder = ImmutableSortedSet.naturalOrder();
      for (String part : trimmed.split(",")) {
        if (!part.trim().isEmpty()) {
          builder.add(parseYear(part, text));
        }
      }
      return of(builder.build());
    }
    return of(parseYear(trimmed, text));
  }

  private static @Nullable Integer parseBound(String part, String text) {
    return part.trim().isEmpty() ? null : parseYear(part, text);
  }

  private static int parseYear(String part, String text) {
    try {
      return Integer.parseInt(part.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid year '" + part.trim() + "' in '" + text + "'", e);
    }
  }

  private static void checkYear(int year) {
    if (year < MIN_YEAR) {
      throw new IllegalArgumentException(
          "Year " + year + " is before " + MIN_YEAR);
    }
  }

  /** First year sent as {@code startPeriod}, or null. */
  public @Nullable Integer getStart() {
    return start;
  }

  /** Last year sent as {@code endPeriod}, or null. */
  public @Nullable Integer getEnd() {
    return end;
  }

  /** Whether this is an explicit, possibly non-contiguous list of years. */
  public boolean isExplicitList() {
    return !years.isEmpty();
  }

  public ImmutableSortedSet<Integer> getYears() {
    return years;
  }

  /**
   * Whether a calendar year belongs to the requested years.
   *
   * <p>Pass the year of the observation's period as reported, not its
   * decimal form: {@code 2020-12} is year 2020 even where it converts to
   * 2021.0.
   */
  public boolean accepts(int year) {
    if (!years.isEmpty()) {
      return years.contains(year);
    }
    return (start == null || year >= start) && (end == null || year <= end);
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof YearSpec)) {
      return false;
    }
    YearSpec that = (YearSpec) o;
    return Objects.equals(start, that.start)
        && Objects.equals(end, that.end)
        && years.equals(that.years);
  }

  @Override public int hashCode() {
    return Objects.hash(start, end, years);
  }

  @Override public String toString() {
    if (!years.isEmpty()) {
      return years.toString();
    }
    if (start == null && end == null) {
      return "all";
    }
    return (start == null ? "" : start) + ":" + (end == null ? "" : end);
  }
}
